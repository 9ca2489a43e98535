package com.idiomchain.interfaces.rest;

import com.idiomchain.application.DictionaryNotReadyException;
import com.idiomchain.application.IdiomQueryService;
import com.idiomchain.application.UnknownIdiomException;
import com.idiomchain.dto.ErrorMessage;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Idiom lookup endpoints.
 *
 * <p>All responses are JSON arrays of idiom texts. {@code o} and {@code l} are offset and length;
 * they default to 0 and the configured length when absent or not numbers.
 */
@Validated
@RestController
@RequestMapping("/api")
public class IdiomController {
  private static final Logger log = LoggerFactory.getLogger(IdiomController.class);

  private final IdiomQueryService queries;

  public IdiomController(IdiomQueryService queries) {
    this.queries = queries;
  }

  /** {@code /api/b?b=$WORD&o=3&l=10} */
  @GetMapping("/b")
  public List<String> beginWith(
      @RequestParam("b") @NotBlank String b,
      @RequestParam(value = "o", required = false) String o,
      @RequestParam(value = "l", required = false) String l) {
    return queries.beginWith(b, o, l);
  }

  /** {@code /api/e?e=$WORD&o=3&l=10} */
  @GetMapping("/e")
  public List<String> endWith(
      @RequestParam("e") @NotBlank String e,
      @RequestParam(value = "o", required = false) String o,
      @RequestParam(value = "l", required = false) String l) {
    return queries.endWith(e, o, l);
  }

  /** {@code /api/be?b=$WORD&e=$WORD&o=3&l=10} */
  @GetMapping("/be")
  public List<String> beginEndWith(
      @RequestParam("b") @NotBlank String b,
      @RequestParam("e") @NotBlank String e,
      @RequestParam(value = "o", required = false) String o,
      @RequestParam(value = "l", required = false) String l) {
    return queries.beginEndWith(b, e, o, l);
  }

  /** {@code /api/path?b=$IDIOM&e=$IDIOM}; the whole chain, empty if there is none. */
  @GetMapping("/path")
  public List<String> shortestChain(
      @RequestParam("b") @NotBlank String b, @RequestParam("e") @NotBlank String e) {
    return queries.shortestChain(b, e);
  }

  @ExceptionHandler(UnknownIdiomException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ErrorMessage onUnknownIdiom(UnknownIdiomException e) {
    log.debug("Unknown idiom '{}'", e.text());
    return new ErrorMessage(ErrorMessage.UNKNOWN_IDIOM, e.getMessage());
  }

  @ExceptionHandler({
    MissingServletRequestParameterException.class,
    ConstraintViolationException.class,
    IllegalArgumentException.class
  })
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ErrorMessage onBadRequest(Exception e) {
    return new ErrorMessage(ErrorMessage.BAD_REQUEST, e.getMessage());
  }

  @ExceptionHandler(DictionaryNotReadyException.class)
  @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
  public ErrorMessage onNotReady(DictionaryNotReadyException e) {
    log.warn("Query rejected: {}", e.getMessage());
    return new ErrorMessage(ErrorMessage.NOT_READY, e.getMessage());
  }
}
