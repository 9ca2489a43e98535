package com.idiomchain.application;

import com.idiomchain.application.port.IdiomDictionary;
import com.idiomchain.domain.Idiom;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Request-facing query service.
 *
 * <p>Takes raw request values, extracts the boundary symbol (first code point), applies the
 * offset/length defaults and renders idioms as their texts. Unparsable or missing paging values
 * fall back to the defaults instead of failing.
 */
@Service
public class IdiomQueryService {
  public static final int DEFAULT_OFFSET = 0;

  private final IdiomDictionary dict;
  private final int defaultLength;

  public IdiomQueryService(
      IdiomDictionary dict, @Value("${idiomchain.default-length:16}") int defaultLength) {
    this.dict = dict;
    this.defaultLength = defaultLength;
  }

  public List<String> beginWith(String word, String offset, String length) {
    return texts(
        dict.beginWith(
            symbol(word, "b"), parseOr(offset, DEFAULT_OFFSET), parseOr(length, defaultLength)));
  }

  public List<String> endWith(String word, String offset, String length) {
    return texts(
        dict.endWith(
            symbol(word, "e"), parseOr(offset, DEFAULT_OFFSET), parseOr(length, defaultLength)));
  }

  public List<String> beginEndWith(String begin, String end, String offset, String length) {
    return texts(
        dict.beginEndWith(
            symbol(begin, "b"),
            symbol(end, "e"),
            parseOr(offset, DEFAULT_OFFSET),
            parseOr(length, defaultLength)));
  }

  /**
   * @return the chain as texts; empty if the idioms are equal or not connected
   * @throws UnknownIdiomException if either text is not in the dictionary
   */
  public List<String> shortestChain(String source, String target) {
    requireText(source, "b");
    requireText(target, "e");
    return texts(dict.shortestChain(source, target));
  }

  public int defaultLength() {
    return defaultLength;
  }

  /**
   * Parse a paging value with base-prefix rules: optional sign, then {@code 0x}, {@code 0b},
   * {@code 0o} or a leading {@code 0} (octal) selects the radix, and single underscores may
   * separate digits. Values are read as 64-bit and saturate to the int range, so an oversized
   * offset still means "past the end". Anything else, {@code #10} included, is unparsable.
   *
   * @return the parsed value, or {@code fallback} if absent or unparsable
   */
  static int parseOr(String value, int fallback) {
    if (value == null || value.isEmpty()) return fallback;
    String s = value;
    String sign = "";
    if (s.charAt(0) == '+' || s.charAt(0) == '-') {
      sign = s.charAt(0) == '-' ? "-" : "";
      s = s.substring(1);
    }
    int radix = 10;
    boolean prefixed = false;
    if (s.length() > 1 && s.charAt(0) == '0') {
      char p = Character.toLowerCase(s.charAt(1));
      if (p == 'x' || p == 'b' || p == 'o') {
        radix = p == 'x' ? 16 : p == 'b' ? 2 : 8;
        s = s.substring(2);
      } else {
        radix = 8;
        s = s.substring(1);
      }
      prefixed = true;
    }
    if (s.isEmpty() || s.endsWith("_") || s.contains("__") || (!prefixed && s.startsWith("_"))) {
      return fallback;
    }
    s = s.replace("_", "");
    if (s.isEmpty() || s.charAt(0) == '+' || s.charAt(0) == '-') return fallback;
    try {
      long parsed = Long.parseLong(sign + s, radix);
      return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, parsed));
    } catch (NumberFormatException e) {
      return fallback;
    }
  }

  private static int symbol(String word, String param) {
    requireText(word, param);
    return word.codePointAt(0);
  }

  private static void requireText(String value, String param) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("Missing parameter '" + param + "'");
    }
  }

  private static List<String> texts(List<Idiom> idioms) {
    return idioms.stream().map(Idiom::text).toList();
  }
}
