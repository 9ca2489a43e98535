package com.idiomchain.infrastructure;

import com.idiomchain.application.DictionaryNotReadyException;
import com.idiomchain.application.UnknownIdiomException;
import com.idiomchain.application.port.IdiomDictionary;
import com.idiomchain.domain.Idiom;
import com.idiomchain.domain.IdiomGraph;
import com.idiomchain.domain.LoadOptions;
import com.idiomchain.domain.PathStrategy;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Dictionary backed by an in-memory {@link IdiomGraph}.
 *
 * <p>The graph is loaded once at startup from either a text file or a SQLite database and then
 * published with a single atomic set; after that every query is a lock-free read. A load failure
 * propagates out of {@link #load()} and stops the application from starting.
 */
@Service
public class IdiomGraphService implements IdiomDictionary {
  private static final Logger log = LoggerFactory.getLogger(IdiomGraphService.class);

  private final IdiomSource source;
  private final LoadOptions options;
  private final AtomicReference<IdiomGraph> graph = new AtomicReference<>();

  @Autowired
  public IdiomGraphService(
      @Value("${idiomchain.dictionary-path:}") String dictionaryPath,
      @Value("${idiomchain.dictionary-jdbc-url:}") String jdbcUrl,
      @Value("${idiomchain.dictionary-query:SELECT idiom FROM idioms}") String query,
      @Value("${idiomchain.gc-interval:3000}") int gcInterval,
      @Value("${idiomchain.path-strategy:AUTO}") String pathStrategy,
      @Value("${idiomchain.all-pairs-limit:4096}") int allPairsLimit) {
    this(
        selectSource(dictionaryPath, jdbcUrl, query),
        new LoadOptions(
            gcInterval,
            PathStrategy.valueOf(pathStrategy.trim().toUpperCase(Locale.ROOT)),
            allPairsLimit));
  }

  public IdiomGraphService(IdiomSource source, LoadOptions options) {
    this.source = source;
    this.options = options;
  }

  /**
   * Build the graph and publish it.
   *
   * @throws IOException if the dictionary cannot be read
   * @throws IllegalStateException if the dictionary is missing or was already loaded
   */
  @PostConstruct
  public void load() throws IOException {
    long t0 = System.nanoTime();
    log.info("Loading idioms from {}", source.describe());
    IdiomGraph loaded = source.load(options);
    if (!graph.compareAndSet(null, loaded)) {
      throw new IllegalStateException("Idiom dictionary already loaded");
    }
    long ms = (System.nanoTime() - t0) / 1_000_000;
    log.info("Idiom dictionary ready: {} idioms, {} ({} ms)", loaded.size(), loaded.pathStrategy(), ms);
  }

  @Override
  public Idiom find(String text) {
    return graph().find(text);
  }

  @Override
  public List<Idiom> beginWith(int symbol, int offset, int length) {
    return graph().beginWith(symbol, offset, length);
  }

  @Override
  public List<Idiom> endWith(int symbol, int offset, int length) {
    return graph().endWith(symbol, offset, length);
  }

  @Override
  public List<Idiom> beginEndWith(int begin, int end, int offset, int length) {
    return graph().beginEndWith(begin, end, offset, length);
  }

  @Override
  public List<Idiom> shortestChain(String sourceText, String targetText) {
    IdiomGraph g = graph();
    Idiom from = g.find(sourceText);
    if (from == null) throw new UnknownIdiomException(sourceText);
    Idiom to = g.find(targetText);
    if (to == null) throw new UnknownIdiomException(targetText);
    return g.shortestChain(from, to);
  }

  @Override
  public int size() {
    return graph().size();
  }

  @Override
  public boolean isReady() {
    return graph.get() != null;
  }

  @Override
  public PathStrategy pathStrategy() {
    return graph().pathStrategy();
  }

  private IdiomGraph graph() {
    IdiomGraph g = graph.get();
    if (g == null) throw new DictionaryNotReadyException();
    return g;
  }

  /** JDBC URL wins over a file path; neither is a startup error. */
  static IdiomSource selectSource(String dictionaryPath, String jdbcUrl, String query) {
    if (jdbcUrl != null && !jdbcUrl.isBlank()) return new SqliteIdiomSource(jdbcUrl.trim(), query);
    if (dictionaryPath != null && !dictionaryPath.isBlank()) {
      return new TextFileIdiomSource(Path.of(dictionaryPath.trim()));
    }
    throw new IllegalStateException(
        "No idiom dictionary configured: set idiomchain.dictionary-path or idiomchain.dictionary-jdbc-url");
  }
}
