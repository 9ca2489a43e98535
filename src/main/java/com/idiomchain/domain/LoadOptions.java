package com.idiomchain.domain;

import java.util.Objects;

/**
 * Construction-time knobs. None of them change query results.
 *
 * @param gcInterval issue a GC hint every this many idioms during the build; {@code <= 0} disables
 * @param pathStrategy shortest-chain strategy
 * @param allPairsLimit largest dictionary for which {@link PathStrategy#AUTO} precomputes all pairs
 */
public record LoadOptions(int gcInterval, PathStrategy pathStrategy, int allPairsLimit) {
  public static final int DEFAULT_GC_INTERVAL = 3000;
  public static final int DEFAULT_ALL_PAIRS_LIMIT = 4096;

  public LoadOptions {
    Objects.requireNonNull(pathStrategy, "pathStrategy");
  }

  public static LoadOptions defaults() {
    return new LoadOptions(DEFAULT_GC_INTERVAL, PathStrategy.AUTO, DEFAULT_ALL_PAIRS_LIMIT);
  }

  public LoadOptions withPathStrategy(PathStrategy strategy) {
    return new LoadOptions(gcInterval, strategy, allPairsLimit);
  }
}
