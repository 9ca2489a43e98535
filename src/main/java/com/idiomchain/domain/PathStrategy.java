package com.idiomchain.domain;

/** How shortest chains are computed. */
public enum PathStrategy {
  /** One BFS per source at load time; queries walk a stored predecessor row. */
  ALL_PAIRS,
  /** One BFS from the source on every query. */
  PER_QUERY,
  /** {@link #ALL_PAIRS} up to {@link LoadOptions#allPairsLimit()} idioms, else {@link #PER_QUERY}. */
  AUTO;

  public PathStrategy resolve(int idiomCount, int allPairsLimit) {
    if (this != AUTO) return this;
    return idiomCount <= allPairsLimit ? ALL_PAIRS : PER_QUERY;
  }
}
