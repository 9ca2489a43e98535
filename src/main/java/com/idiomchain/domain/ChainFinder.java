package com.idiomchain.domain;

/** Shortest-chain lookup over a {@link ChainGraph}. Implementations are safe for concurrent reads. */
public interface ChainFinder {
  /**
   * Minimum-hop chain from {@code source} to {@code target}, both inclusive.
   *
   * @return node ids {@code [source, ..., target]}, or an empty array if the two are the same node
   *     or the target is unreachable
   */
  int[] shortestChain(int source, int target);

  static ChainFinder create(ChainGraph graph, PathStrategy strategy) {
    switch (strategy) {
      case ALL_PAIRS:
        return new AllPairsChainFinder(graph);
      case PER_QUERY:
        return new PerQueryChainFinder(graph);
      default:
        throw new IllegalArgumentException("Unresolved path strategy: " + strategy);
    }
  }
}
