package com.idiomchain.domain;

import java.util.stream.IntStream;

/**
 * Precomputes a shortest-chain predecessor row for every source.
 *
 * <p>Memory is one {@code int} per ordered pair of idioms, so this only suits dictionaries of a few
 * thousand entries. Queries cost O(chain length).
 */
final class AllPairsChainFinder implements ChainFinder {
  private final ChainGraph graph;
  private final int[][] parents;

  AllPairsChainFinder(ChainGraph graph) {
    this.graph = graph;
    int n = graph.nodeCount();
    int[][] rows = new int[n][];
    // rows are disjoint, so the sources can be searched in parallel
    IntStream.range(0, n)
        .parallel()
        .forEach(source -> rows[source] = ChainSearch.predecessors(graph, source, ChainSearch.UNREACHED));
    this.parents = rows;
  }

  @Override
  public int[] shortestChain(int source, int target) {
    checkNode(source);
    checkNode(target);
    return ChainSearch.unwind(parents[source], source, target);
  }

  private void checkNode(int node) {
    if (!graph.contains(node)) throw new IndexOutOfBoundsException("Unknown node: " + node);
  }
}
