package com.idiomchain.domain;

/** Runs a BFS from the source for every query; O(N) memory, O(N + E) per query. */
final class PerQueryChainFinder implements ChainFinder {
  private final ChainGraph graph;

  PerQueryChainFinder(ChainGraph graph) {
    this.graph = graph;
  }

  @Override
  public int[] shortestChain(int source, int target) {
    if (!graph.contains(source) || !graph.contains(target)) {
      throw new IndexOutOfBoundsException("Unknown node: " + (graph.contains(source) ? target : source));
    }
    if (source == target) return new int[0];
    int[] parent = ChainSearch.predecessors(graph, source, target);
    return ChainSearch.unwind(parent, source, target);
  }
}
