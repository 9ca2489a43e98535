package com.idiomchain.domain;

import java.util.Arrays;

/** Breadth-first search helpers shared by the chain finders. */
final class ChainSearch {
  static final int UNREACHED = -1;

  private static final int[] EMPTY = new int[0];

  private ChainSearch() {}

  /**
   * Predecessor row for {@code source}: {@code parent[v]} is the node before {@code v} on a
   * shortest chain, {@code parent[source] == source}, and unreached nodes hold {@link #UNREACHED}.
   *
   * @param stopAt node at which the search may stop early, or {@link #UNREACHED} to visit all
   */
  static int[] predecessors(ChainGraph graph, int source, int stopAt) {
    int n = graph.nodeCount();
    int[] parent = new int[n];
    Arrays.fill(parent, UNREACHED);
    int[] queue = new int[n];
    int head = 0;
    int tail = 0;
    parent[source] = source;
    queue[tail++] = source;
    while (head < tail) {
      int node = queue[head++];
      if (node == stopAt) break;
      for (int next : graph.successorsOf(node)) {
        if (parent[next] == UNREACHED) {
          parent[next] = node;
          queue[tail++] = next;
        }
      }
    }
    return parent;
  }

  /** Walk a predecessor row back from {@code target}; empty when unreachable or trivial. */
  static int[] unwind(int[] parent, int source, int target) {
    if (source == target || parent[target] == UNREACHED) return EMPTY;
    int hops = 0;
    for (int v = target; v != source; v = parent[v]) hops++;
    int[] chain = new int[hops + 1];
    int i = hops;
    for (int v = target; v != source; v = parent[v]) chain[i--] = v;
    chain[0] = source;
    return chain;
  }
}
