package com.idiomchain.domain;

import java.util.Arrays;
import java.util.List;

/**
 * Directed chain graph over idiom ids: an edge A&rarr;B exists iff A's last symbol is B's first
 * symbol and A is not B.
 *
 * <p>Edges are derived from a finished {@link IdiomIndex}, so the topology does not depend on the
 * order idioms were indexed in. Successor arrays are sorted by id.
 */
public final class ChainGraph {
  /** Cost of every edge; a shortest chain is the one with the fewest hops. */
  public static final int HOP_COST = 1;

  private static final int[] NONE = new int[0];

  private final int[][] successors;
  private final long edgeCount;

  private ChainGraph(int[][] successors, long edgeCount) {
    this.successors = successors;
    this.edgeCount = edgeCount;
  }

  /**
   * @param idioms all idioms, where {@code idioms.get(i).id() == i}
   * @param index finished index over the same idioms
   * @param onNode called after each node is wired, with the running count
   */
  static ChainGraph build(List<Idiom> idioms, IdiomIndex index, NodeListener onNode) {
    int[][] succ = new int[idioms.size()][];
    long edges = 0;
    for (Idiom from : idioms) {
      List<Idiom> next = index.beginningWith(from.lastSymbol());
      int[] ids = new int[next.size()];
      int n = 0;
      for (Idiom to : next) {
        if (to.id() != from.id()) ids[n++] = to.id();
      }
      succ[from.id()] = n == 0 ? NONE : Arrays.copyOf(ids, n);
      edges += n;
      onNode.nodeWired(from.id() + 1);
    }
    return new ChainGraph(succ, edges);
  }

  public int nodeCount() {
    return successors.length;
  }

  public long edgeCount() {
    return edgeCount;
  }

  public boolean contains(int node) {
    return node >= 0 && node < successors.length;
  }

  /** Ids reachable in one hop; callers must not modify the array. */
  int[] successorsOf(int node) {
    return successors[node];
  }

  public int[] successors(int node) {
    return successors[node].clone();
  }

  public Relation relation(int from, int to) {
    if (!contains(from) || !contains(to)) {
      throw new IndexOutOfBoundsException("Unknown node: " + (contains(from) ? to : from));
    }
    if (from == to) return Relation.SELF;
    return Arrays.binarySearch(successors[from], to) >= 0 ? Relation.EDGE : Relation.ABSENT;
  }

  @FunctionalInterface
  interface NodeListener {
    void nodeWired(int wired);
  }
}
