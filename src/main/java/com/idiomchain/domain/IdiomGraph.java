package com.idiomchain.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The loaded idiom dictionary: exact-text table, boundary indices, chain graph and chain finder.
 *
 * <p>Built by {@link IdiomGraphLoader} and never modified afterwards, so one instance can be read
 * by any number of threads without locking.
 */
public final class IdiomGraph {
  private final List<Idiom> idioms;
  private final Map<String, Idiom> byText;
  private final IdiomIndex index;
  private final ChainGraph chains;
  private final ChainFinder finder;
  private final PathStrategy pathStrategy;

  IdiomGraph(
      List<Idiom> idioms,
      Map<String, Idiom> byText,
      IdiomIndex index,
      ChainGraph chains,
      ChainFinder finder,
      PathStrategy pathStrategy) {
    this.idioms = idioms;
    this.byText = byText;
    this.index = index;
    this.chains = chains;
    this.finder = finder;
    this.pathStrategy = pathStrategy;
  }

  /** @return the idiom with exactly this text, or null */
  public Idiom find(String text) {
    return text == null ? null : byText.get(text);
  }

  public List<Idiom> beginWith(int symbol, int offset, int length) {
    return IdiomIndex.page(index.beginningWith(symbol), offset, length);
  }

  public List<Idiom> endWith(int symbol, int offset, int length) {
    return IdiomIndex.page(index.endingWith(symbol), offset, length);
  }

  public List<Idiom> beginEndWith(int begin, int end, int offset, int length) {
    return IdiomIndex.page(index.bounded(begin, end), offset, length);
  }

  /**
   * Shortest chain from {@code source} to {@code target}.
   *
   * @return {@code [source, n1, ..., target]}, or an empty list if they are the same idiom or no
   *     chain exists
   */
  public List<Idiom> shortestChain(Idiom source, Idiom target) {
    int[] ids = finder.shortestChain(nodeOf(source), nodeOf(target));
    List<Idiom> chain = new ArrayList<>(ids.length);
    for (int id : ids) chain.add(idioms.get(id));
    return chain;
  }

  public Relation relation(Idiom from, Idiom to) {
    return chains.relation(nodeOf(from), nodeOf(to));
  }

  public int size() {
    return idioms.size();
  }

  /** All idioms in id order. */
  public List<Idiom> idioms() {
    return idioms;
  }

  public ChainGraph chainGraph() {
    return chains;
  }

  public PathStrategy pathStrategy() {
    return pathStrategy;
  }

  private int nodeOf(Idiom idiom) {
    Idiom own = byText.get(idiom.text());
    if (own == null || own.id() != idiom.id()) {
      throw new IllegalArgumentException("Idiom not in this dictionary: " + idiom.text());
    }
    return own.id();
  }
}
