package com.idiomchain.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The three boundary-symbol indices: by first symbol, by last symbol, and by both.
 *
 * <p>Built once from the full idiom list; every idiom lands in exactly one bucket of each map.
 * Buckets keep the order of the input list (id order) and are unmodifiable.
 */
public final class IdiomIndex {
  private final Map<Integer, List<Idiom>> byBegin;
  private final Map<Integer, List<Idiom>> byEnd;
  private final Map<BoundaryKey, List<Idiom>> byBeginEnd;

  private IdiomIndex(
      Map<Integer, List<Idiom>> byBegin,
      Map<Integer, List<Idiom>> byEnd,
      Map<BoundaryKey, List<Idiom>> byBeginEnd) {
    this.byBegin = byBegin;
    this.byEnd = byEnd;
    this.byBeginEnd = byBeginEnd;
  }

  public static IdiomIndex build(List<Idiom> idioms) {
    Map<Integer, List<Idiom>> begin = new HashMap<>();
    Map<Integer, List<Idiom>> end = new HashMap<>();
    Map<BoundaryKey, List<Idiom>> beginEnd = new HashMap<>();
    for (Idiom idiom : idioms) {
      begin.computeIfAbsent(idiom.firstSymbol(), k -> new ArrayList<>()).add(idiom);
      end.computeIfAbsent(idiom.lastSymbol(), k -> new ArrayList<>()).add(idiom);
      beginEnd.computeIfAbsent(idiom.boundary(), k -> new ArrayList<>()).add(idiom);
    }
    return new IdiomIndex(freeze(begin), freeze(end), freeze(beginEnd));
  }

  public List<Idiom> beginningWith(int symbol) {
    return byBegin.getOrDefault(symbol, List.of());
  }

  public List<Idiom> endingWith(int symbol) {
    return byEnd.getOrDefault(symbol, List.of());
  }

  public List<Idiom> bounded(int begin, int end) {
    return byBeginEnd.getOrDefault(new BoundaryKey(begin, end), List.of());
  }

  /**
   * Slice {@code [offset, offset + length)} of a bucket, clamped to its bounds.
   *
   * <p>A negative offset starts at 0, a negative length runs to the end, and an offset past the end
   * yields an empty list.
   */
  public static <T> List<T> page(List<T> bucket, int offset, int length) {
    int size = bucket.size();
    int from = Math.min(Math.max(offset, 0), size);
    long to = length < 0 ? size : Math.min((long) from + length, size);
    return bucket.subList(from, (int) to);
  }

  private static <K> Map<K, List<Idiom>> freeze(Map<K, List<Idiom>> buckets) {
    Map<K, List<Idiom>> out = new HashMap<>(buckets.size() * 2);
    buckets.forEach((k, v) -> out.put(k, List.copyOf(v)));
    return Collections.unmodifiableMap(out);
  }
}
