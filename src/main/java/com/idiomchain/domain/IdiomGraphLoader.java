package com.idiomchain.domain;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds an {@link IdiomGraph} from one-idiom-per-line input.
 *
 * <p>Phases, each depending on the previous one:
 * - read: trim every line, drop lines shorter than two symbols, collapse duplicates
 * - index: fill all three boundary indices
 * - wire: derive chain edges from the finished indices
 * - paths: set up the shortest-chain finder
 *
 * <p>A read failure aborts the load; no partial graph is returned.
 */
public final class IdiomGraphLoader {
  private static final Logger log = LoggerFactory.getLogger(IdiomGraphLoader.class);

  private IdiomGraphLoader() {}

  public static IdiomGraph load(LineSource in, LoadOptions options) throws IOException {
    long t0 = System.nanoTime();
    List<Idiom> idioms = read(in);
    Map<String, Idiom> byText = new HashMap<>(idioms.size() * 2);
    for (Idiom idiom : idioms) byText.put(idiom.text(), idiom);
    log.info("Read {} idioms ({} ms)", idioms.size(), millisSince(t0));
    collect(options, "read");

    long t1 = System.nanoTime();
    IdiomIndex index = IdiomIndex.build(idioms);
    ChainGraph chains =
        ChainGraph.build(
            idioms,
            index,
            wired -> {
              if (options.gcInterval() > 0 && wired % options.gcInterval() == 0) {
                collect(options, "wire@" + wired);
              }
            });
    log.info(
        "Indexed and wired {} idioms, {} chain edges ({} ms)",
        chains.nodeCount(),
        chains.edgeCount(),
        millisSince(t1));
    collect(options, "wire");

    long t2 = System.nanoTime();
    PathStrategy strategy = options.pathStrategy().resolve(idioms.size(), options.allPairsLimit());
    ChainFinder finder = ChainFinder.create(chains, strategy);
    log.info("Chain finder ready: {} ({} ms)", strategy, millisSince(t2));
    collect(options, "paths");

    return new IdiomGraph(
        idioms, Collections.unmodifiableMap(byText), index, chains, finder, strategy);
  }

  /**
   * Accepted idioms in id order. A text seen more than once keeps the position of its last
   * occurrence; ids are then numbered densely in that order.
   */
  static List<Idiom> read(LineSource in) throws IOException {
    Set<String> lastSeen = new LinkedHashSet<>();
    String line;
    while ((line = in.nextLine()) != null) {
      String text = trim(line);
      if (Idiom.isValid(text)) {
        lastSeen.remove(text);
        lastSeen.add(text);
      }
    }
    List<Idiom> idioms = new ArrayList<>(lastSeen.size());
    for (String text : lastSeen) {
      idioms.add(new Idiom(idioms.size(), text));
    }
    return Collections.unmodifiableList(idioms);
  }

  /**
   * Strip leading and trailing white space: Unicode space separators (including no-break spaces),
   * the ASCII controls TAB, LF, VT, FF and CR, and NEL (U+0085).
   */
  static String trim(String line) {
    int from = 0;
    int to = line.length();
    while (from < to) {
      int cp = line.codePointAt(from);
      if (!isSpace(cp)) break;
      from += Character.charCount(cp);
    }
    while (to > from) {
      int cp = line.codePointBefore(to);
      if (!isSpace(cp)) break;
      to -= Character.charCount(cp);
    }
    return line.substring(from, to);
  }

  private static boolean isSpace(int cp) {
    return (cp >= '\t' && cp <= '\r') || cp == 0x85 || Character.isSpaceChar(cp);
  }

  private static void collect(LoadOptions options, String phase) {
    if (options.gcInterval() <= 0) return;
    log.debug("GC hint after {}", phase);
    System.gc();
  }

  private static long millisSince(long t0) {
    return (System.nanoTime() - t0) / 1_000_000;
  }
}
