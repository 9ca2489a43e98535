package com.idiomchain.application.port;

import com.idiomchain.domain.Idiom;
import com.idiomchain.domain.PathStrategy;
import java.util.List;

/**
 * Read-only idiom queries. Every query throws {@link
 * com.idiomchain.application.DictionaryNotReadyException} until the dictionary is loaded.
 */
public interface IdiomDictionary {
  Idiom find(String text);

  List<Idiom> beginWith(int symbol, int offset, int length);

  List<Idiom> endWith(int symbol, int offset, int length);

  List<Idiom> beginEndWith(int begin, int end, int offset, int length);

  /** @throws com.idiomchain.application.UnknownIdiomException if either text is not an idiom */
  List<Idiom> shortestChain(String sourceText, String targetText);

  int size();

  /** Strategy the loaded dictionary resolved to; never {@link PathStrategy#AUTO}. */
  PathStrategy pathStrategy();

  boolean isReady();
}
