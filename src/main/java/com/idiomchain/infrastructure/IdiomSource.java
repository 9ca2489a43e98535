package com.idiomchain.infrastructure;

import com.idiomchain.domain.IdiomGraph;
import com.idiomchain.domain.LoadOptions;
import java.io.IOException;

/** Where the dictionary is read from at startup. */
public interface IdiomSource {
  IdiomGraph load(LoadOptions options) throws IOException;

  /** Human-readable location for logs. */
  String describe();
}
