package com.idiomchain.domain;

import java.io.IOException;

/** Pull-style line input for the loader; {@code BufferedReader::readLine} fits. */
@FunctionalInterface
public interface LineSource {
  /**
   * @return the next raw line, or null once the input is exhausted
   * @throws IOException if the underlying input fails before its end
   */
  String nextLine() throws IOException;
}
