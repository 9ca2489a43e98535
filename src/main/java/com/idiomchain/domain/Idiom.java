package com.idiomchain.domain;

import java.util.Objects;

/**
 * A dictionary entry: its text and the dense id the loader assigned to it.
 *
 * <p>Symbols are Unicode code points, so an idiom's length and its boundary symbols are measured
 * in code points rather than UTF-16 chars.
 */
public record Idiom(int id, String text) {
  public static final int MIN_SYMBOLS = 2;

  public Idiom {
    Objects.requireNonNull(text, "text");
    if (!isValid(text)) {
      throw new IllegalArgumentException("Idiom needs at least " + MIN_SYMBOLS + " symbols: " + text);
    }
  }

  /** True if {@code text} has enough symbols to be an idiom. */
  public static boolean isValid(String text) {
    return text != null && text.codePointCount(0, text.length()) >= MIN_SYMBOLS;
  }

  public int firstSymbol() {
    return text.codePointAt(0);
  }

  public int lastSymbol() {
    return text.codePointBefore(text.length());
  }

  public BoundaryKey boundary() {
    return new BoundaryKey(firstSymbol(), lastSymbol());
  }

  /** True if this idiom's last symbol is {@code next}'s first one. */
  public boolean chainsInto(Idiom next) {
    return lastSymbol() == next.firstSymbol();
  }

  @Override
  public String toString() {
    return text;
  }
}
