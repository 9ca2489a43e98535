package com.idiomchain.application;

/** A query arrived before the dictionary was loaded and published. */
public class DictionaryNotReadyException extends IllegalStateException {
  public DictionaryNotReadyException() {
    super("Idiom dictionary not loaded");
  }
}
