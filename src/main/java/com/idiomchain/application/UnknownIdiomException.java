package com.idiomchain.application;

/** A query named a text that is not in the dictionary. */
public class UnknownIdiomException extends RuntimeException {
  private final String text;

  public UnknownIdiomException(String text) {
    super("not a valid idiom: " + text);
    this.text = text;
  }

  public String text() {
    return text;
  }
}
