package com.idiomchain.dto;

public record ErrorMessage(String type, String message) {
  public static final String BAD_REQUEST = "bad_request";
  public static final String UNKNOWN_IDIOM = "unknown_idiom";
  public static final String NOT_READY = "not_ready";
}
