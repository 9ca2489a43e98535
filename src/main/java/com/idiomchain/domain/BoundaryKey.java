package com.idiomchain.domain;

/** First and last symbol (code points) of an idiom. */
public record BoundaryKey(int begin, int end) {}
