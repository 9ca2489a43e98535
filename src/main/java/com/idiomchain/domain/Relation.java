package com.idiomchain.domain;

/** How one idiom relates to another in the chain graph. */
public enum Relation {
  /** Both ends are the same idiom; never a chain step. */
  SELF,
  /** The first idiom cannot be chained into the second. */
  ABSENT,
  /** A chain step of cost {@link ChainGraph#HOP_COST}. */
  EDGE;

  public boolean isStep() {
    return this == EDGE;
  }
}
