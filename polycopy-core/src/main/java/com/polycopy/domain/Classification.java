package com.polycopy.domain;

/**
 * What a fill means relative to the exposure held before it.
 */
public enum Classification {
  OPEN(false),
  INCREASE(false),
  PARTIAL_CLOSE(true),
  FULL_CLOSE(true),
  REVERSE(true),
  HEDGE_CLOSE(true),
  PARTIAL_HEDGE(true);

  private final boolean realizesPnl;

  Classification(boolean realizesPnl) {
    this.realizesPnl = realizesPnl;
  }

  public boolean realizesPnl() {
    return realizesPnl;
  }
}
