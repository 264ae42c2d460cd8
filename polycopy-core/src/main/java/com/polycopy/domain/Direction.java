package com.polycopy.domain;

/**
 * Direction of held exposure, fixed when a position is created.
 */
public enum Direction {
  LONG(1),
  SHORT(-1);

  private final int signum;

  Direction(int signum) {
    this.signum = signum;
  }

  public int signum() {
    return signum;
  }

  public Direction opposite() {
    return this == LONG ? SHORT : LONG;
  }

  public static Direction of(TradeSide side) {
    return side == TradeSide.BUY ? LONG : SHORT;
  }
}
