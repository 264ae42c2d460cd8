package com.polycopy.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Open exposure in a single outcome token.
 *
 * Tracks:
 * - Shares currently held (always strictly positive while in the ledger)
 * - Volume-weighted average entry price
 * - Direction, fixed at creation
 */
public record Position(
    String tokenId,
    String marketId,
    String outcome,
    BigDecimal size,
    BigDecimal entryPrice,
    Direction direction,
    Instant openedAt,
    Instant updatedAt
) {

  /**
   * Open a new position from a fill.
   */
  public static Position open(FillEvent fill, BigDecimal size, BigDecimal price, Direction direction) {
    return new Position(
        fill.tokenId(),
        fill.marketId(),
        fill.outcome(),
        size,
        price,
        direction,
        fill.timestamp(),
        fill.timestamp()
    );
  }

  /**
   * Add to the position; entry price becomes the volume-weighted average.
   */
  public Position increase(BigDecimal addedSize, BigDecimal addedPrice, int priceScale, Instant at) {
    BigDecimal totalCost = size.multiply(entryPrice).add(addedSize.multiply(addedPrice));
    BigDecimal newSize = size.add(addedSize);
    BigDecimal newEntry = totalCost.divide(newSize, priceScale, RoundingMode.HALF_UP);
    return new Position(tokenId, marketId, outcome, newSize, newEntry, direction, openedAt, at);
  }

  /**
   * Shrink the position. Entry price and direction do not change on reduction.
   */
  public Position reduceTo(BigDecimal remainingSize, Instant at) {
    return new Position(tokenId, marketId, outcome, remainingSize, entryPrice, direction, openedAt, at);
  }

  public BigDecimal signedSize() {
    return direction == Direction.LONG ? size : size.negate();
  }
}
