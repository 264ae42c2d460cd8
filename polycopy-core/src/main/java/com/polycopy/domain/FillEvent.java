package com.polycopy.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A single executed fill, as delivered by the trade feed (deduplicated and in chronological order per market).
 */
public record FillEvent(
    String tradeId,        // Feed-assigned id, e.g. the transaction hash
    String tokenId,        // Outcome token traded
    String marketId,       // Market (condition) the token belongs to
    String outcome,        // "Up"/"Down", "Yes"/"No"
    TradeSide side,
    BigDecimal size,       // Shares, > 0
    BigDecimal price,      // In [0, 1]
    Instant timestamp
) {

  public FillEvent withSize(BigDecimal newSize) {
    return new FillEvent(tradeId, tokenId, marketId, outcome, side, newSize, price, timestamp);
  }

  public BigDecimal signedSize() {
    return side == TradeSide.BUY ? size : size.negate();
  }
}
