package com.polycopy.events.payload;

import com.polycopy.classification.ClassificationResult;
import com.polycopy.domain.Classification;
import com.polycopy.domain.ClosedTradeRecord;
import com.polycopy.domain.FillEvent;
import com.polycopy.domain.Position;
import com.polycopy.domain.TradeSide;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Emitted once per processed fill. Close-related fields are null when nothing was realized;
 * {@code resultingPositionSize} is zero when the traded token's position was removed.
 */
public record ClassificationEvent(
    Classification classification,
    String tradeId,
    String tokenId,
    String marketId,
    String outcome,
    TradeSide side,
    BigDecimal fillSize,
    BigDecimal fillPrice,
    String closedTokenId,
    BigDecimal closingSize,
    BigDecimal entryPrice,
    BigDecimal exitPrice,
    BigDecimal realizedPnl,
    BigDecimal resultingPositionSize,
    Instant occurredAt
) {

  public static ClassificationEvent from(ClassificationResult result) {
    FillEvent fill = result.fill();
    ClosedTradeRecord closed = result.closedTrade().orElse(null);
    Position resulting = result.resultingPosition();
    return new ClassificationEvent(
        result.classification(),
        fill.tradeId(),
        fill.tokenId(),
        fill.marketId(),
        fill.outcome(),
        fill.side(),
        fill.size(),
        fill.price(),
        closed != null ? closed.tokenId() : null,
        closed != null ? closed.closingSize() : null,
        closed != null ? closed.entryPrice() : null,
        closed != null ? closed.exitPrice() : null,
        closed != null ? closed.realizedPnl() : null,
        resulting != null ? resulting.size() : BigDecimal.ZERO,
        fill.timestamp()
    );
  }

  public boolean realized() {
    return realizedPnl != null;
  }
}
