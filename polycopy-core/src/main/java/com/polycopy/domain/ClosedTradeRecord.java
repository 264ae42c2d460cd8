package com.polycopy.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable record of PnL realized by a close, partial close, reverse or hedge.
 *
 * For hedges the exit price is the implied exit of the unwound leg ({@code 1 - p}).
 */
public record ClosedTradeRecord(
    String marketId,
    String tokenId,
    String outcome,
    Classification classification,
    Direction direction,
    BigDecimal closingSize,
    BigDecimal entryPrice,
    BigDecimal exitPrice,
    BigDecimal realizedPnl,
    Instant closedAt,
    String tradeId
) {
}
