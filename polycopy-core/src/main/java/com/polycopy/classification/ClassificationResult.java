package com.polycopy.classification;

import com.polycopy.domain.Classification;
import com.polycopy.domain.ClosedTradeRecord;
import com.polycopy.domain.FillEvent;
import com.polycopy.domain.Position;
import com.polycopy.ledger.LedgerDelta;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Outcome of classifying one fill: the classification, the ledger mutation to apply, and the
 * resulting position of the traded token ({@code null} when the fill removed it).
 */
public record ClassificationResult(
    Classification classification,
    FillEvent fill,
    LedgerDelta delta,
    Position resultingPosition
) {

  public Optional<ClosedTradeRecord> closedTrade() {
    return delta.closedTradeOpt();
  }

  public Optional<BigDecimal> realizedPnl() {
    return closedTrade().map(ClosedTradeRecord::realizedPnl);
  }
}
