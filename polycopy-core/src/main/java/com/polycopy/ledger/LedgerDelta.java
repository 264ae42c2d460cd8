package com.polycopy.ledger;

import com.polycopy.domain.ClosedTradeRecord;
import com.polycopy.domain.Position;

import java.util.List;
import java.util.Optional;

/**
 * Every ledger effect of one fill. Applied as a unit by {@link PositionLedger#apply(LedgerDelta)}.
 */
public record LedgerDelta(
    List<PositionChange> changes,
    ClosedTradeRecord closedTrade
) {

  public LedgerDelta {
    changes = changes == null ? List.of() : List.copyOf(changes);
  }

  public static LedgerDelta of(ClosedTradeRecord closedTrade, PositionChange... changes) {
    return new LedgerDelta(List.of(changes), closedTrade);
  }

  public static LedgerDelta upsert(Position expected, Position position) {
    return new LedgerDelta(List.of(new PositionChange.Upsert(expected, position)), null);
  }

  public static LedgerDelta removal(Position expected) {
    return new LedgerDelta(List.of(new PositionChange.Removal(expected)), null);
  }

  public static LedgerDelta closedTradeOnly(ClosedTradeRecord closedTrade) {
    return new LedgerDelta(List.of(), closedTrade);
  }

  public Optional<ClosedTradeRecord> closedTradeOpt() {
    return Optional.ofNullable(closedTrade);
  }
}
