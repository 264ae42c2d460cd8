package com.polycopy.ledger;

import com.polycopy.domain.ClosedTradeRecord;
import com.polycopy.domain.Position;
import com.polycopy.error.InconsistentStateException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Open positions per token plus the append-only closed-trade history.
 *
 * State is an immutable {@link LedgerState} swapped in with compare-and-set, so a reader sees either all
 * of a fill's effects or none of them. Fills for different markets may be applied concurrently;
 * callers serialize fills within a market.
 */
public class PositionLedger implements LedgerView {

  private static final Comparator<Position> BY_OPENED_AT = Comparator
      .comparing(Position::openedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
      .thenComparing(Position::tokenId);

  private final AtomicReference<LedgerState> state;

  public PositionLedger() {
    this(LedgerState.EMPTY);
  }

  private PositionLedger(LedgerState initial) {
    this.state = new AtomicReference<>(initial);
  }

  /**
   * Rebuild a ledger from a previously saved snapshot.
   */
  public static PositionLedger restore(LedgerSnapshot snapshot) {
    Map<String, Position> positions = new HashMap<>();
    for (Position p : snapshot.positions()) {
      LedgerState.checked(p);
      if (positions.put(p.tokenId(), p) != null) {
        throw new InconsistentStateException("snapshot holds more than one position for token " + p.tokenId());
      }
    }
    BigDecimal pnl = BigDecimal.ZERO;
    for (ClosedTradeRecord record : snapshot.closedTrades()) {
      if (record.realizedPnl() == null) {
        throw new InconsistentStateException("closed trade without realized pnl: " + record);
      }
      pnl = pnl.add(record.realizedPnl());
    }
    return new PositionLedger(new LedgerState(positions, snapshot.closedTrades(), pnl));
  }

  /**
   * Current immutable state; use it as a consistent view for a whole classification.
   */
  public LedgerState state() {
    return state.get();
  }

  @Override
  public Optional<Position> getPosition(String tokenId) {
    return state.get().getPosition(tokenId);
  }

  @Override
  public Optional<Position> getOppositePosition(String marketId, String outcome) {
    return state.get().getOppositePosition(marketId, outcome);
  }

  /**
   * Apply every change in {@code delta} atomically, checking each against the position it was computed from.
   *
   * @throws InconsistentStateException if any precondition fails; the ledger is left untouched
   */
  public LedgerState apply(LedgerDelta delta) {
    while (true) {
      LedgerState current = state.get();
      LedgerState next = current.apply(delta);
      if (state.compareAndSet(current, next)) {
        return next;
      }
    }
  }

  public void upsertPosition(Position position) {
    apply(LedgerDelta.upsert(getPosition(position.tokenId()).orElse(null), position));
  }

  public void removePosition(String tokenId) {
    Position existing = getPosition(tokenId)
        .orElseThrow(() -> new InconsistentStateException("no position to remove for token " + tokenId));
    apply(LedgerDelta.removal(existing));
  }

  public void appendClosedTrade(ClosedTradeRecord record) {
    apply(LedgerDelta.closedTradeOnly(record));
  }

  public BigDecimal cumulativeRealizedPnl() {
    return state.get().realizedPnl();
  }

  public List<Position> listOpenPositions() {
    List<Position> positions = new ArrayList<>(state.get().positionsByTokenId().values());
    positions.sort(BY_OPENED_AT);
    return positions;
  }

  /**
   * Most recent first. A non-positive limit returns the full history.
   */
  public List<ClosedTradeRecord> listClosedTrades(int limit) {
    List<ClosedTradeRecord> all = state.get().closedTrades();
    int count = limit <= 0 ? all.size() : Math.min(limit, all.size());
    List<ClosedTradeRecord> result = new ArrayList<>(count);
    for (int i = all.size() - 1; i >= all.size() - count; i--) {
      result.add(all.get(i));
    }
    return result;
  }

  public LedgerSnapshot snapshot(Instant savedAt) {
    LedgerState current = state.get();
    List<Position> positions = new ArrayList<>(current.positionsByTokenId().values());
    positions.sort(BY_OPENED_AT);
    return new LedgerSnapshot(positions, current.closedTrades(), List.of(), savedAt);
  }
}
