package com.polycopy.ledger;

import com.polycopy.domain.ClosedTradeRecord;
import com.polycopy.domain.Position;
import com.polycopy.error.InconsistentStateException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable ledger contents at one point in time. Published whole by {@link PositionLedger}.
 */
public record LedgerState(
    Map<String, Position> positionsByTokenId,
    List<ClosedTradeRecord> closedTrades,
    BigDecimal realizedPnl
) implements LedgerView {

  static final LedgerState EMPTY = new LedgerState(Map.of(), List.of(), BigDecimal.ZERO);

  public LedgerState {
    positionsByTokenId = Collections.unmodifiableMap(new LinkedHashMap<>(positionsByTokenId));
    closedTrades = List.copyOf(closedTrades);
  }

  @Override
  public Optional<Position> getPosition(String tokenId) {
    return Optional.ofNullable(positionsByTokenId.get(tokenId));
  }

  @Override
  public Optional<Position> getOppositePosition(String marketId, String outcome) {
    Position found = null;
    for (Position p : positionsByTokenId.values()) {
      if (!Objects.equals(p.marketId(), marketId) || Objects.equals(p.outcome(), outcome)) {
        continue;
      }
      if (found != null && !Objects.equals(found.outcome(), p.outcome())) {
        throw new InconsistentStateException("market " + marketId + " holds positions on more than one outcome other than "
            + outcome + "; opposite outcome is ambiguous");
      }
      found = p;
    }
    return Optional.ofNullable(found);
  }

  /**
   * Returns the state with {@code delta} applied. Nothing is applied if any precondition fails.
   */
  LedgerState apply(LedgerDelta delta) {
    Map<String, Position> next = new LinkedHashMap<>(positionsByTokenId);
    for (PositionChange change : delta.changes()) {
      Position current = next.get(change.tokenId());
      if (!Objects.equals(current, change.expected())) {
        throw new InconsistentStateException("position " + change.tokenId() + " changed underneath the mutation: expected "
            + change.expected() + " but ledger holds " + current);
      }
      if (change instanceof PositionChange.Upsert upsert) {
        next.put(upsert.tokenId(), checked(upsert.position()));
      } else {
        next.remove(change.tokenId());
      }
    }

    if (delta.closedTrade() == null) {
      return new LedgerState(next, closedTrades, realizedPnl);
    }
    List<ClosedTradeRecord> trades = new ArrayList<>(closedTrades.size() + 1);
    trades.addAll(closedTrades);
    trades.add(delta.closedTrade());
    return new LedgerState(next, trades, realizedPnl.add(delta.closedTrade().realizedPnl()));
  }

  static Position checked(Position position) {
    if (position.tokenId() == null || position.tokenId().isBlank()) {
      throw new InconsistentStateException("position has no token id: " + position);
    }
    if (position.size() == null || position.size().signum() <= 0) {
      throw new InconsistentStateException("position " + position.tokenId() + " must have a positive size, got " + position.size());
    }
    if (position.entryPrice() == null || position.direction() == null) {
      throw new InconsistentStateException("position " + position.tokenId() + " is missing entry price or direction");
    }
    return position;
  }
}
