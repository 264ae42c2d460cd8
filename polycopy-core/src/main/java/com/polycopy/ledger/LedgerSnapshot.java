package com.polycopy.ledger;

import com.polycopy.domain.ClosedTradeRecord;
import com.polycopy.domain.Position;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Persistable copy of the ledger: open positions plus closed-trade history, oldest first.
 * {@code seenTransactionHashes} lists the feed transactions already taken in, so a restart
 * does not book them twice.
 */
public record LedgerSnapshot(
    List<Position> positions,
    List<ClosedTradeRecord> closedTrades,
    List<String> seenTransactionHashes,
    Instant savedAt
) {

  public LedgerSnapshot {
    positions = positions == null ? List.of() : List.copyOf(positions);
    closedTrades = closedTrades == null ? List.of() : List.copyOf(closedTrades);
    seenTransactionHashes = seenTransactionHashes == null ? List.of() : List.copyOf(new TreeSet<>(seenTransactionHashes));
  }

  public static LedgerSnapshot empty() {
    return new LedgerSnapshot(List.of(), List.of(), List.of(), null);
  }

  public LedgerSnapshot withSeenTransactionHashes(Collection<String> hashes) {
    return new LedgerSnapshot(positions, closedTrades, hashes == null ? null : List.copyOf(hashes), savedAt);
  }
}
