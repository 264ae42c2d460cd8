package com.polycopy.ledger;

import com.polycopy.domain.Position;

import java.util.Optional;

/**
 * Read-only view of open positions, as consumed by the classification engine.
 */
public interface LedgerView {

  Optional<Position> getPosition(String tokenId);

  /**
   * The position held on the other outcome of {@code marketId}, if any.
   */
  Optional<Position> getOppositePosition(String marketId, String outcome);
}
