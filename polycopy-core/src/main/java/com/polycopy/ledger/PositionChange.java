package com.polycopy.ledger;

import com.polycopy.domain.Position;

/**
 * One position mutation inside a {@link LedgerDelta}. {@code expected} is the position the change was
 * computed against ({@code null} when the token had none); the ledger refuses the change if it differs.
 */
public sealed interface PositionChange permits PositionChange.Upsert, PositionChange.Removal {

  String tokenId();

  Position expected();

  record Upsert(Position expected, Position position) implements PositionChange {
    @Override
    public String tokenId() {
      return position.tokenId();
    }
  }

  record Removal(Position expected) implements PositionChange {
    @Override
    public String tokenId() {
      return expected.tokenId();
    }
  }
}
