package com.polycopy.error;

/**
 * The ledger does not hold the state a mutation was computed against, or holds state that
 * cannot be classified against. Nothing is applied when this is raised.
 */
public class InconsistentStateException extends LedgerException {

  public InconsistentStateException(String message) {
    super(message);
  }
}
