package com.polycopy.error;

/**
 * Base type for failures raised by the classification engine and the position ledger.
 */
public abstract class LedgerException extends RuntimeException {

  protected LedgerException(String message) {
    super(message);
  }
}
