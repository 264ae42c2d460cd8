package com.polycopy.error;

/**
 * A fill violates the input contract (ids, side, size, price, timestamp). The fill is dropped, never retried.
 */
public class InvalidEventException extends LedgerException {

  public InvalidEventException(String message) {
    super(message);
  }
}
