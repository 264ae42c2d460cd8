package com.polycopy.error;

public class LedgerStoreException extends RuntimeException {

  public LedgerStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
