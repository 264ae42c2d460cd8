package com.polycopy.domain;

import com.polycopy.error.InvalidEventException;

import java.util.Locale;

public enum TradeSide {
  BUY,
  SELL;

  public static TradeSide parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidEventException("side must not be blank");
    }
    return switch (raw.trim().toUpperCase(Locale.ROOT)) {
      case "BUY" -> BUY;
      case "SELL" -> SELL;
      default -> throw new InvalidEventException("unknown side: " + raw);
    };
  }
}
