package com.polycopy.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix="copy")
public record CopyProperties(
    @Valid Ledger ledger,
    @Valid Sizing sizing,
    @Valid Feed feed
) {

  public CopyProperties {
    if (ledger == null) {
      ledger = new Ledger(null, null, null);
    }
    if (sizing == null) {
      sizing = new Sizing(null, null, null);
    }
    if (feed == null) {
      feed = new Feed(null);
    }
  }

  public record Ledger(
      /**
       * Share size at or below which a remaining position counts as fully unwound.
       */
      @Positive BigDecimal sizeEpsilon,
      /**
       * Scale used when dividing to compute volume-weighted entry prices.
       */
      @Min(2) Integer priceScale,
      String stateFile
  ) {
    public Ledger {
      if (sizeEpsilon == null) {
        sizeEpsilon = new BigDecimal("0.000001");
      }
      if (priceScale == null) {
        priceScale = 10;
      }
      if (stateFile == null || stateFile.isBlank()) {
        stateFile = "ledger_state.json";
      }
    }
  }

  public record Sizing(
      Boolean enabled,
      @Positive BigDecimal riskMultiplier,
      @Positive BigDecimal maxTradeUsdc
  ) {
    public Sizing {
      if (enabled == null) {
        enabled = true;
      }
      if (riskMultiplier == null) {
        riskMultiplier = BigDecimal.ONE;
      }
      if (maxTradeUsdc == null) {
        maxTradeUsdc = new BigDecimal("100.0");
      }
    }
  }

  public record Feed(
      /**
       * Proxy wallet whose activity is copied. Rows from other wallets are dropped when set.
       */
      String targetWallet
  ) {
    public Feed {
      if (targetWallet != null) {
        targetWallet = targetWallet.trim().toLowerCase();
        if (targetWallet.isEmpty()) {
          targetWallet = null;
        }
      }
    }
  }
}
