package com.polycopy.ledger;

import com.polycopy.classification.ClassificationResult;
import com.polycopy.classification.TradeClassifier;
import com.polycopy.domain.Classification;
import com.polycopy.domain.ClosedTradeRecord;
import com.polycopy.domain.FillEvent;
import com.polycopy.domain.Position;
import com.polycopy.domain.TradeSide;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Whole-sequence properties: realized PnL only on closing classifications, strictly positive sizes,
 * cumulative PnL equal to the history sum, and resumption from any saved prefix.
 */
class LedgerReplayTests {

  private static final Instant START = Instant.parse("2024-01-15T10:00:00Z");

  private final TradeClassifier classifier = new TradeClassifier(new BigDecimal("0.000001"), 10);

  @Test
  void invariantsHoldAcrossMixedSequence() {
    PositionLedger ledger = new PositionLedger();

    for (FillEvent fill : sequence()) {
      ClassificationResult result = apply(ledger, fill);

      assertThat(result.closedTrade().isPresent()).isEqualTo(result.classification().realizesPnl());
      assertThat(ledger.listOpenPositions()).allSatisfy(p -> assertThat(p.size()).isPositive());
      BigDecimal sum = ledger.listClosedTrades(0).stream()
          .map(ClosedTradeRecord::realizedPnl)
          .reduce(BigDecimal.ZERO, BigDecimal::add);
      assertThat(ledger.cumulativeRealizedPnl()).isEqualByComparingTo(sum);
    }

    assertThat(ledger.listClosedTrades(0)).extracting(ClosedTradeRecord::classification)
        .contains(Classification.FULL_CLOSE, Classification.PARTIAL_CLOSE, Classification.REVERSE,
            Classification.HEDGE_CLOSE, Classification.PARTIAL_HEDGE);
  }

  @Test
  void resumingFromAnyPrefixSnapshotReproducesFinalState() {
    List<FillEvent> fills = sequence();
    PositionLedger reference = new PositionLedger();
    fills.forEach(fill -> apply(reference, fill));

    for (int prefix = 0; prefix <= fills.size(); prefix++) {
      PositionLedger first = new PositionLedger();
      fills.subList(0, prefix).forEach(fill -> apply(first, fill));

      PositionLedger resumed = PositionLedger.restore(first.snapshot(START));
      fills.subList(prefix, fills.size()).forEach(fill -> apply(resumed, fill));

      assertThat(resumed.listOpenPositions()).as("positions after prefix %d", prefix)
          .isEqualTo(reference.listOpenPositions());
      assertThat(resumed.listClosedTrades(0)).as("history after prefix %d", prefix)
          .isEqualTo(reference.listClosedTrades(0));
      assertThat(resumed.cumulativeRealizedPnl()).isEqualByComparingTo(reference.cumulativeRealizedPnl());
    }
  }

  @Test
  void marketsAppliedConcurrentlyDoNotLoseUpdates() throws Exception {
    PositionLedger ledger = new PositionLedger();
    int markets = 8;
    int fillsPerMarket = 200;
    ExecutorService pool = Executors.newFixedThreadPool(markets);
    try {
      List<Callable<Void>> tasks = new ArrayList<>();
      for (int m = 0; m < markets; m++) {
        String market = "market-" + m;
        tasks.add(() -> {
          for (int i = 0; i < fillsPerMarket; i++) {
            apply(ledger, new FillEvent("tx-" + market + "-" + i, market + "-up", market, "Up", TradeSide.BUY,
                BigDecimal.ONE, new BigDecimal("0.50"), START.plusSeconds(i)));
          }
          return null;
        });
      }
      for (Future<Void> future : pool.invokeAll(tasks)) {
        future.get();
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(ledger.listOpenPositions()).hasSize(markets);
    assertThat(ledger.listOpenPositions()).allSatisfy(p ->
        assertThat(p.size()).isEqualByComparingTo(BigDecimal.valueOf(fillsPerMarket)));
  }

  private ClassificationResult apply(PositionLedger ledger, FillEvent fill) {
    ClassificationResult result = classifier.classify(ledger.state(), fill);
    ledger.apply(result.delta());
    return result;
  }

  private static List<FillEvent> sequence() {
    List<FillEvent> fills = new ArrayList<>();
    fills.add(fill(fills, "m1", "m1-up", "Up", TradeSide.BUY, "100", "0.60"));      // OPEN
    fills.add(fill(fills, "m1", "m1-up", "Up", TradeSide.BUY, "50", "0.65"));       // INCREASE
    fills.add(fill(fills, "m1", "m1-up", "Up", TradeSide.SELL, "40", "0.70"));      // PARTIAL_CLOSE
    fills.add(fill(fills, "m2", "m2-yes", "Yes", TradeSide.BUY, "30", "0.20"));     // OPEN
    fills.add(fill(fills, "m1", "m1-down", "Down", TradeSide.BUY, "30", "0.45"));   // PARTIAL_HEDGE
    fills.add(fill(fills, "m1", "m1-down", "Down", TradeSide.BUY, "90", "0.40"));   // HEDGE_CLOSE
    fills.add(fill(fills, "m1", "m1-down", "Down", TradeSide.SELL, "150", "0.55")); // REVERSE
    fills.add(fill(fills, "m1", "m1-down", "Down", TradeSide.BUY, "30", "0.50"));   // FULL_CLOSE
    fills.add(fill(fills, "m2", "m2-yes", "Yes", TradeSide.SELL, "30", "0.35"));    // FULL_CLOSE
    fills.add(fill(fills, "m2", "m2-no", "No", TradeSide.BUY, "12.5", "0.61"));     // OPEN
    return fills;
  }

  private static FillEvent fill(List<FillEvent> prior, String market, String token, String outcome, TradeSide side,
                                String size, String price) {
    int n = prior.size() + 1;
    return new FillEvent("0xtx" + n, token, market, outcome, side, new BigDecimal(size), new BigDecimal(price),
        START.plusSeconds(n));
  }
}
