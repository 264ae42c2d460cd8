package com.polycopy.service.processing;

import com.fasterxml.jackson.databind.JsonNode;
import com.polycopy.classification.ClassificationResult;
import com.polycopy.classification.TradeClassifier;
import com.polycopy.domain.Classification;
import com.polycopy.domain.FillEvent;
import com.polycopy.error.LedgerException;
import com.polycopy.error.LedgerStoreException;
import com.polycopy.events.NotificationSink;
import com.polycopy.events.payload.ClassificationEvent;
import com.polycopy.ledger.LedgerStateStore;
import com.polycopy.ledger.PositionLedger;
import com.polycopy.service.feed.ActivityFillParser;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives fills through sizing, classification and the ledger.
 *
 * For each fill:
 * 1. Copy sizing is applied to the observed size
 * 2. Under the market's lock, the fill is classified against a consistent ledger state and the delta applied
 * 3. The new ledger snapshot is saved, together with the feed transactions seen so far
 * 4. Every notification sink receives the classification event
 *
 * Fills for one market are serialized; fills for different markets run concurrently.
 */
@Slf4j
public class FillProcessor {

    private final TradeClassifier classifier;
    private final PositionLedger ledger;
    private final CopySizingPolicy sizingPolicy;
    private final ActivityFillParser activityParser;
    private final LedgerStateStore stateStore;
    private final List<NotificationSink> sinks;
    private final Clock clock;

    private final Map<String, Object> marketLocks = new ConcurrentHashMap<>();
    private final Object persistLock = new Object();

    private final AtomicLong fillsProcessed = new AtomicLong();
    private final AtomicLong fillsRejected = new AtomicLong();
    private final AtomicLong snapshotFailures = new AtomicLong();

    // Prometheus metrics
    private final Map<Classification, Counter> classifiedCounters = new EnumMap<>(Classification.class);
    private final Counter rejectedCounter;
    private final Counter snapshotFailureCounter;
    private final DistributionSummary realizedPnlSummary;

    public FillProcessor(
            TradeClassifier classifier,
            PositionLedger ledger,
            CopySizingPolicy sizingPolicy,
            ActivityFillParser activityParser,
            LedgerStateStore stateStore,
            List<NotificationSink> sinks,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.classifier = classifier;
        this.ledger = ledger;
        this.sizingPolicy = sizingPolicy;
        this.activityParser = activityParser;
        this.stateStore = stateStore;
        this.sinks = List.copyOf(sinks);
        this.clock = clock;

        for (Classification kind : Classification.values()) {
            classifiedCounters.put(kind, Counter.builder("ledger.fills.classified")
                    .description("Fills applied to the ledger, by classification")
                    .tag("classification", kind.name())
                    .register(meterRegistry));
        }
        this.rejectedCounter = Counter.builder("ledger.fills.rejected")
                .description("Fills rejected as invalid or inconsistent with the ledger")
                .register(meterRegistry);
        this.snapshotFailureCounter = Counter.builder("ledger.snapshot.failures")
                .description("Ledger snapshots that could not be saved")
                .register(meterRegistry);
        this.realizedPnlSummary = DistributionSummary.builder("ledger.realized.pnl")
                .description("Realized PnL per closing fill (USDC)")
                .register(meterRegistry);

        Gauge.builder("ledger.positions.open", ledger, l -> l.state().positionsByTokenId().size())
                .description("Number of open positions")
                .register(meterRegistry);
    }

    /**
     * Classify one fill and apply it to the ledger.
     *
     * @throws LedgerException if the fill is invalid or inconsistent with the ledger; nothing is applied
     */
    public ClassificationEvent process(FillEvent fill) {
        FillEvent sized = sizingPolicy.apply(fill);
        String marketKey = sized == null || sized.marketId() == null ? "" : sized.marketId();

        ClassificationResult result;
        synchronized (marketLocks.computeIfAbsent(marketKey, k -> new Object())) {
            try {
                result = classifier.classify(ledger.state(), sized);
                ledger.apply(result.delta());
            } catch (LedgerException e) {
                fillsRejected.incrementAndGet();
                rejectedCounter.increment();
                log.warn("Rejected fill {}: {}", sized != null ? sized.tradeId() : null, e.getMessage());
                throw e;
            }
        }

        fillsProcessed.incrementAndGet();
        classifiedCounters.get(result.classification()).increment();
        result.realizedPnl().ifPresent(pnl -> realizedPnlSummary.record(pnl.doubleValue()));

        persistSnapshot();

        ClassificationEvent event = ClassificationEvent.from(result);
        notifySinks(event);
        return event;
    }

    /**
     * Parse a data-api activity payload and process every new fill in order. A rejected fill is dropped
     * and does not stop the rest of the batch; its transaction still counts as seen.
     */
    public List<ClassificationEvent> ingestActivity(JsonNode payload) {
        List<FillEvent> fills = activityParser.parse(payload);
        if (!fills.isEmpty()) {
            log.info("Processing {} new fill(s)", fills.size());
        }

        List<ClassificationEvent> events = new ArrayList<>(fills.size());
        for (FillEvent fill : fills) {
            if (!activityParser.markSeen(fill.tradeId())) {
                continue;
            }
            try {
                events.add(process(fill));
            } catch (LedgerException e) {
                log.debug("Dropped fill {} from activity batch", fill.tradeId());
            }
        }
        return events;
    }

    private void persistSnapshot() {
        synchronized (persistLock) {
            try {
                stateStore.save(ledger.snapshot(clock.instant())
                        .withSeenTransactionHashes(activityParser.seenTransactionHashes()));
            } catch (LedgerStoreException e) {
                snapshotFailures.incrementAndGet();
                snapshotFailureCounter.increment();
                log.error("Failed to save ledger snapshot", e);
            }
        }
    }

    private void notifySinks(ClassificationEvent event) {
        for (NotificationSink sink : sinks) {
            try {
                sink.onClassified(event);
            } catch (RuntimeException e) {
                log.warn("Notification sink {} failed for trade {}: {}",
                        sink.getClass().getSimpleName(), event.tradeId(), e.getMessage());
            }
        }
    }

    // ========== Status Methods ==========

    public Map<String, Object> getMetrics() {
        return Map.of(
                "fillsProcessed", fillsProcessed.get(),
                "fillsRejected", fillsRejected.get(),
                "snapshotFailures", snapshotFailures.get(),
                "openPositions", ledger.state().positionsByTokenId().size(),
                "closedTrades", ledger.state().closedTrades().size(),
                "seenTransactions", activityParser.seenCount()
        );
    }
}
