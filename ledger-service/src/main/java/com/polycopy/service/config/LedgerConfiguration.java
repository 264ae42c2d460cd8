package com.polycopy.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polycopy.classification.TradeClassifier;
import com.polycopy.config.CopyProperties;
import com.polycopy.events.NotificationSink;
import com.polycopy.ledger.LedgerSnapshot;
import com.polycopy.ledger.LedgerStateStore;
import com.polycopy.ledger.PositionLedger;
import com.polycopy.service.feed.ActivityFillParser;
import com.polycopy.service.notify.LoggingNotificationSink;
import com.polycopy.service.processing.CopySizingPolicy;
import com.polycopy.service.processing.FillProcessor;
import com.polycopy.service.store.JsonFileLedgerStateStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Wires up:
 * - TradeClassifier from copy.ledger
 * - PositionLedger, restored from the state file when one exists
 * - CopySizingPolicy from copy.sizing
 * - ActivityFillParser for the target wallet, seeded with the transactions already taken in
 * - FillProcessor with every NotificationSink in the context
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CopyProperties.class)
public class LedgerConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TradeClassifier tradeClassifier(CopyProperties properties) {
        return TradeClassifier.from(properties.ledger());
    }

    @Bean
    public LedgerStateStore ledgerStateStore(CopyProperties properties, ObjectMapper objectMapper) {
        return new JsonFileLedgerStateStore(Path.of(properties.ledger().stateFile()), objectMapper);
    }

    /**
     * A snapshot that cannot be read fails startup rather than silently starting from an empty ledger.
     */
    @Bean
    public LedgerSnapshot savedLedgerSnapshot(LedgerStateStore stateStore) {
        Optional<LedgerSnapshot> snapshot = stateStore.load();
        if (snapshot.isEmpty()) {
            log.info("No saved ledger, starting empty");
            return LedgerSnapshot.empty();
        }
        log.info("Loaded ledger saved at {}: {} open positions, {} closed trades, {} seen transactions",
                snapshot.get().savedAt(), snapshot.get().positions().size(),
                snapshot.get().closedTrades().size(), snapshot.get().seenTransactionHashes().size());
        return snapshot.get();
    }

    @Bean
    public PositionLedger positionLedger(LedgerSnapshot savedLedgerSnapshot) {
        PositionLedger ledger = PositionLedger.restore(savedLedgerSnapshot);
        log.info("Ledger ready: realized pnl {}", ledger.cumulativeRealizedPnl());
        return ledger;
    }

    @Bean
    public CopySizingPolicy copySizingPolicy(CopyProperties properties) {
        CopyProperties.Sizing sizing = properties.sizing();
        log.info("Copy sizing: enabled={}, multiplier={}x, max=${} USDC",
                sizing.enabled(), sizing.riskMultiplier(), sizing.maxTradeUsdc());
        return CopySizingPolicy.from(sizing);
    }

    @Bean
    public ActivityFillParser activityFillParser(CopyProperties properties, LedgerSnapshot savedLedgerSnapshot) {
        return new ActivityFillParser(properties.feed().targetWallet(), savedLedgerSnapshot.seenTransactionHashes());
    }

    @Bean
    public LoggingNotificationSink loggingNotificationSink() {
        return new LoggingNotificationSink();
    }

    @Bean
    public FillProcessor fillProcessor(
            TradeClassifier classifier,
            PositionLedger ledger,
            CopySizingPolicy sizingPolicy,
            ActivityFillParser activityParser,
            LedgerStateStore stateStore,
            List<NotificationSink> sinks,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        return new FillProcessor(classifier, ledger, sizingPolicy, activityParser, stateStore, sinks, clock, meterRegistry);
    }
}
