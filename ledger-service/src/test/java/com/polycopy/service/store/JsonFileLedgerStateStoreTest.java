package com.polycopy.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.polycopy.classification.TradeClassifier;
import com.polycopy.domain.FillEvent;
import com.polycopy.domain.TradeSide;
import com.polycopy.error.LedgerStoreException;
import com.polycopy.ledger.LedgerSnapshot;
import com.polycopy.ledger.PositionLedger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileLedgerStateStoreTest {

    private static final Instant START = Instant.parse("2024-01-15T10:00:00Z");

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final TradeClassifier classifier = new TradeClassifier(new BigDecimal("0.000001"), 10);

    @Test
    void missingFileLoadsAsEmpty() {
        JsonFileLedgerStateStore store = new JsonFileLedgerStateStore(tempDir.resolve("state.json"), objectMapper);

        assertThat(store.load()).isEmpty();
    }

    @Test
    void savesAndLoadsSnapshot() throws Exception {
        JsonFileLedgerStateStore store = new JsonFileLedgerStateStore(tempDir.resolve("nested/state.json"), objectMapper);
        PositionLedger ledger = new PositionLedger();
        fills().subList(0, 4).forEach(fill -> apply(ledger, fill));
        LedgerSnapshot saved = ledger.snapshot(START).withSeenTransactionHashes(List.of("0xtx2", "0xtx1"));

        store.save(saved);

        assertThat(Files.exists(store.path())).isTrue();
        assertThat(Files.exists(tempDir.resolve("nested/state.json.tmp"))).isFalse();
        LedgerSnapshot loaded = store.load().orElseThrow();
        assertThat(loaded)
                .usingRecursiveComparison()
                .withComparatorForType(BigDecimal::compareTo, BigDecimal.class)
                .isEqualTo(saved);
        assertThat(loaded.seenTransactionHashes()).containsExactly("0xtx1", "0xtx2");
    }

    @Test
    void snapshotWithoutSeenTransactionsLoadsWithEmptyList() throws Exception {
        Path path = tempDir.resolve("state.json");
        Files.writeString(path, "{\"positions\":[],\"closedTrades\":[],\"savedAt\":\"2024-01-15T10:00:00Z\"}");

        LedgerSnapshot loaded = new JsonFileLedgerStateStore(path, objectMapper).load().orElseThrow();

        assertThat(loaded.seenTransactionHashes()).isEmpty();
        assertThat(loaded.savedAt()).isEqualTo(START);
    }

    @Test
    void resumingFromSavedFileMatchesUninterruptedRun() {
        List<FillEvent> fills = fills();
        PositionLedger reference = new PositionLedger();
        fills.forEach(fill -> apply(reference, fill));

        JsonFileLedgerStateStore store = new JsonFileLedgerStateStore(tempDir.resolve("state.json"), objectMapper);
        PositionLedger beforeRestart = new PositionLedger();
        fills.subList(0, 3).forEach(fill -> apply(beforeRestart, fill));
        store.save(beforeRestart.snapshot(START));

        PositionLedger afterRestart = PositionLedger.restore(store.load().orElseThrow());
        fills.subList(3, fills.size()).forEach(fill -> apply(afterRestart, fill));

        Comparator<BigDecimal> byValue = BigDecimal::compareTo;
        assertThat(afterRestart.listOpenPositions()).hasSize(2);
        assertThat(afterRestart.snapshot(START))
                .usingRecursiveComparison()
                .withComparatorForType(byValue, BigDecimal.class)
                .isEqualTo(reference.snapshot(START));
        assertThat(afterRestart.cumulativeRealizedPnl()).isEqualByComparingTo(reference.cumulativeRealizedPnl());
    }

    @Test
    void corruptFileFailsLoudly() throws Exception {
        Path path = tempDir.resolve("state.json");
        Files.writeString(path, "{not json");
        JsonFileLedgerStateStore store = new JsonFileLedgerStateStore(path, objectMapper);

        assertThatThrownBy(store::load).isInstanceOf(LedgerStoreException.class);
    }

    private void apply(PositionLedger ledger, FillEvent fill) {
        ledger.apply(classifier.classify(ledger.state(), fill).delta());
    }

    private static List<FillEvent> fills() {
        return List.of(
                fill(1, "up", "Up", TradeSide.BUY, "100", "0.60"),
                fill(2, "up", "Up", TradeSide.BUY, "50", "0.65"),
                fill(3, "up", "Up", TradeSide.SELL, "40", "0.70"),
                fill(4, "down", "Down", TradeSide.BUY, "30", "0.45"),
                fill(5, "up", "Up", TradeSide.SELL, "120", "0.72"),
                fill(6, "down", "Down", TradeSide.BUY, "10", "0.41")
        );
    }

    private static FillEvent fill(int n, String token, String outcome, TradeSide side, String size, String price) {
        return new FillEvent("0xtx" + n, token, "m1", outcome, side, new BigDecimal(size), new BigDecimal(price),
                START.plusSeconds(n));
    }
}
