package com.polycopy.service.notify;

import com.polycopy.domain.Classification;
import com.polycopy.domain.TradeSide;
import com.polycopy.events.payload.ClassificationEvent;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingNotificationSinkTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @Test
    void rendersOpenWithoutCloseDetails() {
        ClassificationEvent event = new ClassificationEvent(Classification.OPEN, "0x1", "up", "m1", "Up", TradeSide.BUY,
                new BigDecimal("100"), new BigDecimal("0.6"), null, null, null, null, null, new BigDecimal("100"), NOW);

        assertThat(LoggingNotificationSink.render(event))
                .isEqualTo("[OPEN] BUY 100.00 Up @ $0.6000 (market m1) | position 100.00");
    }

    @Test
    void rendersRealizedLoss() {
        ClassificationEvent event = new ClassificationEvent(Classification.HEDGE_CLOSE, "0x2", "down", "m1", "Down",
                TradeSide.BUY, new BigDecimal("100"), new BigDecimal("0.5"), "up", new BigDecimal("100"),
                new BigDecimal("0.6"), new BigDecimal("0.5"), new BigDecimal("-10"), new BigDecimal("100"), NOW);

        assertThat(LoggingNotificationSink.render(event))
                .isEqualTo("[HEDGE_CLOSE] BUY 100.00 Down @ $0.5000 (market m1)"
                        + " | closed 100.00 entry $0.6000 exit $0.5000 pnl -$10.00 | position 100.00");
    }
}
