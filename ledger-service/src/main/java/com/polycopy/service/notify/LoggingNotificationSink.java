package com.polycopy.service.notify;

import com.polycopy.events.NotificationSink;
import com.polycopy.events.payload.ClassificationEvent;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Writes one human-readable line per classified fill.
 */
@Slf4j
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public void onClassified(ClassificationEvent event) {
        log.info(render(event));
    }

    public static String render(ClassificationEvent event) {
        StringBuilder sb = new StringBuilder()
                .append('[').append(event.classification()).append("] ")
                .append(event.side()).append(' ')
                .append(shares(event.fillSize())).append(' ')
                .append(event.outcome())
                .append(" @ ").append(price(event.fillPrice()))
                .append(" (market ").append(event.marketId()).append(')');
        if (event.realized()) {
            sb.append(" | closed ").append(shares(event.closingSize()))
                    .append(" entry ").append(price(event.entryPrice()))
                    .append(" exit ").append(price(event.exitPrice()))
                    .append(" pnl ").append(usd(event.realizedPnl()));
        }
        sb.append(" | position ").append(shares(event.resultingPositionSize()));
        return sb.toString();
    }

    private static String shares(BigDecimal value) {
        return value == null ? "-" : value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String price(BigDecimal value) {
        return value == null ? "-" : "$" + value.setScale(4, RoundingMode.HALF_UP).toPlainString();
    }

    private static String usd(BigDecimal value) {
        if (value == null) {
            return "-";
        }
        BigDecimal rounded = value.setScale(2, RoundingMode.HALF_UP);
        return rounded.signum() < 0 ? "-$" + rounded.negate().toPlainString() : "+$" + rounded.toPlainString();
    }
}
