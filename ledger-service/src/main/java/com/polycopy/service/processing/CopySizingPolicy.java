package com.polycopy.service.processing;

import com.polycopy.config.CopyProperties;
import com.polycopy.domain.FillEvent;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Scales an observed fill into our copy size before it reaches the classifier.
 *
 * size = observed * riskMultiplier, capped so that size * price does not exceed maxTradeUsdc.
 */
@Slf4j
public final class CopySizingPolicy {

    private static final int SHARE_SCALE = 6;

    private final boolean enabled;
    private final BigDecimal riskMultiplier;
    private final BigDecimal maxTradeUsdc;

    public CopySizingPolicy(boolean enabled, BigDecimal riskMultiplier, BigDecimal maxTradeUsdc) {
        this.enabled = enabled;
        this.riskMultiplier = riskMultiplier;
        this.maxTradeUsdc = maxTradeUsdc;
    }

    public static CopySizingPolicy from(CopyProperties.Sizing sizing) {
        return new CopySizingPolicy(sizing.enabled(), sizing.riskMultiplier(), sizing.maxTradeUsdc());
    }

    public static CopySizingPolicy passThrough() {
        return new CopySizingPolicy(false, BigDecimal.ONE, null);
    }

    /**
     * Fills with a missing size or price are returned untouched so the classifier can reject them.
     */
    public FillEvent apply(FillEvent fill) {
        if (!enabled || fill == null || fill.size() == null || fill.price() == null) {
            return fill;
        }
        return fill.withSize(copySize(fill.size(), fill.price()));
    }

    BigDecimal copySize(BigDecimal observedSize, BigDecimal price) {
        BigDecimal desired = observedSize.multiply(riskMultiplier);
        if (maxTradeUsdc == null || price.signum() <= 0) {
            return desired;
        }
        BigDecimal desiredValue = desired.multiply(price);
        if (desiredValue.compareTo(maxTradeUsdc) > 0) {
            BigDecimal capped = maxTradeUsdc.divide(price, SHARE_SCALE, RoundingMode.DOWN);
            log.info("Capping copy size from {} to {} (max ${} USDC)", desired, capped, maxTradeUsdc);
            return capped;
        }
        return desired;
    }
}
