package com.polycopy.service.processing;

import com.polycopy.config.CopyProperties;
import com.polycopy.domain.FillEvent;
import com.polycopy.domain.TradeSide;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CopySizingPolicyTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @Test
    void shouldApplyRiskMultiplier() {
        CopySizingPolicy policy = new CopySizingPolicy(true, new BigDecimal("0.5"), new BigDecimal("100"));

        FillEvent sized = policy.apply(fill("100", "0.60"));

        // 100 * 0.5 = 50 shares, $30 notional, under the cap
        assertThat(sized.size()).isEqualByComparingTo("50");
        assertThat(sized.price()).isEqualByComparingTo("0.60");
        assertThat(sized.tradeId()).isEqualTo("0xabc");
    }

    @Test
    void shouldCapAtMaxTradeUsdc() {
        CopySizingPolicy policy = new CopySizingPolicy(true, BigDecimal.ONE, new BigDecimal("100"));

        // 1000 shares @ 0.50 = $500 > $100 cap -> 100 / 0.50 = 200 shares
        assertThat(policy.apply(fill("1000", "0.50")).size()).isEqualByComparingTo("200");
        // 100 / 0.30 rounds down to 6 decimals
        assertThat(policy.apply(fill("1000", "0.30")).size()).isEqualByComparingTo("333.333333");
    }

    @Test
    void shouldNotCapZeroPricedFills() {
        CopySizingPolicy policy = new CopySizingPolicy(true, new BigDecimal("2"), new BigDecimal("100"));

        assertThat(policy.apply(fill("1000", "0")).size()).isEqualByComparingTo("2000");
    }

    @Test
    void shouldPassThroughWhenDisabled() {
        CopySizingPolicy policy = CopySizingPolicy.from(new CopyProperties.Sizing(false, new BigDecimal("3"), BigDecimal.ONE));
        FillEvent fill = fill("1000", "0.50");

        assertThat(policy.apply(fill)).isSameAs(fill);
        assertThat(CopySizingPolicy.passThrough().apply(fill)).isSameAs(fill);
    }

    @Test
    void shouldLeaveMalformedFillsForTheClassifier() {
        CopySizingPolicy policy = new CopySizingPolicy(true, BigDecimal.ONE, new BigDecimal("100"));
        FillEvent noSize = new FillEvent("0xabc", "token-up", "m1", "Up", TradeSide.BUY, null, new BigDecimal("0.5"), NOW);

        assertThat(policy.apply(noSize)).isSameAs(noSize);
        assertThat(policy.apply(null)).isNull();
    }

    private static FillEvent fill(String size, String price) {
        return new FillEvent("0xabc", "token-up", "m1", "Up", TradeSide.BUY,
                new BigDecimal(size), new BigDecimal(price), NOW);
    }
}
