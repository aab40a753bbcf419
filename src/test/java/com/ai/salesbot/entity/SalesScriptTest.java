package com.ai.salesbot.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Usage feedback on scripts and handlers")
class SalesScriptTest {

    @Test
    @DisplayName("success after one use at 50% moves the rate to 75%")
    void cumulativeMeanOnSuccess() {
        SalesScript script = SalesScript.builder().successRate(50).usageCount(1).build();

        script.recordUsage(true);

        assertThat(script.getUsageCount()).isEqualTo(2);
        assertThat(script.getSuccessRate()).isEqualTo(75);
    }

    @Test
    @DisplayName("failure after one use at 50% moves the rate to 25%")
    void cumulativeMeanOnFailure() {
        SalesScript script = SalesScript.builder().successRate(50).usageCount(1).build();

        script.recordUsage(false);

        assertThat(script.getSuccessRate()).isEqualTo(25);
    }

    @Test
    @DisplayName("the first use sets the rate outright")
    void firstUse() {
        SalesScript script = SalesScript.builder().build();

        script.recordUsage(true);

        assertThat(script.getUsageCount()).isEqualTo(1);
        assertThat(script.getSuccessRate()).isEqualTo(100);
    }

    @Test
    @DisplayName("rate stays within 0..100")
    void bounded() {
        assertThat(SuccessRates.cumulativeMean(100, 5, true)).isEqualTo(100);
        assertThat(SuccessRates.cumulativeMean(0, 5, false)).isZero();
        assertThat(SuccessRates.cumulativeMean(40, 0, true)).isEqualTo(40);
    }

    @Test
    @DisplayName("handlers share the same bookkeeping")
    void handlers() {
        ObjectionHandler handler = ObjectionHandler.builder().successRate(50).usageCount(1).build();

        handler.recordUsage(true);

        assertThat(handler.getUsageCount()).isEqualTo(2);
        assertThat(handler.getSuccessRate()).isEqualTo(75);
    }
}
