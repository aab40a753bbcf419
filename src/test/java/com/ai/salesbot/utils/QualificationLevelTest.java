package com.ai.salesbot.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QualificationLevel")
class QualificationLevelTest {

    @Test
    @DisplayName("thresholds are inclusive and checked top-down")
    void boundaries() {
        assertThat(QualificationLevel.forScore(0)).isEqualTo(QualificationLevel.UNQUALIFIED);
        assertThat(QualificationLevel.forScore(9)).isEqualTo(QualificationLevel.UNQUALIFIED);
        assertThat(QualificationLevel.forScore(10)).isEqualTo(QualificationLevel.LOW);
        assertThat(QualificationLevel.forScore(19)).isEqualTo(QualificationLevel.LOW);
        assertThat(QualificationLevel.forScore(20)).isEqualTo(QualificationLevel.MEDIUM);
        assertThat(QualificationLevel.forScore(29)).isEqualTo(QualificationLevel.MEDIUM);
        assertThat(QualificationLevel.forScore(30)).isEqualTo(QualificationLevel.HIGH);
        assertThat(QualificationLevel.forScore(40)).isEqualTo(QualificationLevel.HIGH);
    }
}
