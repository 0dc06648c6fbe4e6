package com.mlbbai.hero_analysis_engine.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RateMetricTest {

    @Test
    void formatsFractionAsPercentWithOneDecimal() {
        assertThat(RateMetric.of(0.5234).display()).isEqualTo("52.3%");
        assertThat(RateMetric.of(0.5).display()).isEqualTo("50.0%");
        assertThat(RateMetric.of(0.56789).display()).isEqualTo("56.8%");
    }

    @Test
    void roundsHalfUp() {
        assertThat(RateMetric.of(0.52345).display()).isEqualTo("52.3%");
        assertThat(RateMetric.of(0.52350).display()).isEqualTo("52.4%");
    }

    @Test
    void unknownValueSortsAsZeroAndRendersPlaceholder() {
        RateMetric unknown = RateMetric.of(null);

        assertThat(unknown.known()).isFalse();
        assertThat(unknown.raw()).isZero();
        assertThat(unknown.display()).isEqualTo(RateMetric.UNKNOWN_DISPLAY);
    }

    @Test
    void clampsOutOfRangeValuesAndRecomputesDisplay() {
        RateMetric tooHigh = new RateMetric(1.7, true, "bogus");

        assertThat(tooHigh.raw()).isEqualTo(1.0);
        assertThat(tooHigh.display()).isEqualTo("100.0%");
        assertThat(new RateMetric(-0.2, true, null).raw()).isZero();
    }

    @Test
    void nanIsTreatedAsUnknown() {
        RateMetric nan = new RateMetric(Double.NaN, true, null);

        assertThat(nan.known()).isFalse();
        assertThat(nan.display()).isEqualTo(RateMetric.UNKNOWN_DISPLAY);
    }
}
