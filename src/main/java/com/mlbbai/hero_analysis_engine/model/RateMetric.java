package com.mlbbai.hero_analysis_engine.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A provider rate (win, ban or pick) held both as a raw fraction for sorting
 * and as the display string rendered from it.
 *
 * <p>An absent provider value is represented as {@code raw = 0} with
 * {@code known = false}; it sorts as zero and renders as {@link #UNKNOWN_DISPLAY}.
 * The display string is always recomputed from {@code raw}, so the two can
 * never disagree.</p>
 *
 * @param raw fraction in [0, 1]
 * @param known whether the provider supplied a value
 * @param display percentage with one decimal, or the unknown placeholder
 */
public record RateMetric(double raw, boolean known, String display) {

    public static final String UNKNOWN_DISPLAY = "—";

    private static final RateMetric UNKNOWN = new RateMetric(0.0, false, UNKNOWN_DISPLAY);

    public RateMetric {
        if (!known || Double.isNaN(raw) || Double.isInfinite(raw)) {
            raw = 0.0;
            known = false;
        } else {
            raw = Math.max(0.0, Math.min(1.0, raw));
        }
        display = known ? formatPercent(raw) : UNKNOWN_DISPLAY;
    }

    public static RateMetric unknown() {
        return UNKNOWN;
    }

    public static RateMetric of(Double raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        return new RateMetric(raw, true, null);
    }

    /**
     * Formats a fraction as a percentage rounded half-up to one decimal, e.g. {@code 0.5234 -> "52.3%"}.
     */
    public static String formatPercent(double raw) {
        BigDecimal pct = BigDecimal.valueOf(raw).movePointRight(2).setScale(1, RoundingMode.HALF_UP);
        return pct.toPlainString() + "%";
    }
}
