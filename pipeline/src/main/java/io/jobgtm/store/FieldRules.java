package io.jobgtm.store;

import java.util.Locale;
import java.util.Set;

/**
 * Normalisation applied to scraped and model-produced text before it is written.
 *
 * <p>Nullable columns store {@code null} for placeholder values; the columns of the
 * {@code job_listings} natural key store {@link #NOT_AVAILABLE} instead. Everything is
 * trimmed and cut to the column length.</p>
 */
public final class FieldRules {

    public static final String NOT_AVAILABLE = "N/A";

    private static final Set<String> PLACEHOLDERS = Set.of("n/a", "na", "null", "none", "unknown");

    private FieldRules() {
    }

    public static boolean isPlaceholder(String value) {
        if (value == null) return true;
        String v = value.trim();
        return v.isEmpty() || PLACEHOLDERS.contains(v.toLowerCase(Locale.ROOT));
    }

    /**
     * @param maxLength column length, or {@code 0} for unbounded text
     */
    public static String nullable(String value, int maxLength) {
        if (isPlaceholder(value)) return null;
        return truncate(value.trim(), maxLength);
    }

    public static String required(String value, int maxLength) {
        String v = nullable(value, maxLength);
        return v == null ? NOT_AVAILABLE : v;
    }

    public static String text(String value) {
        return nullable(value, 0);
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || maxLength <= 0 || value.length() <= maxLength) return value;
        return value.substring(0, maxLength);
    }

    /**
     * Drops values a {@code NUMERIC(precision, scale)} column cannot hold.
     */
    public static Double decimal(Double value, int precision, int scale) {
        if (value == null || value.isNaN() || value.isInfinite()) return null;
        double limit = Math.pow(10, precision - scale);
        return Math.abs(value) < limit ? value : null;
    }

    public static Double clamp(Double value, double min, double max) {
        if (value == null || value.isNaN()) return null;
        return Math.max(min, Math.min(max, value));
    }
}
