package com.di.featurenova.pipeline.table;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;

/**
 * Cell-level coercion rules shared by ingestion, validation and transformation.
 */
public final class CellValues {

    /** Compared lower-case after trimming; the empty string is also missing. */
    private static final Set<String> MISSING_TOKENS = Set.of("na", "nan", "null");

    private CellValues() {
    }

    public static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double d) {
            return d.isNaN();
        }
        if (value instanceof Float f) {
            return f.isNaN();
        }
        if (value instanceof String s) {
            String t = s.trim();
            return t.isEmpty() || MISSING_TOKENS.contains(t.toLowerCase(Locale.ROOT));
        }
        return false;
    }

    /**
     * Numeric value of a non-missing cell, or {@code null} when it cannot be
     * coerced. Booleans map to 1/0; strings must parse to a finite double.
     */
    public static Double toDouble(Object value) {
        if (isMissing(value)) {
            return null;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        return parseDouble(value.toString());
    }

    public static Double parseDouble(String text) {
        if (text == null) {
            return null;
        }
        String t = text.trim();
        if (t.isEmpty()) {
            return null;
        }
        try {
            double d = Double.parseDouble(t);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Text form of a non-missing cell; {@code null} for missing cells. */
    public static String toText(Object value) {
        if (isMissing(value)) {
            return null;
        }
        if (value instanceof Double d) {
            return format(d);
        }
        if (value instanceof Float f) {
            return format(f.doubleValue());
        }
        if (value instanceof BigDecimal bd) {
            return bd.stripTrailingZeros().toPlainString();
        }
        return value.toString().trim();
    }

    /** Integral doubles print without a fraction ({@code 3.0 -> "3"}). */
    public static String format(double d) {
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }
}
