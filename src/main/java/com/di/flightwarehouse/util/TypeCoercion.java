package com.di.flightwarehouse.util;

/**
 * Lenient conversions for raw CSV text.
 * <p>
 * Null-safety policy: blank or unparseable numbers become {@code null}; strings are trimmed and
 * blank strings become {@code null}; 0/1 flags become booleans and anything unparseable is {@code false}.
 * The OpenFlights null marker {@code \N} is treated as blank.
 */
public final class TypeCoercion {

    public static final String OPENFLIGHTS_NULL = "\\N";

    private TypeCoercion() {
    }

    public static String toStr(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() || OPENFLIGHTS_NULL.equals(trimmed) ? null : trimmed;
    }

    public static Double toDouble(String raw) {
        String value = toStr(raw);
        if (value == null) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value);
            return Double.isNaN(parsed) ? null : parsed;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Accepts integral text as well as float text such as {@code "123.0"} (truncated). */
    public static Integer toInteger(String raw) {
        Double value = toDouble(raw);
        if (value == null || value.isInfinite()) {
            return null;
        }
        return value.intValue();
    }

    /** {@code "1"}, {@code "1.00"} and any non-zero number are true. */
    public static boolean toFlag(String raw) {
        Integer value = toInteger(raw);
        return value != null && value != 0;
    }
}
