/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.types;

import com.intuitivedesigns.querykernel.error.AggregationException;
import com.intuitivedesigns.querykernel.error.ErrorKind;
import com.intuitivedesigns.querykernel.model.SemanticType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Explicit coercion table from raw adapter values to canonical semantic values.
 *
 * <table>
 *   <tr><th>target</th><th>accepted raw values</th></tr>
 *   <tr><td>TEXT</td><td>String, Number, Boolean, temporal (ISO-8601)</td></tr>
 *   <tr><td>INTEGER</td><td>integral Number, integral-valued decimal, numeric String</td></tr>
 *   <tr><td>FLOAT</td><td>Number, numeric String</td></tr>
 *   <tr><td>BOOLEAN</td><td>Boolean, 0/1, true/false/yes/no/t/f String</td></tr>
 *   <tr><td>TIMESTAMP</td><td>epoch-millis integral, Date, java.time values, ISO-8601 String</td></tr>
 *   <tr><td>VECTOR</td><td>List of Number, double[], float[]</td></tr>
 * </table>
 *
 * Anything outside the table throws {@link AggregationException} with
 * {@link ErrorKind#UNSUPPORTED_COERCION}. Null passes through as null.
 */
public final class TypeCoercion {

    private TypeCoercion() {}

    public static Object coerce(Object raw, SemanticType target) {
        if (raw == null) return null;
        switch (target) {
            case TEXT: return toText(raw);
            case INTEGER: return toInteger(raw);
            case FLOAT: return toFloat(raw);
            case BOOLEAN: return toBoolean(raw);
            case TIMESTAMP: return toTimestamp(raw);
            case VECTOR: return toVector(raw);
            default: throw unsupported(raw, target);
        }
    }

    /**
     * Common comparable type for a join key declared as {@code left} on one side and
     * {@code right} on the other, or empty when the pairing is unsupported.
     */
    public static Optional<SemanticType> joinKeyType(SemanticType left, SemanticType right) {
        if (left == null || right == null) return Optional.empty();
        if (left == SemanticType.VECTOR || right == SemanticType.VECTOR) return Optional.empty();
        if (left == right) return Optional.of(left);
        if (pair(left, right, SemanticType.INTEGER, SemanticType.FLOAT)) return Optional.of(SemanticType.FLOAT);
        if (pair(left, right, SemanticType.INTEGER, SemanticType.TIMESTAMP)) return Optional.of(SemanticType.TIMESTAMP);
        if (pair(left, right, SemanticType.TEXT, SemanticType.TIMESTAMP)) return Optional.of(SemanticType.TIMESTAMP);
        if (pair(left, right, SemanticType.INTEGER, SemanticType.TEXT)) return Optional.of(SemanticType.TEXT);
        return Optional.empty();
    }

    /**
     * Canonical hash key. {@code -0.0} and {@code 0.0} collapse; NaN never matches anything.
     */
    public static Object joinKey(Object raw, SemanticType keyType) {
        Object v = coerce(raw, keyType);
        if (v instanceof Double d) {
            if (d.isNaN()) return null;
            return (d == 0.0d) ? 0.0d : d;
        }
        return v;
    }

    /**
     * Total order for MIN/MAX over canonical values of the same semantic type.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb && !(a.getClass().equals(b.getClass()))) {
            return Double.compare(na.doubleValue(), nb.doubleValue());
        }
        if (a instanceof Comparable ca && a.getClass().equals(b.getClass())) {
            return ca.compareTo(b);
        }
        throw new AggregationException(ErrorKind.UNSUPPORTED_COERCION,
                "Values are not comparable: " + typeName(a) + " vs " + typeName(b));
    }

    private static boolean pair(SemanticType a, SemanticType b, SemanticType x, SemanticType y) {
        return (a == x && b == y) || (a == y && b == x);
    }

    // --- TEXT ---

    private static String toText(Object raw) {
        if (raw instanceof String s) return s;
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        if (raw instanceof BigDecimal bd) return bd.stripTrailingZeros().toPlainString();
        if (raw instanceof Number || raw instanceof Boolean) return raw.toString();
        if (raw instanceof Date d) return d.toInstant().toString();
        if (raw instanceof Instant || raw instanceof LocalDate || raw instanceof LocalDateTime
                || raw instanceof OffsetDateTime || raw instanceof ZonedDateTime) {
            return raw.toString();
        }
        if (raw instanceof Character c) return c.toString();
        throw unsupported(raw, SemanticType.TEXT);
    }

    // --- INTEGER ---

    private static Long toInteger(Object raw) {
        if (raw instanceof Long l) return l;
        if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigInteger bi) {
            try {
                return bi.longValueExact();
            } catch (ArithmeticException e) {
                throw unsupported(raw, SemanticType.INTEGER);
            }
        }
        if (raw instanceof BigDecimal bd) {
            try {
                return bd.longValueExact();
            } catch (ArithmeticException e) {
                throw unsupported(raw, SemanticType.INTEGER);
            }
        }
        if (raw instanceof Double || raw instanceof Float) {
            return integralOrFail(((Number) raw).doubleValue(), raw);
        }
        if (raw instanceof String s) {
            String t = s.trim();
            try {
                return Long.parseLong(t);
            } catch (NumberFormatException e) {
                try {
                    return integralOrFail(Double.parseDouble(t), raw);
                } catch (NumberFormatException e2) {
                    throw unsupported(raw, SemanticType.INTEGER);
                }
            }
        }
        throw unsupported(raw, SemanticType.INTEGER);
    }

    private static Long integralOrFail(double d, Object raw) {
        if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)
                || d > Long.MAX_VALUE || d < Long.MIN_VALUE) {
            throw unsupported(raw, SemanticType.INTEGER);
        }
        return (long) d;
    }

    // --- FLOAT ---

    private static Double toFloat(Object raw) {
        if (raw instanceof Double d) return d;
        if (raw instanceof Number n) return n.doubleValue();
        if (raw instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw unsupported(raw, SemanticType.FLOAT);
            }
        }
        throw unsupported(raw, SemanticType.FLOAT);
    }

    // --- BOOLEAN ---

    private static Boolean toBoolean(Object raw) {
        if (raw instanceof Boolean b) return b;
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            if (d == 0d) return Boolean.FALSE;
            if (d == 1d) return Boolean.TRUE;
            throw unsupported(raw, SemanticType.BOOLEAN);
        }
        if (raw instanceof String s) {
            switch (s.trim().toLowerCase(Locale.ROOT)) {
                case "true": case "t": case "yes": case "y": case "1":
                    return Boolean.TRUE;
                case "false": case "f": case "no": case "n": case "0":
                    return Boolean.FALSE;
                default:
                    throw unsupported(raw, SemanticType.BOOLEAN);
            }
        }
        throw unsupported(raw, SemanticType.BOOLEAN);
    }

    // --- TIMESTAMP (UTC epoch millis) ---

    private static Long toTimestamp(Object raw) {
        if (raw instanceof Long || raw instanceof Integer) return ((Number) raw).longValue();
        if (raw instanceof Double || raw instanceof Float || raw instanceof BigDecimal || raw instanceof BigInteger) {
            return toInteger(raw);
        }
        if (raw instanceof Date d) return d.getTime();
        if (raw instanceof Instant i) return i.toEpochMilli();
        if (raw instanceof OffsetDateTime o) return o.toInstant().toEpochMilli();
        if (raw instanceof ZonedDateTime z) return z.toInstant().toEpochMilli();
        if (raw instanceof LocalDateTime l) return l.toInstant(ZoneOffset.UTC).toEpochMilli();
        if (raw instanceof LocalDate d) return d.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        if (raw instanceof String s) return parseTimestamp(s.trim(), raw);
        throw unsupported(raw, SemanticType.TIMESTAMP);
    }

    private static Long parseTimestamp(String s, Object raw) {
        if (s.isEmpty()) throw unsupported(raw, SemanticType.TIMESTAMP);
        if (isDigits(s)) return Long.parseLong(s);
        try {
            return Instant.parse(s).toEpochMilli();
        } catch (DateTimeParseException ignored) {
            // next format
        }
        try {
            return OffsetDateTime.parse(s).toInstant().toEpochMilli();
        } catch (DateTimeParseException ignored) {
            // next format
        }
        try {
            return LocalDateTime.parse(s.replace(' ', 'T')).toInstant(ZoneOffset.UTC).toEpochMilli();
        } catch (DateTimeParseException ignored) {
            // next format
        }
        try {
            return LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            throw unsupported(raw, SemanticType.TIMESTAMP);
        }
    }

    private static boolean isDigits(String s) {
        int start = (s.charAt(0) == '-') ? 1 : 0;
        if (start == s.length()) return false;
        for (int i = start; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return s.length() - start <= 18;
    }

    // --- VECTOR ---

    private static List<Double> toVector(Object raw) {
        if (raw instanceof List<?> list) {
            List<Double> out = new ArrayList<>(list.size());
            for (Object o : list) {
                if (!(o instanceof Number n)) throw unsupported(raw, SemanticType.VECTOR);
                out.add(n.doubleValue());
            }
            return Collections.unmodifiableList(out);
        }
        if (raw instanceof double[] arr) {
            List<Double> out = new ArrayList<>(arr.length);
            for (double d : arr) out.add(d);
            return Collections.unmodifiableList(out);
        }
        if (raw instanceof float[] arr) {
            List<Double> out = new ArrayList<>(arr.length);
            for (float f : arr) out.add((double) f);
            return Collections.unmodifiableList(out);
        }
        throw unsupported(raw, SemanticType.VECTOR);
    }

    private static AggregationException unsupported(Object raw, SemanticType target) {
        return new AggregationException(ErrorKind.UNSUPPORTED_COERCION,
                "Cannot coerce " + typeName(raw) + " value '" + preview(raw) + "' to " + target);
    }

    private static String typeName(Object o) {
        return (o == null) ? "null" : o.getClass().getSimpleName();
    }

    private static String preview(Object o) {
        String s = String.valueOf(o);
        return s.length() > 40 ? s.substring(0, 40) + "..." : s;
    }
}
