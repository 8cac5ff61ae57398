package com.example.profilestore.profile;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dot-separated path helpers over nested {@code Map}/{@code List} documents.
 */
final class DocumentPaths {

    static final String APPEND = "++";
    static final String REMOVE_INDEX = "--";

    private DocumentPaths() {
        // utility
    }

    /**
     * Split a path into segments, or return null when it is blank or has an empty segment.
     */
    static List<String> split(String path) {
        if (path == null || path.isBlank()) return null;
        List<String> segments = Arrays.asList(path.split("\\.", -1));
        for (String s : segments) {
            if (s.isEmpty()) return null;
        }
        return segments;
    }

    static Object resolve(Map<String, Object> root, List<String> segments) {
        Object node = root;
        for (String segment : segments) {
            if (!(node instanceof Map)) return null;
            node = ((Map<?, ?>) node).get(segment);
            if (node == null) return null;
        }
        return node;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(Object node) {
        return node instanceof Map ? (Map<String, Object>) node : null;
    }

    @SuppressWarnings("unchecked")
    static List<Object> asList(Object node) {
        return node instanceof List ? (List<Object>) node : null;
    }

    /**
     * Deep copy into mutable containers; leaves are shared.
     */
    static Object deepCopy(Object value) {
        if (value instanceof Map) {
            return copyMap((Map<?, ?>) value);
        }
        if (value instanceof List) {
            List<Object> out = new ArrayList<>();
            for (Object item : (List<?>) value) {
                out.add(deepCopy(item));
            }
            return out;
        }
        return value;
    }

    static Map<String, Object> copyMap(Map<?, ?> source) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (source == null) return out;
        for (Map.Entry<?, ?> e : source.entrySet()) {
            out.put(String.valueOf(e.getKey()), deepCopy(e.getValue()));
        }
        return out;
    }

    /**
     * Copy into {@code target} every key of {@code template} it lacks, descending into
     * nested maps present on both sides. Existing values are never overwritten.
     *
     * @return true if any key was added
     */
    static boolean mergeMissing(Map<String, Object> target, Map<String, Object> template) {
        boolean added = false;
        for (Map.Entry<String, Object> e : template.entrySet()) {
            Object current = target.get(e.getKey());
            if (current == null && !target.containsKey(e.getKey())) {
                target.put(e.getKey(), deepCopy(e.getValue()));
                added = true;
            } else if (current instanceof Map && e.getValue() instanceof Map) {
                added |= mergeMissing(asMap(current), asMap(e.getValue()));
            }
        }
        return added;
    }

    /**
     * Equality that treats numbers by value, so a decoded {@code 1} matches {@code 1L} or {@code 1.0}.
     */
    static boolean sameValue(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return toDecimal((Number) a).compareTo(toDecimal((Number) b)) == 0;
        }
        return Objects.equals(a, b);
    }

    static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte
                || n instanceof BigInteger;
    }

    /**
     * The value as a long if it is a whole number in range, so {@code 1.0} reads as {@code 1}.
     */
    static Long wholeNumber(Number n) {
        if (n == null) return null;
        BigDecimal d = toDecimal(n);
        try {
            return d.stripTrailingZeros().scale() <= 0 ? d.longValueExact() : null;
        } catch (ArithmeticException | NumberFormatException e) {
            return null;
        }
    }

    /**
     * @return the sum, or null when an integral sum leaves the long range
     */
    static Number add(Number current, Number delta) {
        if (isIntegral(current) && isIntegral(delta)) {
            BigInteger sum = toBigInteger(current).add(toBigInteger(delta));
            return sum.bitLength() < Long.SIZE ? (Number) sum.longValue() : null;
        }
        double sum = current.doubleValue() + delta.doubleValue();
        return Double.isFinite(sum) ? sum : null;
    }

    private static BigInteger toBigInteger(Number n) {
        return n instanceof BigInteger ? (BigInteger) n : BigInteger.valueOf(n.longValue());
    }

    private static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal) return (BigDecimal) n;
        if (n instanceof BigInteger) return new BigDecimal((BigInteger) n);
        if (isIntegral(n)) return BigDecimal.valueOf(n.longValue());
        return BigDecimal.valueOf(n.doubleValue());
    }
}
