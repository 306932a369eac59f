package org.transitscope.serialization;

import org.transitscope.host.HostValues;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;

/**
 * Encodes generic value trees as JSON text with a stable byte-for-byte output.
 * <p>
 * Supported values are {@code null}, {@link Boolean}, {@link Number}, {@link String},
 * {@link List} and {@link Map}. A map whose keys are exactly the integers {@code 1..N}
 * ({@code N > 0}) is written as an array in key order; every other map is written as an
 * object with its keys sorted by their string form. NaN and infinite numbers, values
 * nested deeper than {@code maxDepth} and values of any other type are written as
 * {@code null}, so encoding never fails.
 * <p>
 * Instances are immutable and thread-safe.
 */
public class DeterministicEncoder {

    public static final int DEFAULT_MAX_DEPTH = 20;

    private final int maxDepth;
    private final String indent;

    /**
     * Creates a compact encoder with the default depth cap.
     */
    public DeterministicEncoder() {
        this(DEFAULT_MAX_DEPTH, "");
    }

    /**
     * @param maxDepth The deepest nesting level that is still encoded; the root is level 0.
     * @param indent   The indent unit for pretty printing, or the empty string for compact output.
     */
    public DeterministicEncoder(int maxDepth, String indent) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.indent = indent == null ? "" : indent;
    }

    /**
     * Encodes a value tree.
     *
     * @param value The root value.
     * @return The JSON text.
     */
    public String encode(Object value) {
        StringBuilder out = new StringBuilder();
        write(out, value, 0);
        return out.toString();
    }

    private void write(StringBuilder out, Object value, int level) {
        if (level > maxDepth || value == null) {
            out.append("null");
        } else if (value instanceof Boolean b) {
            out.append(b.booleanValue());
        } else if (value instanceof Number n) {
            writeNumber(out, n);
        } else if (value instanceof String s) {
            writeString(out, s);
        } else if (value instanceof List<?> list) {
            writeArray(out, new ArrayList<Object>(list), level);
        } else if (value instanceof Map<?, ?> map) {
            List<Object> sequence = asSequence(map);
            if (sequence != null) {
                writeArray(out, sequence, level);
            } else {
                writeObject(out, map, level);
            }
        } else {
            out.append("null");
        }
    }

    private static void writeNumber(StringBuilder out, Number n) {
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                out.append("null");
            } else {
                out.append(Double.toString(d));
            }
        } else if (n instanceof BigDecimal || n instanceof BigInteger || n instanceof Long || n instanceof Integer
                || n instanceof Short || n instanceof Byte) {
            out.append(n);
        } else {
            double d = n.doubleValue();
            out.append(Double.isNaN(d) || Double.isInfinite(d) ? "null" : Double.toString(d));
        }
    }

    private void writeArray(StringBuilder out, List<Object> elements, int level) {
        if (elements.isEmpty()) {
            out.append("[]");
            return;
        }
        out.append('[');
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                out.append(',');
            }
            newline(out, level + 1);
            write(out, elements.get(i), level + 1);
        }
        newline(out, level);
        out.append(']');
    }

    private void writeObject(StringBuilder out, Map<?, ?> map, int level) {
        if (map.isEmpty()) {
            out.append("{}");
            return;
        }
        Map<String, Object> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            sorted.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        out.append('{');
        boolean first = true;
        for (Map.Entry<String, Object> entry : sorted.entrySet()) {
            if (!first) {
                out.append(',');
            }
            first = false;
            newline(out, level + 1);
            writeString(out, entry.getKey());
            out.append(indent.isEmpty() ? ":" : ": ");
            write(out, entry.getValue(), level + 1);
        }
        newline(out, level);
        out.append('}');
    }

    private void newline(StringBuilder out, int level) {
        if (indent.isEmpty()) {
            return;
        }
        out.append('\n');
        for (int i = 0; i < level; i++) {
            out.append(indent);
        }
    }

    /**
     * Returns the map's values in key order if its keys are exactly {@code 1..N}, otherwise
     * {@code null}.
     */
    static List<Object> asSequence(Map<?, ?> map) {
        if (map.isEmpty()) {
            return null;
        }
        Set<Long> seen = new HashSet<>();
        Object[] ordered = new Object[map.size()];
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            OptionalLong key = HostValues.integerKey(entry.getKey());
            if (key.isEmpty() || key.getAsLong() < 1 || key.getAsLong() > map.size() || !seen.add(key.getAsLong())) {
                return null;
            }
            ordered[(int) (key.getAsLong() - 1)] = entry.getValue();
        }
        List<Object> sequence = new ArrayList<>(ordered.length);
        for (Object element : ordered) {
            sequence.add(element);
        }
        return sequence;
    }

    static void writeString(StringBuilder out, String s) {
        out.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20 || isLoneSurrogate(s, i)) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }

    /**
     * A surrogate without its partner cannot be written as UTF-8, so it is escaped instead.
     */
    private static boolean isLoneSurrogate(String s, int i) {
        char c = s.charAt(i);
        if (Character.isHighSurrogate(c)) {
            return i + 1 >= s.length() || !Character.isLowSurrogate(s.charAt(i + 1));
        }
        if (Character.isLowSurrogate(c)) {
            return i == 0 || !Character.isHighSurrogate(s.charAt(i - 1));
        }
        return false;
    }
}
