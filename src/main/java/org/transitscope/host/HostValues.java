package org.transitscope.host;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Conversions for loosely typed host values. None of these methods throw; a value of the
 * wrong kind converts to the zero value of the requested type.
 */
public final class HostValues {

    private static final List<String> ENTITY_ID_FIELDS = List.of("entity", "id", "entityId", "entity_id");

    private HostValues() {
    }

    /**
     * Returns the value floored to an integer, or 0 if it is not a number.
     */
    public static long safeInt(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return 0L;
            }
            return (long) Math.floor(d);
        }
        return 0L;
    }

    /**
     * Returns the value rounded half-up to the given number of decimals, or 0.0 if it is
     * not a number.
     */
    public static double safeFloat(Object value, int digits) {
        if (value instanceof Number number) {
            double factor = Math.pow(10, digits);
            return Math.floor(number.doubleValue() * factor + 0.5) / factor;
        }
        return 0.0;
    }

    /**
     * Rounds to two decimals, the precision used for coordinates.
     */
    public static double safeFloat(Object value) {
        return safeFloat(value, 2);
    }

    /**
     * Returns the value if it is a string, otherwise the empty string.
     */
    public static String safeStr(Object value) {
        return value instanceof String s ? s : "";
    }

    public static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    /**
     * Extracts an entity id from either a plain number or a record carrying one of the
     * fields {@code entity, id, entityId, entity_id}.
     *
     * @return The id, or 0 if none is present.
     */
    public static long toEntityId(Object value) {
        if (value instanceof Number) {
            return safeInt(value);
        }
        if (value instanceof Map<?, ?> map) {
            for (String field : ENTITY_ID_FIELDS) {
                Object candidate = map.get(field);
                if (candidate != null) {
                    return safeInt(candidate);
                }
            }
        }
        return 0L;
    }

    /**
     * Returns the sequence view of a host value. Lists are returned as they are; maps are
     * read like an array part, walking keys 1, 2, 3, ... until the first gap.
     *
     * @return An unmodifiable list, empty if the value is not sequence-like.
     */
    public static List<Object> asList(Object value) {
        if (value instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<Object>(list));
        }
        if (value instanceof Map<?, ?> map && !map.isEmpty()) {
            List<Object> result = new ArrayList<>();
            for (long i = 1; ; i++) {
                Object element = lookupIntegerKey(map, i);
                if (element == null) {
                    break;
                }
                result.add(element);
            }
            return Collections.unmodifiableList(result);
        }
        return List.of();
    }

    /**
     * Returns the integral value of a map key, if the key is an integer-valued number.
     */
    public static OptionalLong integerKey(Object key) {
        if (key instanceof Integer || key instanceof Long || key instanceof Short || key instanceof Byte
                || key instanceof BigInteger) {
            return OptionalLong.of(((Number) key).longValue());
        }
        if (key instanceof Double || key instanceof Float || key instanceof BigDecimal) {
            double d = ((Number) key).doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d)) {
                return OptionalLong.of((long) d);
            }
        }
        return OptionalLong.empty();
    }

    private static Object lookupIntegerKey(Map<?, ?> map, long index) {
        Object element = map.get(index);
        if (element == null && index <= Integer.MAX_VALUE) {
            element = map.get((int) index);
        }
        return element;
    }
}
