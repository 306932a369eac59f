package org.transitscope.host;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A read-only view over a host record (an entity, a component or a nested structure).
 * <p>
 * Host records have no published schema. Accessors take an ordered list of candidate
 * field names and return the first field that is present, mirroring how the host's
 * undocumented field names have to be probed.
 */
public final class HostRecord {

    private final Map<?, ?> fields;

    private HostRecord(Map<?, ?> fields) {
        this.fields = Objects.requireNonNull(fields);
    }

    /**
     * Wraps a host value if it is a record.
     *
     * @param value The raw host value.
     * @return The record view, or empty if the value is not a map.
     */
    public static Optional<HostRecord> of(Object value) {
        if (value instanceof Map<?, ?> map) {
            return Optional.of(new HostRecord(map));
        }
        return Optional.empty();
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.get(field) != null;
    }

    /**
     * Returns the value of the first present field.
     *
     * @param candidates The candidate field names, in priority order.
     * @return The first non-null value, or {@code null}.
     */
    public Object first(List<String> candidates) {
        for (String field : candidates) {
            Object value = fields.get(field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public Object first(String... candidates) {
        return first(List.of(candidates));
    }

    /**
     * Returns the first present field as a string; the empty string if that field is not a
     * string or no field is present.
     */
    public String string(List<String> candidates) {
        return HostValues.safeStr(first(candidates));
    }

    public String string(String... candidates) {
        return string(List.of(candidates));
    }

    /**
     * Returns the first present field as an integer id; 0 if absent or not a number.
     */
    public long integer(List<String> candidates) {
        return HostValues.safeInt(first(candidates));
    }

    public long integer(String... candidates) {
        return integer(List.of(candidates));
    }

    public Optional<HostRecord> record(String field) {
        return HostRecord.of(fields.get(field));
    }

    public Optional<HostRecord> record(List<String> candidates) {
        for (String field : candidates) {
            Optional<HostRecord> nested = HostRecord.of(fields.get(field));
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }

    public List<Object> list(String field) {
        return HostValues.asList(fields.get(field));
    }

    /**
     * Returns the underlying map, unmodifiable.
     */
    public Map<?, ?> raw() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public String toString() {
        return "HostRecord" + fields.keySet();
    }
}
