package com.carbondna.api.canonical;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.*;

/**
 * Immutable, key-sorted payload of a ledger record.
 *
 * <p>Nested input is flattened into dotted keys: maps contribute
 * {@code parent.child}, lists contribute {@code parent.0}, {@code parent.1}, ...
 * Keys are kept in natural {@link String} order, which is also the order the
 * canonicalizer writes them in.
 */
public final class FieldMap {

    private static final FieldMap EMPTY = new FieldMap(new TreeMap<>());

    private final SortedMap<String, FieldValue> fields;

    private FieldMap(SortedMap<String, FieldValue> fields) {
        this.fields = Collections.unmodifiableSortedMap(fields);
    }

    public static FieldMap empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Converts loosely-typed input (for example a JSON request body) into a
     * field map.
     *
     * @throws CanonicalizationException for values that have no deterministic form
     */
    public static FieldMap of(Map<String, ?> source) {
        if (source == null) {
            throw new CanonicalizationException("Payload cannot be null");
        }
        Builder builder = new Builder();
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            flatten(requireKey(entry.getKey()), entry.getValue(), builder);
        }
        return builder.build();
    }

    private static void flatten(String key, Object value, Builder builder) {
        if (value instanceof Map<?, ?> nested) {
            if (nested.isEmpty()) {
                builder.put(key, FieldValue.nullValue());
                return;
            }
            for (Map.Entry<?, ?> entry : nested.entrySet()) {
                if (!(entry.getKey() instanceof String child)) {
                    throw new CanonicalizationException("Nested key under '" + key + "' is not a string");
                }
                flatten(key + "." + requireKey(child), entry.getValue(), builder);
            }
        } else if (value instanceof List<?> list) {
            if (list.isEmpty()) {
                builder.put(key, FieldValue.nullValue());
                return;
            }
            for (int i = 0; i < list.size(); i++) {
                flatten(key + "." + i, list.get(i), builder);
            }
        } else {
            builder.put(key, toValue(key, value));
        }
    }

    static FieldValue toValue(String key, Object value) {
        if (value == null) {
            return FieldValue.nullValue();
        }
        if (value instanceof FieldValue fieldValue) {
            return fieldValue;
        }
        if (value instanceof String s) {
            return FieldValue.text(s);
        }
        if (value instanceof Boolean b) {
            return FieldValue.bool(b);
        }
        if (value instanceof BigDecimal d) {
            return FieldValue.number(d);
        }
        if (value instanceof BigInteger i) {
            return FieldValue.number(new BigDecimal(i));
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new CanonicalizationException("Field '" + key + "' is not a finite number: " + value);
            }
            return FieldValue.number(BigDecimal.valueOf(d));
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return FieldValue.number(BigDecimal.valueOf(((Number) value).longValue()));
        }
        if (value instanceof Instant || value instanceof LocalDate || value instanceof LocalDateTime
                || value instanceof UUID || value instanceof Enum<?>) {
            return FieldValue.text(value.toString());
        }
        if (value instanceof OffsetDateTime odt) {
            return FieldValue.text(odt.toInstant().toString());
        }
        if (value instanceof ZonedDateTime zdt) {
            return FieldValue.text(zdt.toInstant().toString());
        }
        throw new CanonicalizationException("Field '" + key + "' has unsupported type "
                + value.getClass().getName());
    }

    private static String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new CanonicalizationException("Field names must not be blank");
        }
        return key;
    }

    public Optional<FieldValue> get(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    /**
     * Non-blank text rendering of a field, if present.
     */
    public Optional<String> text(String key) {
        FieldValue value = fields.get(key);
        if (value instanceof FieldValue.Text text && !text.value().isBlank()) {
            return Optional.of(text.value());
        }
        if (value instanceof FieldValue.Numeric numeric) {
            return Optional.of(numeric.canonical());
        }
        return Optional.empty();
    }

    public boolean containsKey(String key) {
        return fields.containsKey(key);
    }

    public Set<String> keys() {
        return fields.keySet();
    }

    public SortedMap<String, FieldValue> asMap() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Copy with one field added or replaced.
     */
    public FieldMap with(String key, FieldValue value) {
        TreeMap<String, FieldValue> copy = new TreeMap<>(fields);
        copy.put(requireKey(key), Objects.requireNonNull(value, "value"));
        return new FieldMap(copy);
    }

    /**
     * Splits this map in two: fields whose key is in {@code keys} and the rest.
     */
    public Split split(Set<String> keys) {
        TreeMap<String, FieldValue> selected = new TreeMap<>();
        TreeMap<String, FieldValue> remaining = new TreeMap<>();
        for (Map.Entry<String, FieldValue> entry : fields.entrySet()) {
            if (keys.contains(entry.getKey()) || keys.contains(rootOf(entry.getKey()))) {
                selected.put(entry.getKey(), entry.getValue());
            } else {
                remaining.put(entry.getKey(), entry.getValue());
            }
        }
        return new Split(new FieldMap(selected), new FieldMap(remaining));
    }

    private static String rootOf(String key) {
        int dot = key.indexOf('.');
        return dot < 0 ? key : key.substring(0, dot);
    }

    /**
     * Plain Java view, in key order, for JSON responses.
     */
    public Map<String, Object> toJavaMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        fields.forEach((key, value) -> out.put(key, value.toJava()));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FieldMap other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }

    public record Split(FieldMap selected, FieldMap remaining) {}

    public static final class Builder {
        private final TreeMap<String, FieldValue> fields = new TreeMap<>();

        private Builder() {}

        public Builder put(String key, FieldValue value) {
            requireKey(key);
            if (fields.containsKey(key)) {
                throw new CanonicalizationException("Duplicate field '" + key + "' after flattening");
            }
            fields.put(key, Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder put(String key, String value) {
            return put(key, FieldValue.text(value));
        }

        public Builder put(String key, long value) {
            return put(key, FieldValue.number(BigDecimal.valueOf(value)));
        }

        public Builder put(String key, BigDecimal value) {
            return put(key, FieldValue.number(value));
        }

        public Builder put(String key, boolean value) {
            return put(key, FieldValue.bool(value));
        }

        public Builder putNull(String key) {
            return put(key, FieldValue.nullValue());
        }

        public FieldMap build() {
            return fields.isEmpty() ? EMPTY : new FieldMap(new TreeMap<>(fields));
        }
    }
}
