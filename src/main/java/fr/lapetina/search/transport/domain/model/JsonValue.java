package fr.lapetina.search.transport.domain.model;

import fr.lapetina.search.transport.exception.EncodingException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value model for everything that can travel in a request body.
 *
 * <p>Each variant has exactly one wire representation. Java values enter the
 * model through {@link #of(Object)}, which is strict: a value without a
 * variant raises {@link EncodingException} instead of being stringified.
 * The nested records are the only variants the serializer writes; any other
 * implementation is rejected when encoded.
 */
public interface JsonValue {

    /** ISO-8601 local date-time, second precision, no zone suffix. */
    DateTimeFormatter ISO_SECONDS = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");

    record NullValue() implements JsonValue {
        public static final NullValue INSTANCE = new NullValue();
    }

    record BoolValue(boolean value) implements JsonValue {
    }

    record TextValue(String value) implements JsonValue {
        public TextValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record IntegralValue(BigInteger value) implements JsonValue {
        public IntegralValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record FloatingValue(double value) implements JsonValue {
        public FloatingValue {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new EncodingException(value, "Non-finite number has no JSON representation: " + value);
            }
        }
    }

    record DecimalValue(BigDecimal value) implements JsonValue {
        public DecimalValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record DateValue(LocalDate value) implements JsonValue {
        public DateValue {
            Objects.requireNonNull(value, "value");
        }

        public String toIsoString() {
            return ISO_SECONDS.format(value.atStartOfDay());
        }
    }

    record DateTimeValue(LocalDateTime value) implements JsonValue {
        public DateTimeValue {
            Objects.requireNonNull(value, "value");
        }

        public String toIsoString() {
            return ISO_SECONDS.format(value);
        }
    }

    record ArrayValue(List<JsonValue> elements) implements JsonValue {
        public ArrayValue {
            elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }
    }

    record ObjectValue(Map<String, JsonValue> members) implements JsonValue {
        public ObjectValue {
            members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
        }
    }

    /**
     * Converts a Java value into the closed model.
     *
     * <p>Supported: {@code null}, {@link JsonValue}, {@link Boolean}, {@link CharSequence},
     * {@link Character}, integral boxed types, {@link BigInteger}, {@link Float}, {@link Double},
     * {@link BigDecimal}, {@link LocalDate}, {@link LocalDateTime}, {@link Map} with string keys,
     * any {@link Collection} (sets in iteration order), object arrays and
     * {@code int[]}, {@code long[]} and {@code double[]}. Other primitive arrays
     * are rejected; pass a {@link List} instead.
     *
     * @throws EncodingException for any other type
     */
    static JsonValue of(Object value) {
        if (value == null) {
            return NullValue.INSTANCE;
        }
        if (value instanceof JsonValue json) {
            return json;
        }
        if (value instanceof Boolean b) {
            return new BoolValue(b);
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return new TextValue(value.toString());
        }
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            return new IntegralValue(BigInteger.valueOf(((Number) value).longValue()));
        }
        if (value instanceof BigInteger big) {
            return new IntegralValue(big);
        }
        if (value instanceof Double d) {
            return new FloatingValue(d);
        }
        if (value instanceof Float f) {
            // keep the float's shortest form: 0.1f is 0.1, not 0.10000000149011612
            return new FloatingValue(Double.parseDouble(Float.toString(f)));
        }
        if (value instanceof BigDecimal decimal) {
            return new DecimalValue(decimal);
        }
        if (value instanceof LocalDateTime dateTime) {
            return new DateTimeValue(dateTime);
        }
        if (value instanceof LocalDate date) {
            return new DateValue(date);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, JsonValue> members = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new EncodingException(entry.getKey(),
                            "JSON object keys must be strings, got: " + describe(entry.getKey()));
                }
                members.put(key, of(entry.getValue()));
            }
            return new ObjectValue(members);
        }
        if (value instanceof Collection<?> collection) {
            List<JsonValue> elements = new ArrayList<>(collection.size());
            for (Object element : collection) {
                elements.add(of(element));
            }
            return new ArrayValue(elements);
        }
        List<?> sequence = asList(value);
        if (sequence != null) {
            return of(sequence);
        }
        throw new EncodingException(value, "No JSON representation for " + describe(value));
    }

    /**
     * Views a supported array as a list, or returns {@code null} for any other value.
     */
    static List<?> asList(Object value) {
        if (value instanceof Object[] objects) {
            return Arrays.asList(objects);
        }
        if (value instanceof int[] ints) {
            return Arrays.stream(ints).boxed().toList();
        }
        if (value instanceof long[] longs) {
            return Arrays.stream(longs).boxed().toList();
        }
        if (value instanceof double[] doubles) {
            return Arrays.stream(doubles).boxed().toList();
        }
        return null;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName() + " (" + value + ")";
    }
}
