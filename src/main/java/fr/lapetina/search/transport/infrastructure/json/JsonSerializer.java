package fr.lapetina.search.transport.infrastructure.json;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.search.transport.domain.model.JsonValue;
import fr.lapetina.search.transport.exception.EncodingException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Converts values to their wire representation.
 *
 * <p>Two encodings are offered:
 * <ul>
 *   <li>{@link #encodeBody(Object)} - JSON request bodies. Decimals are written
 *       as exact JSON numbers, dates as second-precision ISO-8601 strings.</li>
 *   <li>{@link #encodeScalar(Object)} - query-string values. Booleans become
 *       {@code true}/{@code false}, lists are comma-joined.</li>
 * </ul>
 * Both are strict: unsupported values raise {@link EncodingException}.
 *
 * Thread-safe; one instance is shared by the whole transport.
 */
public final class JsonSerializer {

    private final JsonFactory jsonFactory;

    public JsonSerializer(ObjectMapper objectMapper) {
        this.jsonFactory = objectMapper.getFactory();
    }

    public JsonSerializer() {
        this(new ObjectMapper());
    }

    /**
     * Encodes a structured value as UTF-8 JSON.
     *
     * @throws EncodingException if the value, or anything nested in it, has no JSON representation
     */
    public byte[] encodeBody(Object value) {
        return encode(JsonValue.of(value));
    }

    /**
     * Same as {@link #encodeBody(Object)}, returned as a string.
     */
    public String encodeBodyAsString(Object value) {
        return new String(encodeBody(value), StandardCharsets.UTF_8);
    }

    /**
     * Encodes an already-converted value as UTF-8 JSON.
     */
    public byte[] encode(JsonValue value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (JsonGenerator generator = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
            write(generator, value);
        } catch (IOException e) {
            throw new EncodingException(value, "Failed to write JSON: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }

    private void write(JsonGenerator generator, JsonValue value) throws IOException {
        if (value instanceof JsonValue.NullValue) {
            generator.writeNull();
        } else if (value instanceof JsonValue.BoolValue bool) {
            generator.writeBoolean(bool.value());
        } else if (value instanceof JsonValue.TextValue text) {
            generator.writeString(text.value());
        } else if (value instanceof JsonValue.IntegralValue integral) {
            generator.writeNumber(integral.value());
        } else if (value instanceof JsonValue.FloatingValue floating) {
            generator.writeNumber(floating.value());
        } else if (value instanceof JsonValue.DecimalValue decimal) {
            generator.writeNumber(decimal.value());
        } else if (value instanceof JsonValue.DateValue date) {
            generator.writeString(date.toIsoString());
        } else if (value instanceof JsonValue.DateTimeValue dateTime) {
            generator.writeString(dateTime.toIsoString());
        } else if (value instanceof JsonValue.ArrayValue array) {
            generator.writeStartArray();
            for (JsonValue element : array.elements()) {
                write(generator, element);
            }
            generator.writeEndArray();
        } else if (value instanceof JsonValue.ObjectValue object) {
            generator.writeStartObject();
            for (Map.Entry<String, JsonValue> member : object.members().entrySet()) {
                generator.writeFieldName(member.getKey());
                write(generator, member.getValue());
            }
            generator.writeEndObject();
        } else {
            throw new EncodingException(value, "Unknown JSON value variant: " + value);
        }
    }

    /**
     * Encodes a value for use in a query string.
     *
     * @throws EncodingException naming the value if it has no query-string representation
     */
    public String encodeScalar(Object value) {
        if (value instanceof Boolean bool) {
            return bool ? "true" : "false";
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return value.toString();
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Double || value instanceof Float) {
            return floatingText(value);
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof LocalDateTime dateTime) {
            return new JsonValue.DateTimeValue(dateTime).toIsoString();
        }
        if (value instanceof LocalDate date) {
            return new JsonValue.DateValue(date).toIsoString();
        }
        if (value instanceof List<?> list) {
            StringJoiner joined = new StringJoiner(",");
            for (Object element : list) {
                joined.add(encodeScalar(element));
            }
            return joined.toString();
        }
        List<?> sequence = JsonValue.asList(value);
        if (sequence != null) {
            return encodeScalar(sequence);
        }
        if (value instanceof JsonValue json) {
            Object unwrapped = unwrap(json);
            if (unwrapped != json) {
                return encodeScalar(unwrapped);
            }
        }
        throw new EncodingException(value, "Don't know how to represent "
                + (value == null ? "null" : value.getClass().getName() + " (" + value + ")")
                + " in a query string");
    }

    private static String floatingText(Object value) {
        double d = ((Number) value).doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new EncodingException(value, "Non-finite number has no query-string representation: " + value);
        }
        // Float.toString keeps the float's own shortest form (0.1f stays 0.1)
        return new BigDecimal(value.toString()).toPlainString();
    }

    private static Object unwrap(JsonValue json) {
        if (json instanceof JsonValue.BoolValue bool) {
            return bool.value();
        }
        if (json instanceof JsonValue.TextValue text) {
            return text.value();
        }
        if (json instanceof JsonValue.IntegralValue integral) {
            return integral.value();
        }
        if (json instanceof JsonValue.FloatingValue floating) {
            return floating.value();
        }
        if (json instanceof JsonValue.DecimalValue decimal) {
            return decimal.value();
        }
        if (json instanceof JsonValue.DateValue date) {
            return date.value();
        }
        if (json instanceof JsonValue.DateTimeValue dateTime) {
            return dateTime.value();
        }
        if (json instanceof JsonValue.ArrayValue array) {
            return array.elements();
        }
        // null and objects have no query-string form
        return json;
    }
}
