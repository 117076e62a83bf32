package com.carbondna.api.canonical;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Deterministic serializer for ledger payloads.
 *
 * <p>Canonical form: a compact UTF-8 JSON object with keys in natural String
 * order, no whitespace, numbers as plain decimals without trailing zeros or
 * exponent, booleans as {@code true}/{@code false} and nulls kept as
 * {@code null}. Two logically equal payloads always produce the same bytes.
 * Changing this format invalidates every stored record hash.
 */
@Component
public class Canonicalizer {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final JsonFactory jsonFactory;
    private final ObjectMapper reader;

    public Canonicalizer() {
        this.jsonFactory = JsonFactory.builder().build();
        JsonFactory readFactory = JsonFactory.builder()
                .streamReadConstraints(StreamReadConstraints.builder()
                        .maxNumberLength(FieldValue.Numeric.MAX_PLAIN_LENGTH)
                        .build())
                .build();
        this.reader = new ObjectMapper(readFactory)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS)
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    /**
     * Canonical bytes of a payload; this is the hash input.
     */
    public byte[] canonicalize(FieldMap payload) {
        if (payload == null) {
            throw new CanonicalizationException("Payload cannot be null");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(64 + payload.size() * 32);
        try (JsonGenerator generator = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
            generator.writeStartObject();
            for (Map.Entry<String, FieldValue> entry : payload.asMap().entrySet()) {
                generator.writeFieldName(entry.getKey());
                writeValue(generator, entry.getValue());
            }
            generator.writeEndObject();
        } catch (IOException e) {
            throw new CanonicalizationException("Failed to serialize payload", e);
        }
        return out.toByteArray();
    }

    public String canonicalJson(FieldMap payload) {
        return new String(canonicalize(payload), StandardCharsets.UTF_8);
    }

    /**
     * Reads stored canonical JSON back into a payload.
     *
     * @throws CanonicalizationException if the text is not a JSON object of supported values
     */
    public FieldMap parse(String json) {
        if (json == null || json.isBlank()) {
            throw new CanonicalizationException("Stored payload is empty");
        }
        Map<String, Object> raw;
        try {
            raw = reader.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new CanonicalizationException("Stored payload is not a JSON object: " + e.getOriginalMessage(), e);
        }
        if (raw == null) {
            throw new CanonicalizationException("Stored payload is null");
        }
        return FieldMap.of(raw);
    }

    private void writeValue(JsonGenerator generator, FieldValue value) throws IOException {
        if (value instanceof FieldValue.Text text) {
            generator.writeString(text.value());
        } else if (value instanceof FieldValue.Numeric numeric) {
            generator.writeNumber(numeric.canonical());
        } else if (value instanceof FieldValue.Bool bool) {
            generator.writeBoolean(bool.value());
        } else {
            generator.writeNull();
        }
    }
}
