package com.custodia.auditchain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Flat, ordered key to string-or-number map attached to an audit entry.
 * <p>
 * Keys are kept in natural string order and numbers are normalised on the way in
 * ({@code 1.50} and {@code 1.5} are the same value, {@code 2.0} is {@code 2}), so two logically
 * equal payloads always encode to the same bytes. Nested objects, arrays, booleans, nulls and
 * non-finite numbers are rejected with {@link AuditValidationException}.
 */
public final class Metadata {

    private static final Metadata EMPTY = new Metadata(new TreeMap<>());

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final SortedMap<String, Object> values;

    private Metadata(SortedMap<String, Object> values) {
        this.values = Collections.unmodifiableSortedMap(values);
    }

    public static Metadata empty() {
        return EMPTY;
    }

    /**
     * Copies and validates an arbitrary map. All problems are reported at once.
     *
     * @throws AuditValidationException if a key is blank or a value is neither a string nor a
     *                                  finite number
     */
    public static Metadata of(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return EMPTY;
        }
        var errors = new ArrayList<String>();
        var normalized = new TreeMap<String, Object>();
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank()) {
                errors.add("metadata keys must not be null or blank");
                continue;
            }
            Object value = entry.getValue();
            if (value instanceof String s) {
                normalized.put(key, s);
            } else if (value instanceof Number n) {
                BigDecimal decimal = toDecimal(n);
                if (decimal == null) {
                    errors.add("metadata." + key + " must be a finite number");
                } else {
                    normalized.put(key, decimal);
                }
            } else {
                errors.add("metadata." + key + " must be a string or a number, got "
                        + (value == null ? "null" : value.getClass().getSimpleName()));
            }
        }
        if (!errors.isEmpty()) {
            throw new AuditValidationException(errors);
        }
        return new Metadata(normalized);
    }

    /**
     * Parses a flat JSON object such as {@code {"box":"B-12","weight":4.5}}. A null or blank
     * string yields empty metadata.
     *
     * @throws AuditValidationException if the text is not a flat JSON object of strings and numbers
     */
    public static Metadata fromJson(String json) {
        if (json == null || json.isBlank()) {
            return EMPTY;
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AuditValidationException("metadata is not well-formed JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new AuditValidationException("metadata must be a JSON object");
        }
        var errors = new ArrayList<String>();
        var normalized = new TreeMap<String, Object>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            if (field.getKey().isBlank()) {
                errors.add("metadata keys must not be null or blank");
            } else if (node.isTextual()) {
                normalized.put(field.getKey(), node.textValue());
            } else if (node.isDouble() && !Double.isFinite(node.doubleValue())) {
                errors.add("metadata." + field.getKey() + " must be a finite number");
            } else if (node.isNumber()) {
                normalized.put(field.getKey(), normalize(node.decimalValue()));
            } else {
                errors.add("metadata." + field.getKey() + " must be a string or a number, got "
                        + node.getNodeType().name().toLowerCase());
            }
        }
        if (!errors.isEmpty()) {
            throw new AuditValidationException(errors);
        }
        return normalized.isEmpty() ? EMPTY : new Metadata(normalized);
    }

    /**
     * Compact JSON with sorted keys, suitable for storage and for {@link #fromJson(String)}.
     */
    public String toJson() {
        var node = MAPPER.createObjectNode();
        values.forEach((key, value) -> {
            if (value instanceof BigDecimal decimal) {
                node.put(key, decimal);
            } else {
                node.put(key, (String) value);
            }
        });
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize metadata", e);
        }
    }

    /**
     * Read-only view in key order. Values are {@link String} or normalised {@link BigDecimal}.
     */
    public SortedMap<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public List<String> keys() {
        return List.copyOf(values.keySet());
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal d) {
            return normalize(d);
        }
        if (number instanceof BigInteger i) {
            return normalize(new BigDecimal(i));
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return normalize(new BigDecimal(number.toString()));
        }
        return normalize(BigDecimal.valueOf(number.longValue()));
    }

    private static BigDecimal normalize(BigDecimal decimal) {
        BigDecimal stripped = decimal.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Metadata other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Metadata" + values;
    }
}
