package com.custodia.auditchain;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Byte-stable encoding of the hashed fields of an audit entry.
 * <p>
 * Output is a UTF-8 JSON object written field by field with Jackson's streaming generator, in
 * the fixed order tenantId, eventType, actorId, timestamp, subjectRef, description, metadata,
 * previousHash. Timestamps are ISO-8601 UTC with exactly three fractional digits. Metadata keys
 * are sorted and numbers are written in plain notation after trailing zeros are stripped.
 * Absent values are written as JSON {@code null}. Changing any of these rules breaks
 * verification of every existing chain.
 */
public final class CanonicalEncoder {

    private static final JsonFactory FACTORY = new JsonFactory();

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private CanonicalEncoder() {
        // utility class
    }

    /**
     * Encodes the chained fields. Pure: equal inputs always produce byte-identical output.
     */
    public static byte[] encode(ChainedFields fields) {
        var out = new ByteArrayOutputStream(256);
        try (JsonGenerator gen = FACTORY.createGenerator(out, JsonEncoding.UTF8)) {
            gen.writeStartObject();
            writeString(gen, "tenantId", fields.tenantId());
            writeString(gen, "eventType", fields.eventType() == null ? null : fields.eventType().value());
            writeString(gen, "actorId", fields.actorId());
            writeString(gen, "timestamp", formatTimestamp(fields.timestamp()));
            gen.writeFieldName("subjectRef");
            if (fields.subjectRef() == null) {
                gen.writeNull();
            } else {
                gen.writeStartObject();
                writeString(gen, "type", fields.subjectRef().type());
                writeString(gen, "id", fields.subjectRef().id());
                gen.writeEndObject();
            }
            writeString(gen, "description", fields.description());
            gen.writeFieldName("metadata");
            writeMetadata(gen, fields.metadata());
            writeString(gen, "previousHash", fields.previousHash());
            gen.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode audit entry", e);
        }
        return out.toByteArray();
    }

    /**
     * The textual timestamp form used inside the encoding, e.g. {@code 2026-01-05T10:15:30.000Z}.
     */
    public static String formatTimestamp(Instant timestamp) {
        return timestamp == null ? null : TIMESTAMP_FORMAT.format(timestamp.truncatedTo(ChronoUnit.MILLIS));
    }

    private static void writeMetadata(JsonGenerator gen, Metadata metadata) throws IOException {
        gen.writeStartObject();
        for (Map.Entry<String, Object> entry : metadata.asMap().entrySet()) {
            gen.writeFieldName(entry.getKey());
            if (entry.getValue() instanceof BigDecimal decimal) {
                gen.writeNumber(decimal.stripTrailingZeros().toPlainString());
            } else {
                gen.writeString((String) entry.getValue());
            }
        }
        gen.writeEndObject();
    }

    private static void writeString(JsonGenerator gen, String name, String value) throws IOException {
        gen.writeFieldName(name);
        if (value == null) {
            gen.writeNull();
        } else {
            gen.writeString(value);
        }
    }
}
