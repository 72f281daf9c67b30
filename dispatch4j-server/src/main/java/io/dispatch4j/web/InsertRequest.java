package io.dispatch4j.web;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Arrays;

/**
 * Parsed {@code /insert} payload.
 *
 * <p>{@code body} is kept as the exact bytes the client sent, so numbers and spacing reach the
 * callback untouched. Field names match case-insensitively.
 */
final class InsertRequest {

    private final Instant timestamp;
    private final byte[] body;

    private InsertRequest(Instant timestamp, byte[] body) {
        this.timestamp = timestamp;
        this.body = body;
    }

    Instant timestamp() {
        return timestamp;
    }

    /** Raw JSON of {@code body}, or {@code null} when absent or JSON null. */
    byte[] body() {
        return body;
    }

    static InsertRequest read(JsonFactory factory, byte[] raw) throws IOException {
        Instant timestamp = null;
        byte[] body = null;
        try (JsonParser p = factory.createParser(raw)) {
            if (p.nextToken() != JsonToken.START_OBJECT) {
                throw new IllegalArgumentException("request body must be a JSON object");
            }
            while (p.nextToken() == JsonToken.FIELD_NAME) {
                String name = p.currentName();
                JsonToken value = p.nextToken();
                if ("timestamp".equalsIgnoreCase(name)) {
                    timestamp = value == JsonToken.VALUE_NULL ? null : parseTimestamp(p);
                } else if ("body".equalsIgnoreCase(name)) {
                    body = value == JsonToken.VALUE_NULL ? null : captureValue(p, raw);
                } else {
                    p.skipChildren();
                }
            }
            if (p.currentToken() != JsonToken.END_OBJECT) {
                throw new IllegalArgumentException("request body must be a JSON object");
            }
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp is required");
        }
        return new InsertRequest(timestamp, body);
    }

    private static Instant parseTimestamp(JsonParser p) throws IOException {
        if (p.currentToken() != JsonToken.VALUE_STRING) {
            throw new IllegalArgumentException("timestamp must be an RFC 3339 string");
        }
        try {
            return OffsetDateTime.parse(p.getText()).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("timestamp must be an RFC 3339 string", e);
        }
    }

    // parser sits on the first token of the value
    private static byte[] captureValue(JsonParser p, byte[] raw) throws IOException {
        int start = (int) p.currentTokenLocation().getByteOffset();
        if (p.currentToken().isStructStart()) {
            p.skipChildren();
        } else {
            p.finishToken();
        }
        int end = (int) p.currentLocation().getByteOffset();
        return Arrays.copyOfRange(raw, start, end);
    }
}
