package com.jobpulse.ingestion.classifier;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Envelope timestamp parsing: ISO-8601 with offset or Z, zone-less ISO (read as UTC), or epoch milliseconds.
 */
public final class EventTimestamps {

    private EventTimestamps() {
    }

    /**
     * @return empty when the node is absent, null or not a timestamp
     */
    public static Optional<Instant> parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isIntegralNumber()) {
            return Optional.of(Instant.ofEpochMilli(node.asLong()));
        }
        if (!node.isTextual() || node.asText().isBlank()) {
            return Optional.empty();
        }
        String text = node.asText().trim();
        try {
            return Optional.of(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException notLocal) {
                return Optional.empty();
            }
        }
    }
}
