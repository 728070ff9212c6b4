package com.jobpulse.ingestion.event;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle event variants, keyed by the envelope's "event" discriminator.
 */
public enum EventKind {
    JOB_START("SparkListenerJobStart"),
    TASK_END("SparkListenerTaskEnd"),
    JOB_END("SparkListenerJobEnd");

    private final String discriminator;

    EventKind(String discriminator) {
        this.discriminator = discriminator;
    }

    public String discriminator() {
        return discriminator;
    }

    public static Optional<EventKind> fromDiscriminator(String value) {
        return Arrays.stream(values())
                .filter(k -> k.discriminator().equals(value))
                .findFirst();
    }
}
