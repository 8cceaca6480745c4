package com.loopPhones.util;

import com.google.cloud.Timestamp;

import java.time.Instant;

/** Conversions between Firestore timestamps and java.time. */
public final class Timestamps {

    private Timestamps() {
    }

    public static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    }

    public static Timestamp fromInstant(Instant instant) {
        return instant == null ? null : Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
    }
}
