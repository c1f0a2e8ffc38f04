package com.krickert.yappy.watch.dependency;

import java.time.Clock;
import java.time.Duration;

/**
 * Metadata paired with every successful fetch.
 *
 * @param lastIndex   change token from the backend, or a synthetic value for backends without one
 * @param lastContact time since the answering server last heard from the leader (stale reads only)
 */
public record ResponseMetadata(long lastIndex, Duration lastContact) {

    public ResponseMetadata {
        lastContact = lastContact == null ? Duration.ZERO : lastContact;
    }

    /**
     * Metadata for non-indexed backends: the current Unix time stands in for the index, so every
     * successful poll looks like a potential change.
     */
    public static ResponseMetadata synthetic(Clock clock) {
        return new ResponseMetadata(clock.instant().getEpochSecond(), Duration.ZERO);
    }

    public static ResponseMetadata synthetic() {
        return synthetic(Clock.systemUTC());
    }
}
