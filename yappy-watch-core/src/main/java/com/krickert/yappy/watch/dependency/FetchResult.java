package com.krickert.yappy.watch.dependency;

import java.time.Clock;
import java.util.Objects;

/**
 * A fetched value together with its {@link ResponseMetadata}. The value may be {@code null} only
 * where a dependency documents it (a write that returned nothing, a never-populated secret).
 */
public record FetchResult<T>(T value, ResponseMetadata metadata) {

    public FetchResult {
        Objects.requireNonNull(metadata, "metadata");
    }

    public static <T> FetchResult<T> of(T value, ResponseMetadata metadata) {
        return new FetchResult<>(value, metadata);
    }

    public static <T> FetchResult<T> synthetic(T value, Clock clock) {
        return new FetchResult<>(value, ResponseMetadata.synthetic(clock));
    }
}
