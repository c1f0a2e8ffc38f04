package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.dependency.ResponseMetadata;

import java.time.Duration;

/**
 * A discovery-service answer with the index and last-contact headers that came with it.
 */
public record IndexedResponse<T>(T value, long index, Duration lastContact) {

    public IndexedResponse {
        lastContact = lastContact == null ? Duration.ZERO : lastContact;
    }

    public ResponseMetadata metadata() {
        return new ResponseMetadata(index, lastContact);
    }
}
