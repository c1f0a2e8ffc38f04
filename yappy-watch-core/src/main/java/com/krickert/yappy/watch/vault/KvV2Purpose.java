package com.krickert.yappy.watch.vault;

public enum KvV2Purpose {
    /** Reads and writes, under {@code data/}. */
    DATA("data"),
    /** Listing, under {@code metadata/}. */
    METADATA("metadata");

    private final String segment;

    KvV2Purpose(String segment) {
        this.segment = segment;
    }

    public String segment() {
        return segment;
    }
}
