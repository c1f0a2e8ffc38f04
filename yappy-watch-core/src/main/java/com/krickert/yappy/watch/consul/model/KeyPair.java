package com.krickert.yappy.watch.consul.model;

/**
 * A key/value entry. {@code exists == false} stands for "no such key" and carries only the
 * requested key.
 *
 * @param path full key as stored
 * @param key  key relative to the queried prefix (equal to {@code path} for single-key reads)
 */
public record KeyPair(
        String path,
        String key,
        String value,
        boolean exists,
        long createIndex,
        long modifyIndex,
        long lockIndex,
        long flags,
        String session
) {

    public static KeyPair missing(String key) {
        return new KeyPair(key, key, "", false, 0, 0, 0, 0, "");
    }

    public KeyPair withKey(String relativeKey) {
        return new KeyPair(path, relativeKey, value, exists, createIndex, modifyIndex, lockIndex, flags, session);
    }
}
