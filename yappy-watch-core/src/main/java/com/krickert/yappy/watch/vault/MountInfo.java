package com.krickert.yappy.watch.vault;

/**
 * Mount metadata for a secret path.
 *
 * @param path    mount path with its trailing slash, e.g. {@code secret/}
 * @param type    engine type, e.g. {@code kv}
 * @param version engine version option, empty when unset
 */
public record MountInfo(String path, String type, String version) {

    public MountInfo {
        path = path == null ? "" : path;
        type = type == null ? "" : type;
        version = version == null ? "" : version;
    }

    public boolean isKvV2() {
        return "2".equals(version) && "kv".equals(type);
    }
}
