package com.krickert.yappy.watch.vault;

/**
 * Rewrites logical secret paths into the versioned layout of a KV v2 mount.
 * <p>
 * Already-normalized paths are returned unchanged. A remainder that merely starts with the
 * letters {@code data} or {@code metadata} (such as {@code datafoo/bar}) is not treated as
 * normalized.
 */
public final class KvV2Paths {

    private KvV2Paths() {
    }

    public static String normalize(String rawPath, String mountPath, KvV2Purpose purpose) {
        String mount = trimTrailingSlash(mountPath);
        String segment = purpose.segment();
        if (rawPath.equals(mount) || rawPath.equals(mount + "/")) {
            return join(mount, segment);
        }
        String rest = rawPath.startsWith(mount + "/") ? rawPath.substring(mount.length() + 1) : rawPath;
        if (isUnder(rest, segment)) {
            return rawPath;
        }
        if (purpose == KvV2Purpose.DATA && isUnder(rest, KvV2Purpose.METADATA.segment())) {
            return rawPath;
        }
        return join(join(mount, segment), rest);
    }

    private static boolean isUnder(String rest, String segment) {
        return rest.equals(segment) || rest.startsWith(segment + "/");
    }

    private static String trimTrailingSlash(String path) {
        String p = path;
        while (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

    private static String join(String left, String right) {
        String r = right;
        while (r.startsWith("/")) {
            r = r.substring(1);
        }
        if (left.isEmpty()) {
            return trimTrailingSlash(r);
        }
        if (r.isEmpty()) {
            return left;
        }
        return trimTrailingSlash(left + "/" + r);
    }
}
