package com.krickert.yappy.watch.file;

import com.krickert.yappy.watch.dependency.AbstractDependency;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.exception.DependencyFetchException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Contents of a local file. The first fetch returns at once, later fetches block until the
 * file's size or modification time changes.
 */
public class FileQuery extends AbstractDependency<String> {

    public static final Duration POLL_INTERVAL = Duration.ofSeconds(2);

    private final FileChangeWatcher watcher;
    private FileSnapshot lastSnapshot;

    public FileQuery(String path) {
        this(new FileChangeWatcher(toPath(path), POLL_INTERVAL), Clock.systemUTC());
    }

    public FileQuery(FileChangeWatcher watcher, Clock clock) {
        super(clock);
        this.watcher = watcher;
    }

    @Override
    public FetchResult<String> fetch(Clients clients) {
        checkStopped();
        FileSnapshot snapshot = watcher.awaitChange(id(), lastSnapshot, stopSignal);
        String contents;
        try {
            contents = new String(Files.readAllBytes(watcher.path()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DependencyFetchException(id(), e);
        }
        lastSnapshot = snapshot;
        return FetchResult.synthetic(contents, clock);
    }

    @Override
    public String id() {
        return "file(" + watcher.path() + ")";
    }

    @Override
    public boolean canShare() {
        return false;
    }

    private static Path toPath(String path) {
        String trimmed = path == null ? "" : path.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("file: invalid format: \"" + path + "\"");
        }
        return Path.of(trimmed);
    }
}
