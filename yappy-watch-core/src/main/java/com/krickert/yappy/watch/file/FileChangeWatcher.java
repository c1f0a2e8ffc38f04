package com.krickert.yappy.watch.file;

import com.krickert.yappy.watch.dependency.StopSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;

/**
 * Polls a file's size and modification time until they differ from a previous snapshot.
 */
public class FileChangeWatcher {

    private static final Logger LOG = LoggerFactory.getLogger(FileChangeWatcher.class);

    private final Path path;
    private final Duration pollInterval;
    private final Scheduler scheduler;

    public FileChangeWatcher(Path path, Duration pollInterval) {
        this(path, pollInterval, Schedulers.boundedElastic());
    }

    public FileChangeWatcher(Path path, Duration pollInterval, Scheduler scheduler) {
        this.path = path;
        this.pollInterval = pollInterval;
        this.scheduler = scheduler;
    }

    /**
     * Blocks until the file differs from {@code previous} (any state counts as a change when
     * {@code previous} is {@code null}) or the stop signal fires.
     *
     * @throws com.krickert.yappy.watch.exception.DependencyFetchException if the file cannot be read
     * @throws com.krickert.yappy.watch.exception.DependencyStoppedException on stop
     */
    public FileSnapshot awaitChange(String dependencyId, FileSnapshot previous, StopSignal stopSignal) {
        Mono<FileSnapshot> change = Flux.interval(Duration.ZERO, pollInterval, scheduler)
                .map(tick -> snapshot())
                .filter(current -> !current.equals(previous))
                .next();
        FileSnapshot snapshot = stopSignal.await(dependencyId, change);
        LOG.trace("{}: {} changed: {}", dependencyId, path, snapshot);
        return snapshot;
    }

    public Path path() {
        return path;
    }

    FileSnapshot snapshot() {
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return new FileSnapshot(attributes.size(), attributes.lastModifiedTime());
        } catch (IOException e) {
            throw new UncheckedIOException("failed to stat " + path, e);
        }
    }
}
