package com.krickert.yappy.watch.file;

import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.exception.DependencyFetchException;
import com.krickert.yappy.watch.exception.DependencyStoppedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class FileQueryTest {

    private static final Duration POLL = Duration.ofMillis(20);

    @TempDir
    Path dir;

    private final Clients clients = mock(Clients.class);

    private FileQuery query(Path file) {
        return new FileQuery(new FileChangeWatcher(file, POLL), Clock.systemUTC());
    }

    @Test
    void firstFetchReturnsTheContentsAtOnce() throws IOException {
        Path file = Files.writeString(dir.resolve("app.conf"), "port=8080\n");

        FileQuery query = query(file);

        assertEquals("port=8080\n", query.fetch(clients).value());
        assertEquals("file(" + file + ")", query.id());
        verifyNoInteractions(clients);
    }

    @Test
    void laterFetchesWaitForAChange() throws Exception {
        Path file = Files.writeString(dir.resolve("app.conf"), "port=8080\n");
        FileQuery query = query(file);
        query.fetch(clients);

        CompletableFuture<String> next = CompletableFuture.supplyAsync(() -> query.fetch(clients).value());
        Thread.sleep(100);
        assertFalse(next.isDone());

        Files.write(file, "port=9090\nhost=0.0.0.0\n".getBytes(StandardCharsets.UTF_8));

        assertEquals("port=9090\nhost=0.0.0.0\n", next.get(5, TimeUnit.SECONDS));
    }

    @Test
    void stopInterruptsAWaitingFetch() throws Exception {
        Path file = Files.writeString(dir.resolve("app.conf"), "port=8080\n");
        FileQuery query = query(file);
        query.fetch(clients);

        CompletableFuture<String> next = CompletableFuture.supplyAsync(() -> query.fetch(clients).value());
        Thread.sleep(50);
        query.stop();

        ExecutionException e = assertThrows(ExecutionException.class, () -> next.get(5, TimeUnit.SECONDS));
        assertInstanceOf(DependencyStoppedException.class, e.getCause());
    }

    @Test
    void missingFileFailsTheFetch() {
        Path file = dir.resolve("missing.conf");

        DependencyFetchException e = assertThrows(DependencyFetchException.class, () -> query(file).fetch(clients));

        assertTrue(e.getMessage().startsWith("file(" + file + "): "), e.getMessage());
    }

    @Test
    void blankPathIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FileQuery("  "));
    }
}
