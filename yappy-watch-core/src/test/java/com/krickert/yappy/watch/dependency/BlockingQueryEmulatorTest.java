package com.krickert.yappy.watch.dependency;

import com.krickert.yappy.watch.exception.DependencyStoppedException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class BlockingQueryEmulatorTest {

    private final BlockingQueryEmulator emulator = new BlockingQueryEmulator();

    @Test
    void firstPollDoesNotSleep() {
        StopSignal signal = new StopSignal();
        long start = System.nanoTime();

        emulator.pauseIfPolled("test", QueryOptions.EMPTY, Duration.ofMinutes(10), signal);

        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(1)) < 0);
    }

    @Test
    void repeatPollSleepsForTheInterval() {
        StopSignal signal = new StopSignal();
        QueryOptions polled = QueryOptions.builder().waitIndex(1).build();
        long start = System.nanoTime();

        emulator.pauseIfPolled("test", polled, Duration.ofMillis(150), signal);

        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofMillis(150)) >= 0);
    }

    @Test
    void stopCutsALongSleepShort() {
        StopSignal signal = new StopSignal();
        CompletableFuture<Void> sleeping = CompletableFuture.runAsync(
                () -> emulator.pause("catalog.datacenters", Duration.ofMinutes(10), signal));

        signal.stop();

        await().atMost(Duration.ofSeconds(2)).until(sleeping::isDone);
        assertTrue(sleeping.isCompletedExceptionally());
        Throwable cause = assertThrows(Exception.class, sleeping::join).getCause();
        assertInstanceOf(DependencyStoppedException.class, cause);
    }

    @Test
    void pauseOnStoppedSignalFailsAtOnce() {
        StopSignal signal = new StopSignal();
        signal.stop();

        assertThrows(DependencyStoppedException.class, () -> emulator.pause("test", Duration.ZERO, signal));
    }

    @Test
    void zeroDurationReturnsImmediately() {
        assertDoesNotThrow(() -> emulator.pause("test", Duration.ZERO, new StopSignal()));
        assertDoesNotThrow(() -> emulator.pause("test", null, new StopSignal()));
    }
}
