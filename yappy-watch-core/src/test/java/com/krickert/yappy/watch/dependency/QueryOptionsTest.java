package com.krickert.yappy.watch.dependency;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class QueryOptionsTest {

    private static final QueryOptions FULL = QueryOptions.builder()
            .allowStale(true)
            .datacenter("dc1")
            .namespace("team-a")
            .filter("Service.Tags contains \"web\"")
            .near("_agent")
            .requireConsistent(true)
            .waitIndex(42)
            .waitTime(Duration.ofSeconds(30))
            .defaultLease(Duration.ofMinutes(5))
            .build();

    @Test
    @DisplayName("An empty override never clobbers populated fields")
    void mergeWithEmptyKeepsEverything() {
        assertEquals(FULL, FULL.merge(QueryOptions.EMPTY));
        assertEquals(FULL, FULL.merge(null));
    }

    @Test
    @DisplayName("Populated override fields win, one field at a time")
    void mergeIsRightBiasedPerField() {
        QueryOptions override = QueryOptions.builder()
                .datacenter("dc2")
                .waitIndex(99)
                .defaultLease(Duration.ofSeconds(10))
                .build();

        QueryOptions merged = FULL.merge(override);

        assertEquals("dc2", merged.datacenter());
        assertEquals(99, merged.waitIndex());
        assertEquals(Duration.ofSeconds(10), merged.defaultLease());
        assertEquals("team-a", merged.namespace());
        assertEquals("_agent", merged.near());
        assertEquals(Duration.ofSeconds(30), merged.waitTime());
        assertTrue(merged.allowStale());
        assertTrue(merged.requireConsistent());
    }

    @Test
    void mergeIntoEmptyTakesOverride() {
        assertEquals(FULL, QueryOptions.EMPTY.merge(FULL));
    }

    @Test
    void withoutBlockingClearsOnlyWaitFields() {
        QueryOptions nonBlocking = FULL.withoutBlocking();

        assertEquals(0, nonBlocking.waitIndex());
        assertEquals(Duration.ZERO, nonBlocking.waitTime());
        assertFalse(nonBlocking.isBlocking());
        assertEquals("dc1", nonBlocking.datacenter());
        assertEquals(Duration.ofMinutes(5), nonBlocking.defaultLease());
    }

    @Test
    void nullStringsBecomeEmpty() {
        QueryOptions options = new QueryOptions(false, null, null, null, null, false, 0, null, null);

        assertEquals("", options.datacenter());
        assertEquals("", options.filter());
        assertEquals(Duration.ZERO, options.waitTime());
        assertEquals(Duration.ZERO, options.defaultLease());
    }

    @Test
    void queryStringIsSortedAndEncoded() {
        QueryOptions options = QueryOptions.builder()
                .datacenter("dc1")
                .filter("a == b")
                .waitIndex(7)
                .waitTime(Duration.ofSeconds(2))
                .build();

        assertEquals("dc=dc1&filter=a+%3D%3D+b&index=7&wait=2000ms", options.toQueryString());
        assertEquals("", QueryOptions.EMPTY.toQueryString());
    }
}
