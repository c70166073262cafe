package com.triagedesk.support.common.concurrent;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SingleFlightTest {

    @Test
    void overlapping_callers_share_one_execution() throws Exception {
        var flight = new SingleFlight<Integer>();
        var executions = new AtomicInteger();
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            var first = pool.submit(() -> flight.run("scan", () -> {
                started.countDown();
                await(release);
                return executions.incrementAndGet();
            }));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            assertTrue(flight.isInFlight("scan"));

            var followers = new ArrayList<Future<Integer>>();
            for (int i = 0; i < 3; i++) {
                followers.add(pool.submit(() -> flight.run("scan", executions::incrementAndGet)));
            }
            // give followers time to join the running call
            Thread.sleep(500);
            release.countDown();

            assertEquals(1, first.get(5, TimeUnit.SECONDS));
            for (var f : followers) {
                assertEquals(1, f.get(5, TimeUnit.SECONDS));
            }
            assertEquals(1, executions.get());
            assertFalse(flight.isInFlight("scan"));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void sequential_calls_run_again() {
        var flight = new SingleFlight<Integer>();
        var executions = new AtomicInteger();
        assertEquals(1, flight.run("k", executions::incrementAndGet));
        assertEquals(2, flight.run("k", executions::incrementAndGet));
    }

    @Test
    void failure_is_rethrown_and_key_released() {
        var flight = new SingleFlight<String>();
        var ex = assertThrows(IllegalStateException.class, () -> flight.run("k", () -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals("boom", ex.getMessage());
        assertFalse(flight.isInFlight("k"));
        assertEquals("ok", flight.run("k", () -> "ok"));
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
