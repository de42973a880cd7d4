package dev.timedqueue.client;

import dev.timedqueue.config.TimedQueueConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class IdleResourceReaperTest {

    private IdleResourceReaper<String, FakeHandle> reaper;

    @AfterEach
    void tearDown() {
        if (reaper != null) reaper.close();
    }

    static class FakeHandle implements AutoCloseable {
        final AtomicInteger closes = new AtomicInteger();
        final CountDownLatch closed = new CountDownLatch(1);
        final boolean failOnClose;

        FakeHandle() { this(false); }
        FakeHandle(boolean failOnClose) { this.failOnClose = failOnClose; }

        @Override
        public void close() throws Exception {
            closes.incrementAndGet();
            closed.countDown();
            if (failOnClose) throw new Exception("handle is busy");
        }

        boolean awaitClosed(long ms) throws InterruptedException {
            return closed.await(ms, TimeUnit.MILLISECONDS);
        }
    }

    private static TimedQueueConfig config(long delayMs) {
        return new TimedQueueConfig()
                .setName("reaper-test")
                .setDelay(Duration.ofMillis(delayMs))
                .setShutdownTimeout(Duration.ofMillis(500));
    }

    @Test
    void closesResourceAfterIdleDelay() throws Exception {
        reaper = new IdleResourceReaper<>(config(100));
        FakeHandle h = new FakeHandle();

        reaper.touch("db", h);
        assertTrue(reaper.isPending("db"));
        assertTrue(h.awaitClosed(2_000));
        assertEquals(1, h.closes.get());
        assertEquals(0, reaper.pendingCount());
    }

    @Test
    void touchingKeepsResourceOpen() throws Exception {
        reaper = new IdleResourceReaper<>(config(200));
        FakeHandle h = new FakeHandle();

        for (int i = 0; i < 5; i++) {
            reaper.touch("db", h);
            Thread.sleep(80);
        }
        assertEquals(0, h.closes.get(), "touched handle closed early");
        assertTrue(h.awaitClosed(2_000));
    }

    @Test
    void releasedResourceIsNotClosed() throws Exception {
        reaper = new IdleResourceReaper<>(config(100));
        FakeHandle h = new FakeHandle();

        reaper.touch("db", h);
        reaper.release("db");
        Thread.sleep(300);
        assertEquals(0, h.closes.get());
        assertFalse(reaper.isPending("db"));
    }

    @Test
    void failingCloseDoesNotStopReaper() throws Exception {
        reaper = new IdleResourceReaper<>(config(50));
        FakeHandle bad = new FakeHandle(true);
        FakeHandle good = new FakeHandle();

        reaper.touch("bad", bad);
        reaper.touch("good", good);

        assertTrue(bad.awaitClosed(2_000));
        assertTrue(good.awaitClosed(2_000));
    }

    @Test
    void closeReleasesPendingResources() throws Exception {
        reaper = new IdleResourceReaper<>(config(60_000));
        FakeHandle a = new FakeHandle();
        FakeHandle b = new FakeHandle();
        reaper.touch("a", a);
        reaper.touch("b", b);

        reaper.close();

        assertEquals(1, a.closes.get());
        assertEquals(1, b.closes.get());
        assertTrue(reaper.isClosed());
        assertEquals(0, reaper.pendingCount());
        assertThrows(IllegalStateException.class, () -> reaper.touch("c", new FakeHandle()));

        reaper.close();
        assertEquals(1, a.closes.get(), "second close must not close resources again");
    }

    @Test
    void concurrentTouchAndClose_closesEveryAcceptedResourceExactlyOnce() throws Exception {
        final int rounds = Integer.getInteger("tq.reaperRounds", 200);
        final int touchers = 4;
        ExecutorService pool = Executors.newFixedThreadPool(touchers);
        try {
            for (int round = 0; round < rounds; round++) {
                IdleResourceReaper<String, FakeHandle> r = new IdleResourceReaper<>(
                        config(60_000).setShutdownTimeout(Duration.ofMillis(10)));
                CountDownLatch start = new CountDownLatch(1);
                List<Future<List<FakeHandle>>> accepted = new ArrayList<>();

                for (int t = 0; t < touchers; t++) {
                    final String prefix = "t" + t + "-";
                    accepted.add(pool.submit(() -> {
                        List<FakeHandle> mine = new ArrayList<>();
                        start.await();
                        for (int i = 0; ; i++) {
                            FakeHandle h = new FakeHandle();
                            try {
                                // unique keys so no accepted handle is replaced without being closed
                                r.touch(prefix + i, h);
                            } catch (IllegalStateException closedNow) {
                                return mine;
                            }
                            mine.add(h);
                        }
                    }));
                }

                start.countDown();
                Thread.sleep(1);
                r.close();

                for (Future<List<FakeHandle>> f : accepted) {
                    for (FakeHandle h : f.get(5, TimeUnit.SECONDS)) {
                        assertEquals(1, h.closes.get(), "accepted handle closed " + h.closes.get() + " times in round " + round);
                    }
                }
                assertEquals(0, r.pendingCount(), "resources left pending after close in round " + round);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void resourceClosingItsOwnReaperDoesNotStallShutdown() throws Exception {
        IdleResourceReaper<String, AutoCloseable> selfClosing = new IdleResourceReaper<>(
                config(50).setShutdownTimeout(Duration.ofSeconds(5)));
        FakeHandle other = new FakeHandle();
        CountDownLatch returned = new CountDownLatch(1);
        long[] tookMs = new long[1];

        selfClosing.touch("owner", () -> {
            long t0 = System.currentTimeMillis();
            selfClosing.close();
            tookMs[0] = System.currentTimeMillis() - t0;
            returned.countDown();
        });
        Thread.sleep(10);
        selfClosing.touch("other", other);

        assertTrue(returned.await(2, TimeUnit.SECONDS), "close from the worker thread did not return");
        assertTrue(tookMs[0] < 1_000, "close from the worker thread took " + tookMs[0] + " ms");
        assertTrue(selfClosing.isClosed());
        assertTrue(other.awaitClosed(2_000), "pending resource not closed on shutdown");
        assertEquals(1, other.closes.get());
    }
}
