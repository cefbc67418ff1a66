package com.p14n.subsync.sequencer;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import io.opentelemetry.api.OpenTelemetry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class SequencerTest {

    private Sequencer sequencer;

    @BeforeEach
    void setUp() {
        sequencer = new Sequencer("test", OpenTelemetry.noop());
    }

    @AfterEach
    void tearDown() {
        try {
            sequencer.shutdown(Duration.ofSeconds(1));
        } catch (SequencerTimeoutException e) {
            // a test left stalled work behind
        }
    }

    @Test
    void shouldRunItemsInSubmissionOrder() {
        List<Integer> seen = new CopyOnWriteArrayList<>();
        for (int i = 0; i < 100; i++) {
            int n = i;
            assertTrue(sequencer.submit("item " + n, () -> seen.add(n)));
        }

        sequencer.shutdown(Duration.ofSeconds(5));

        assertEquals(IntStream.range(0, 100).boxed().collect(Collectors.toList()), seen);
    }

    @Test
    void shouldContinueAfterFailingItem() {
        List<String> seen = new CopyOnWriteArrayList<>();
        sequencer.submit("first", () -> seen.add("first"));
        sequencer.submit("failing", () -> {
            throw new IllegalStateException("boom");
        });
        sequencer.submit("last", () -> seen.add("last"));

        sequencer.shutdown(Duration.ofSeconds(5));

        assertEquals(List.of("first", "last"), seen);
    }

    @Test
    void shouldNeverRunTwoItemsAtOnce() throws InterruptedException {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger overlaps = new AtomicInteger();
        CountDownLatch producers = new CountDownLatch(4);

        for (int t = 0; t < 4; t++) {
            new Thread(() -> {
                for (int i = 0; i < 50; i++) {
                    sequencer.submit("concurrent", () -> {
                        if (active.incrementAndGet() > 1) {
                            overlaps.incrementAndGet();
                        }
                        Thread.yield();
                        active.decrementAndGet();
                    });
                }
                producers.countDown();
            }).start();
        }
        assertTrue(producers.await(5, TimeUnit.SECONDS));

        sequencer.shutdown(Duration.ofSeconds(5));

        assertEquals(0, overlaps.get());
    }

    @Test
    void shouldAbandonAndReportWorkStalledPastTimeout() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        AtomicInteger ranAfterStall = new AtomicInteger();

        sequencer.submit("stalled", () -> {
            started.countDown();
            try {
                never.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        sequencer.submit("queued-1", ranAfterStall::incrementAndGet);
        sequencer.submit("queued-2", ranAfterStall::incrementAndGet);
        assertTrue(started.await(2, TimeUnit.SECONDS));
        assertEquals(2, sequencer.pending());

        long begin = System.nanoTime();
        var e = assertThrows(SequencerTimeoutException.class, () -> sequencer.shutdown(Duration.ofMillis(200)));
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

        assertTrue(elapsed < 2000, "shutdown took " + elapsed + "ms");
        assertEquals(List.of("stalled", "queued-1", "queued-2"), e.abandoned());
        assertEquals(0, ranAfterStall.get());
    }

    @RepeatedTest(25)
    void shouldAccountForEveryItemWhenTimeoutRacesCompletion(RepetitionInfo repetition) {
        List<String> started = new CopyOnWriteArrayList<>();
        long runFor = 80 + (repetition.getCurrentRepetition() % 5) * 10;

        sequencer.submit("slow", () -> {
            started.add("slow");
            try {
                Thread.sleep(runFor);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        for (int i = 1; i <= 3; i++) {
            String description = "next-" + i;
            sequencer.submit(description, () -> started.add(description));
        }

        List<String> abandoned;
        try {
            sequencer.shutdown(Duration.ofMillis(100));
            abandoned = List.of();
        } catch (SequencerTimeoutException e) {
            abandoned = e.abandoned();
        }

        List<String> all = List.of("slow", "next-1", "next-2", "next-3");
        if (abandoned.isEmpty()) {
            assertEquals(all, started);
        } else {
            // the abandoned items are the tail, sharing at most the interrupted item with what started
            int firstAbandoned = all.indexOf(abandoned.get(0));
            assertEquals(all.subList(firstAbandoned, all.size()), abandoned);
            assertTrue(started.size() == firstAbandoned || started.size() == firstAbandoned + 1,
                    "started " + started + " abandoned " + abandoned);
            assertEquals(all.subList(0, started.size()), started);
        }
    }

    @Test
    void shouldContinueAfterItemThrowsError() {
        List<String> seen = new CopyOnWriteArrayList<>();
        sequencer.submit("erroring", () -> {
            throw new AssertionError("broken invariant");
        });
        sequencer.submit("after", () -> seen.add("after"));

        sequencer.shutdown(Duration.ofSeconds(5));

        assertEquals(List.of("after"), seen);
    }

    @Test
    void shouldRejectWorkAfterShutdown() {
        sequencer.shutdown(Duration.ofSeconds(1));

        assertTrue(sequencer.isShutdown());
        assertFalse(sequencer.submit("late", () -> fail("should not run")));
    }

    @Test
    void shouldIgnoreSecondShutdown() {
        sequencer.shutdown(Duration.ofSeconds(1));
        assertDoesNotThrow(() -> sequencer.shutdown(Duration.ZERO));
    }

    @Test
    void shouldRejectNullWork() {
        assertThrows(IllegalArgumentException.class, () -> sequencer.submit("null", null));
    }
}
