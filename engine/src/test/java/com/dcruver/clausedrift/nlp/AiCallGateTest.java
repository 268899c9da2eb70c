package com.dcruver.clausedrift.nlp;

import com.dcruver.clausedrift.StubDriftAssistant;
import com.dcruver.clausedrift.config.DriftProperties;
import com.dcruver.clausedrift.domain.ChangeKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AiCallGateTest {

    private AiCallGate gate;

    @AfterEach
    void tearDown() {
        if (gate != null) {
            gate.shutdown();
        }
    }

    @Test
    void testSuccessfulCallPassesThrough() {
        gate = gate(1, 1000);

        assertEquals(Optional.of("summary"), gate.call("summary", () -> Optional.of("summary")));
    }

    @Test
    void testFailureBecomesEmpty() {
        gate = gate(1, 1000);

        Optional<String> result = gate.call("summary", () -> {
            throw new IllegalStateException("connection refused");
        });

        assertTrue(result.isEmpty());
    }

    @Test
    void testTimeoutBecomesEmpty() {
        gate = gate(1, 100);

        long start = System.nanoTime();
        Optional<String> result = gate.call("explanation", () -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Optional.of("too late");
        });
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(result.isEmpty());
        assertTrue(elapsedMs < 4000, "took " + elapsedMs + "ms");
    }

    @Test
    void testCallsAreSpacedByMinimumIntervalAfterIdle() throws Exception {
        gate = gate(300, 1000);
        Thread.sleep(600);

        List<Long> starts = new ArrayList<>();
        long before = System.nanoTime();
        for (int i = 0; i < 3; i++) {
            gate.call("similarity", () -> {
                starts.add(System.nanoTime());
                return Optional.of(0.5);
            });
        }

        // first call after idle goes straight through
        assertTrue(millis(starts.get(0) - before) < 300, "first call waited");
        for (int i = 1; i < starts.size(); i++) {
            long gap = millis(starts.get(i) - starts.get(i - 1));
            // small allowance for hand-off to the worker thread
            assertTrue(gap >= 290, "gap " + i + " was " + gap + "ms");
        }
    }

    @Test
    void testIdleTimeDoesNotBankCalls() throws Exception {
        gate = gate(400, 1000);
        gate.call("similarity", () -> Optional.of(0.1));
        Thread.sleep(1500);

        List<Long> starts = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            gate.call("similarity", () -> {
                starts.add(System.nanoTime());
                return Optional.of(0.5);
            });
        }

        assertTrue(millis(starts.get(1) - starts.get(0)) >= 390);
        assertTrue(millis(starts.get(2) - starts.get(1)) >= 390);
    }

    @Test
    void testTimedOutCallIsInterruptedBeforeNextCall() {
        gate = gate(1, 100);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        AtomicInteger interrupted = new AtomicInteger();

        for (int i = 0; i < 2; i++) {
            Optional<String> result = gate.call("summary", () -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(600);
                    return Optional.of("late");
                } catch (InterruptedException e) {
                    interrupted.incrementAndGet();
                    return Optional.empty();
                } finally {
                    running.decrementAndGet();
                }
            });
            assertTrue(result.isEmpty());
        }

        assertEquals(1, maxRunning.get());
        assertTrue(interrupted.get() >= 1);
    }

    @Test
    void testGatedAssistantDelegatesThroughGate() {
        gate = gate(1, 1000);
        StubDriftAssistant delegate = new StubDriftAssistant();
        delegate.summary = "Fee halved.";
        DriftAssistant assistant = new GatedDriftAssistant(delegate, gate);

        assertEquals(Optional.of("Fee halved."), assistant.summarize("a", "b", ChangeKind.MODIFIED));
        assertTrue(assistant.similarity("a", "b").isEmpty());

        delegate.failing = true;
        assertTrue(assistant.explain("text", "payment", "").isEmpty());
        assertEquals(3, delegate.calls.get());
    }

    private static long millis(long nanos) {
        return TimeUnit.NANOSECONDS.toMillis(nanos);
    }

    private static AiCallGate gate(long minIntervalMs, long timeoutMs) {
        DriftProperties properties = new DriftProperties();
        properties.getAi().setMinIntervalMs(minIntervalMs);
        properties.getAi().setTimeoutMs(timeoutMs);
        return new AiCallGate(properties);
    }
}
