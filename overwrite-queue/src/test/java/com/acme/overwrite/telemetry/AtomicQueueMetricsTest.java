package com.acme.overwrite.telemetry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AtomicQueueMetricsTest {

    @Test
    void waitStatsShouldBeZeroBeforeFirstPop() {
        AtomicQueueMetrics metrics = new AtomicQueueMetrics();
        assertEquals(0L, metrics.meanWaitNanos());
        assertEquals(0L, metrics.snapshot().waitMaxNanos());
    }

    @Test
    void shouldTrackMeanAndLongestWait() {
        AtomicQueueMetrics metrics = new AtomicQueueMetrics();
        metrics.observeWaitNanos(1_000L);
        metrics.observeWaitNanos(9_000L);
        metrics.observeWaitNanos(2_000L);

        assertEquals(4_000L, metrics.meanWaitNanos());
        AtomicQueueMetrics.Snapshot s = metrics.snapshot();
        assertEquals(9_000L, s.waitMaxNanos());
        assertEquals(12_000L, s.waitNanosTotal());
        assertEquals(3L, s.waitSamples());
    }

    @Test
    void shouldIgnoreNegativeInputs() {
        AtomicQueueMetrics metrics = new AtomicQueueMetrics();
        metrics.incPushed(-3);
        metrics.incPopped(-1);
        metrics.observeWaitNanos(-10);
        metrics.setDepth(-4);

        AtomicQueueMetrics.Snapshot s = metrics.snapshot();
        assertEquals(0L, s.pushed());
        assertEquals(0L, s.popped());
        assertEquals(0L, s.waitSamples());
        assertEquals(0, s.depth());
    }

    @Test
    void snapshotShouldReflectCounters() {
        AtomicQueueMetrics metrics = new AtomicQueueMetrics();
        metrics.incPushed(5);
        metrics.incOverwritten(2);
        metrics.incPopped(3);
        metrics.incTimeouts(1);
        metrics.observeWaitNanos(2_000L);
        metrics.setDepth(2);

        AtomicQueueMetrics.Snapshot s = metrics.snapshot();
        assertEquals(5L, s.pushed());
        assertEquals(2L, s.overwritten());
        assertEquals(3L, s.popped());
        assertEquals(1L, s.timeouts());
        assertEquals(2, s.depth());
        assertEquals(2_000L, s.waitNanosTotal());
        assertEquals(1L, s.waitSamples());
        assertEquals(2_000L, s.waitMaxNanos());
    }
}
