package com.acme.overwrite.telemetry;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicQueueMetrics implements QueueMetrics {
    private final LongAdder pushed = new LongAdder();
    private final LongAdder overwritten = new LongAdder();
    private final LongAdder popped = new LongAdder();
    private final LongAdder timeouts = new LongAdder();
    private final LongAdder waitNanos = new LongAdder();
    private final LongAdder waitSamples = new LongAdder();
    // longest single pop wait since creation; shows consumers parked on an empty queue
    private final LongAccumulator maxWaitNanos = new LongAccumulator(Math::max, 0L);
    private final AtomicInteger depth = new AtomicInteger();

    @Override
    public void incPushed(long n) {
        pushed.add(Math.max(0L, n));
    }

    @Override
    public void incOverwritten(long n) {
        overwritten.add(Math.max(0L, n));
    }

    @Override
    public void incPopped(long n) {
        popped.add(Math.max(0L, n));
    }

    @Override
    public void incTimeouts(long n) {
        timeouts.add(Math.max(0L, n));
    }

    @Override
    public void observeWaitNanos(long nanos) {
        if (nanos < 0) return;
        waitNanos.add(nanos);
        waitSamples.increment();
        maxWaitNanos.accumulate(nanos);
    }

    /**
     * Mean pop wait, or 0 before the first pop.
     */
    public long meanWaitNanos() {
        long samples = waitSamples.sum();
        return samples == 0 ? 0L : waitNanos.sum() / samples;
    }

    @Override
    public void setDepth(int depth) {
        this.depth.set(Math.max(0, depth));
    }

    public Snapshot snapshot() {
        return new Snapshot(
            pushed.sum(),
            overwritten.sum(),
            popped.sum(),
            timeouts.sum(),
            depth.get(),
            waitNanos.sum(),
            waitSamples.sum(),
            maxWaitNanos.get()
        );
    }

    public record Snapshot(long pushed,
                           long overwritten,
                           long popped,
                           long timeouts,
                           int depth,
                           long waitNanosTotal,
                           long waitSamples,
                           long waitMaxNanos) {}
}
