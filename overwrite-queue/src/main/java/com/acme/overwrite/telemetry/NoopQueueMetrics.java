package com.acme.overwrite.telemetry;

public final class NoopQueueMetrics implements QueueMetrics {
    public static final NoopQueueMetrics INSTANCE = new NoopQueueMetrics();

    private NoopQueueMetrics() {
    }

    @Override
    public void incPushed(long n) {
    }

    @Override
    public void incOverwritten(long n) {
    }

    @Override
    public void incPopped(long n) {
    }

    @Override
    public void incTimeouts(long n) {
    }

    @Override
    public void observeWaitNanos(long nanos) {
    }

    @Override
    public void setDepth(int depth) {
    }
}
