package com.acme.overwrite.telemetry;

public interface QueueMetrics {
    void incPushed(long n);
    void incOverwritten(long n);
    void incPopped(long n);
    void incTimeouts(long n);
    void observeWaitNanos(long nanos);

    /**
     * Called with the queue lock held, so the last value set matches the
     * queue's count once activity stops. Must not block.
     */
    void setDepth(int depth);
}
