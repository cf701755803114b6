package com.acme.overwrite.util;

/**
 * Defaults used when the corresponding environment variable is not set.
 */
public final class QueueDefaults {

    // ---- Queue ----
    public static final int DEFAULT_QUEUE_CAPACITY = 2;
    public static final int MAX_QUEUE_CAPACITY = 1 << 24;

    // ---- Demo ----
    public static final int DEFAULT_DEMO_PUSH_COUNT = 5;
    public static final long DEFAULT_DEMO_PUSH_INTERVAL_MS = 100L;
    public static final long DEFAULT_DEMO_READER_DELAY_MS = 150L;
    public static final int DEFAULT_DEMO_BLOCKING_POPS = 2;
    public static final long DEFAULT_DEMO_POP_TIMEOUT_MS = 200L;
    public static final int MAX_DEMO_OPERATIONS = 1_000_000;
    public static final long MAX_DEMO_DELAY_MS = 60_000L;

    // ---- Metrics ----
    public static final int DEFAULT_METRICS_LOG_INTERVAL_SEC = 10;
    public static final int MAX_METRICS_LOG_INTERVAL_SEC = 3600;

    private QueueDefaults() {
    }
}
