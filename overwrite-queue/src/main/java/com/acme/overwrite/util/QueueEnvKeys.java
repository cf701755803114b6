package com.acme.overwrite.util;

/**
 * Canonical environment variable names read by the demo runtime.
 */
public final class QueueEnvKeys {
    public static final String OVERWRITE_QUEUE_CAPACITY = "OVERWRITE_QUEUE_CAPACITY";

    public static final String OVERWRITE_DEMO_PUSH_COUNT = "OVERWRITE_DEMO_PUSH_COUNT";
    public static final String OVERWRITE_DEMO_PUSH_INTERVAL_MS = "OVERWRITE_DEMO_PUSH_INTERVAL_MS";
    public static final String OVERWRITE_DEMO_READER_DELAY_MS = "OVERWRITE_DEMO_READER_DELAY_MS";
    public static final String OVERWRITE_DEMO_BLOCKING_POPS = "OVERWRITE_DEMO_BLOCKING_POPS";
    public static final String OVERWRITE_DEMO_POP_TIMEOUT_MS = "OVERWRITE_DEMO_POP_TIMEOUT_MS";

    public static final String OVERWRITE_METRICS_ENABLED = "OVERWRITE_METRICS_ENABLED";
    public static final String OVERWRITE_METRICS_LOG_INTERVAL_SEC = "OVERWRITE_METRICS_LOG_INTERVAL_SEC";

    private QueueEnvKeys() {
    }
}
