package com.acme.overwrite.demo;

import com.acme.overwrite.util.EnvVars;
import com.acme.overwrite.util.QueueDefaults;
import com.acme.overwrite.util.QueueEnvKeys;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

public record DemoConfig(
    int capacity,
    int pushCount,
    Duration pushInterval,
    Duration readerDelay,
    int blockingPops,
    Duration popTimeout,
    boolean metricsEnabled,
    int metricsLogIntervalSec
) {

    public DemoConfig {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        if (pushCount < 0 || blockingPops < 0) {
            throw new IllegalArgumentException("pushCount and blockingPops must be non-negative");
        }
        if (blockingPops > pushCount) {
            // the reader would wait forever for a value nobody pushes
            throw new IllegalArgumentException("blockingPops " + blockingPops
                + " exceeds pushCount " + pushCount);
        }
        Objects.requireNonNull(pushInterval, "pushInterval");
        Objects.requireNonNull(readerDelay, "readerDelay");
        Objects.requireNonNull(popTimeout, "popTimeout");
    }

    public static DemoConfig defaults() {
        return fromEnv(Map.of());
    }

    public static DemoConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static DemoConfig fromEnv(Map<String, String> env) {
        return new DemoConfig(
            EnvVars.getIntClamped(env, QueueEnvKeys.OVERWRITE_QUEUE_CAPACITY,
                QueueDefaults.DEFAULT_QUEUE_CAPACITY, 1, QueueDefaults.MAX_QUEUE_CAPACITY),
            EnvVars.getIntClamped(env, QueueEnvKeys.OVERWRITE_DEMO_PUSH_COUNT,
                QueueDefaults.DEFAULT_DEMO_PUSH_COUNT, 0, QueueDefaults.MAX_DEMO_OPERATIONS),
            millis(env, QueueEnvKeys.OVERWRITE_DEMO_PUSH_INTERVAL_MS, QueueDefaults.DEFAULT_DEMO_PUSH_INTERVAL_MS),
            millis(env, QueueEnvKeys.OVERWRITE_DEMO_READER_DELAY_MS, QueueDefaults.DEFAULT_DEMO_READER_DELAY_MS),
            EnvVars.getIntClamped(env, QueueEnvKeys.OVERWRITE_DEMO_BLOCKING_POPS,
                QueueDefaults.DEFAULT_DEMO_BLOCKING_POPS, 0, QueueDefaults.MAX_DEMO_OPERATIONS),
            millis(env, QueueEnvKeys.OVERWRITE_DEMO_POP_TIMEOUT_MS, QueueDefaults.DEFAULT_DEMO_POP_TIMEOUT_MS),
            EnvVars.getBoolean(env, QueueEnvKeys.OVERWRITE_METRICS_ENABLED, false),
            EnvVars.getIntClamped(env, QueueEnvKeys.OVERWRITE_METRICS_LOG_INTERVAL_SEC,
                QueueDefaults.DEFAULT_METRICS_LOG_INTERVAL_SEC, 1, QueueDefaults.MAX_METRICS_LOG_INTERVAL_SEC)
        );
    }

    private static Duration millis(Map<String, String> env, String key, long defaultMillis) {
        return Duration.ofMillis(EnvVars.getLongClamped(env, key, defaultMillis, 0L, QueueDefaults.MAX_DEMO_DELAY_MS));
    }
}
