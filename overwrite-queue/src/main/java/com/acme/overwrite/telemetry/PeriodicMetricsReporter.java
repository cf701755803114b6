package com.acme.overwrite.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs a JSON line with the queue counters at a fixed interval.
 */
public final class PeriodicMetricsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicMetricsReporter.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AtomicQueueMetrics metrics;
    private final String queueName;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicMetricsReporter(AtomicQueueMetrics metrics, String queueName, long intervalSeconds) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.queueName = queueName == null || queueName.isBlank() ? "overwrite-queue" : queueName;
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "overwrite-queue-metrics-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    String render() {
        AtomicQueueMetrics.Snapshot s = metrics.snapshot();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", queueName);
        payload.put("type", "queue_metrics");
        payload.put("pushed", s.pushed());
        payload.put("overwritten", s.overwritten());
        payload.put("popped", s.popped());
        payload.put("timeouts", s.timeouts());
        payload.put("depth", s.depth());
        payload.put("waitNanosTotal", s.waitNanosTotal());
        payload.put("waitSamples", s.waitSamples());
        payload.put("waitMeanNanos", metrics.meanWaitNanos());
        payload.put("waitMaxNanos", s.waitMaxNanos());
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            LOG.log(Level.FINE, "JSON rendering failed, falling back to toString", e);
            return payload.toString();
        }
    }

    private void emit() {
        try {
            LOG.info(render());
        } catch (Throwable t) {
            LOG.log(Level.WARNING, "Metrics reporter failure", t);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
