package com.acme.overwrite.demo;

import com.acme.overwrite.queue.OverwriteQueue;
import com.acme.overwrite.queue.QueueSnapshot;
import com.acme.overwrite.telemetry.AtomicQueueMetrics;
import com.acme.overwrite.telemetry.PeriodicMetricsReporter;

import java.util.List;
import java.util.logging.Logger;

public final class OverwriteQueueDemoMain {
    private static final Logger LOG = Logger.getLogger(OverwriteQueueDemoMain.class.getName());

    private OverwriteQueueDemoMain() {
    }

    public static void main(String[] args) throws Exception {
        DemoConfig config = DemoConfig.fromEnv();
        LOG.info("Starting overwrite queue demo capacity=" + config.capacity()
            + " pushCount=" + config.pushCount()
            + " pushIntervalMs=" + config.pushInterval().toMillis()
            + " readerDelayMs=" + config.readerDelay().toMillis()
            + " popTimeoutMs=" + config.popTimeout().toMillis());

        AtomicQueueMetrics metrics = new AtomicQueueMetrics();
        OverwriteQueue<Integer> queue = new OverwriteQueue<>(config.capacity(), metrics);
        PeriodicMetricsReporter reporter = config.metricsEnabled()
            ? new PeriodicMetricsReporter(metrics, "overwrite-queue-demo", config.metricsLogIntervalSec())
            : null;
        try {
            if (reporter != null) {
                reporter.start();
            }
            List<DemoScenario.Outcome> outcomes = new DemoScenario(queue, config).run();
            for (DemoScenario.Outcome outcome : outcomes) {
                LOG.info(outcome.describe());
            }
            QueueSnapshot snapshot = queue.snapshot();
            LOG.info("Demo finished depth=" + snapshot.depth()
                + " pushed=" + snapshot.pushedTotal()
                + " popped=" + snapshot.poppedTotal()
                + " overwritten=" + snapshot.overwrittenTotal());
        } finally {
            if (reporter != null) {
                reporter.close();
            }
        }
    }
}
