package com.acme.overwrite.demo;

import com.acme.overwrite.queue.OverwriteRing;
import com.acme.overwrite.queue.PopResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * One writer and one reader sharing a queue.
 *
 * <p>The writer pushes {@code 1..pushCount}, sleeping between pushes. The
 * reader sleeps before every retrieval, performs {@code blockingPops}
 * blocking pops and finishes with one timed pop. With the default timings
 * the reader falls behind and the writer overwrites unread values.</p>
 */
public final class DemoScenario {
    private static final Logger LOG = Logger.getLogger(DemoScenario.class.getName());
    private static final Duration READER_GRACE = Duration.ofSeconds(1);

    private final OverwriteRing<Integer> queue;
    private final DemoConfig config;

    public DemoScenario(OverwriteRing<Integer> queue, DemoConfig config) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Runs writer and reader to completion and returns the reader's
     * retrievals in order.
     *
     * @throws IllegalStateException if the reader is still blocked after the
     *         writer finished and its own delays and timeout have elapsed,
     *         i.e. overwrites left fewer values than blocking pops
     */
    public List<Outcome> run() throws InterruptedException, ExecutionException {
        AtomicInteger threadIds = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "overwrite-demo-" + threadIds.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        try {
            Future<?> writer = pool.submit(() -> {
                writeLoop();
                return null;
            });
            Future<List<Outcome>> reader = pool.submit(this::readLoop);
            writer.get();
            long budgetMillis = readerBudget().toMillis();
            try {
                return reader.get(budgetMillis, TimeUnit.MILLISECONDS);
            } catch (TimeoutException starved) {
                reader.cancel(true);
                LOG.warning("reader still blocked " + budgetMillis + "ms after writer finished"
                    + " depth=" + queue.count());
                throw new IllegalStateException("reader starved: fewer values left than blocking pops", starved);
            }
        } finally {
            pool.shutdownNow();
            pool.awaitTermination(1, TimeUnit.SECONDS);
        }
    }

    // time the reader may still need once no more pushes can arrive
    Duration readerBudget() {
        return config.readerDelay()
            .multipliedBy(config.blockingPops() + 1L)
            .plus(config.popTimeout())
            .plus(READER_GRACE);
    }

    private void writeLoop() throws InterruptedException {
        for (int i = 1; i <= config.pushCount(); i++) {
            if (i > 1) {
                sleep(config.pushInterval());
            }
            queue.push(i);
            LOG.fine("push " + i + " depth=" + queue.count());
        }
    }

    private List<Outcome> readLoop() throws InterruptedException {
        List<Outcome> outcomes = new ArrayList<>(config.blockingPops() + 1);
        for (int i = 0; i < config.blockingPops(); i++) {
            sleep(config.readerDelay());
            Integer value = queue.pop();
            outcomes.add(new Outcome("pop", new PopResult.Item<>(value)));
        }
        sleep(config.readerDelay());
        outcomes.add(new Outcome("popWithTimeout", queue.popWithTimeout(config.popTimeout())));
        return List.copyOf(outcomes);
    }

    private static void sleep(Duration d) throws InterruptedException {
        if (!d.isZero()) {
            Thread.sleep(d.toMillis());
        }
    }

    public record Outcome(String operation, PopResult<Integer> result) {

        public String describe() {
            if (result instanceof PopResult.Item<Integer> item) {
                return operation + "() -> " + item.value();
            }
            return operation + "() -> Timeout: no elements in queue";
        }
    }
}
