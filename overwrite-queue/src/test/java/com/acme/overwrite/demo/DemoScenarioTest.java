package com.acme.overwrite.demo;

import com.acme.overwrite.queue.OverwriteQueue;
import com.acme.overwrite.queue.PopResult;
import com.acme.overwrite.queue.QueueSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DemoScenarioTest {

    @Test
    void lateReaderShouldSeeOnlyNewestValuesThenTimeOut() throws Exception {
        // writer finishes long before the reader wakes, so only 4 and 5 survive
        DemoConfig config = new DemoConfig(2, 5, Duration.ZERO, Duration.ofMillis(200),
            2, Duration.ofMillis(50), false, 10);
        OverwriteQueue<Integer> queue = new OverwriteQueue<>(config.capacity());

        List<DemoScenario.Outcome> outcomes = new DemoScenario(queue, config).run();

        assertEquals(3, outcomes.size());
        assertEquals(4, outcomes.get(0).result().valueOrThrow());
        assertEquals(5, outcomes.get(1).result().valueOrThrow());
        assertInstanceOf(PopResult.TimedOut.class, outcomes.get(2).result());
        assertEquals("pop() -> 4", outcomes.get(0).describe());
        assertEquals("popWithTimeout() -> Timeout: no elements in queue", outcomes.get(2).describe());

        QueueSnapshot s = queue.snapshot();
        assertEquals(5L, s.pushedTotal());
        assertEquals(2L, s.poppedTotal());
        assertEquals(3L, s.overwrittenTotal());
        assertEquals(0, s.depth());
    }

    @Test
    void blockedReaderShouldReceiveEveryValueWhenItKeepsUp() throws Exception {
        DemoConfig config = new DemoConfig(2, 3, Duration.ofMillis(30), Duration.ZERO,
            3, Duration.ZERO, false, 10);
        OverwriteQueue<Integer> queue = new OverwriteQueue<>(config.capacity());

        List<DemoScenario.Outcome> outcomes = new DemoScenario(queue, config).run();

        assertEquals(4, outcomes.size());
        assertEquals(1, outcomes.get(0).result().valueOrThrow());
        assertEquals(2, outcomes.get(1).result().valueOrThrow());
        assertEquals(3, outcomes.get(2).result().valueOrThrow());
        assertEquals("popWithTimeout", outcomes.get(3).operation());
        assertInstanceOf(PopResult.TimedOut.class, outcomes.get(3).result());
    }

    @Test
    void shouldFailInsteadOfHangingWhenOverwritesStarveReader() {
        // five instant pushes into two slots leave two values for three blocking pops
        DemoConfig config = new DemoConfig(2, 5, Duration.ZERO, Duration.ofMillis(50),
            3, Duration.ZERO, false, 10);
        OverwriteQueue<Integer> queue = new OverwriteQueue<>(config.capacity());
        DemoScenario scenario = new DemoScenario(queue, config);

        IllegalStateException starved = assertTimeoutPreemptively(Duration.ofSeconds(5),
            () -> assertThrows(IllegalStateException.class, scenario::run));
        assertTrue(starved.getMessage().contains("starved"));
        assertEquals(0, queue.count());
    }

    @Test
    void emptyRunShouldEndWithSingleTimedPop() throws Exception {
        DemoConfig config = new DemoConfig(2, 0, Duration.ZERO, Duration.ZERO,
            0, Duration.ofMillis(20), false, 10);

        List<DemoScenario.Outcome> outcomes = assertTimeoutPreemptively(Duration.ofSeconds(5),
            () -> new DemoScenario(new OverwriteQueue<>(config.capacity()), config).run());

        assertEquals(1, outcomes.size());
        assertInstanceOf(PopResult.TimedOut.class, outcomes.get(0).result());
    }

    @Test
    void readerBudgetShouldCoverDelaysAndTimeout() {
        DemoConfig config = new DemoConfig(2, 5, Duration.ofMillis(100), Duration.ofMillis(150),
            2, Duration.ofMillis(200), false, 10);
        DemoScenario scenario = new DemoScenario(new OverwriteQueue<>(2), config);

        assertEquals(Duration.ofMillis(3 * 150 + 200 + 1000), scenario.readerBudget());
    }
}
