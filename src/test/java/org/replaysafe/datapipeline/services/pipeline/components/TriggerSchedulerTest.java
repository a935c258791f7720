package org.replaysafe.datapipeline.services.pipeline.components;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.replaysafe.datapipeline.api.resources.log.LogRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TriggerSchedulerTest {

    /** Manual clock; sleeping advances it. */
    private static final class FakeClock {
        long now = 1_000_000_000L;
        final List<Long> sleeps = new ArrayList<>();

        long nanoTime() {
            return now;
        }

        void sleep(long nanos) {
            sleeps.add(nanos);
            now += nanos;
        }

        void advanceMs(long ms) {
            now += TimeUnit.MILLISECONDS.toNanos(ms);
        }
    }

    private static List<LogRecord> records(int partition, int count) {
        List<LogRecord> list = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            list.add(new LogRecord(partition, i, "{}"));
        }
        return list;
    }

    @Test
    void firstTrigger_waitsOneInterval() throws Exception {
        FakeClock clock = new FakeClock();
        TriggerScheduler scheduler = new TriggerScheduler(100, 10, clock::nanoTime, clock::sleep);

        scheduler.awaitNextTrigger();

        assertThat(clock.sleeps).containsExactly(TimeUnit.MILLISECONDS.toNanos(100));
        assertThat(scheduler.getState()).isEqualTo(TriggerScheduler.State.ACCUMULATING);
    }

    @Test
    void boundariesFollowFixedGrid_whenDispatchIsShort() throws Exception {
        FakeClock clock = new FakeClock();
        TriggerScheduler scheduler = new TriggerScheduler(100, 10, clock::nanoTime, clock::sleep);

        scheduler.awaitNextTrigger();
        clock.advanceMs(30);
        scheduler.awaitNextTrigger();

        assertThat(clock.sleeps).containsExactly(
            TimeUnit.MILLISECONDS.toNanos(100),
            TimeUnit.MILLISECONDS.toNanos(70));
        assertThat(scheduler.getSkippedBoundaryCount()).isZero();
    }

    @Test
    void overrunningDispatch_firesImmediatelyAndSkipsMissedBoundaries() throws Exception {
        FakeClock clock = new FakeClock();
        TriggerScheduler scheduler = new TriggerScheduler(100, 10, clock::nanoTime, clock::sleep);

        scheduler.awaitNextTrigger();
        clock.advanceMs(350);
        scheduler.awaitNextTrigger();

        assertThat(clock.sleeps).hasSize(1);
        assertThat(scheduler.getSkippedBoundaryCount()).isEqualTo(2);

        // back on the grid: the next boundary is the one after the current time
        scheduler.awaitNextTrigger();
        assertThat(clock.sleeps).hasSize(2);
        assertThat(clock.sleeps.get(1)).isEqualTo(TimeUnit.MILLISECONDS.toNanos(50));
    }

    @Test
    void emptyWindow_isIdleTrigger() {
        TriggerScheduler scheduler = new TriggerScheduler(100, 10);

        List<List<LogRecord>> chunks = scheduler.cut(List.of());

        assertThat(chunks).isEmpty();
        assertThat(scheduler.getTriggerCount()).isEqualTo(1);
        assertThat(scheduler.getIdleTriggerCount()).isEqualTo(1);
        assertThat(scheduler.getState()).isEqualTo(TriggerScheduler.State.IDLE);
    }

    @Test
    void largeWindow_isCutIntoOrderedChunks() {
        TriggerScheduler scheduler = new TriggerScheduler(100, 4);
        List<LogRecord> window = new ArrayList<>(records(1, 3));
        window.addAll(records(0, 3));

        List<List<LogRecord>> chunks = scheduler.cut(window);

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0)).extracting(LogRecord::partition).containsExactly(0, 0, 0, 1);
        assertThat(chunks.get(0)).extracting(LogRecord::offset).containsExactly(0L, 1L, 2L, 0L);
        assertThat(chunks.get(1)).extracting(LogRecord::offset).containsExactly(1L, 2L);
        assertThat(scheduler.getDispatchCount()).isEqualTo(2);
        assertThat(scheduler.getState()).isEqualTo(TriggerScheduler.State.DISPATCHING);

        scheduler.dispatchComplete();
        assertThat(scheduler.getState()).isEqualTo(TriggerScheduler.State.IDLE);
    }

    @Test
    void reset_startsFreshInterval() throws Exception {
        FakeClock clock = new FakeClock();
        TriggerScheduler scheduler = new TriggerScheduler(100, 10, clock::nanoTime, clock::sleep);
        scheduler.awaitNextTrigger();
        clock.advanceMs(1000);

        scheduler.reset();
        scheduler.awaitNextTrigger();

        assertThat(clock.sleeps).containsExactly(
            TimeUnit.MILLISECONDS.toNanos(100),
            TimeUnit.MILLISECONDS.toNanos(100));
        assertThat(scheduler.getSkippedBoundaryCount()).isZero();
    }

    @Test
    void interruptedWait_returnsToIdle() {
        TriggerScheduler scheduler = new TriggerScheduler(100, 10, () -> 0L, nanos -> {
            throw new InterruptedException("stop");
        });

        assertThatThrownBy(scheduler::awaitNextTrigger).isInstanceOf(InterruptedException.class);
        assertThat(scheduler.getState()).isEqualTo(TriggerScheduler.State.IDLE);
    }

    @Test
    void invalidSettings_areRejected() {
        assertThatThrownBy(() -> new TriggerScheduler(0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TriggerScheduler(100, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
