package com.heronix.directory.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.heronix.directory.exception.DirectoryException;
import com.heronix.directory.model.domain.Region;
import com.heronix.directory.model.enums.ErrorKind;
import com.heronix.directory.service.RegionFanout.RegionOutcome;

class RegionFanoutTest {

    private static final Region EAST = Region.of("us-east-1");
    private static final Region WEST = Region.of("us-west-2");
    private static final Region EU = Region.of("eu-west-2");

    private RegionFanout fanout;

    @AfterEach
    void tearDown() {
        fanout.shutdown();
    }

    private static <T> Map<Region, RegionOutcome<T>> drain(RegionFanout.Dispatch<T> dispatch) {
        Map<Region, RegionOutcome<T>> outcomes = new HashMap<>();
        RegionOutcome<T> outcome;
        while ((outcome = dispatch.next()) != null) {
            outcomes.put(outcome.region(), outcome);
        }
        return outcomes;
    }

    private static String sleepFor(Duration duration, CountDownLatch interrupted) {
        try {
            Thread.sleep(duration.toMillis());
            return "late";
        } catch (InterruptedException e) {
            interrupted.countDown();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        }
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void reportsValueOrFailureOncePerRegion() {
        fanout = new RegionFanout(4, 3, Duration.ofSeconds(2));

        try (RegionFanout.Dispatch<String> dispatch = fanout.dispatch(List.of(EAST, WEST), region -> {
            if (region.equals(WEST)) {
                throw new IllegalStateException("west is down");
            }
            return "ok:" + region;
        })) {
            Map<Region, RegionOutcome<String>> outcomes = drain(dispatch);

            assertThat(outcomes).hasSize(2);
            assertThat(outcomes.get(EAST).isSuccess()).isTrue();
            assertThat(outcomes.get(EAST).value()).isEqualTo("ok:us-east-1");
            assertThat(outcomes.get(WEST).isSuccess()).isFalse();
            assertThat(outcomes.get(WEST).failure()).isInstanceOf(IllegalStateException.class).hasMessage("west is down");
            assertThat(dispatch.next()).isNull();
        }
    }

    @Test
    void reportsRegionsInCompletionOrder() {
        fanout = new RegionFanout(4, 3, Duration.ofSeconds(5));

        try (RegionFanout.Dispatch<String> dispatch = fanout.dispatch(List.of(EAST, WEST), region -> {
            if (region.equals(EAST)) {
                sleepQuietly(400);
            }
            return region.code();
        })) {
            assertThat(dispatch.next().region()).isEqualTo(WEST);
            assertThat(dispatch.next().region()).isEqualTo(EAST);
        }
    }

    @Test
    void slowRegionTimesOutAndIsInterrupted() throws Exception {
        fanout = new RegionFanout(2, 2, Duration.ofMillis(100));
        CountDownLatch interrupted = new CountDownLatch(1);

        try (RegionFanout.Dispatch<String> dispatch =
                     fanout.dispatch(List.of(EAST), region -> sleepFor(Duration.ofSeconds(5), interrupted))) {
            RegionOutcome<String> outcome = dispatch.next();

            assertThat(outcome.region()).isEqualTo(EAST);
            assertThat(outcome.failure()).isInstanceOf(TimeoutException.class);
            assertThat(dispatch.next()).isNull();
        }
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void runsAtMostMaxParallelismCallsPerDispatch() {
        fanout = new RegionFanout(8, 1, Duration.ofMillis(400));
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        try (RegionFanout.Dispatch<String> dispatch = fanout.dispatch(List.of(EAST, WEST, EU), region -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            sleepQuietly(250);
            running.decrementAndGet();
            return region.code();
        })) {
            Map<Region, RegionOutcome<String>> outcomes = drain(dispatch);

            assertThat(outcomes.values()).allMatch(RegionOutcome::isSuccess);
            assertThat(peak.get()).isEqualTo(1);
        }
    }

    @Test
    void waitingForASharedWorkerDoesNotCountAgainstTheRegion() throws Exception {
        fanout = new RegionFanout(1, 1, Duration.ofMillis(200));
        ExecutorService callers = Executors.newFixedThreadPool(2);
        CountDownLatch firstRunning = new CountDownLatch(1);

        try {
            Future<RegionOutcome<String>> busy = callers.submit(() -> {
                try (RegionFanout.Dispatch<String> dispatch = fanout.dispatch(List.of(EAST), region -> {
                    firstRunning.countDown();
                    sleepQuietly(150);
                    return "first";
                })) {
                    return dispatch.next();
                }
            });
            assertThat(firstRunning.await(2, TimeUnit.SECONDS)).isTrue();

            Future<RegionOutcome<String>> queued = callers.submit(() -> {
                try (RegionFanout.Dispatch<String> dispatch = fanout.dispatch(List.of(WEST), region -> {
                    sleepQuietly(100);
                    return "second";
                })) {
                    return dispatch.next();
                }
            });

            assertThat(busy.get(5, TimeUnit.SECONDS).value()).isEqualTo("first");
            RegionOutcome<String> outcome = queued.get(5, TimeUnit.SECONDS);
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.value()).isEqualTo("second");
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void closingDropsCallsThatHaveNotStarted() {
        fanout = new RegionFanout(4, 1, Duration.ofSeconds(10));
        CountDownLatch interrupted = new CountDownLatch(1);
        List<Region> started = Collections.synchronizedList(new ArrayList<>());

        try (RegionFanout.Dispatch<String> dispatch = fanout.dispatch(List.of(EAST, WEST, EU), region -> {
            started.add(region);
            if (region.equals(EAST)) {
                return "fast";
            }
            return sleepFor(Duration.ofSeconds(5), interrupted);
        })) {
            assertThat(dispatch.next().value()).isEqualTo("fast");
        }

        sleepQuietly(200);
        assertThat(started).contains(EAST).doesNotContain(EU);
    }

    @Test
    void interruptedCallerCancelsEverythingAndFails() {
        fanout = new RegionFanout(2, 2, Duration.ofSeconds(10));
        CountDownLatch interrupted = new CountDownLatch(1);

        try (RegionFanout.Dispatch<String> dispatch =
                     fanout.dispatch(List.of(EAST), region -> sleepFor(Duration.ofSeconds(5), interrupted))) {
            Thread.currentThread().interrupt();

            assertThatThrownBy(dispatch::next)
                    .isInstanceOfSatisfying(DirectoryException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.SERVER_ERROR));
            assertThat(Thread.interrupted()).isTrue();
        }
    }
}
