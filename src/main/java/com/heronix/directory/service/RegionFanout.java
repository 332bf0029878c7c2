package com.heronix.directory.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.heronix.directory.exception.DirectoryException;
import com.heronix.directory.model.domain.Region;
import com.heronix.directory.model.enums.ErrorKind;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded fan-out of one call per region.
 *
 * All dispatches share one worker pool sized for concurrent requests, while each
 * dispatch runs at most {@code maxParallelism} of its own region calls at a time.
 * A region's deadline starts when a worker picks its call up, so time spent
 * waiting for a free worker never counts against the region.
 *
 * Outcomes are handed to the calling thread in completion order. Callers that
 * need catalog order buffer them and assemble at the end.
 *
 * @author Heronix Educational Systems LLC
 * @since October 2026
 */
@Slf4j
public class RegionFanout {

    private static final long IDLE_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final ThreadPoolTaskExecutor executor;
    @Getter
    private final int poolSize;
    @Getter
    private final int maxParallelism;
    @Getter
    private final Duration regionTimeout;

    public RegionFanout(int poolSize, int maxParallelism, Duration regionTimeout) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be positive: " + poolSize);
        }
        if (maxParallelism < 1) {
            throw new IllegalArgumentException("maxParallelism must be positive: " + maxParallelism);
        }
        this.poolSize = poolSize;
        this.maxParallelism = maxParallelism;
        this.regionTimeout = regionTimeout;

        this.executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setThreadNamePrefix("region-fanout-");
        executor.setDaemon(true);
        executor.initialize();
    }

    /**
     * Start {@code call} for each region, at most {@code maxParallelism} at a time,
     * in the given order.
     */
    public <T> Dispatch<T> dispatch(List<Region> regions, Function<Region, T> call) {
        Dispatch<T> dispatch = new Dispatch<>(executor, regions, call, regionTimeout.toNanos());
        dispatch.start(Math.min(maxParallelism, regions.size()));
        log.debug("FANOUT: Dispatched {} region calls, {} at a time",
                regions.size(), Math.min(maxParallelism, regions.size()));
        return dispatch;
    }

    public void shutdown() {
        executor.shutdown();
    }

    // ========================================================================
    // DISPATCH
    // ========================================================================

    /**
     * In-flight region calls of one request. Closing cancels every call that has
     * not completed and drops those not yet started.
     *
     * {@link #next()} must only be called from the thread that owns the dispatch.
     */
    public static final class Dispatch<T> implements AutoCloseable {

        private final ThreadPoolTaskExecutor executor;
        private final Function<Region, T> call;
        private final long timeoutNanos;
        private final List<RegionTask> tasks = new ArrayList<>();
        private final Queue<RegionTask> pending = new ConcurrentLinkedQueue<>();
        private final BlockingQueue<RegionOutcome<T>> completions = new LinkedBlockingQueue<>();
        private final Set<Region> reported = new HashSet<>();
        private volatile boolean closed;

        private Dispatch(ThreadPoolTaskExecutor executor, List<Region> regions,
                         Function<Region, T> call, long timeoutNanos) {
            this.executor = executor;
            this.call = call;
            this.timeoutNanos = timeoutNanos;
            for (Region region : regions) {
                RegionTask task = new RegionTask(region);
                tasks.add(task);
                pending.add(task);
            }
        }

        private void start(int permits) {
            for (int i = 0; i < permits; i++) {
                submitNext();
            }
        }

        private void submitNext() {
            if (closed) {
                return;
            }
            RegionTask task = pending.poll();
            if (task == null) {
                return;
            }
            try {
                executor.execute(task.future);
            } catch (TaskRejectedException e) {
                log.warn("FANOUT: Worker pool rejected call for {}", task.region);
                completions.offer(RegionOutcome.failure(task.region, e));
            }
        }

        /**
         * Wait for the next region to finish or run out of time.
         *
         * @return the next outcome in completion order, or null once every region
         *         has been reported
         * @throws DirectoryException with kind SERVER_ERROR if the calling thread is
         *         interrupted; every outstanding call is cancelled first
         */
        public RegionOutcome<T> next() {
            try {
                while (reported.size() < tasks.size()) {
                    RegionOutcome<T> done = completions.poll();
                    if (done != null) {
                        if (reported.add(done.region())) {
                            return done;
                        }
                        continue;
                    }

                    long now = System.nanoTime();
                    long wait = IDLE_POLL_NANOS;
                    for (RegionTask task : tasks) {
                        if (!task.started || reported.contains(task.region)) {
                            continue;
                        }
                        long left = task.startedAt + timeoutNanos - now;
                        if (left <= 0) {
                            task.future.cancel(true);
                            reported.add(task.region);
                            log.debug("FANOUT: Region {} timed out", task.region);
                            return RegionOutcome.failure(task.region,
                                    new TimeoutException("Region " + task.region + " did not answer in time"));
                        }
                        wait = Math.min(wait, left);
                    }

                    done = completions.poll(wait, TimeUnit.NANOSECONDS);
                    if (done != null && reported.add(done.region())) {
                        return done;
                    }
                }
                return null;

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll();
                throw new DirectoryException(ErrorKind.SERVER_ERROR,
                        "Interrupted while waiting for region calls", e);
            }
        }

        public void cancelAll() {
            closed = true;
            pending.clear();
            for (RegionTask task : tasks) {
                if (!task.future.isDone()) {
                    task.future.cancel(true);
                }
            }
        }

        @Override
        public void close() {
            cancelAll();
        }

        private final class RegionTask implements Callable<T> {

            private final Region region;
            private final FutureTask<T> future;
            private volatile boolean started;
            private volatile long startedAt;

            private RegionTask(Region region) {
                this.region = region;
                this.future = new FutureTask<>(this);
            }

            @Override
            public T call() {
                startedAt = System.nanoTime();
                started = true;
                try {
                    T value = call.apply(region);
                    completions.offer(RegionOutcome.success(region, value));
                    return value;
                } catch (RuntimeException | Error e) {
                    completions.offer(RegionOutcome.failure(region, e));
                    throw e;
                } finally {
                    submitNext();
                }
            }
        }
    }

    /**
     * Result of one region call: a value or the failure that replaced it.
     */
    public record RegionOutcome<T>(Region region, T value, Throwable failure) {

        static <T> RegionOutcome<T> success(Region region, T value) {
            return new RegionOutcome<>(region, value, null);
        }

        static <T> RegionOutcome<T> failure(Region region, Throwable failure) {
            return new RegionOutcome<>(region, null, failure);
        }

        public boolean isSuccess() {
            return failure == null;
        }
    }
}
