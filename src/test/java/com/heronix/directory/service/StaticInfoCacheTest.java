package com.heronix.directory.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.heronix.directory.model.domain.CacheEntry;
import com.heronix.directory.model.dto.QueueDepthDTO;

class StaticInfoCacheTest {

    private static final String ID = "arn:aws:braket:us-east-1::device/qpu/acme/Aria";

    private final StaticInfoCache cache = new StaticInfoCache();

    private static CacheEntry entry(String name, int jobs) {
        return CacheEntry.builder()
                .deviceArn(ID)
                .deviceName(name)
                .deviceType("QPU")
                .providerName("Acme")
                .queueDepth(new QueueDepthDTO(0, 0, jobs))
                .build();
    }

    @Test
    void firstWriteWinsAndIsNeverReplaced() {
        CacheEntry first = entry("first", 1);
        CacheEntry second = entry("second", 2);

        assertThat(cache.putIfAbsent(ID, first)).isSameAs(first);
        assertThat(cache.putIfAbsent(ID, second)).isSameAs(first);
        assertThat(cache.get(ID)).containsSame(first);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void missingIdIsAbsent() {
        assertThat(cache.get(ID)).isEmpty();
        assertThat(cache.get(ID)).isEmpty();
    }

    @Test
    void racingWritersAllObserveTheSameWinner() throws Exception {
        int writers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<CacheEntry> candidates = new ArrayList<>();
            List<Future<CacheEntry>> winners = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                CacheEntry candidate = entry("writer-" + i, i);
                candidates.add(candidate);
                winners.add(pool.submit(() -> {
                    start.await();
                    return cache.putIfAbsent(ID, candidate);
                }));
            }
            start.countDown();

            CacheEntry stored = cache.get(ID).orElse(null);
            for (Future<CacheEntry> winner : winners) {
                CacheEntry observed = winner.get(5, TimeUnit.SECONDS);
                stored = cache.get(ID).orElseThrow();
                assertThat(observed).isSameAs(stored);
            }
            assertThat(candidates).containsOnlyOnce(stored);
            assertThat(cache.size()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
