package com.rfidsync.application.service;

import com.rfidsync.domain.model.CacheSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheSnapshotHolderTest {

    private final CacheSnapshotHolder holder = new CacheSnapshotHolder();

    @Test
    void current_isEmptyBeforeFirstPublish() {
        assertThat(holder.current()).isEmpty();
        assertThat(holder.isAvailable()).isFalse();
    }

    @Test
    void publish_replacesSnapshotAndReturnsPrevious() {
        CacheSnapshot first = snapshot(1, 10);
        CacheSnapshot second = snapshot(2, 20);

        assertThat(holder.publish(first)).isEmpty();
        assertThat(holder.publish(second)).contains(first);
        assertThat(holder.current()).contains(second);
    }

    @Test
    void publish_rejectsNull() {
        assertThatThrownBy(() -> holder.publish(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void publishedSnapshotCannotBeMutated() {
        holder.publish(snapshot(1, 3));
        CacheSnapshot current = holder.current().orElseThrow();

        assertThatThrownBy(() -> current.getDoorCache().put(99L, 1)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> current.getMachineCache().get(1L).add("Laser"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    /**
     * Cada snapshot de generación N tiene exactamente N tags, todos con nivel N y la capacitación "gen-N".
     * Un lector que viera una mezcla rompería alguna de esas igualdades.
     */
    @Test
    void concurrentReadersNeverObservePartialSnapshot() throws Exception {
        int readers = 6;
        int generations = 300;
        holder.publish(snapshot(1, 1));

        ExecutorService pool = Executors.newFixedThreadPool(readers);
        AtomicBoolean publishing = new AtomicBoolean(true);
        CountDownLatch started = new CountDownLatch(readers);
        ConcurrentLinkedQueue<String> violations = new ConcurrentLinkedQueue<>();

        for (int r = 0; r < readers; r++) {
            pool.submit(() -> {
                started.countDown();
                long lastSeen = 0;
                while (publishing.get()) {
                    CacheSnapshot s = holder.current().orElseThrow();
                    long gen = s.getGeneration();
                    if (gen < lastSeen) {
                        violations.add("generación retrocedió: " + lastSeen + " -> " + gen);
                    }
                    lastSeen = gen;
                    if (s.getDoorCache().size() != gen || s.getMachineCache().size() != gen) {
                        violations.add("tamaño inconsistente en generación " + gen);
                    }
                    for (Map.Entry<Long, Integer> e : s.getDoorCache().entrySet()) {
                        SortedSet<String> trainings = s.getMachineCache().get(e.getKey());
                        if (e.getValue() != gen || trainings == null || !trainings.equals(Set.of("gen-" + gen))) {
                            violations.add("entrada mezclada en generación " + gen + ": tag " + e.getKey());
                        }
                    }
                }
            });
        }

        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        for (int gen = 2; gen <= generations; gen++) {
            holder.publish(snapshot(gen, gen));
        }
        publishing.set(false);
        pool.shutdown();

        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(violations).isEmpty();
        assertThat(holder.current().orElseThrow().getGeneration()).isEqualTo(generations);
    }

    private static CacheSnapshot snapshot(long generation, int tags) {
        Map<Long, Integer> door = new HashMap<>();
        Map<Long, Set<String>> machine = new HashMap<>();
        for (long tag = 1; tag <= tags; tag++) {
            door.put(tag, (int) generation);
            machine.put(tag, Set.of("gen-" + generation));
        }
        return new CacheSnapshot(generation, Instant.now(), door, machine);
    }

    @Test
    void machineEntriesFor_filtersByTraining() {
        CacheSnapshot s = new CacheSnapshot(1, Instant.now(),
                Map.of(1L, 1, 2L, 1, 3L, 2),
                Map.of(1L, Set.of("Laser", "WoodShop"), 2L, Set.of("WoodShop"), 3L, Set.<String>of()));

        assertThat(s.machineEntriesFor("WoodShop")).extracting(e -> e.tagId()).containsExactly(1L, 2L);
        assertThat(s.machineEntries()).hasSize(3);
        assertThat(s.machineEntries().get(0).trainings()).isEqualTo(List.of("Laser", "WoodShop"));
        assertThat(s.getMachineCache().get(3L)).isEmpty();
    }
}
