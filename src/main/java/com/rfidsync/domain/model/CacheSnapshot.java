package com.rfidsync.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Vista inmutable y completa de las dos caches de acceso.
 * Se construye de una sola vez y nunca se modifica después de publicarse.
 */
public final class CacheSnapshot {

    private final long generation;
    private final Instant builtAt;
    private final SortedMap<Long, Integer> doorCache;
    private final SortedMap<Long, SortedSet<String>> machineCache;

    public CacheSnapshot(long generation,
            Instant builtAt,
            Map<Long, Integer> doorCache,
            Map<Long, ? extends Set<String>> machineCache) {
        this.generation = generation;
        this.builtAt = Objects.requireNonNull(builtAt, "builtAt");
        this.doorCache = Collections.unmodifiableSortedMap(new TreeMap<>(doorCache));

        TreeMap<Long, SortedSet<String>> machines = new TreeMap<>();
        machineCache.forEach((tagId, trainings) -> machines.put(tagId,
                Collections.unmodifiableSortedSet(new TreeSet<>(trainings))));
        this.machineCache = Collections.unmodifiableSortedMap(machines);
    }

    public long getGeneration() {
        return generation;
    }

    public Instant getBuiltAt() {
        return builtAt;
    }

    /** tag_id -> nivel de membresía */
    public SortedMap<Long, Integer> getDoorCache() {
        return doorCache;
    }

    /** tag_id -> capacitaciones; un tag conocido sin capacitaciones tiene un set vacío */
    public SortedMap<Long, SortedSet<String>> getMachineCache() {
        return machineCache;
    }

    public List<DoorCacheEntry> doorEntries() {
        List<DoorCacheEntry> entries = new ArrayList<>(doorCache.size());
        doorCache.forEach((tagId, level) -> entries.add(new DoorCacheEntry(tagId, level)));
        return entries;
    }

    public List<MachineCacheEntry> machineEntries() {
        List<MachineCacheEntry> entries = new ArrayList<>(machineCache.size());
        machineCache.forEach((tagId, trainings) -> entries.add(new MachineCacheEntry(tagId, List.copyOf(trainings))));
        return entries;
    }

    /**
     * Entradas de máquina que incluyen la capacitación indicada.
     *
     * @param training nombre de la capacitación
     * @return entradas ordenadas por tag
     */
    public List<MachineCacheEntry> machineEntriesFor(String training) {
        List<MachineCacheEntry> entries = new ArrayList<>();
        machineCache.forEach((tagId, trainings) -> {
            if (trainings.contains(training)) {
                entries.add(new MachineCacheEntry(tagId, List.copyOf(trainings)));
            }
        });
        return entries;
    }

    public int size() {
        return doorCache.size();
    }

    /**
     * Compara solo el contenido de las caches, ignorando generación y fecha.
     */
    public boolean sameContentAs(CacheSnapshot other) {
        return other != null
                && doorCache.equals(other.doorCache)
                && machineCache.equals(other.machineCache);
    }

    @Override
    public String toString() {
        return "CacheSnapshot{generation=" + generation + ", builtAt=" + builtAt + ", tags=" + doorCache.size() + "}";
    }
}
