package in.taskfarm.application.service;

import in.taskfarm.domain.farm.FarmTodoCoordination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FarmSnapshotCache - last committed snapshot per farm.
 *
 * STRUCTURE:
 * - Map<farmId, FarmTodoCoordination> for reads
 * - Map<farmId, AtomicLong> version counters, kept across invalidation so a
 *   version is never reused for a farm
 *
 * THREAD-SAFETY:
 * Snapshots are only published from the farm's writer partition; readers on any
 * thread see either the previous or the new snapshot, never a partial one.
 */
public final class FarmSnapshotCache {
    private static final Logger log = LoggerFactory.getLogger(FarmSnapshotCache.class);

    private final Map<String, FarmTodoCoordination> snapshots = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> versions = new ConcurrentHashMap<>();

    public Optional<FarmTodoCoordination> get(String farmId) {
        return Optional.ofNullable(snapshots.get(farmId));
    }

    /**
     * Reserve the next version number for a farm. Called by the writer before it
     * builds a new snapshot.
     */
    public long nextVersion(String farmId) {
        return versions.computeIfAbsent(farmId, k -> new AtomicLong(0)).incrementAndGet();
    }

    /**
     * Latest reserved version, 0 if the farm was never built.
     */
    public long currentVersion(String farmId) {
        AtomicLong version = versions.get(farmId);
        return version == null ? 0L : version.get();
    }

    public void publish(FarmTodoCoordination snapshot) {
        snapshots.put(snapshot.farmId(), snapshot);
        log.debug("Snapshot published: farm={}, version={}", snapshot.farmId(), snapshot.version());
    }

    /**
     * Drop a farm's snapshot after a failed write so the next read rebuilds from
     * the store.
     */
    public void invalidate(String farmId) {
        if (snapshots.remove(farmId) != null) {
            log.debug("Snapshot invalidated: farm={}", farmId);
        }
    }

    public int size() {
        return snapshots.size();
    }
}
