package in.taskfarm.application.service;

import in.taskfarm.domain.common.CoordinationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * FarmWriteCoordinator - Actor-based routing for farm mutations.
 *
 * SINGLE-WRITER PER FARM:
 * All mutations for a farm are routed to the same executor partition, so they
 * run one at a time and in submission order. Different farms proceed in
 * parallel on other partitions.
 *
 * PARTITIONING STRATEGY:
 * - Partition count = clamp(availableProcessors(), 8, 32)
 * - Route by: hash(key) % partitions
 * - Farm keys are "farm:{farmId}", todos outside any farm use "agent:{agentId}"
 *
 * RE-ENTRY:
 * A task already running on the target partition executes inline instead of
 * queueing behind itself.
 */
public final class FarmWriteCoordinator {
    private static final Logger log = LoggerFactory.getLogger(FarmWriteCoordinator.class);

    private static final int MIN_PARTITIONS = 8;
    private static final int MAX_PARTITIONS = 32;

    private static final ThreadLocal<Integer> CURRENT_PARTITION = new ThreadLocal<>();

    private final ExecutorService[] partitions;
    private final int partitionCount;

    public FarmWriteCoordinator() {
        this(calculateOptimalPartitions());
    }

    public FarmWriteCoordinator(int partitionCount) {
        if (partitionCount <= 0) {
            throw new IllegalArgumentException("Partition count must be positive");
        }
        this.partitionCount = partitionCount;
        this.partitions = new ExecutorService[partitionCount];

        for (int i = 0; i < partitionCount; i++) {
            final int partitionIndex = i;  // Lambda requires final variable
            this.partitions[i] = Executors.newSingleThreadExecutor(runnable -> {
                Thread t = new Thread(() -> {
                    CURRENT_PARTITION.set(partitionIndex);
                    runnable.run();
                }, "farm-writer-" + partitionIndex);
                t.setDaemon(true);
                return t;
            });
        }

        log.info("FarmWriteCoordinator initialized with {} partitions (CPUs: {})",
            partitionCount, Runtime.getRuntime().availableProcessors());
    }

    public static String farmKey(String farmId) {
        return "farm:" + farmId;
    }

    public static String agentKey(String agentId) {
        return "agent:" + agentId;
    }

    /**
     * Calculate optimal partition count with clamping.
     *
     * Rule: clamp(availableProcessors(), 8, 32)
     */
    private static int calculateOptimalPartitions() {
        int processors = Runtime.getRuntime().availableProcessors();
        return Math.max(MIN_PARTITIONS, Math.min(MAX_PARTITIONS, processors));
    }

    /**
     * Queue a task on the key's partition.
     *
     * @param key Routing key (see {@link #farmKey}, {@link #agentKey})
     * @param task Task to execute
     * @param <T> Result type
     * @return CompletableFuture with result
     */
    public <T> CompletableFuture<T> executeWithResult(String key, Supplier<T> task) {
        int partition = getPartition(key);
        if (Integer.valueOf(partition).equals(CURRENT_PARTITION.get())) {
            try {
                return CompletableFuture.completedFuture(task.get());
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        return CompletableFuture.supplyAsync(task, partitions[partition]);
    }

    /**
     * Run a task on the key's partition and wait for it. Exceptions thrown by the
     * task are rethrown unchanged.
     */
    public <T> T submit(String key, Supplier<T> task) {
        try {
            return executeWithResult(key, task).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new CoordinationException("Farm operation failed: " + key, cause);
        }
    }

    /**
     * Calculate partition index for a key.
     *
     * Uses hashCode() % partitionCount for consistent routing.
     * Math.floorMod() to handle negative hash codes.
     */
    int getPartition(String key) {
        return Math.floorMod(key.hashCode(), partitionCount);
    }

    /**
     * Shutdown all partitions gracefully.
     *
     * Waits up to 30 seconds for pending tasks to complete.
     */
    public void shutdown() {
        log.info("Shutting down FarmWriteCoordinator with {} partitions", partitionCount);

        for (int i = 0; i < partitionCount; i++) {
            partitions[i].shutdown();
        }

        try {
            for (int i = 0; i < partitionCount; i++) {
                if (!partitions[i].awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Partition {} did not terminate in time, forcing shutdown", i);
                    partitions[i].shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            log.error("Shutdown interrupted", e);
            for (ExecutorService partition : partitions) {
                partition.shutdownNow();
            }
            Thread.currentThread().interrupt();
        }

        log.info("FarmWriteCoordinator shutdown complete");
    }

    /**
     * Get partition count (for testing/monitoring).
     */
    public int getPartitionCount() {
        return partitionCount;
    }
}
