package in.taskfarm.application.service;

import in.taskfarm.domain.common.TodoStoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class FarmWriteCoordinatorTest {

    private final FarmWriteCoordinator coordinator = new FarmWriteCoordinator(4);

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    @Test
    void testSameKeyAlwaysRoutesToSamePartition() {
        String key = FarmWriteCoordinator.farmKey("farm-1");
        int partition = coordinator.getPartition(key);
        for (int i = 0; i < 100; i++) {
            assertEquals(partition, coordinator.getPartition(key));
        }
        assertEquals(4, coordinator.getPartitionCount());
    }

    @Test
    void testMutationsForOneFarmRunInSubmissionOrder() throws Exception {
        String key = FarmWriteCoordinator.farmKey("farm-1");
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());

        List<CompletableFuture<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            final int n = i;
            futures.add(coordinator.executeWithResult(key, () -> {
                seen.add(n);
                return n;
            }));
        }
        for (CompletableFuture<Integer> f : futures) {
            f.get(5, TimeUnit.SECONDS);
        }

        assertEquals(IntStream.range(0, 50).boxed().toList(), seen);
    }

    @Test
    void testNoTwoMutationsOverlapForOneFarm() throws Exception {
        String key = FarmWriteCoordinator.farmKey("farm-busy");
        int[] counter = {0};
        ExecutorService callers = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(200);

        for (int i = 0; i < 200; i++) {
            callers.submit(() -> {
                coordinator.submit(key, () -> {
                    int read = counter[0];
                    Thread.yield();
                    counter[0] = read + 1;
                    return null;
                });
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        callers.shutdown();
        coordinator.submit(key, () -> {
            assertEquals(200, counter[0]);
            return null;
        });
    }

    @Test
    void testNestedSubmitOnSamePartitionRunsInline() {
        String key = FarmWriteCoordinator.farmKey("farm-1");

        String result = coordinator.submit(key, () -> coordinator.submit(key, () -> "inner"));

        assertEquals("inner", result);
    }

    @Test
    void testTaskExceptionsSurfaceUnwrapped() {
        String key = FarmWriteCoordinator.farmKey("farm-1");

        TodoStoreException e = assertThrows(TodoStoreException.class,
            () -> coordinator.submit(key, () -> {
                throw new TodoStoreException("boom", null);
            }));
        assertEquals("boom", e.getMessage());
    }

    @Test
    void testInvalidPartitionCount() {
        assertThrows(IllegalArgumentException.class, () -> new FarmWriteCoordinator(0));
    }
}
