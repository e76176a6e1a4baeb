package in.taskfarm.application.service;

import in.taskfarm.domain.common.TodoStoreException;
import in.taskfarm.domain.common.TodoValidationException;
import in.taskfarm.domain.common.ValidationErrorCode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StoreRetryPolicy.
 *
 * Tests:
 * - Exponential backoff calculations
 * - Retry until success
 * - Attempt budget
 * - Non-store failures pass through
 */
class StoreRetryPolicyTest {

    @Test
    void testExponentialBackoffIsCapped() {
        StoreRetryPolicy policy = StoreRetryPolicy.builder()
            .initialDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofMillis(300))
            .multiplier(2.0)
            .maxAttempts(5)
            .build();

        assertEquals(Duration.ofMillis(200), policy.nextDelay(Duration.ofMillis(100)));
        assertEquals(Duration.ofMillis(300), policy.nextDelay(Duration.ofMillis(200)), "Should hit max delay");
        assertEquals(Duration.ofMillis(300), policy.nextDelay(Duration.ofMillis(300)));
    }

    @Test
    void testRetriesUntilSuccess() {
        List<String> retries = new ArrayList<>();
        StoreRetryPolicy policy = StoreRetryPolicy.builder()
            .initialDelay(Duration.ofMillis(1))
            .maxAttempts(3)
            .retryListener(retries::add)
            .build();
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute("createTodo", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TodoStoreException("store down", null);
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of("createTodo", "createTodo"), retries);
    }

    @Test
    void testLastFailureRethrownWhenBudgetSpent() {
        StoreRetryPolicy policy = StoreRetryPolicy.builder()
            .initialDelay(Duration.ofMillis(1))
            .maxAttempts(2)
            .build();
        AtomicInteger calls = new AtomicInteger();

        TodoStoreException e = assertThrows(TodoStoreException.class, () -> policy.execute("bulkAssign", () -> {
            throw new TodoStoreException("attempt " + calls.incrementAndGet(), null);
        }));

        assertEquals("attempt 2", e.getMessage());
        assertEquals(2, calls.get());
    }

    @Test
    void testValidationErrorsAreNotRetried() {
        StoreRetryPolicy policy = StoreRetryPolicy.builder()
            .initialDelay(Duration.ofMillis(1))
            .maxAttempts(3)
            .build();
        AtomicInteger calls = new AtomicInteger();

        assertThrows(TodoValidationException.class, () -> policy.execute("createTodo", () -> {
            calls.incrementAndGet();
            throw new TodoValidationException(ValidationErrorCode.EMPTY_TITLE);
        }));
        assertEquals(1, calls.get(), "Validation failure should not be retried");
    }

    @Test
    void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> StoreRetryPolicy.builder().maxAttempts(0));
        assertThrows(IllegalArgumentException.class, () -> StoreRetryPolicy.builder().multiplier(0.5));
        assertThrows(IllegalArgumentException.class, () -> StoreRetryPolicy.builder().initialDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> StoreRetryPolicy.builder()
            .initialDelay(Duration.ofSeconds(10))
            .maxDelay(Duration.ofSeconds(1))
            .build());
    }
}
