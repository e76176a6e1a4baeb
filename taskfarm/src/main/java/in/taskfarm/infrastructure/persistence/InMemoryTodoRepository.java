package in.taskfarm.infrastructure.persistence;

import in.taskfarm.application.port.output.TodoRepository;
import in.taskfarm.domain.common.TodoStoreException;
import in.taskfarm.domain.todo.AgentTodo;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory todo store for development mode and tests.
 *
 * Supports fault injection: fail one write after a number of successful ones,
 * fail every put, fail every delete (to exercise rollback failures), fail the
 * next listings and add latency to every call.
 */
public final class InMemoryTodoRepository implements TodoRepository {

    private static final Comparator<AgentTodo> ORDER =
        Comparator.comparing(AgentTodo::createdAt).thenComparing(AgentTodo::id);

    private final ConcurrentHashMap<String, AgentTodo> todos = new ConcurrentHashMap<>();

    private final AtomicInteger writesBeforeFailure = new AtomicInteger(-1);
    private final AtomicInteger failingListings = new AtomicInteger();
    private volatile boolean failPuts = false;
    private volatile boolean failDeletes = false;
    private volatile Duration latency = Duration.ZERO;

    @Override
    public void put(AgentTodo todo) {
        pause();
        if (failPuts) {
            throw new TodoStoreException("Injected put failure for " + todo.id(), null);
        }
        failIfExhausted("put " + todo.id());
        todos.put(todo.id(), todo);
    }

    @Override
    public Optional<AgentTodo> get(String todoId) {
        pause();
        return Optional.ofNullable(todos.get(todoId));
    }

    @Override
    public boolean delete(String todoId) {
        pause();
        if (failDeletes) {
            throw new TodoStoreException("Injected delete failure for " + todoId, null);
        }
        failIfExhausted("delete " + todoId);
        return todos.remove(todoId) != null;
    }

    @Override
    public List<AgentTodo> listByAgent(String agentId) {
        pause();
        failIfListingArmed("agent " + agentId);
        return todos.values().stream()
            .filter(t -> agentId.equals(t.agentId()))
            .sorted(ORDER)
            .toList();
    }

    @Override
    public List<AgentTodo> listByFarm(String farmId) {
        pause();
        failIfListingArmed("farm " + farmId);
        return todos.values().stream()
            .filter(t -> farmId.equals(t.farmId()))
            .sorted(ORDER)
            .toList();
    }

    // ═══════════════════════════════════════════════════════════════
    // FAULT INJECTION
    // ═══════════════════════════════════════════════════════════════

    /**
     * Let {@code successfulWrites} more writes through, then fail the next one.
     * Later writes succeed again.
     */
    public void failWriteAfter(int successfulWrites) {
        writesBeforeFailure.set(successfulWrites);
    }

    /**
     * Fail the next {@code count} calls to either listing method.
     */
    public void failListings(int count) {
        failingListings.set(count);
    }

    public void failPuts(boolean fail) {
        this.failPuts = fail;
    }

    public void failDeletes(boolean fail) {
        this.failDeletes = fail;
    }

    public void setLatency(Duration latency) {
        this.latency = latency == null ? Duration.ZERO : latency;
    }

    public void clearFailures() {
        writesBeforeFailure.set(-1);
        failingListings.set(0);
        failPuts = false;
        failDeletes = false;
        latency = Duration.ZERO;
    }

    public int size() {
        return todos.size();
    }

    private void failIfExhausted(String operation) {
        // 0 fires once and disarms
        int remaining = writesBeforeFailure.getAndUpdate(n -> n > 0 ? n - 1 : -1);
        if (remaining == 0) {
            throw new TodoStoreException("Injected write failure: " + operation, null);
        }
    }

    private void failIfListingArmed(String scope) {
        if (failingListings.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new TodoStoreException("Injected listing failure for " + scope, null);
        }
    }

    private void pause() {
        Duration d = latency;
        if (d.isZero()) {
            return;
        }
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TodoStoreException("Interrupted", e);
        }
    }
}
