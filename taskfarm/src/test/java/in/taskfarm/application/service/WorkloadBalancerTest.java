package in.taskfarm.application.service;

import in.taskfarm.config.CoordinationConfig;
import in.taskfarm.domain.farm.FarmTodoCoordination;
import in.taskfarm.domain.farm.MoveSet;
import in.taskfarm.domain.farm.TaskMove;
import in.taskfarm.domain.todo.AgentTodo;
import in.taskfarm.domain.todo.TodoPriority;
import in.taskfarm.domain.todo.TodoStatus;
import in.taskfarm.infrastructure.persistence.InMemoryFarmRosterRepository;
import in.taskfarm.infrastructure.persistence.InMemoryTodoRepository;
import in.taskfarm.support.TodoFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkloadBalancerTest {

    private static final String FARM = "farm-1";

    private InMemoryTodoRepository todos;
    private InMemoryFarmRosterRepository roster;
    private WorkloadBalancer balancer;

    @BeforeEach
    void setUp() {
        todos = new InMemoryTodoRepository();
        roster = new InMemoryFarmRosterRepository();
        balancer = new WorkloadBalancer(CoordinationConfig::defaults);
    }

    @Test
    void testOverloadedAgentFeedsBestPerformerFirst() {
        join("A", "B", "C");
        AgentTodo critical = add(TodoFixtures.todo("A", FARM).priority(TodoPriority.CRITICAL));
        for (int i = 0; i < 9; i++) {
            add(TodoFixtures.todo("A", FARM).priority(TodoPriority.LOW));
        }
        addPending("B", 2);
        add(TodoFixtures.todo("B", FARM).status(TodoStatus.COMPLETED));
        add(TodoFixtures.todo("B", FARM).status(TodoStatus.COMPLETED));
        addPending("C", 2);

        FarmTodoCoordination snapshot = TodoFixtures.snapshot(todos, roster, FARM, 7);
        MoveSet moves = balancer.rebalance(snapshot);

        assertEquals(7, moves.basedOnVersion());
        assertEquals(5, moves.size());
        Map<String, Integer> received = new HashMap<>();
        for (TaskMove move : moves.moves()) {
            assertEquals("A", move.fromAgent());
            assertEquals(TaskMove.REASON_OVERLOAD, move.reason());
            assertNotEquals(critical.id(), move.taskId());
            received.merge(move.toAgent(), 1, Integer::sum);
        }
        assertEquals(3, received.get("B"));
        assertEquals(2, received.get("C"));
        // B fills up before C is used
        assertEquals("B", moves.moves().get(0).toAgent());
    }

    @Test
    void testBalancedFarmProducesNoMoves() {
        join("A", "B", "C");
        addPending("A", 4);
        addPending("B", 4);
        addPending("C", 5);

        MoveSet moves = balancer.rebalance(TodoFixtures.snapshot(todos, roster, FARM, 1));

        assertTrue(moves.isEmpty());
    }

    @Test
    void testInProgressWorkNeverMoves() {
        join("A", "B", "C");
        for (int i = 0; i < 8; i++) {
            add(TodoFixtures.todo("A", FARM).status(TodoStatus.IN_PROGRESS));
        }
        AgentTodo p1 = add(TodoFixtures.todo("A", FARM));
        AgentTodo p2 = add(TodoFixtures.todo("A", FARM));

        MoveSet moves = balancer.rebalance(TodoFixtures.snapshot(todos, roster, FARM, 1));

        assertEquals(2, moves.size());
        assertTrue(moves.moves().stream().allMatch(m -> m.taskId().equals(p1.id()) || m.taskId().equals(p2.id())));
    }

    @Test
    void testOnlyPendingOrphansAreReassigned() {
        join("A", "B");
        addPending("A", 2);
        addPending("B", 1);
        AgentTodo pendingOrphan = add(TodoFixtures.todo("X", FARM));
        add(TodoFixtures.todo("X", FARM).status(TodoStatus.IN_PROGRESS));

        FarmTodoCoordination snapshot = TodoFixtures.snapshot(todos, roster, FARM, 3);
        assertEquals(2, snapshot.orphanedTodos().size());

        MoveSet moves = balancer.rebalance(snapshot);

        assertEquals(1, moves.size());
        TaskMove move = moves.moves().get(0);
        assertEquals(pendingOrphan.id(), move.taskId());
        assertEquals("X", move.fromAgent());
        assertEquals("B", move.toAgent());
        assertEquals(TaskMove.REASON_ORPHANED, move.reason());
        assertEquals(pendingOrphan.updatedAt(), move.expectedUpdatedAt());
    }

    @Test
    void testEmptyRosterOrIdleFarm() {
        assertTrue(balancer.rebalance(TodoFixtures.snapshot(todos, roster, FARM, 0)).isEmpty());

        join("A", "B");
        assertTrue(balancer.rebalance(TodoFixtures.snapshot(todos, roster, FARM, 0)).isEmpty());
    }

    private void join(String... agents) {
        for (String agent : agents) {
            roster.addAgent(FARM, agent, TodoFixtures.NOW);
        }
    }

    private void addPending(String agent, int count) {
        for (int i = 0; i < count; i++) {
            add(TodoFixtures.todo(agent, FARM));
        }
    }

    private AgentTodo add(TodoFixtures.Builder builder) {
        AgentTodo todo = builder.build();
        todos.put(todo);
        return todo;
    }
}
