package in.taskfarm.application.service;

import in.taskfarm.config.CoordinationConfig;
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

import static org.junit.jupiter.api.Assertions.*;

class AssignmentOptimizerTest {

    private static final String FARM = "farm-opt";

    private InMemoryTodoRepository todos;
    private InMemoryFarmRosterRepository roster;
    private AssignmentOptimizer optimizer;

    @BeforeEach
    void setUp() {
        todos = new InMemoryTodoRepository();
        roster = new InMemoryFarmRosterRepository();
        optimizer = new AssignmentOptimizer(CoordinationConfig::defaults);
        roster.addAgent(FARM, "P", TodoFixtures.NOW);
        roster.addAgent(FARM, "W", TodoFixtures.NOW);
    }

    @Test
    void testMostUrgentWorkMovesToProvenAgentWithinCapacity() {
        put(TodoFixtures.todo("P", FARM).status(TodoStatus.COMPLETED));
        AgentTodo critical = put(TodoFixtures.todo("W", FARM).priority(TodoPriority.CRITICAL));
        put(TodoFixtures.todo("W", FARM).priority(TodoPriority.HIGH));
        put(TodoFixtures.todo("W", FARM).priority(TodoPriority.LOW));

        MoveSet moves = optimizer.optimize(TodoFixtures.snapshot(todos, roster, FARM, 4));

        // load 3 over 2 agents: capacity 1.8, so P takes exactly one
        assertEquals(1, moves.size());
        TaskMove move = moves.moves().get(0);
        assertEquals(critical.id(), move.taskId());
        assertEquals("W", move.fromAgent());
        assertEquals("P", move.toAgent());
        assertEquals(TaskMove.REASON_PERFORMANCE, move.reason());
        assertEquals(4, moves.basedOnVersion());
    }

    @Test
    void testLowPriorityWorkIsLeftAlone() {
        put(TodoFixtures.todo("P", FARM).status(TodoStatus.COMPLETED));
        put(TodoFixtures.todo("W", FARM).priority(TodoPriority.LOW));
        put(TodoFixtures.todo("W", FARM).priority(TodoPriority.MEDIUM));

        assertTrue(optimizer.optimize(TodoFixtures.snapshot(todos, roster, FARM, 1)).isEmpty());
    }

    @Test
    void testNoProvenAgentMeansNoMoves() {
        put(TodoFixtures.todo("P", FARM));
        put(TodoFixtures.todo("W", FARM).priority(TodoPriority.CRITICAL));

        assertTrue(optimizer.optimize(TodoFixtures.snapshot(todos, roster, FARM, 1)).isEmpty());
    }

    @Test
    void testInProgressHighPriorityStaysPut() {
        put(TodoFixtures.todo("P", FARM).status(TodoStatus.COMPLETED));
        put(TodoFixtures.todo("W", FARM).priority(TodoPriority.CRITICAL).status(TodoStatus.IN_PROGRESS));

        assertTrue(optimizer.optimize(TodoFixtures.snapshot(todos, roster, FARM, 1)).isEmpty());
    }

    private AgentTodo put(TodoFixtures.Builder builder) {
        AgentTodo todo = builder.build();
        todos.put(todo);
        return todo;
    }
}
