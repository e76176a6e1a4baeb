package in.taskfarm.domain.todo;

import in.taskfarm.support.TodoFixtures;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentTodoTest {

    @Test
    void testUpdatedAtAlwaysAdvances() {
        AgentTodo todo = TodoFixtures.todo("agent-1", "farm-1").build();

        // clock behind the last write
        AgentTodo moved = todo.withAgent("agent-2", todo.updatedAt().minusSeconds(60));

        assertEquals("agent-2", moved.agentId());
        assertTrue(moved.updatedAt().isAfter(todo.updatedAt()));
    }

    @Test
    void testCompletionStampsCompletedAt() {
        AgentTodo todo = TodoFixtures.todo("agent-1", "farm-1").build();
        Instant now = TodoFixtures.NOW;

        AgentTodo done = todo.withStatus(TodoStatus.COMPLETED, now);

        assertEquals(TodoStatus.COMPLETED, done.status());
        assertEquals(done.updatedAt(), done.completedAt());
        assertNull(todo.completedAt());
        assertEquals(0, todo.progress().percentage());
        assertEquals(TodoProgress.COMPLETE, done.progress().percentage());
    }

    @Test
    void testCreateCarriesDependenciesAndContext() {
        CreateTodoRequest request = new CreateTodoRequest("agent-1", "farm-1", " Close spreads ", null,
            TodoCategory.TRADING, TodoPriority.HIGH, null, null, null, null,
            Arrays.asList(" todo_a ", "", null, "todo_b", "todo_a"),
            new TodoContext(null, "  ", " exit before close "));

        AgentTodo todo = AgentTodo.create(request.withDefaults(), TodoFixtures.NOW);

        assertEquals(List.of("todo_a", "todo_b"), todo.dependsOn());
        assertEquals(new TodoContext(null, null, "exit before close"), todo.context());
        assertEquals(TodoProgress.notStarted(), todo.progress());
    }

    @Test
    void testBlankContextIsDropped() {
        assertNull(TodoContext.normalize(new TodoContext(null, " ", "")));
        assertNull(TodoContext.normalize(null));
    }

    @Test
    void testSummaryCountsAndLoad() {
        Instant now = TodoFixtures.NOW;
        List<AgentTodo> todos = List.of(
            TodoFixtures.todo("a", "f").priority(TodoPriority.HIGH).build(),
            TodoFixtures.todo("a", "f").status(TodoStatus.IN_PROGRESS).due(now.minusSeconds(10)).build(),
            TodoFixtures.todo("a", "f").status(TodoStatus.COMPLETED).priority(TodoPriority.CRITICAL).build(),
            TodoFixtures.todo("a", "f").status(TodoStatus.CANCELLED).due(now.minusSeconds(10)).build()
        );

        TodoSummary summary = TodoSummary.of(todos, now);

        assertEquals(4, summary.total());
        assertEquals(1, summary.pending());
        assertEquals(1, summary.inProgress());
        assertEquals(1, summary.completed());
        assertEquals(1, summary.cancelled());
        assertEquals(1, summary.highPriority());
        assertEquals(1, summary.overdue());
        assertEquals(2, summary.activeLoad());
    }

    @Test
    void testFilterMatchesOnlySetFields() {
        AgentTodo todo = TodoFixtures.todo("a", "farm-1").priority(TodoPriority.HIGH).build();

        assertTrue(TodoFilter.none().matches(todo));
        assertTrue(new TodoFilter(TodoStatus.PENDING, TodoPriority.HIGH, null, "farm-1").matches(todo));
        assertFalse(new TodoFilter(null, null, TodoCategory.GOAL, null).matches(todo));
        assertFalse(new TodoFilter(null, null, null, "farm-2").matches(todo));
    }
}
