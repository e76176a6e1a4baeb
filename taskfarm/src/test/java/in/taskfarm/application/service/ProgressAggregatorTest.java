package in.taskfarm.application.service;

import in.taskfarm.domain.farm.FarmProgress;
import in.taskfarm.domain.todo.AgentTodo;
import in.taskfarm.domain.todo.TodoStatus;
import in.taskfarm.support.TodoFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProgressAggregatorTest {

    private final ProgressAggregator aggregator = new ProgressAggregator();

    @Test
    void testEmptyFarm() {
        FarmProgress progress = aggregator.aggregate(List.of(), List.of("a"));

        assertEquals(0.0, progress.overallCompletion());
        assertEquals(0.0, progress.performanceOf("a"));
        assertTrue(progress.goalProgress().isEmpty());
    }

    @Test
    void testCancelledCountsTowardTotalOnly() {
        List<AgentTodo> todos = List.of(
            TodoFixtures.todo("a", "f").status(TodoStatus.COMPLETED).build(),
            TodoFixtures.todo("a", "f").status(TodoStatus.CANCELLED).build(),
            TodoFixtures.todo("b", "f").status(TodoStatus.PENDING).build(),
            TodoFixtures.todo("b", "f").status(TodoStatus.COMPLETED).build());

        FarmProgress progress = aggregator.aggregate(todos, List.of("a", "b", "c"));

        assertEquals(50.0, progress.overallCompletion(), 1e-9);
        assertEquals(50.0, progress.performanceOf("a"), 1e-9);
        assertEquals(50.0, progress.performanceOf("b"), 1e-9);
        assertEquals(0.0, progress.agentPerformance().get("c"));
        assertEquals(List.of("a", "b", "c"), List.copyOf(progress.agentPerformance().keySet()));
    }

    @Test
    void testDepartedAgentsStillCountTowardOverall() {
        List<AgentTodo> todos = List.of(
            TodoFixtures.todo("gone", "f").status(TodoStatus.COMPLETED).build(),
            TodoFixtures.todo("a", "f").status(TodoStatus.PENDING).build());

        FarmProgress progress = aggregator.aggregate(todos, List.of("a"));

        assertEquals(50.0, progress.overallCompletion(), 1e-9);
        assertFalse(progress.agentPerformance().containsKey("gone"));
    }

    @Test
    void testGoalProgress() {
        List<AgentTodo> todos = List.of(
            TodoFixtures.todo("a", "f").goal("goal-1").status(TodoStatus.COMPLETED).build(),
            TodoFixtures.todo("b", "f").goal("goal-1").build(),
            TodoFixtures.todo("b", "f").goal("goal-1").build(),
            TodoFixtures.todo("b", "f").goal("goal-2").status(TodoStatus.COMPLETED).build(),
            TodoFixtures.todo("b", "f").build());

        FarmProgress progress = aggregator.aggregate(todos, List.of("a", "b"));

        assertEquals(100.0 / 3, progress.goalProgress().get("goal-1"), 1e-9);
        assertEquals(100.0, progress.goalProgress().get("goal-2"), 1e-9);
        assertEquals(2, progress.goalProgress().size());
    }
}
