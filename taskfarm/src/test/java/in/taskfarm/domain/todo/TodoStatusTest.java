package in.taskfarm.domain.todo;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TodoStatusTest {

    @Test
    void testPendingCanMoveAnywhereElse() {
        assertTrue(TodoStatus.PENDING.canTransitionTo(TodoStatus.IN_PROGRESS));
        assertTrue(TodoStatus.PENDING.canTransitionTo(TodoStatus.COMPLETED));
        assertTrue(TodoStatus.PENDING.canTransitionTo(TodoStatus.CANCELLED));
        assertFalse(TodoStatus.PENDING.canTransitionTo(TodoStatus.PENDING));
    }

    @Test
    void testInProgressCannotGoBackToPending() {
        assertFalse(TodoStatus.IN_PROGRESS.canTransitionTo(TodoStatus.PENDING));
        assertFalse(TodoStatus.IN_PROGRESS.canTransitionTo(TodoStatus.IN_PROGRESS));
        assertTrue(TodoStatus.IN_PROGRESS.canTransitionTo(TodoStatus.COMPLETED));
        assertTrue(TodoStatus.IN_PROGRESS.canTransitionTo(TodoStatus.CANCELLED));
    }

    @Test
    void testTerminalStatesAreFinal() {
        for (TodoStatus target : TodoStatus.values()) {
            assertFalse(TodoStatus.COMPLETED.canTransitionTo(target));
            assertFalse(TodoStatus.CANCELLED.canTransitionTo(target));
        }
        assertFalse(TodoStatus.PENDING.canTransitionTo(null));
    }

    @Test
    void testWireNames() {
        assertEquals(TodoStatus.IN_PROGRESS, TodoStatus.fromWire("inProgress"));
        assertEquals(TodoStatus.IN_PROGRESS, TodoStatus.fromWire("in_progress"));
        assertEquals("completed", TodoStatus.COMPLETED.wireName());
        assertThrows(IllegalArgumentException.class, () -> TodoStatus.fromWire("done"));
    }

    @Test
    void testGoalPriorityMapping() {
        assertEquals(TodoPriority.CRITICAL, TodoPriority.fromGoalPriority("urgent"));
        assertEquals(TodoPriority.HIGH, TodoPriority.fromGoalPriority("high"));
        assertEquals(TodoPriority.MEDIUM, TodoPriority.fromGoalPriority(null));
        assertThrows(IllegalArgumentException.class, () -> TodoPriority.fromGoalPriority("someday"));
    }
}
