package in.taskfarm.domain.command;

import in.taskfarm.domain.common.TodoValidationException;
import in.taskfarm.domain.common.ValidationErrorCode;
import in.taskfarm.domain.todo.AgentTodo;
import in.taskfarm.domain.todo.TodoStatus;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BulkTodoOperationTest {

    @Test
    void testIdsAreDeduplicatedAndActorDefaults() {
        BulkTodoOperation op = BulkTodoOperation.update("farm-1",
            Arrays.asList("t1", " t1", "t2", null, ""), TodoStatus.CANCELLED, " ");

        assertEquals(List.of("t1", "t2"), op.todoIds());
        assertEquals(AgentTodo.FARM_COORDINATOR, op.actor());
        assertEquals(2, op.size());
    }

    @Test
    void testShapeIsCheckedAtConstruction() {
        TodoValidationException noFarm = assertThrows(TodoValidationException.class,
            () -> BulkTodoOperation.delete(null, List.of("t1")));
        assertEquals(ValidationErrorCode.MISSING_FARM_ID, noFarm.getCode());

        TodoValidationException empty = assertThrows(TodoValidationException.class,
            () -> BulkTodoOperation.create("farm-1", List.of()));
        assertEquals(ValidationErrorCode.EMPTY_BULK_OPERATION, empty.getCode());

        TodoValidationException noStatus = assertThrows(TodoValidationException.class,
            () -> BulkTodoOperation.update("farm-1", List.of("t1"), null, null));
        assertEquals(ValidationErrorCode.MISSING_STATUS, noStatus.getCode());
    }

    @Test
    void testWireNames() {
        assertEquals(BulkOperationType.DELETE, BulkOperationType.fromWire("delete"));
        assertThrows(IllegalArgumentException.class, () -> BulkOperationType.fromWire("upsert"));
    }
}
