package in.taskfarm.application.service;

import in.taskfarm.config.CoordinationConfig;
import in.taskfarm.domain.command.BulkAssignRequest;
import in.taskfarm.domain.command.FarmGoal;
import in.taskfarm.domain.common.TodoValidationException;
import in.taskfarm.domain.common.ValidationErrorCode;
import in.taskfarm.domain.todo.AgentTodo;
import in.taskfarm.domain.todo.CreateTodoRequest;
import in.taskfarm.domain.todo.HierarchyLevel;
import in.taskfarm.domain.todo.TodoCategory;
import in.taskfarm.domain.todo.TodoPriority;
import in.taskfarm.domain.todo.TodoStatus;
import in.taskfarm.support.TodoFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TodoRequestValidator.
 */
@DisplayName("Todo Request Validator Tests")
class TodoRequestValidatorTest {

    private TodoRequestValidator validator;

    @BeforeEach
    void setUp() {
        validator = new TodoRequestValidator(CoordinationConfig::defaults);
    }

    @Test
    @DisplayName("Create requests are trimmed and defaulted")
    void testCreateDefaults() {
        CreateTodoRequest clean = validator.validateCreate(request("  agent-1 ", "  Check fills  "));

        assertEquals("agent-1", clean.agentId());
        assertEquals("Check fills", clean.title());
        assertEquals(HierarchyLevel.INDIVIDUAL, clean.hierarchyLevel());
        assertEquals(AgentTodo.SYSTEM_ACTOR, clean.assignedBy());
    }

    @Test
    @DisplayName("Titles must be non-empty and at most 200 characters")
    void testTitleBounds() {
        assertCode(ValidationErrorCode.EMPTY_TITLE, () -> validator.validateCreate(request("a", "   ")));
        assertCode(ValidationErrorCode.EMPTY_TITLE, () -> validator.validateCreate(request("a", null)));
        assertCode(ValidationErrorCode.TITLE_TOO_LONG, () -> validator.validateCreate(request("a", "x".repeat(201))));
        assertDoesNotThrow(() -> validator.validateCreate(request("a", "x".repeat(200))));
    }

    @Test
    @DisplayName("Missing required fields are rejected")
    void testRequiredFields() {
        assertCode(ValidationErrorCode.MISSING_AGENT_ID, () -> validator.validateCreate(request(" ", "t")));
        assertCode(ValidationErrorCode.MISSING_CATEGORY, () -> validator.validateCreate(
            new CreateTodoRequest("a", null, "t", null, null, TodoPriority.LOW, null, null, null, null, null, null)));
        assertCode(ValidationErrorCode.MISSING_PRIORITY, () -> validator.validateCreate(
            new CreateTodoRequest("a", null, "t", null, TodoCategory.TRADING, null,
                null, null, null, null, null, null)));
        assertCode(ValidationErrorCode.FARM_REQUIRED_FOR_LEVEL, () -> validator.validateCreate(
            new CreateTodoRequest("a", null, "t", null, TodoCategory.TRADING, TodoPriority.LOW,
                HierarchyLevel.GROUP, null, null, null, null, null)));
    }

    @Test
    @DisplayName("Farm creates are placed in the farm and cannot target another")
    void testFarmCreate() {
        CreateTodoRequest placed = validator.validateFarmCreate("farm-1", request("a", "t"));
        assertEquals("farm-1", placed.farmId());

        assertCode(ValidationErrorCode.FARM_MISMATCH,
            () -> validator.validateFarmCreate("farm-1", request("a", "t").withFarmId("farm-2")));
        assertCode(ValidationErrorCode.MISSING_FARM_ID, () -> validator.validateFarmCreate(" ", request("a", "t")));
    }

    @Test
    @DisplayName("Bulk assign targets are de-duplicated and bounded")
    void testBulkAssignTargets() {
        BulkAssignRequest request = new BulkAssignRequest("Hedge", null, TodoCategory.TRADING, TodoPriority.HIGH,
            null, Arrays.asList("a", " a ", null, "b", ""));

        assertEquals(List.of("a", "b"), validator.validateBulkAssign(request));

        BulkAssignRequest noTargets = new BulkAssignRequest("Hedge", null, TodoCategory.TRADING, TodoPriority.HIGH,
            null, List.of(" "));
        assertCode(ValidationErrorCode.NO_TARGET_AGENTS, () -> validator.validateBulkAssign(noTargets));
    }

    @Test
    @DisplayName("Bulk size limits")
    void testBulkSize() {
        assertCode(ValidationErrorCode.EMPTY_BULK_OPERATION, () -> validator.validateBulkSize(0));
        assertCode(ValidationErrorCode.BULK_TOO_LARGE, () -> validator.validateBulkSize(501));
        assertDoesNotThrow(() -> validator.validateBulkSize(500));
    }

    @Test
    @DisplayName("Only the owner or the farm coordinator may change status")
    void testTransitionAuthority() {
        AgentTodo todo = TodoFixtures.todo("agent-1", "farm-1").build();

        assertDoesNotThrow(() -> validator.validateTransition(todo, TodoStatus.IN_PROGRESS, "agent-1"));
        assertDoesNotThrow(() -> validator.validateTransition(todo, TodoStatus.CANCELLED, AgentTodo.FARM_COORDINATOR));
        assertCode(ValidationErrorCode.NOT_TODO_OWNER,
            () -> validator.validateTransition(todo, TodoStatus.COMPLETED, "agent-2"));
        assertCode(ValidationErrorCode.NOT_TODO_OWNER,
            () -> validator.validateTransition(todo, TodoStatus.COMPLETED, null));
        assertCode(ValidationErrorCode.MISSING_STATUS,
            () -> validator.validateTransition(todo, null, "agent-1"));
    }

    @Test
    @DisplayName("Illegal lifecycle moves are rejected")
    void testIllegalTransition() {
        AgentTodo done = TodoFixtures.todo("agent-1", "farm-1").status(TodoStatus.COMPLETED).build();

        assertCode(ValidationErrorCode.ILLEGAL_STATUS_TRANSITION,
            () -> validator.validateTransition(done, TodoStatus.PENDING, "agent-1"));
    }

    @Test
    @DisplayName("Goals need a name, targets and a known priority")
    void testGoalValidation() {
        FarmGoal goal = new FarmGoal("g1", "Reduce drawdown", null, "urgent", null, null, null, null);

        assertDoesNotThrow(() -> validator.validateGoal(goal, List.of("a")));
        assertCode(ValidationErrorCode.MISSING_GOAL_NAME,
            () -> validator.validateGoal(new FarmGoal("g1", " ", null, null, null, null, null, null), List.of("a")));
        assertCode(ValidationErrorCode.NO_TARGET_AGENTS, () -> validator.validateGoal(goal, List.of()));
        assertCode(ValidationErrorCode.MALFORMED_REQUEST,
            () -> validator.validateGoal(new FarmGoal("g1", "n", null, "someday", null, null, null, null),
                List.of("a")));
    }

    private static CreateTodoRequest request(String agentId, String title) {
        return new CreateTodoRequest(agentId, null, title, null, TodoCategory.TRADING, TodoPriority.MEDIUM,
            null, null, null, null, null, null);
    }

    private static void assertCode(ValidationErrorCode expected, Executable executable) {
        TodoValidationException e = assertThrows(TodoValidationException.class, executable);
        assertEquals(expected, e.getCode());
    }
}
