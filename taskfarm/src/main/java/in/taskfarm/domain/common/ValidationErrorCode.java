package in.taskfarm.domain.common;

/**
 * Validation error codes for todo and farm coordination requests.
 */
public enum ValidationErrorCode {
    // Todo content
    EMPTY_TITLE("Title must not be empty"),
    TITLE_TOO_LONG("Title exceeds maximum length"),
    MISSING_CATEGORY("Category is required"),
    MISSING_PRIORITY("Priority is required"),

    // Ownership and scope
    MISSING_AGENT_ID("Agent id is required"),
    MISSING_FARM_ID("Farm id is required"),
    FARM_REQUIRED_FOR_LEVEL("Group and farm todos require a farm id"),
    FARM_MISMATCH("Todo does not belong to this farm"),
    AGENT_NOT_IN_FARM("Agent is not assigned to this farm"),

    // Bulk commands
    EMPTY_BULK_OPERATION("Bulk operation contains no todos"),
    NO_TARGET_AGENTS("At least one target agent is required"),
    BULK_TOO_LARGE("Bulk operation exceeds maximum size"),
    MISSING_STATUS("Target status is required"),

    // Lifecycle
    ILLEGAL_STATUS_TRANSITION("Status transition not allowed"),
    NOT_TODO_OWNER("Only the owning agent or the farm coordinator may change this todo"),

    // Goals
    MISSING_GOAL_NAME("Goal name is required"),

    // Transport
    MALFORMED_REQUEST("Request body could not be parsed");

    private final String message;

    ValidationErrorCode(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
