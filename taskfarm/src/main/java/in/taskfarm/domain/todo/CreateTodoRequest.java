package in.taskfarm.domain.todo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Request to create a single todo.
 *
 * Optional fields are filled in by {@link #withDefaults()}: hierarchy level
 * INDIVIDUAL, assignedBy "system", no dependencies.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateTodoRequest(
    @JsonProperty("agentId")
    String agentId,

    @JsonProperty("farmId")
    String farmId,

    @JsonProperty("title")
    String title,

    @JsonProperty("description")
    String description,

    @JsonProperty("category")
    TodoCategory category,

    @JsonProperty("priority")
    TodoPriority priority,

    @JsonProperty("hierarchyLevel")
    HierarchyLevel hierarchyLevel,

    @JsonProperty("assignedBy")
    String assignedBy,

    @JsonProperty("dueDate")
    Instant dueDate,

    @JsonProperty("goalId")
    String goalId,

    @JsonProperty("dependencies")
    List<String> dependencies,

    @JsonProperty("context")
    TodoContext context
) {
    /**
     * Copy with trimmed text and defaults applied to missing optional fields.
     */
    public CreateTodoRequest withDefaults() {
        return new CreateTodoRequest(
            trimToNull(agentId),
            trimToNull(farmId),
            title == null ? null : title.trim(),
            trimToNull(description),
            category,
            priority,
            hierarchyLevel != null ? hierarchyLevel : HierarchyLevel.INDIVIDUAL,
            assignedBy != null && !assignedBy.isBlank() ? assignedBy.trim() : AgentTodo.SYSTEM_ACTOR,
            dueDate,
            trimToNull(goalId),
            cleanDependencies(dependencies),
            TodoContext.normalize(context)
        );
    }

    public CreateTodoRequest withFarmId(String newFarmId) {
        return new CreateTodoRequest(agentId, newFarmId, title, description, category, priority,
            hierarchyLevel, assignedBy, dueDate, goalId, dependencies, context);
    }

    public CreateTodoRequest withAgentId(String newAgentId) {
        return new CreateTodoRequest(newAgentId, farmId, title, description, category, priority,
            hierarchyLevel, assignedBy, dueDate, goalId, dependencies, context);
    }

    // Trimmed, blanks dropped, first occurrence kept
    private static List<String> cleanDependencies(List<String> ids) {
        if (ids == null) {
            return List.of();
        }
        LinkedHashSet<String> clean = new LinkedHashSet<>();
        for (String id : ids) {
            String trimmed = trimToNull(id);
            if (trimmed != null) {
                clean.add(trimmed);
            }
        }
        return List.copyOf(clean);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
