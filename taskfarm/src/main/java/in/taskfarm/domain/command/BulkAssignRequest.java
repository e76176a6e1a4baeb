package in.taskfarm.domain.command;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.taskfarm.domain.todo.TodoCategory;
import in.taskfarm.domain.todo.TodoPriority;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * "Same task to many agents": one template expanded into a GROUP todo per
 * distinct target agent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BulkAssignRequest(
    @JsonProperty("title")
    String title,

    @JsonProperty("description")
    String description,

    @JsonProperty("category")
    TodoCategory category,

    @JsonProperty("priority")
    TodoPriority priority,

    @JsonProperty("dueDate")
    Instant dueDate,

    @JsonProperty("agentIds")
    List<String> agentIds
) {
    /**
     * Target agents in request order with blanks dropped and duplicates collapsed.
     */
    public List<String> distinctAgentIds() {
        if (agentIds == null) {
            return List.of();
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String agentId : agentIds) {
            if (agentId != null && !agentId.isBlank()) {
                unique.add(agentId.trim());
            }
        }
        return new ArrayList<>(unique);
    }
}
