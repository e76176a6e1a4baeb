package in.taskfarm.domain.command;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.taskfarm.domain.todo.TodoContext;

import java.time.Instant;

/**
 * Farm goal that todos are derived from. {@code priority} uses goal wording
 * (low, medium, high, urgent). Target value, strategy and instructions travel
 * to every derived todo as its context.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FarmGoal(
    @JsonProperty("goalId")
    String goalId,

    @JsonProperty("name")
    String name,

    @JsonProperty("description")
    String description,

    @JsonProperty("priority")
    String priority,

    @JsonProperty("targetDate")
    Instant targetDate,

    @JsonProperty("targetValue")
    Double targetValue,

    @JsonProperty("strategy")
    String strategy,

    @JsonProperty("customInstructions")
    String customInstructions
) {
    @JsonIgnore
    public TodoContext todoContext() {
        return TodoContext.normalize(new TodoContext(targetValue, strategy, customInstructions));
    }
}
