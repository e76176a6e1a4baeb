package in.taskfarm.domain.todo;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Working context carried by a todo. Todos derived from a farm goal get the
 * goal's target, strategy and instructions here. All fields are optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TodoContext(
    @JsonProperty("targetValue")
    Double targetValue,

    @JsonProperty("strategy")
    String strategy,

    @JsonProperty("customInstructions")
    String customInstructions
) {
    /**
     * Trimmed copy, or null when nothing is set.
     */
    public static TodoContext normalize(TodoContext context) {
        if (context == null) {
            return null;
        }
        TodoContext clean = new TodoContext(context.targetValue,
            trimToNull(context.strategy), trimToNull(context.customInstructions));
        return clean.isEmpty() ? null : clean;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return targetValue == null && strategy == null && customInstructions == null;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
