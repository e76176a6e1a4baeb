package in.taskfarm.domain.todo;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Completion progress of a single todo: a percentage and the steps recorded so far.
 */
public record TodoProgress(
    @JsonProperty("percentage")
    int percentage,

    @JsonProperty("steps")
    List<String> steps
) {
    public static final int COMPLETE = 100;

    public TodoProgress {
        if (percentage < 0 || percentage > COMPLETE) {
            throw new IllegalArgumentException("Progress percentage out of range: " + percentage);
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static TodoProgress notStarted() {
        return new TodoProgress(0, List.of());
    }

    public TodoProgress completed() {
        return new TodoProgress(COMPLETE, steps);
    }
}
