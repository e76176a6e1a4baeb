package in.taskfarm.domain.common;

public class TodoNotFoundException extends CoordinationException {

    private final String todoId;

    public TodoNotFoundException(String todoId) {
        super("Todo not found: " + todoId);
        this.todoId = todoId;
    }

    public String getTodoId() {
        return todoId;
    }
}
