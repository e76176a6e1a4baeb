package in.taskfarm.application.service;

import in.taskfarm.application.port.output.TodoRepository;
import in.taskfarm.domain.common.PartialRollbackException;
import in.taskfarm.domain.common.TodoStoreException;
import in.taskfarm.domain.todo.AgentTodo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Write log over the todo store for one atomic operation.
 *
 * Every successful write records how to undo it. {@link #rollback()} replays the
 * undo log newest-first: created todos are deleted, replaced and deleted todos
 * are restored to their previous state. The deadline is checked before and after
 * each store call; a write that completes past the deadline is still logged, so
 * the rollback covers it.
 *
 * Not thread-safe: one instance per operation, used from the farm's writer.
 */
public final class CompensatingTodoWriter {
    private static final Logger log = LoggerFactory.getLogger(CompensatingTodoWriter.class);

    private enum UndoAction { DELETE_CREATED, RESTORE_PREVIOUS }

    private record Undo(UndoAction action, String todoId, AgentTodo previous) {
    }

    private final TodoRepository todoRepo;
    private final BulkDeadline deadline;
    private final Deque<Undo> undoLog = new ArrayDeque<>();

    public CompensatingTodoWriter(TodoRepository todoRepo, BulkDeadline deadline) {
        this.todoRepo = todoRepo;
        this.deadline = deadline;
    }

    public void create(AgentTodo todo) {
        deadline.check("before creating " + todo.id());
        store(() -> todoRepo.put(todo), "create " + todo.id());
        undoLog.push(new Undo(UndoAction.DELETE_CREATED, todo.id(), null));
        deadline.check("after creating " + todo.id());
    }

    public void replace(AgentTodo previous, AgentTodo updated) {
        deadline.check("before updating " + updated.id());
        store(() -> todoRepo.put(updated), "update " + updated.id());
        undoLog.push(new Undo(UndoAction.RESTORE_PREVIOUS, previous.id(), previous));
        deadline.check("after updating " + updated.id());
    }

    public void delete(AgentTodo previous) {
        deadline.check("before deleting " + previous.id());
        store(() -> todoRepo.delete(previous.id()), "delete " + previous.id());
        undoLog.push(new Undo(UndoAction.RESTORE_PREVIOUS, previous.id(), previous));
        deadline.check("after deleting " + previous.id());
    }

    public int writeCount() {
        return undoLog.size();
    }

    /**
     * Undo every logged write, newest first. Keeps going past individual
     * failures so as much as possible is restored.
     *
     * @throws PartialRollbackException listing the todos that could not be undone
     */
    public void rollback() {
        if (undoLog.isEmpty()) {
            return;
        }
        log.warn("Rolling back {} todo writes", undoLog.size());

        List<String> failed = new ArrayList<>();
        RuntimeException firstFailure = null;

        while (!undoLog.isEmpty()) {
            Undo undo = undoLog.pop();
            try {
                switch (undo.action()) {
                    case DELETE_CREATED -> todoRepo.delete(undo.todoId());
                    case RESTORE_PREVIOUS -> todoRepo.put(undo.previous());
                }
            } catch (RuntimeException e) {
                log.error("Rollback of todo {} failed: {}", undo.todoId(), e.getMessage());
                failed.add(undo.todoId());
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }

        if (!failed.isEmpty()) {
            throw new PartialRollbackException("Rollback incomplete", failed, firstFailure);
        }
        log.info("Rollback complete");
    }

    private static void store(Runnable write, String description) {
        try {
            write.run();
        } catch (TodoStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TodoStoreException("Store write failed: " + description, e);
        }
    }
}
