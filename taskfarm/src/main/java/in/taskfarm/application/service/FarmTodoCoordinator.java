package in.taskfarm.application.service;

import in.taskfarm.application.monitoring.AlertService;
import in.taskfarm.application.port.input.FarmTodoService;
import in.taskfarm.application.port.output.FarmRosterRepository;
import in.taskfarm.application.port.output.TodoRepository;
import in.taskfarm.config.CoordinationConfig;
import in.taskfarm.domain.command.BulkAssignRequest;
import in.taskfarm.domain.command.BulkTodoOperation;
import in.taskfarm.domain.command.FarmGoal;
import in.taskfarm.domain.common.CoordinationConflictException;
import in.taskfarm.domain.common.PartialRollbackException;
import in.taskfarm.domain.common.TodoEventType;
import in.taskfarm.domain.common.TodoNotFoundException;
import in.taskfarm.domain.common.TodoStoreException;
import in.taskfarm.domain.common.TodoValidationException;
import in.taskfarm.domain.common.ValidationErrorCode;
import in.taskfarm.domain.farm.FarmTodoCoordination;
import in.taskfarm.domain.farm.MoveSet;
import in.taskfarm.domain.farm.TaskMove;
import in.taskfarm.domain.farm.TodoUpdateResult;
import in.taskfarm.domain.todo.AgentTodo;
import in.taskfarm.domain.todo.AgentTodoList;
import in.taskfarm.domain.todo.CreateTodoRequest;
import in.taskfarm.domain.todo.HierarchyLevel;
import in.taskfarm.domain.todo.TodoCategory;
import in.taskfarm.domain.todo.TodoFilter;
import in.taskfarm.domain.todo.TodoPriority;
import in.taskfarm.domain.todo.TodoStatus;
import in.taskfarm.infrastructure.metrics.CoordinationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * FarmTodoCoordinator - single owner of farm todo state.
 *
 * EXECUTION MODEL:
 * Every mutation is routed to the farm's writer partition through
 * {@link FarmWriteCoordinator} and ends by rebuilding and publishing the farm
 * snapshot. Reads are served from {@link FarmSnapshotCache}; a miss is rebuilt
 * on the farm's partition so a reader never sees a half-applied bulk write.
 *
 * REASSIGNMENT (rebalance, optimize):
 * The proposal is computed off-partition from the committed snapshot, then
 * applied on the partition only if the snapshot version is unchanged and every
 * moved todo still has the owner, status and updatedAt the proposal saw.
 * Otherwise the proposal is recomputed, up to maxConflictRetries attempts.
 *
 * FAILURES:
 * - Validation problems surface before any write.
 * - A mutation has a write phase and a publish phase (snapshot rebuild, events).
 *   Store failures are retried via {@link StoreRetryPolicy}. A write that failed
 *   has already been rolled back by {@link AssignmentEngine} and runs again; a
 *   write that committed never runs again, only its publish phase is repeated.
 * - A failed rollback raises a CRITICAL alert and is rethrown, never retried.
 */
public final class FarmTodoCoordinator implements FarmTodoService {
    private static final Logger log = LoggerFactory.getLogger(FarmTodoCoordinator.class);

    private static final String GOAL_TITLE_PREFIX = "Goal: ";
    private static final String GOAL_DESCRIPTION_PREFIX = "Work towards achieving goal: ";

    private final TodoRepository todoRepo;
    private final FarmRosterRepository rosterRepo;
    private final FarmWriteCoordinator writer;
    private final FarmSnapshotCache cache;
    private final FarmSnapshotBuilder snapshotBuilder;
    private final AssignmentEngine engine;
    private final WorkloadBalancer balancer;
    private final AssignmentOptimizer optimizer;
    private final TodoRequestValidator validator;
    private final TodoEventService events;
    private final AlertService alerts;
    private final CoordinationMetrics metrics;
    private final Supplier<CoordinationConfig> config;
    private final Clock clock;

    public FarmTodoCoordinator(
            TodoRepository todoRepo,
            FarmRosterRepository rosterRepo,
            FarmWriteCoordinator writer,
            FarmSnapshotCache cache,
            FarmSnapshotBuilder snapshotBuilder,
            AssignmentEngine engine,
            WorkloadBalancer balancer,
            AssignmentOptimizer optimizer,
            TodoRequestValidator validator,
            TodoEventService events,
            AlertService alerts,
            CoordinationMetrics metrics,
            Supplier<CoordinationConfig> config,
            Clock clock) {
        this.todoRepo = todoRepo;
        this.rosterRepo = rosterRepo;
        this.writer = writer;
        this.cache = cache;
        this.snapshotBuilder = snapshotBuilder;
        this.engine = engine;
        this.balancer = balancer;
        this.optimizer = optimizer;
        this.validator = validator;
        this.events = events;
        this.alerts = alerts;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // READS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public FarmTodoCoordination getFarmTodos(String farmId) {
        String farm = validator.requireFarmId(farmId);
        return observe("getFarmTodos", farm, () -> committedSnapshot(farm));
    }

    @Override
    public AgentTodoList getAgentTodos(String agentId, TodoFilter filter) {
        String agent = validator.requireAgentId(agentId);
        TodoFilter f = filter == null ? TodoFilter.none() : filter;

        return observe("getAgentTodos", FarmWriteCoordinator.agentKey(agent), () -> {
            List<AgentTodo> stored = retryPolicy().execute("getAgentTodos", () -> todoRepo.listByAgent(agent));

            // Farm todos come from the committed farm snapshot, individual todos from the store
            Set<String> farms = new LinkedHashSet<>();
            List<AgentTodo> result = new ArrayList<>();
            for (AgentTodo todo : stored) {
                if (todo.farmId() == null) {
                    result.add(todo);
                } else {
                    farms.add(todo.farmId());
                }
            }
            if (f.farmId() != null) {
                farms.add(f.farmId());
            }
            for (String farm : farms) {
                result.addAll(agentTodosIn(committedSnapshot(farm), agent));
            }

            List<AgentTodo> filtered = result.stream().filter(f::matches).toList();
            return AgentTodoList.of(agent, filtered, clock.instant());
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // CREATION
    // ═══════════════════════════════════════════════════════════════

    @Override
    public FarmTodoCoordination createTodo(CreateTodoRequest request) {
        CreateTodoRequest clean = validator.validateCreate(request);
        String farm = validator.requireFarmId(clean.farmId());

        AgentTodo todo = AgentTodo.create(clean, clock.instant());
        return mutate("createTodo", farm, () -> createWithEnrollment("createTodo", farm, List.of(todo)), joined -> {
            FarmTodoCoordination snapshot = rebuild(farm);

            emitJoined(farm, joined, clean.assignedBy());
            events.emitTodo(TodoEventType.TODO_CREATED, farm, todo.agentId(), todo.id(), todo, clean.assignedBy());
            log.info("Todo {} created for agent {} in farm {}", todo.id(), todo.agentId(), farm);
            return snapshot;
        });
    }

    @Override
    public AgentTodoList createAgentTodo(CreateTodoRequest request) {
        CreateTodoRequest clean = validator.validateCreate(request);
        if (clean.farmId() != null) {
            FarmTodoCoordination snapshot = createTodo(clean);
            return AgentTodoList.of(clean.agentId(), agentTodosIn(snapshot, clean.agentId()), clock.instant());
        }

        String key = FarmWriteCoordinator.agentKey(clean.agentId());
        AgentTodo todo = AgentTodo.create(clean, clock.instant());
        return observe("createAgentTodo", key, () -> commitThenPublish("createAgentTodo", key, null,
            () -> engine.createAll("createAgentTodo", List.of(todo)),
            created -> {
                List<AgentTodo> individual = todoRepo.listByAgent(clean.agentId()).stream()
                    .filter(t -> t.farmId() == null)
                    .toList();
                events.emitTodo(TodoEventType.TODO_CREATED, null, todo.agentId(), todo.id(), todo, clean.assignedBy());
                return AgentTodoList.of(clean.agentId(), individual, clock.instant());
            }));
    }

    @Override
    public FarmTodoCoordination bulkAssign(String farmId, BulkAssignRequest request) {
        String farm = validator.requireFarmId(farmId);
        List<AgentTodo> todos = engine.expand(farm, request);

        return mutate("bulkAssign", farm, () -> createWithEnrollment("bulkAssign", farm, todos), joined -> {
            FarmTodoCoordination snapshot = rebuild(farm);

            emitJoined(farm, joined, AgentTodo.FARM_COORDINATOR);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("title", todos.get(0).title());
            payload.put("todoIds", todos.stream().map(AgentTodo::id).toList());
            payload.put("agentIds", todos.stream().map(AgentTodo::agentId).toList());
            events.emitFarm(TodoEventType.TODOS_BULK_ASSIGNED, farm, payload, AgentTodo.FARM_COORDINATOR);

            log.info("Bulk assigned '{}' to {} agents in farm {}", todos.get(0).title(), todos.size(), farm);
            return snapshot;
        });
    }

    @Override
    public FarmTodoCoordination createTodosFromGoal(String farmId, FarmGoal goal, List<String> agentIds) {
        String farm = validator.requireFarmId(farmId);
        validator.validateGoal(goal, agentIds);

        TodoPriority priority = TodoPriority.fromGoalPriority(goal.priority());
        String description = goal.description() != null && !goal.description().isBlank()
            ? goal.description().trim()
            : goal.name().trim();

        Instant now = clock.instant();
        List<AgentTodo> todos = new ArrayList<>();
        for (String agentId : new LinkedHashSet<>(agentIds)) {
            if (agentId == null || agentId.isBlank()) {
                continue;
            }
            CreateTodoRequest perAgent = new CreateTodoRequest(
                agentId,
                farm,
                GOAL_TITLE_PREFIX + goal.name().trim(),
                GOAL_DESCRIPTION_PREFIX + description,
                TodoCategory.GOAL,
                priority,
                HierarchyLevel.FARM,
                AgentTodo.SYSTEM_ACTOR,
                goal.targetDate(),
                goal.goalId(),
                null,
                goal.todoContext()
            );
            todos.add(AgentTodo.create(validator.validateFarmCreate(farm, perAgent), now));
        }

        return mutate("createTodosFromGoal", farm,
            () -> createWithEnrollment("createTodosFromGoal", farm, todos), joined -> {
            FarmTodoCoordination snapshot = rebuild(farm);

            emitJoined(farm, joined, AgentTodo.SYSTEM_ACTOR);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("goalId", goal.goalId() == null ? "" : goal.goalId());
            payload.put("todoIds", todos.stream().map(AgentTodo::id).toList());
            payload.put("agentIds", todos.stream().map(AgentTodo::agentId).toList());
            events.emitFarm(TodoEventType.TODOS_BULK_ASSIGNED, farm, payload, AgentTodo.SYSTEM_ACTOR);

            log.info("Created {} todos from goal {} in farm {}", todos.size(), goal.goalId(), farm);
            return snapshot;
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // BULK OPERATIONS AND STATUS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public FarmTodoCoordination bulkOperation(BulkTodoOperation operation) {
        Objects.requireNonNull(operation, "operation");
        String farm = operation.farmId();
        validator.validateBulkSize(operation.size());

        return switch (operation.type()) {
            case CREATE -> bulkCreate(farm, operation);
            case UPDATE -> bulkUpdate(farm, operation);
            case DELETE -> bulkDelete(farm, operation);
        };
    }

    private FarmTodoCoordination bulkCreate(String farm, BulkTodoOperation operation) {
        List<AgentTodo> todos = engine.prepareCreates(farm, operation.creates());

        return mutate("bulkOperation", farm, () -> createWithEnrollment("bulkOperation", farm, todos), joined -> {
            FarmTodoCoordination snapshot = rebuild(farm);

            emitJoined(farm, joined, operation.actor());
            for (AgentTodo todo : todos) {
                events.emitTodo(TodoEventType.TODO_CREATED, farm, todo.agentId(), todo.id(), todo, todo.assignedBy());
            }
            log.info("Bulk created {} todos in farm {}", todos.size(), farm);
            return snapshot;
        });
    }

    private FarmTodoCoordination bulkUpdate(String farm, BulkTodoOperation operation) {
        Supplier<List<AgentTodo>> write = () -> engine.applyStatus("bulkOperation",
            loadFarmTodos(farm, operation.todoIds()), operation.targetStatus(), operation.actor());

        return mutate("bulkOperation", farm, write, updated -> {
            FarmTodoCoordination snapshot = rebuild(farm);

            for (AgentTodo todo : updated) {
                emitStatusChange(todo, operation.actor());
            }
            log.info("Bulk moved {} todos to {} in farm {}", updated.size(),
                operation.targetStatus().wireName(), farm);
            return snapshot;
        });
    }

    private FarmTodoCoordination bulkDelete(String farm, BulkTodoOperation operation) {
        Supplier<List<AgentTodo>> write = () -> engine.deleteAll("bulkOperation",
            loadFarmTodos(farm, operation.todoIds()));

        return mutate("bulkOperation", farm, write, deleted -> {
            FarmTodoCoordination snapshot = rebuild(farm);

            events.emitFarm(TodoEventType.TODOS_DELETED, farm,
                Map.of("todoIds", operation.todoIds()), operation.actor());
            log.info("Bulk deleted {} todos in farm {}", deleted.size(), farm);
            return snapshot;
        });
    }

    @Override
    public TodoUpdateResult updateTodoStatus(String todoId, TodoStatus status, String actor) {
        if (todoId == null || todoId.isBlank()) {
            throw new TodoNotFoundException(String.valueOf(todoId));
        }
        AgentTodo existing = retryPolicy().execute("updateTodoStatus",
            () -> todoRepo.get(todoId)).orElseThrow(() -> new TodoNotFoundException(todoId));
        String farm = existing.farmId();
        String key = farm != null ? FarmWriteCoordinator.farmKey(farm) : FarmWriteCoordinator.agentKey(existing.agentId());

        Supplier<AgentTodo> write = () -> {
            AgentTodo current = todoRepo.get(todoId).orElseThrow(() -> new TodoNotFoundException(todoId));
            if (AgentTodo.FARM_COORDINATOR.equals(actor) && !actor.equals(current.agentId())) {
                log.info("Coordinator override: {} moves todo {} of agent {} to {}",
                    actor, todoId, current.agentId(), status == null ? null : status.wireName());
            }
            return engine.applyStatus("updateTodoStatus", List.of(current), status, actor).get(0);
        };

        return observe("updateTodoStatus", key, () -> commitThenPublish("updateTodoStatus", key, farm, write,
            updated -> {
                FarmTodoCoordination snapshot = farm != null ? rebuild(farm) : null;
                emitStatusChange(updated, actor);
                return new TodoUpdateResult(updated, snapshot);
            }));
    }

    // ═══════════════════════════════════════════════════════════════
    // REASSIGNMENT
    // ═══════════════════════════════════════════════════════════════

    @Override
    public FarmTodoCoordination rebalanceWorkload(String farmId) {
        String farm = validator.requireFarmId(farmId);
        return reassign("rebalanceWorkload", farm, balancer::rebalance, TodoEventType.WORKLOAD_REBALANCED);
    }

    @Override
    public FarmTodoCoordination optimizeAssignments(String farmId) {
        String farm = validator.requireFarmId(farmId);
        return reassign("optimizeAssignments", farm, optimizer::optimize, TodoEventType.ASSIGNMENTS_OPTIMIZED);
    }

    @Override
    public FarmTodoCoordination updatePriorities(String farmId) {
        String farm = validator.requireFarmId(farmId);
        return mutate("updatePriorities", farm, () -> null, nothing -> {
            FarmTodoCoordination snapshot = rebuild(farm);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("version", snapshot.version());
            payload.put("immediate", snapshot.priorities().immediate().size());
            payload.put("planned", snapshot.priorities().planned().size());
            payload.put("longTerm", snapshot.priorities().longTerm().size());
            events.emitFarm(TodoEventType.PRIORITIES_UPDATED, farm, payload, AgentTodo.FARM_COORDINATOR);
            return snapshot;
        });
    }

    private FarmTodoCoordination reassign(String operation, String farm,
                                          Function<FarmTodoCoordination, MoveSet> proposer,
                                          TodoEventType eventType) {
        String key = FarmWriteCoordinator.farmKey(farm);
        return observe(operation, key, () -> {
            int maxAttempts = config.get().maxConflictRetries();
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                FarmTodoCoordination snapshot = committedSnapshot(farm);
                MoveSet proposal = proposer.apply(snapshot);
                if (proposal.isEmpty()) {
                    log.info("{} for farm {}: nothing to move (version {})", operation, farm, snapshot.version());
                    return snapshot;
                }

                Optional<FarmTodoCoordination> applied = commitThenPublish(operation, key, farm,
                    () -> applyMoves(operation, farm, proposal),
                    moved -> moved
                        ? Optional.of(publishMoves(operation, farm, proposal, eventType))
                        : Optional.empty());
                if (applied.isPresent()) {
                    return applied.get();
                }

                metrics.recordConflictRetry(operation);
                log.info("{} for farm {}: proposal on version {} is stale, attempt {}/{}",
                    operation, farm, proposal.basedOnVersion(), attempt, maxAttempts);
            }
            log.warn("{} for farm {} gave up after {} conflicting attempts", operation, farm, maxAttempts);
            throw new CoordinationConflictException(farm, maxAttempts);
        });
    }

    /**
     * Apply a proposal if nothing it depends on has changed. Runs on the farm's
     * partition.
     *
     * @return false when the proposal is stale
     */
    private boolean applyMoves(String operation, String farm, MoveSet proposal) {
        if (cache.currentVersion(farm) != proposal.basedOnVersion()) {
            return false;
        }

        Set<String> roster = new HashSet<>(rosterRepo.listAgents(farm));
        List<AgentTodo> current = new ArrayList<>(proposal.size());
        for (TaskMove move : proposal.moves()) {
            Optional<AgentTodo> stored = todoRepo.get(move.taskId());
            if (stored.isEmpty() || !stillMovable(stored.get(), farm, move) || !roster.contains(move.toAgent())) {
                log.debug("Move of {} is stale", move.taskId());
                return false;
            }
            current.add(stored.get());
        }

        engine.applyMoves(operation, current, proposal.moves());
        metrics.recordMoves(operation, proposal.size());
        return true;
    }

    private FarmTodoCoordination publishMoves(String operation, String farm, MoveSet proposal,
                                              TodoEventType eventType) {
        FarmTodoCoordination snapshot = rebuild(farm);

        List<Map<String, Object>> moves = new ArrayList<>();
        for (TaskMove move : proposal.moves()) {
            moves.add(Map.of(
                "taskId", move.taskId(),
                "fromAgent", move.fromAgent(),
                "toAgent", move.toAgent(),
                "reason", move.reason()));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("version", snapshot.version());
        payload.put("moves", moves);
        events.emitFarm(eventType, farm, payload, AgentTodo.FARM_COORDINATOR);

        log.info("{} for farm {}: applied {} moves, now version {}",
            operation, farm, proposal.size(), snapshot.version());
        return snapshot;
    }

    private static boolean stillMovable(AgentTodo stored, String farm, TaskMove move) {
        return farm.equals(stored.farmId())
            && stored.isPending()
            && stored.agentId().equals(move.fromAgent())
            && stored.updatedAt().equals(move.expectedUpdatedAt());
    }

    // ═══════════════════════════════════════════════════════════════
    // ROSTER
    // ═══════════════════════════════════════════════════════════════

    @Override
    public FarmTodoCoordination addAgentToFarm(String farmId, String agentId) {
        String farm = validator.requireFarmId(farmId);
        String agent = validator.requireAgentId(agentId);

        return mutate("addAgentToFarm", farm, () -> rosterRepo.addAgent(farm, agent, clock.instant()), added -> {
            FarmTodoCoordination snapshot = rebuild(farm);
            if (added) {
                emitJoined(farm, List.of(agent), AgentTodo.FARM_COORDINATOR);
                log.info("Agent {} joined farm {}", agent, farm);
            }
            return snapshot;
        });
    }

    @Override
    public FarmTodoCoordination removeAgentFromFarm(String farmId, String agentId) {
        String farm = validator.requireFarmId(farmId);
        String agent = validator.requireAgentId(agentId);

        Supplier<Boolean> write = () -> {
            if (!rosterRepo.removeAgent(farm, agent, clock.instant())) {
                throw new TodoValidationException(ValidationErrorCode.AGENT_NOT_IN_FARM, agent);
            }
            return true;
        };

        return mutate("removeAgentFromFarm", farm, write, removed -> {
            FarmTodoCoordination snapshot = rebuild(farm);

            long orphaned = snapshot.orphanedTodos().stream().filter(t -> agent.equals(t.agentId())).count();
            events.emitTodo(TodoEventType.AGENT_LEFT_FARM, farm, agent, null,
                Map.of("agentId", agent, "orphanedTodos", orphaned), AgentTodo.FARM_COORDINATOR);
            log.info("Agent {} left farm {}, {} open todos await reassignment", agent, farm, orphaned);
            return snapshot;
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    /**
     * Persist {@code todos} atomically and enroll owners missing from the roster.
     * Enrollment happens first and is undone if the todo write fails.
     *
     * @return agents that were newly enrolled
     */
    private List<String> createWithEnrollment(String operation, String farm, List<AgentTodo> todos) {
        Instant now = clock.instant();
        List<String> joined = new ArrayList<>();
        Set<String> owners = new LinkedHashSet<>();
        for (AgentTodo todo : todos) {
            owners.add(todo.agentId());
        }

        try {
            for (String owner : owners) {
                if (!rosterRepo.isMember(farm, owner) && rosterRepo.addAgent(farm, owner, now)) {
                    joined.add(owner);
                }
            }
            engine.createAll(operation, todos);
            return joined;
        } catch (RuntimeException e) {
            for (String agent : joined) {
                try {
                    rosterRepo.removeAgent(farm, agent, now);
                } catch (RuntimeException undo) {
                    log.warn("Could not undo enrollment of {} in farm {}: {}", agent, farm, undo.getMessage());
                }
            }
            throw e;
        }
    }

    private List<AgentTodo> loadFarmTodos(String farm, List<String> todoIds) {
        List<AgentTodo> todos = new ArrayList<>(todoIds.size());
        for (String todoId : todoIds) {
            AgentTodo todo = todoRepo.get(todoId).orElseThrow(() -> new TodoNotFoundException(todoId));
            if (!farm.equals(todo.farmId())) {
                throw new TodoValidationException(ValidationErrorCode.FARM_MISMATCH, todoId);
            }
            todos.add(todo);
        }
        return todos;
    }

    private static List<AgentTodo> agentTodosIn(FarmTodoCoordination snapshot, String agentId) {
        List<AgentTodo> todos = new ArrayList<>();
        AgentTodoList list = snapshot.agentTodoLists().get(agentId);
        if (list != null) {
            todos.addAll(list.todos());
        }
        for (AgentTodo orphan : snapshot.orphanedTodos()) {
            if (agentId.equals(orphan.agentId())) {
                todos.add(orphan);
            }
        }
        return todos;
    }

    private void emitJoined(String farm, List<String> agents, String actor) {
        for (String agent : agents) {
            events.emitTodo(TodoEventType.AGENT_JOINED_FARM, farm, agent, null, Map.of("agentId", agent), actor);
        }
    }

    private void emitStatusChange(AgentTodo todo, String actor) {
        TodoEventType type = todo.status() == TodoStatus.COMPLETED
            ? TodoEventType.TODO_COMPLETED
            : TodoEventType.TODO_UPDATED;
        events.emitTodo(type, todo.farmId(), todo.agentId(), todo.id(), todo, actor);
    }

    /**
     * Committed snapshot, rebuilding on the farm's partition when missing.
     */
    private FarmTodoCoordination committedSnapshot(String farm) {
        Optional<FarmTodoCoordination> cached = cache.get(farm);
        if (cached.isPresent()) {
            return cached.get();
        }
        return retryPolicy().execute("rebuildSnapshot", () -> writer.submit(FarmWriteCoordinator.farmKey(farm),
            () -> cache.get(farm).orElseGet(() -> rebuild(farm))));
    }

    /**
     * Build and publish a new snapshot version. Partition thread only.
     */
    private FarmTodoCoordination rebuild(String farm) {
        FarmTodoCoordination snapshot = snapshotBuilder.build(farm, cache.nextVersion(farm));
        cache.publish(snapshot);
        metrics.setCachedFarms(cache.size());
        return snapshot;
    }

    /**
     * Run a farm mutation on its partition with store retries.
     */
    private <W, T> T mutate(String operation, String farm, Supplier<W> write, Function<W, T> publish) {
        String key = FarmWriteCoordinator.farmKey(farm);
        return observe(operation, key, () -> commitThenPublish(operation, key, farm, write, publish));
    }

    /**
     * Run {@code write} then {@code publish} on the partition for {@code key}.
     * A store failure is retried; once {@code write} has returned it is not run
     * again and a retry repeats {@code publish} only.
     */
    private <W, T> T commitThenPublish(String operation, String key, String farm,
                                       Supplier<W> write, Function<W, T> publish) {
        WriteOnce<W> once = new WriteOnce<>(write);
        return retryPolicy().execute(operation,
            () -> writer.submit(key, guarded(farm, () -> publish.apply(once.get()))));
    }

    /**
     * Drop the farm's cached snapshot when a write fails, so the next read
     * rebuilds from what the store actually holds.
     */
    private <T> Supplier<T> guarded(String farm, Supplier<T> body) {
        return () -> {
            try {
                return body.get();
            } catch (TodoStoreException | PartialRollbackException e) {
                if (farm != null) {
                    cache.invalidate(farm);
                }
                throw e;
            }
        };
    }

    private <T> T observe(String operation, String scopeKey, Supplier<T> action) {
        long start = System.nanoTime();
        String outcome = "success";
        try {
            return action.get();
        } catch (PartialRollbackException e) {
            outcome = e.getClass().getSimpleName();
            metrics.recordPartialRollback(operation);
            alerts.sendPartialRollbackAlert(operation, scopeKey, e);
            throw e;
        } catch (CoordinationConflictException e) {
            outcome = e.getClass().getSimpleName();
            alerts.sendConflictAlert(operation, scopeKey, e);
            throw e;
        } catch (RuntimeException e) {
            outcome = e.getClass().getSimpleName();
            throw e;
        } finally {
            metrics.recordOperation(operation, outcome, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private StoreRetryPolicy retryPolicy() {
        return StoreRetryPolicy.fromConfig(config.get(), metrics::recordStoreRetry);
    }

    /**
     * Write phase that runs until it succeeds once, then returns the committed result.
     */
    private static final class WriteOnce<W> implements Supplier<W> {
        private final Supplier<W> write;
        private boolean committed;
        private W result;

        WriteOnce(Supplier<W> write) {
            this.write = write;
        }

        @Override
        public synchronized W get() {
            if (!committed) {
                result = write.get();
                committed = true;
            }
            return result;
        }
    }
}
