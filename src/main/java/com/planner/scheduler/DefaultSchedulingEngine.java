package com.planner.scheduler;

import com.planner.config.PlannerConfig;
import com.planner.core.Task;
import com.planner.estimate.Estimate;
import com.planner.estimate.HeuristicEstimator;
import com.planner.estimate.NaturalLanguageParser;
import com.planner.estimate.ParsedTask;
import com.planner.exception.DeadlineParseException;
import com.planner.exception.DependencyException;
import com.planner.exception.SnapshotFormatException;
import com.planner.snapshot.Snapshot;
import com.planner.snapshot.SnapshotCodec;
import com.planner.store.InMemoryTaskStore;
import com.planner.store.TaskStore;
import com.planner.store.TaskUpdate;
import com.planner.time.DeadlineParser;
import com.planner.time.DefaultDeadlineParser;
import com.planner.time.IdGenerator;
import com.planner.time.UuidIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory scheduling engine over a single owned {@link TaskStore}.
 * <p>
 * Tasks handed to callers are detached copies taken under the lock; changing
 * one has no effect on the engine.
 * <p>
 * Every mutation runs under the write lock together with the index rebuild it
 * triggers. {@link #peekNext()} and {@link #popNext()} also take the write lock
 * because they discard stale heap entries. Pure reads share the read lock.
 */
public class DefaultSchedulingEngine implements SchedulingEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultSchedulingEngine.class);

    private final TaskStore store;
    private final DeadlineParser deadlineParser;
    private final IdGenerator idGenerator;
    private final Clock clock;
    private final HeuristicEstimator estimator;
    private final NaturalLanguageParser naturalLanguageParser;
    private final GlobalScheduleRanker ranker;
    private final SnapshotCodec codec;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public DefaultSchedulingEngine(PlannerConfig config, Clock clock) {
        this(new InMemoryTaskStore(),
                new DefaultDeadlineParser(clock, config.zone()),
                new UuidIdGenerator(),
                clock,
                config.prettyPrintSnapshot());
    }

    public DefaultSchedulingEngine(TaskStore store,
                                   DeadlineParser deadlineParser,
                                   IdGenerator idGenerator,
                                   Clock clock,
                                   boolean prettyPrintSnapshot) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.deadlineParser = Objects.requireNonNull(deadlineParser, "deadlineParser cannot be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.estimator = new HeuristicEstimator(clock);
        this.naturalLanguageParser = new NaturalLanguageParser(clock);
        this.ranker = new GlobalScheduleRanker(clock);
        this.codec = new SnapshotCodec(idGenerator, clock, prettyPrintSnapshot);

        log.info("DefaultSchedulingEngine initialized with {} tasks", store.size());
    }

    @Override
    public Task createTask(CreateTaskRequest request) {
        Objects.requireNonNull(request, "request cannot be null");

        String title = request.getTitle();
        String description = request.getDescription();
        String deadlineText = request.getDeadlineText();
        Integer priority = request.getPriority();
        Instant inferredDeadline = null;

        if (request.isNaturalLanguageAssist()) {
            String text = description.isEmpty() ? title : title + " " + description;
            ParsedTask parsed = naturalLanguageParser.parse(text);
            title = parsed.title();
            description = parsed.description();
            if (parsed.deadline() != null && isBlank(deadlineText)) {
                inferredDeadline = parsed.deadline();
            }
            if (parsed.urgent() && priority == null) {
                priority = 1;
            }
        }

        // Parse before taking the lock so a bad deadline never touches the store
        Instant deadline = isBlank(deadlineText) ? inferredDeadline : resolveDeadline(deadlineText);

        Task task = new Task(idGenerator.newId(), clock.instant());
        task.setTitle(title);
        task.setDescription(description);
        if (priority == null) {
            Estimate estimate = estimator.estimate(title, description, deadline);
            task.setPriority(estimate.priority());
            task.setDeadline(estimate.deadline());
            task.setTags(estimate.tags());
            task.setEstimatedEffortMinutes(estimate.estimatedEffortMinutes());
            task.setAutoAssigned(true);
        } else {
            task.setPriority(priority);
            task.setDeadline(deadline);
            task.setTags(request.getTags());
            task.setEstimatedEffortMinutes(request.getEffortMinutes());
            task.setAutoAssigned(false);
        }
        task.setDependencies(request.getDependencyIds());

        Task created = write(() -> store.create(task).copy());
        log.debug("Created task {} (priority={}, deadline={}, autoAssigned={})",
                created.getId(), created.getPriority(), created.getDeadline(), created.isAutoAssigned());
        return created;
    }

    @Override
    public Task getTask(String id) {
        return read(() -> store.require(id).copy());
    }

    @Override
    public List<Task> listTasks(boolean includeCompleted) {
        return read(() -> copies(includeCompleted ? store.listAll() : store.listActive()));
    }

    @Override
    public Task updateTask(String id, Map<String, ?> fields) {
        // Existence first, then conversion and deadline parsing, all before any write
        read(() -> store.require(id));
        TaskUpdate update = TaskUpdate.fromFields(fields, this::resolveDeadline);
        return write(() -> {
            Task task = store.update(id, update);
            log.debug("Updated task {} (fields={})", id, fields != null ? fields.keySet() : List.of());
            return task.copy();
        });
    }

    @Override
    public void deleteTask(String id) {
        write(() -> {
            boolean removed = store.delete(id);
            if (removed) {
                log.debug("Deleted task {}", id);
            } else {
                log.debug("Delete ignored, task {} not present", id);
            }
            return null;
        });
    }

    @Override
    public Task setProgress(String id, int progress) {
        return write(() -> {
            Task task = store.require(id);
            int stored = task.setProgress(progress);
            store.rebuildIndex();
            log.debug("Task {} progress set to {} (completed={})", id, stored, task.isCompleted());
            return task.copy();
        });
    }

    @Override
    public Task completeTask(String id) {
        return write(() -> {
            Task task = store.require(id);
            List<String> unmet = new ArrayList<>();
            for (String dependencyId : task.getDependencies()) {
                Optional<Task> dependency = store.get(dependencyId);
                if (dependency.isEmpty() || !dependency.get().isCompleted()) {
                    unmet.add(dependencyId);
                }
            }
            if (!unmet.isEmpty()) {
                log.warn("Completion of task {} blocked by unmet dependencies: {}", id, unmet);
                throw new DependencyException(id, unmet);
            }
            task.markCompleted();
            store.rebuildIndex();
            log.debug("Completed task {}", id);
            return task.copy();
        });
    }

    @Override
    public Optional<Task> peekNext() {
        return write(() -> store.peekNext().map(Task::copy));
    }

    @Override
    public Optional<Task> popNext() {
        return write(() -> store.popNext().map(Task::copy));
    }

    @Override
    public List<String> globalSchedule() {
        return read(() -> ranker.rank(store.listActive()));
    }

    @Override
    public void markReminded(String id) {
        write(() -> {
            store.require(id).setNotified(true);
            log.debug("Task {} marked as reminded", id);
            return null;
        });
    }

    @Override
    public TaskSummary summary() {
        return read(() -> {
            List<Task> all = store.listAll();
            Map<Integer, Integer> byPriority = new TreeMap<>();
            int active = 0;
            for (Task task : all) {
                if (!task.isCompleted()) {
                    active++;
                    byPriority.merge(task.getPriority(), 1, Integer::sum);
                }
            }
            return new TaskSummary(all.size(), active, all.size() - active, byPriority);
        });
    }

    @Override
    public Snapshot exportSnapshot() {
        return read(() -> codec.toSnapshot(store.listAll()));
    }

    @Override
    public void importSnapshot(Snapshot snapshot) {
        // Decode fully before replacing anything
        List<Task> tasks = codec.toTasks(snapshot);
        write(() -> {
            store.bulkReplace(tasks);
            return null;
        });
        log.info("Imported {} tasks", tasks.size());
    }

    @Override
    public String exportJson() {
        Snapshot snapshot = exportSnapshot();
        String json = codec.write(snapshot);
        log.info("Exported {} tasks", snapshot.tasks().size());
        return json;
    }

    @Override
    public void importJson(String json) {
        Snapshot snapshot;
        try {
            snapshot = codec.read(json);
        } catch (SnapshotFormatException e) {
            log.warn("Rejected snapshot import: {}", e.getMessage());
            throw e;
        }
        importSnapshot(snapshot);
    }

    private Instant resolveDeadline(String text) {
        try {
            return deadlineParser.parse(text);
        } catch (DeadlineParseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DeadlineParseException(text, e);
        }
    }

    private static List<Task> copies(List<Task> tasks) {
        List<Task> copies = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            copies.add(task.copy());
        }
        return copies;
    }

    private <R> R read(Supplier<R> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <R> R write(Supplier<R> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
