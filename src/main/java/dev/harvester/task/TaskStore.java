package dev.harvester.task;

import dev.harvester.crawl.CrawlResult;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory table of crawl tasks.
 *
 * <p>Maintains a {@link ConcurrentHashMap} of immutable {@link Task} snapshots keyed by task id.
 * Each transition atomically reads the current snapshot, derives the next one and writes it back
 * using {@code compute()}, so a reader always sees a consistent status/result/error triple.
 *
 * <p>Tasks live as long as the application context: they are not persisted and the table is
 * cleared on shutdown.
 */
@Component
public class TaskStore {

    private static final Logger log = LoggerFactory.getLogger(TaskStore.class);

    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();
    private final Clock clock;

    public TaskStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Register a new pending task.
     *
     * @param taskId identifier of the new task
     * @return the pending snapshot
     * @throws IllegalStateException if the id is already taken
     */
    public Task create(String taskId) {
        Task pending = Task.pending(taskId, clock.instant());
        Task existing = tasks.putIfAbsent(taskId, pending);
        if (existing != null) {
            throw new IllegalStateException("Task already exists: " + taskId);
        }
        return pending;
    }

    /**
     * Move a pending task to running.
     *
     * @param taskId the task a worker picked up
     * @return the running snapshot
     */
    public Task markRunning(String taskId) {
        return transition(taskId, task -> task.running(clock.instant()));
    }

    /**
     * Record the result of a running task.
     *
     * @param taskId the finished task
     * @param result its crawl result
     * @return the completed snapshot
     */
    public Task complete(String taskId, CrawlResult result) {
        return transition(taskId, task -> task.completed(result, clock.instant()));
    }

    /**
     * Record the failure of a pending or running task.
     *
     * @param taskId the failed task
     * @param error error text shown to the caller
     * @return the failed snapshot
     */
    public Task fail(String taskId, String error) {
        return transition(taskId, task -> task.failed(error, clock.instant()));
    }

    public Optional<Task> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public long count(TaskStatus status) {
        return tasks.values().stream().filter(task -> task.status() == status).count();
    }

    public int size() {
        return tasks.size();
    }

    @PreDestroy
    public void clear() {
        log.info("Clearing task table ({} tasks)", tasks.size());
        tasks.clear();
    }

    private Task transition(String taskId, UnaryOperator<Task> step) {
        return tasks.compute(taskId, (id, task) -> {
            if (task == null) {
                throw new TaskNotFoundException(id);
            }
            return step.apply(task);
        });
    }
}
