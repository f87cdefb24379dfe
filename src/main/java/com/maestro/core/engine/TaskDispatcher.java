package com.maestro.core.engine;

import com.maestro.core.logging.MdcContext;
import com.maestro.core.metrics.MaestroMetrics;
import com.maestro.core.model.TaskStatus;
import com.maestro.core.model.Workflow;
import com.maestro.core.model.WorkflowTask;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one batch of ready tasks concurrently and returns once every task of the batch
 * has finished its attempt.
 * <p>
 * Each task is executed on a worker thread, bounded by a semaphore sized to the batch
 * limit. The join at the end of {@link #dispatch} is the barrier after which the driver
 * may recompute readiness.
 */
@Component
public class TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    private final AgentExecutor executor;
    private final LifecycleNotifier notifier;
    private final MaestroMetrics metrics;
    private final ExecutorService workers;

    @Autowired
    public TaskDispatcher(AgentExecutor executor, LifecycleNotifier notifier, MaestroMetrics metrics) {
        this.executor = executor;
        this.notifier = notifier;
        this.metrics = metrics;
        this.workers = Executors.newCachedThreadPool(namedDaemonThreads("maestro-task-"));
    }

    TaskDispatcher(AgentExecutor executor) {
        this(executor, new LifecycleNotifier(null), null);
    }

    /**
     * Executes every task of the batch and waits for all of them.
     *
     * @param workflow    the owning workflow, read for dependency results
     * @param batch       READY tasks; none may depend on another task of the same batch
     * @param maxParallel upper bound on concurrently running attempts
     */
    public void dispatch(Workflow workflow, List<WorkflowTask> batch, int maxParallel) {
        if (batch.isEmpty()) return;

        var semaphore = new Semaphore(Math.max(1, maxParallel));
        var futures = new ArrayList<CompletableFuture<Void>>(batch.size());
        for (var task : batch) {
            futures.add(CompletableFuture.runAsync(() -> runGuarded(workflow, task, semaphore), workers));
        }

        for (var future : futures) {
            try {
                future.join();
            } catch (CompletionException e) {
                log.error("Unexpected error collecting dispatch result", e);
            }
        }
    }

    private void runGuarded(Workflow workflow, WorkflowTask task, Semaphore semaphore) {
        MdcContext.setTask(workflow.getId(), task.getId(), task.getAssignee());
        try {
            semaphore.acquire();
            try {
                runAttempt(workflow, task);
            } finally {
                semaphore.release();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.recordFailure("Interrupted: " + e.getMessage(), Instant.now());
            notifier.taskEvent(workflow, task, task.getStatus().value());
        } finally {
            MdcContext.clear();
        }
    }

    private void runAttempt(Workflow workflow, WorkflowTask task) {
        task.markRunning(Instant.now());
        log.info("Dispatching task {} [{}] attempt {}/{}: {}", task.getId(), task.getAssignee(),
                task.getRetries() + 1, task.getMaxRetries(), task.getName());
        notifier.taskEvent(workflow, task, "started");

        long startMs = System.currentTimeMillis();
        try {
            String result = executor.execute(task.getAssignee(), task.getDescription(), dependencyContext(workflow, task));
            task.markCompleted(result, Instant.now());
            log.info("Task {} completed in {}ms", task.getId(), System.currentTimeMillis() - startMs);
            recordAttempt(task, "completed", startMs);
        } catch (Exception e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            TaskStatus status = task.recordFailure(error, Instant.now());
            if (status == TaskStatus.PENDING) {
                log.warn("Task {} failed (attempt {}/{}), will retry: {}",
                        task.getId(), task.getRetries(), task.getMaxRetries(), error);
                recordAttempt(task, "retried", startMs);
            } else {
                log.warn("Task {} failed after {} attempts: {}", task.getId(), task.getRetries(), error);
                recordAttempt(task, "failed", startMs);
            }
        }

        notifier.taskEvent(workflow, task, task.getStatus().value());
    }

    /**
     * Results of the task's completed dependencies, keyed by task id.
     */
    Map<String, String> dependencyContext(Workflow workflow, WorkflowTask task) {
        var context = new LinkedHashMap<String, String>();
        for (String dep : task.getDependsOn().stream().sorted().toList()) {
            WorkflowTask depTask = workflow.getTask(dep);
            if (depTask != null && depTask.getStatus() == TaskStatus.COMPLETED && depTask.getResult() != null) {
                context.put(dep, depTask.getResult());
            }
        }
        return context;
    }

    private void recordAttempt(WorkflowTask task, String outcome, long startMs) {
        if (metrics != null) {
            metrics.recordTaskExecution(task.getAssignee(), System.currentTimeMillis() - startMs);
            metrics.recordTaskAttempt(outcome);
        }
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
