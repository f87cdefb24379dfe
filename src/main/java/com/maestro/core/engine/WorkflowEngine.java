package com.maestro.core.engine;

import com.maestro.core.config.EngineProperties;
import com.maestro.core.logging.MdcContext;
import com.maestro.core.metrics.MaestroMetrics;
import com.maestro.core.model.PlanItem;
import com.maestro.core.model.TaskStatus;
import com.maestro.core.model.Workflow;
import com.maestro.core.model.WorkflowSnapshot;
import com.maestro.core.model.WorkflowStatus;
import com.maestro.core.model.WorkflowTask;
import com.maestro.core.plan.PlanTranslator;
import com.maestro.core.scheduler.ReadySetScheduler;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.Year;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives workflows to completion: repeatedly computes the ready set, dispatches a bounded
 * batch, and applies retry and failure propagation until the graph is exhausted or the
 * workflow is cancelled.
 * <p>
 * Each workflow has exactly one driver at a time. Workflows are retained after they finish
 * so their status can be queried, until {@link #discard(String)} is called.
 */
@Service
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);
    private static final AtomicInteger WORKFLOW_COUNTER = new AtomicInteger(0);

    private final ReadySetScheduler scheduler;
    private final TaskDispatcher dispatcher;
    private final PlanTranslator translator;
    private final LifecycleNotifier notifier;
    private final MaestroMetrics metrics;
    private final int maxParallel;
    private final int resultPreviewLength;
    private final ExecutorService drivers;

    private final Map<String, Workflow> workflows = new ConcurrentHashMap<>();
    private final Set<String> cancelled = ConcurrentHashMap.newKeySet();
    private final Set<String> running = ConcurrentHashMap.newKeySet();

    @Autowired
    public WorkflowEngine(ReadySetScheduler scheduler, TaskDispatcher dispatcher, PlanTranslator translator,
                          LifecycleNotifier notifier, MaestroMetrics metrics, EngineProperties properties) {
        this(scheduler, dispatcher, translator, notifier, metrics,
                properties.getMaxParallel(), properties.getResultPreviewLength(), properties.getDriverThreads());
    }

    public WorkflowEngine(ReadySetScheduler scheduler, TaskDispatcher dispatcher, PlanTranslator translator,
                          LifecycleNotifier notifier, MaestroMetrics metrics,
                          int maxParallel, int resultPreviewLength, int driverThreads) {
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.translator = translator;
        this.notifier = notifier;
        this.metrics = metrics;
        this.maxParallel = Math.max(1, maxParallel);
        this.resultPreviewLength = resultPreviewLength;
        this.drivers = Executors.newFixedThreadPool(Math.max(1, driverThreads),
                TaskDispatcher.namedDaemonThreads("maestro-driver-"));
    }

    // -- Workflow creation --

    public Workflow createWorkflow(String workflowId, String name, String objective) {
        var workflow = new Workflow(workflowId, name, objective);
        workflows.put(workflowId, workflow);
        log.info("Created workflow {} '{}'", workflowId, name);
        return workflow;
    }

    public Workflow createWorkflow(String name, String objective) {
        return createWorkflow(generateWorkflowId(), name, objective);
    }

    /**
     * Translates a plan into tasks of the workflow.
     *
     * @throws com.maestro.core.plan.InvalidPlanException when the plan has unknown
     *         dependencies or cycles and plan validation is enabled
     */
    public List<WorkflowTask> createTasksFromPlan(Workflow workflow, List<PlanItem> plan) {
        return translator.translate(workflow, plan);
    }

    /**
     * Creates a workflow and its tasks in one step. A rejected plan leaves no workflow behind.
     */
    public Workflow submit(String name, String objective, List<PlanItem> plan) {
        var workflow = new Workflow(generateWorkflowId(), name, objective);
        translator.translate(workflow, plan);
        workflows.put(workflow.getId(), workflow);
        log.info("Submitted workflow {} '{}' with {} tasks", workflow.getId(), name, workflow.getTasks().size());
        return workflow;
    }

    // -- Execution --

    public Map<String, String> execute(Workflow workflow) {
        return execute(workflow, maxParallel);
    }

    /**
     * Runs the scheduling loop on the calling thread until the workflow is complete,
     * stuck, or cancelled.
     *
     * @return results of the completed tasks keyed by task id
     * @throws IllegalStateException if the workflow is already being executed
     */
    public Map<String, String> execute(Workflow workflow, int batchLimit) {
        String workflowId = workflow.getId();
        if (!running.add(workflowId)) {
            throw new IllegalStateException("Workflow " + workflowId + " is already running");
        }
        workflows.putIfAbsent(workflowId, workflow);
        int limit = Math.max(1, batchLimit);

        MdcContext.setWorkflow(workflowId);
        try {
            log.info("Starting workflow {} with {} tasks, maxParallel={}",
                    workflowId, workflow.getTasks().size(), limit);
            workflow.setStatus(WorkflowStatus.RUNNING);
            notifier.workflowEvent(workflow, "started");

            boolean stuck = false;
            int batchNumber = 0;
            while (!workflow.isComplete()) {
                if (cancelled.contains(workflowId)) {
                    log.info("Workflow {} cancelled, no further batches", workflowId);
                    break;
                }

                var ready = scheduler.computeReadySet(workflow);
                if (ready.isEmpty()) {
                    var skipped = scheduler.skipBlockedTasks(workflow, Instant.now());
                    if (!skipped.isEmpty()) {
                        if (metrics != null) {
                            metrics.recordSkippedTasks(skipped.size());
                        }
                        skipped.forEach(t -> notifier.taskEvent(workflow, t, "skipped"));
                        continue;
                    }
                    if (scheduler.hasUnresolvedTasks(workflow)) {
                        stuck = true;
                        log.warn("Workflow {} is stuck: remaining tasks wait on dependencies that can never complete",
                                workflowId);
                    }
                    break;
                }

                var batch = scheduler.nextBatch(ready, limit);
                batchNumber++;
                MdcContext.setBatch(workflowId, batchNumber);
                log.info("Batch {}: dispatching {} of {} ready tasks {}", batchNumber, batch.size(), ready.size(),
                        batch.stream().map(WorkflowTask::getId).toList());
                if (metrics != null) {
                    metrics.recordBatch(batch.size());
                }
                dispatcher.dispatch(workflow, batch, limit);
            }

            finish(workflow, stuck);
            return workflow.getResults();
        } finally {
            running.remove(workflowId);
            MdcContext.clear();
        }
    }

    /**
     * Runs {@link #execute(Workflow)} on the engine's driver pool.
     */
    public CompletableFuture<Map<String, String>> executeAsync(Workflow workflow) {
        return CompletableFuture.supplyAsync(() -> execute(workflow), drivers);
    }

    private void finish(Workflow workflow, boolean stuck) {
        boolean wasCancelled = cancelled.contains(workflow.getId());
        Instant now = Instant.now();

        if (wasCancelled) {
            for (var task : workflow.getTasks()) {
                if (!task.getStatus().isTerminal()) {
                    task.markCancelled(now);
                    notifier.taskEvent(workflow, task, "cancelled");
                }
            }
        }

        boolean anyFailed = workflow.getTasks().stream().anyMatch(t -> t.getStatus() == TaskStatus.FAILED);
        WorkflowStatus status;
        if (anyFailed || stuck) {
            status = WorkflowStatus.COMPLETED_WITH_ERRORS;
        } else if (wasCancelled) {
            status = WorkflowStatus.CANCELLED;
        } else {
            status = WorkflowStatus.COMPLETED;
        }

        workflow.setCompletedAt(now);
        workflow.setStatus(status);
        log.info("Workflow {} finished with status {}", workflow.getId(), status.value());
        if (metrics != null) {
            metrics.recordWorkflowResult(status.value());
        }
        notifier.workflowEvent(workflow, status.value());
    }

    // -- Control --

    /**
     * Requests cancellation. Takes effect before the next batch; an in-flight batch finishes.
     */
    public void cancel(String workflowId) {
        cancelled.add(workflowId);
        log.info("Cancellation requested for workflow {}", workflowId);
    }

    public boolean isCancelled(String workflowId) {
        return cancelled.contains(workflowId);
    }

    /**
     * Labels a workflow as paused. Dispatch is not halted; callers stop driving it.
     * Workflows that already finished are left alone.
     */
    public void pause(String workflowId) {
        var workflow = workflows.get(workflowId);
        if (workflow != null && workflow.markPaused()) {
            log.info("Workflow {} paused", workflowId);
        }
    }

    /**
     * Clears the paused label: RUNNING while a driver is executing the workflow, else CREATED.
     */
    public void resume(String workflowId) {
        var workflow = workflows.get(workflowId);
        if (workflow == null) return;
        var resumed = running.contains(workflowId) ? WorkflowStatus.RUNNING : WorkflowStatus.CREATED;
        if (workflow.markResumed(resumed)) {
            log.info("Workflow {} resumed as {}", workflowId, resumed.value());
        }
    }

    /**
     * Forgets a workflow, its cancellation flag and its event subscribers.
     *
     * @return true if the workflow was known
     */
    public boolean discard(String workflowId) {
        cancelled.remove(workflowId);
        notifier.forget(workflowId);
        return workflows.remove(workflowId) != null;
    }

    // -- Queries --

    public Optional<Workflow> getWorkflow(String workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }

    public Optional<WorkflowSnapshot> getWorkflowStatus(String workflowId) {
        return getWorkflow(workflowId).map(w -> WorkflowSnapshot.of(w, resultPreviewLength));
    }

    public void addTaskListener(TaskLifecycleListener listener) {
        notifier.addTaskListener(listener);
    }

    public void addWorkflowListener(WorkflowLifecycleListener listener) {
        notifier.addWorkflowListener(listener);
    }

    public int getMaxParallel() {
        return maxParallel;
    }

    private String generateWorkflowId() {
        return String.format("WF-%d-%04d", Year.now().getValue(), WORKFLOW_COUNTER.incrementAndGet());
    }

    @PreDestroy
    public void shutdown() {
        drivers.shutdownNow();
    }
}
