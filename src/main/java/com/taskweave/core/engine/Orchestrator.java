package com.taskweave.core.engine;

import com.taskweave.core.analysis.TaskAnalyzer;
import com.taskweave.core.config.OrchestratorProperties;
import com.taskweave.core.decomposition.TaskDecomposer;
import com.taskweave.core.events.EventBus;
import com.taskweave.core.events.Message;
import com.taskweave.core.events.MessageType;
import com.taskweave.core.graph.DependencyMapper;
import com.taskweave.core.graph.UnknownTaskReferenceException;
import com.taskweave.core.logging.MdcContext;
import com.taskweave.core.metrics.TaskweaveMetrics;
import com.taskweave.core.model.DependencyGraph;
import com.taskweave.core.model.ExecutionPlan;
import com.taskweave.core.model.ExecutionStep;
import com.taskweave.core.model.PlanningFailure;
import com.taskweave.core.model.SubTask;
import com.taskweave.core.model.TaskState;
import com.taskweave.core.model.WorkflowResult;
import com.taskweave.core.model.WorkflowStatus;
import com.taskweave.core.planning.ExecutionPlanner;
import com.taskweave.core.results.ResultAggregator;
import com.taskweave.core.results.ResultFormat;
import com.taskweave.core.tracking.TaskStateTracker;
import com.taskweave.core.tracking.TrackedTask;
import com.taskweave.core.worker.Worker;
import com.taskweave.core.worker.WorkerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one workflow at a time: analyze, decompose, build the graph, plan, then dispatch
 * every step to the {@link Worker} and fold the outputs into a {@link WorkflowResult}.
 * <p>
 * Owns its {@link EventBus}, {@link TaskStateTracker} and {@link ResultAggregator}. A new
 * {@link #executeTask} call resets the tracker, aggregator and bus history, so the same
 * orchestrator can run independent workflows one after the other.
 * <p>
 * Steps are separated by a barrier: every task of a step settles (completed, failed or
 * blocked) before the next step begins, and a task is dispatched only when all of its
 * dependencies completed. Multi-task steps run on a bounded worker pool when parallel
 * dispatch is enabled.
 */
public class Orchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);
    private static final AtomicInteger WORKFLOW_COUNTER = new AtomicInteger(0);

    public static final String SENDER = "orchestrator";

    private final TaskAnalyzer analyzer;
    private final TaskDecomposer decomposer;
    private final DependencyMapper dependencyMapper;
    private final ExecutionPlanner planner;
    private final Worker worker;
    private final OrchestratorProperties properties;
    private final TaskweaveMetrics metrics;

    private final EventBus eventBus;
    private final TaskStateTracker tracker;
    private final ResultAggregator aggregator;

    private final AtomicInteger workerCounter = new AtomicInteger(0);
    private ExecutorService dispatchPool;

    private volatile WorkflowStatus status = WorkflowStatus.IDLE;
    private volatile String workflowId;
    private volatile ExecutionPlan plan;
    private volatile List<SubTask> subtasks = List.of();

    /**
     * Builds an orchestrator from default components with its event bus already started.
     */
    public Orchestrator(Worker worker) {
        this(new TaskAnalyzer(), new TaskDecomposer(), new DependencyMapper(), new ExecutionPlanner(),
                worker, new OrchestratorProperties(), null,
                new EventBus(), new TaskStateTracker(), new ResultAggregator());
        start();
    }

    public Orchestrator(TaskAnalyzer analyzer, TaskDecomposer decomposer, DependencyMapper dependencyMapper,
                        ExecutionPlanner planner, Worker worker, OrchestratorProperties properties,
                        TaskweaveMetrics metrics, EventBus eventBus, TaskStateTracker tracker,
                        ResultAggregator aggregator) {
        this.analyzer = analyzer;
        this.decomposer = decomposer;
        this.dependencyMapper = dependencyMapper;
        this.planner = planner;
        this.worker = worker;
        this.properties = properties;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.tracker = tracker;
        this.aggregator = aggregator;
    }

    public void start() {
        eventBus.start();
        log.info("Orchestrator started");
    }

    public synchronized void stop() {
        eventBus.stop();
        if (dispatchPool != null) {
            dispatchPool.shutdown();
            try {
                if (!dispatchPool.awaitTermination(5, TimeUnit.SECONDS)) {
                    dispatchPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                dispatchPool.shutdownNow();
                Thread.currentThread().interrupt();
            }
            dispatchPool = null;
        }
        log.info("Orchestrator stopped");
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Plans and executes a natural-language task.
     *
     * @param description the task
     * @param context     caller context handed to every worker call
     * @return the workflow outcome; per-task failures and clarifications are reported here
     * @throws WorkflowPlanningException on a cyclic graph or an unknown dependency reference
     * @throws IllegalStateException     if a workflow is already running on this orchestrator
     */
    public WorkflowResult executeTask(String description, Map<String, Object> context) {
        beginRun();
        String id = workflowId;
        Map<String, Object> callerContext = context != null ? context : Map.of();
        MdcContext.setWorkflow(id);
        try {
            log.info("Orchestrating workflow {}: {}", id, abbreviate(description));
            publish(Message.broadcast(MessageType.SYSTEM_EVENT, SENDER,
                    Map.of("event", "workflow.started", "workflowId", id)));

            ExecutionPlan executionPlan = planWorkflow(description, callerContext);

            status = WorkflowStatus.EXECUTING;
            for (var step : executionPlan.steps()) {
                executeStep(step, callerContext);
            }

            WorkflowResult result = buildResult(executionPlan);
            status = result.status();
            publish(Message.broadcast(MessageType.SYSTEM_EVENT, SENDER,
                    Map.of("event", "workflow.finished", "workflowId", id,
                           "status", result.status().name(), "degraded", result.degraded())));
            if (metrics != null) {
                metrics.recordWorkflowResult(result.status().name(), result.degraded());
            }
            log.info("Workflow {} finished: status={}, degraded={}, progress={}",
                    id, result.status(), result.degraded(), result.overallProgress());
            return result;
        } catch (RuntimeException | Error e) {
            status = WorkflowStatus.FAILED;
            if (metrics != null) {
                metrics.recordWorkflowResult(WorkflowStatus.FAILED.name(), true);
            }
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    public WorkflowResult executeTask(String description) {
        return executeTask(description, Map.of());
    }

    /**
     * Records progress reported for a running task and publishes a progress event.
     */
    public void reportProgress(String taskId, double progress) {
        tracker.updateProgress(taskId, progress);
        var task = tracker.getTask(taskId).orElseThrow();
        publish(Message.broadcast(MessageType.TASK_PROGRESS,
                task.getWorkerId() != null ? task.getWorkerId() : SENDER,
                Map.of("taskId", taskId, "progress", task.getProgress())));
    }

    public OrchestratorProgress getProgress() {
        return new OrchestratorProgress(workflowId, status, tracker.getOverallProgress(),
                tracker.stats(), aggregator.stats(), eventBus.stats());
    }

    public Optional<TrackedTask> getTaskStatus(String taskId) {
        return tracker.getTask(taskId);
    }

    /**
     * Formats the results of the given tasks, or of every tracked task when none are given.
     */
    public String getResults(List<String> taskIds, ResultFormat format) {
        List<String> ids = taskIds == null || taskIds.isEmpty() ? tracker.taskIds() : taskIds;
        return aggregator.formatFinalOutput(ids, format);
    }

    public String getResults(String format) {
        return getResults(null, ResultFormat.fromValue(format));
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public Optional<ExecutionPlan> getPlan() {
        return Optional.ofNullable(plan);
    }

    public List<SubTask> getSubtasks() {
        return subtasks;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    /**
     * Drops all state of the last workflow and returns to {@link WorkflowStatus#IDLE}.
     */
    public synchronized void cleanup() {
        if (status == WorkflowStatus.PLANNING || status == WorkflowStatus.EXECUTING) {
            throw new IllegalStateException("Cannot clean up while workflow " + workflowId + " is " + status);
        }
        resetRunState();
        status = WorkflowStatus.IDLE;
        workflowId = null;
        log.info("Orchestrator cleaned up");
    }

    /**
     * Generates a workflow id in the format TW-YYYY-NNNN.
     */
    public static String generateWorkflowId() {
        int count = WORKFLOW_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("TW-%d-%04d", year, count);
    }

    private synchronized void beginRun() {
        if (status == WorkflowStatus.PLANNING || status == WorkflowStatus.EXECUTING) {
            throw new IllegalStateException("Workflow " + workflowId + " is still " + status);
        }
        resetRunState();
        workflowId = generateWorkflowId();
        status = WorkflowStatus.PLANNING;
    }

    private void resetRunState() {
        tracker.clear();
        aggregator.clearAll();
        eventBus.clearHistory();
        plan = null;
        subtasks = List.of();
        workerCounter.set(0);
    }

    private ExecutionPlan planWorkflow(String description, Map<String, Object> context) {
        long startMs = System.currentTimeMillis();

        var analysis = analyzer.analyze(description, context);
        log.info("Task complexity: {}, domains: {}", analysis.complexity().value(), analysis.domains());

        var decomposition = decomposer.decompose(analysis, properties.getMaxDepth());
        List<SubTask> batch = decomposition.subtasks();
        log.info("Decomposed into {} subtask(s)", batch.size());

        DependencyGraph graph;
        try {
            graph = dependencyMapper.buildGraph(batch);
        } catch (UnknownTaskReferenceException e) {
            throw planningFailed(PlanningFailure.UNKNOWN_TASK_REFERENCE, e.getMessage(), e);
        }

        ExecutionPlan executionPlan = planner.createPlan(graph, batch);
        if (executionPlan.hasError()) {
            throw planningFailed(PlanningFailure.CYCLIC_DEPENDENCY, executionPlan.error(), null);
        }

        for (var subtask : batch) {
            tracker.addTask(subtask);
        }
        this.subtasks = batch;
        this.plan = executionPlan;

        if (metrics != null) {
            metrics.recordPlanningDuration(System.currentTimeMillis() - startMs);
        }
        log.info("Execution plan: {} steps, parallel={}", executionPlan.totalSteps(), executionPlan.canParallelize());
        return executionPlan;
    }

    private WorkflowPlanningException planningFailed(PlanningFailure failure, String message, Throwable cause) {
        log.error("Planning failed for workflow {} ({}): {}", workflowId, failure, message);
        status = WorkflowStatus.FAILED;
        publish(Message.broadcast(MessageType.SYSTEM_EVENT, SENDER,
                Map.of("event", "workflow.planning_failed", "workflowId", workflowId,
                       "failure", failure.name(), "error", message)));
        return cause != null
                ? new WorkflowPlanningException(failure, message, cause)
                : new WorkflowPlanningException(failure, message);
    }

    private void executeStep(ExecutionStep step, Map<String, Object> context) {
        MdcContext.setStep(workflowId, step.stepNumber());
        log.info("Executing step {}/{}: {}", step.stepNumber(), plan.totalSteps(), step.taskIds());

        var dispatchable = new ArrayList<SubTask>();
        for (var taskId : step.taskIds()) {
            if (tracker.isReady(taskId)) {
                dispatchable.add(subtask(taskId));
            } else {
                log.warn("Task {} not dispatched: a dependency did not complete", taskId);
            }
        }
        if (dispatchable.isEmpty()) {
            return;
        }

        boolean parallel = properties.isParallelDispatch() && dispatchable.size() > 1;
        if (metrics != null) {
            metrics.recordStepExecution(dispatchable.size(), parallel ? "parallel" : "sequential");
        }

        if (!parallel) {
            for (var task : dispatchable) {
                dispatch(task, context);
            }
            MdcContext.clearTask();
            return;
        }

        String id = workflowId;
        var pool = dispatchPool();
        var futures = dispatchable.stream()
                .map(task -> CompletableFuture.runAsync(() -> {
                    MdcContext.setStep(id, step.stepNumber());
                    try {
                        dispatch(task, context);
                    } finally {
                        MdcContext.clear();
                    }
                }, pool))
                .toList();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            log.error("Unexpected error while waiting for step {}: {}", step.stepNumber(), e.getMessage(), e);
        }
    }

    /**
     * Runs one task through assign, start and the worker call. Never throws for worker problems.
     */
    private void dispatch(SubTask task, Map<String, Object> context) {
        String taskId = task.id();
        String workerId = properties.getWorkerIdPrefix() + "-" + task.domain() + "-" + workerCounter.incrementAndGet();
        MdcContext.setTask(workflowId, taskId, workerId);

        tracker.assign(taskId, workerId);
        publish(Message.broadcast(MessageType.TASK_ASSIGNED, SENDER,
                Map.of("taskId", taskId, "workerId", workerId, "description", task.description())));

        tracker.start(taskId);
        publish(Message.broadcast(MessageType.TASK_STARTED, workerId, Map.of("taskId", taskId)));

        long startMs = System.currentTimeMillis();
        WorkerResult result;
        try {
            result = worker.execute(task.description(), workerContext(task, context));
        } catch (Throwable e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Worker {} threw while executing {}: {}", workerId, taskId, message, e);
            failTask(taskId, workerId, message);
            return;
        }
        if (metrics != null) {
            metrics.recordTaskExecution(task.domain(), System.currentTimeMillis() - startMs);
        }

        if (result == null) {
            failTask(taskId, workerId, "Worker returned no result");
            return;
        }

        switch (result.status()) {
            case COMPLETED -> {
                tracker.complete(taskId, result.output());
                String resultId = aggregator.addResult(taskId, workerId, result.output(), result.metadata());
                publish(Message.broadcast(MessageType.TASK_COMPLETED, workerId,
                        Map.of("taskId", taskId, "resultId", resultId)));
                recordOutcome("completed");
            }
            case CLARIFICATION_NEEDED -> {
                tracker.block(taskId, result.questions());
                publish(Message.broadcast(MessageType.TASK_PROGRESS, workerId,
                        Map.of("taskId", taskId, "status", TaskState.BLOCKED.name(),
                               "questions", result.questions())));
                recordOutcome("blocked");
            }
            case ERROR -> failTask(taskId, workerId,
                    result.message() != null ? result.message() : "Worker reported an error");
        }
    }

    private void failTask(String taskId, String workerId, String message) {
        tracker.fail(taskId, message);
        publish(Message.broadcast(MessageType.TASK_FAILED, SENDER,
                Map.of("taskId", taskId, "workerId", workerId, "error", message)));
        recordOutcome("failed");
    }

    private void recordOutcome(String outcome) {
        if (metrics != null) {
            metrics.recordTaskOutcome(outcome);
        }
    }

    private Map<String, Object> workerContext(SubTask task, Map<String, Object> callerContext) {
        var dependencyOutputs = new LinkedHashMap<String, Object>();
        for (var dep : task.dependencies()) {
            tracker.getTask(dep).ifPresent(t -> {
                if (t.getResult() != null) {
                    dependencyOutputs.put(dep, t.getResult());
                }
            });
        }
        var workerContext = new HashMap<String, Object>(callerContext);
        workerContext.put("workflowId", workflowId);
        workerContext.put("taskId", task.id());
        workerContext.put("domain", task.domain());
        workerContext.put("complexity", task.complexity().value());
        workerContext.put("dependencyOutputs", dependencyOutputs);
        return workerContext;
    }

    private WorkflowResult buildResult(ExecutionPlan executionPlan) {
        failUnsettledTasks();
        var completed = idsWithStatus(TaskState.COMPLETED);
        var failed = idsWithStatus(TaskState.FAILED);
        var blocked = idsWithStatus(TaskState.BLOCKED);
        var pending = idsWithStatus(TaskState.PENDING);

        var clarifications = new LinkedHashMap<String, List<String>>();
        for (var task : tracker.getTasksByStatus(TaskState.BLOCKED)) {
            clarifications.put(task.getTaskId(), task.getQuestions());
        }

        var allIds = tracker.taskIds();
        boolean allCompleted = completed.size() == allIds.size();
        var criticalPath = executionPlan.criticalPath();

        return new WorkflowResult(
                workflowId,
                allCompleted ? WorkflowStatus.COMPLETED : WorkflowStatus.FAILED,
                !allCompleted,
                executionPlan.totalSteps(),
                executionPlan.canParallelize(),
                criticalPath,
                criticalPath.size(),
                planner.pathWeight(criticalPath, subtasks),
                executionPlan.estimatedDurationMinutes(),
                tracker.getOverallProgress(),
                completed,
                failed,
                blocked,
                pending,
                clarifications,
                aggregator.aggregateWorkflowResults(allIds));
    }

    /**
     * A task still assigned or in progress after its step's barrier never reported an outcome.
     */
    private void failUnsettledTasks() {
        for (var task : tracker.getAllTasks()) {
            TaskState state = task.getStatus();
            if (state == TaskState.ASSIGNED || state == TaskState.IN_PROGRESS) {
                log.error("Task {} was still {} when its step ended", task.getTaskId(), state);
                failTask(task.getTaskId(), task.getWorkerId(), "Task did not report an outcome");
            }
        }
    }

    private List<String> idsWithStatus(TaskState state) {
        return tracker.getTasksByStatus(state).stream().map(TrackedTask::getTaskId).toList();
    }

    private SubTask subtask(String taskId) {
        return subtasks.stream()
                .filter(t -> t.id().equals(taskId))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Plan references unknown task " + taskId));
    }

    private synchronized ExecutorService dispatchPool() {
        if (dispatchPool == null) {
            var counter = new AtomicInteger(0);
            dispatchPool = Executors.newFixedThreadPool(Math.max(1, properties.getMaxParallel()), r -> {
                Thread t = new Thread(r, "taskweave-dispatch-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }
        return dispatchPool;
    }

    private void publish(Message message) {
        eventBus.publish(message);
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 100 ? text.substring(0, 100) + "..." : text;
    }
}
