package com.taskweave.core.engine;

import com.taskweave.core.analysis.TaskAnalyzer;
import com.taskweave.core.config.OrchestratorProperties;
import com.taskweave.core.decomposition.TaskDecomposer;
import com.taskweave.core.events.EventBus;
import com.taskweave.core.events.Message;
import com.taskweave.core.events.MessageType;
import com.taskweave.core.graph.DependencyMapper;
import com.taskweave.core.metrics.TaskweaveMetrics;
import com.taskweave.core.model.Decomposition;
import com.taskweave.core.model.PlanningFailure;
import com.taskweave.core.model.SubTask;
import com.taskweave.core.model.TaskState;
import com.taskweave.core.model.WorkflowStatus;
import com.taskweave.core.planning.ExecutionPlanner;
import com.taskweave.core.results.ResultAggregator;
import com.taskweave.core.results.ResultFormat;
import com.taskweave.core.tracking.TaskStateTracker;
import com.taskweave.core.worker.Worker;
import com.taskweave.core.worker.WorkerResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OrchestratorTest {

    private OrchestratorProperties properties;
    private SimpleMeterRegistry registry;
    private Orchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    private static SubTask task(String id, String... deps) {
        return SubTask.of(id, "do " + id, List.of(deps));
    }

    private static List<SubTask> diamond() {
        return List.of(task("t1"), task("t2", "t1"), task("t3", "t1"), task("t4", "t2", "t3"));
    }

    /**
     * Orchestrator whose decomposer always returns {@code subtasks}.
     */
    private Orchestrator orchestratorFor(List<SubTask> subtasks, Worker worker) {
        TaskDecomposer decomposer = mock(TaskDecomposer.class);
        var root = SubTask.of(TaskDecomposer.ROOT_TASK_ID, "root", List.of());
        when(decomposer.decompose(any(), anyInt()))
                .thenReturn(new Decomposition(root, subtasks, Map.of(root.id(), List.of())));
        var built = new Orchestrator(new TaskAnalyzer(), decomposer, new DependencyMapper(),
                new ExecutionPlanner(), worker, properties, new TaskweaveMetrics(registry),
                new EventBus(), new TaskStateTracker(), new ResultAggregator());
        built.start();
        return built;
    }

    private static String taskId(Map<String, Object> context) {
        return (String) context.get("taskId");
    }

    @Nested
    @DisplayName("successful workflows")
    class SuccessTests {

        @Test
        @DisplayName("complex request runs every phase and completes")
        void endToEnd() {
            orchestrator = new Orchestrator(
                    (description, context) -> WorkerResult.completed("done: " + description));

            var result = orchestrator.executeTask(
                    "Build a complete web application with authentication, database, and deployment");

            assertEquals(WorkflowStatus.COMPLETED, result.status());
            assertFalse(result.degraded());
            assertTrue(result.isComplete());
            assertEquals(5, result.completedTasks().size());
            assertEquals(5, result.totalSteps());
            assertEquals(5, result.results().totalResults());
            assertEquals(1.0, result.overallProgress(), 1e-9);
            assertTrue(result.workflowId().startsWith("TW-"));
            assertEquals(WorkflowStatus.COMPLETED, orchestrator.getStatus());
        }

        @Test
        @DisplayName("simple request runs the root task alone")
        void simpleRequest() {
            orchestrator = new Orchestrator((description, context) -> WorkerResult.completed("ok"));

            var result = orchestrator.executeTask("Create a simple Python function");

            assertEquals(List.of(TaskDecomposer.ROOT_TASK_ID), result.completedTasks());
            assertEquals(1, result.totalSteps());
        }

        @Test
        @DisplayName("dependency outputs and caller context reach the worker")
        void workerContext() {
            Map<String, Map<String, Object>> seen = new ConcurrentHashMap<>();
            orchestrator = orchestratorFor(diamond(), (description, context) -> {
                seen.put(taskId(context), context);
                return WorkerResult.completed("out-" + taskId(context));
            });

            orchestrator.executeTask("anything", Map.of("tenant", "acme"));

            var joinContext = seen.get("t4");
            assertEquals("acme", joinContext.get("tenant"));
            assertEquals(Map.of("t2", "out-t2", "t3", "out-t3"), joinContext.get("dependencyOutputs"));
            assertEquals("general", joinContext.get("domain"));
            assertEquals("simple", joinContext.get("complexity"));
            assertNotNull(joinContext.get("workflowId"));
        }

        @Test
        @DisplayName("critical path and durations are reported")
        void criticalPath() {
            orchestrator = orchestratorFor(diamond(), (description, context) -> WorkerResult.completed("ok"));

            var result = orchestrator.executeTask("anything");

            assertEquals(3, result.criticalPathLength());
            assertEquals(15, result.criticalPathMinutes());
            assertEquals(20, result.estimatedDurationMinutes());
            assertTrue(result.canParallelize());
        }

        @Test
        @DisplayName("lifecycle messages are published for every task")
        void publishesEvents() throws InterruptedException {
            orchestrator = orchestratorFor(diamond(), (description, context) -> WorkerResult.completed("ok"));
            List<Message> completed = new CopyOnWriteArrayList<>();
            orchestrator.getEventBus().subscribe(MessageType.TASK_COMPLETED, "monitor", completed::add);

            orchestrator.executeTask("anything");

            assertTrue(orchestrator.getEventBus().awaitIdle(Duration.ofSeconds(5)));
            assertEquals(4, completed.size());
            var bus = orchestrator.getEventBus();
            assertEquals(4, bus.history(MessageType.TASK_ASSIGNED, null, 100).size());
            assertEquals(4, bus.history(MessageType.TASK_STARTED, null, 100).size());
        }
    }

    @Nested
    @DisplayName("degraded workflows")
    class DegradedTests {

        @Test
        @DisplayName("clarification leaves the task blocked and its dependents undispatched")
        void clarificationBlocks() {
            Worker worker = mock(Worker.class);
            when(worker.execute(anyString(), anyMap())).thenAnswer(invocation -> {
                Map<String, Object> context = invocation.getArgument(1);
                if ("t2".equals(taskId(context))) {
                    return WorkerResult.clarificationNeeded(List.of("Which schema version?"));
                }
                return WorkerResult.completed("ok");
            });
            orchestrator = orchestratorFor(diamond(), worker);

            var result = orchestrator.executeTask("anything");

            assertEquals(TaskState.BLOCKED, orchestrator.getTaskStatus("t2").orElseThrow().getStatus());
            assertEquals(TaskState.PENDING, orchestrator.getTaskStatus("t4").orElseThrow().getStatus());
            assertEquals(WorkflowStatus.FAILED, result.status());
            assertTrue(result.degraded());
            assertFalse(result.isComplete());
            assertEquals(List.of("t2"), result.blockedTasks());
            assertEquals(List.of("t4"), result.pendingTasks());
            assertEquals(List.of("t1", "t3"), result.completedTasks());
            assertEquals(Map.of("t2", List.of("Which schema version?")), result.clarifications());
            verify(worker, times(3)).execute(anyString(), anyMap());
        }

        @Test
        @DisplayName("blocked task is announced as blocked progress")
        void blockedEvent() {
            orchestrator = orchestratorFor(diamond(), (description, context) ->
                    "t2".equals(taskId(context))
                            ? WorkerResult.clarificationNeeded(List.of("Which region?"))
                            : WorkerResult.completed("ok"));

            orchestrator.executeTask("anything");

            var progress = orchestrator.getEventBus().history(MessageType.TASK_PROGRESS, null, 10);
            assertEquals(1, progress.size());
            assertEquals("t2", progress.get(0).payload().get("taskId"));
            assertEquals("BLOCKED", progress.get(0).payload().get("status"));
        }

        @Test
        @DisplayName("worker exception fails the task and the workflow keeps going")
        void workerThrows() {
            orchestrator = orchestratorFor(diamond(), (description, context) -> {
                if ("t3".equals(taskId(context))) {
                    throw new IllegalStateException("sandbox crashed");
                }
                return WorkerResult.completed("ok");
            });

            var result = orchestrator.executeTask("anything");

            var failed = orchestrator.getTaskStatus("t3").orElseThrow();
            assertEquals(TaskState.FAILED, failed.getStatus());
            assertEquals("sandbox crashed", failed.getError());
            assertEquals(TaskState.COMPLETED, orchestrator.getTaskStatus("t2").orElseThrow().getStatus());
            assertEquals(List.of("t3"), result.failedTasks());
            assertEquals(List.of("t4"), result.pendingTasks());
            assertTrue(result.degraded());
            assertEquals(1, orchestrator.getEventBus().history(MessageType.TASK_FAILED, null, 10).size());
        }

        @Test
        @DisplayName("worker error result fails the task with its message")
        void workerError() {
            orchestrator = orchestratorFor(List.of(task("t1")),
                    (description, context) -> WorkerResult.error("quota exceeded"));

            var result = orchestrator.executeTask("anything");

            assertEquals("quota exceeded", orchestrator.getTaskStatus("t1").orElseThrow().getError());
            assertEquals(WorkflowStatus.FAILED, result.status());
        }

        @Test
        @DisplayName("worker Error in sequential dispatch fails the task and leaves the orchestrator reusable")
        void workerThrowsErrorSequentially() {
            properties.setParallelDispatch(false);
            orchestrator = orchestratorFor(List.of(task("t1")), (description, context) -> {
                throw new AssertionError("worker assertion tripped");
            });

            var result = orchestrator.executeTask("anything");

            var failed = orchestrator.getTaskStatus("t1").orElseThrow();
            assertEquals(TaskState.FAILED, failed.getStatus());
            assertEquals("worker assertion tripped", failed.getError());
            assertEquals(WorkflowStatus.FAILED, result.status());
            assertEquals(WorkflowStatus.FAILED, orchestrator.getStatus());
            assertEquals(List.of("t1"), result.failedTasks());

            var rerun = orchestrator.executeTask("again");
            assertEquals(WorkflowStatus.FAILED, rerun.status());
        }

        @Test
        @DisplayName("worker Error on a pool thread fails only that task")
        void workerThrowsErrorInParallel() {
            orchestrator = orchestratorFor(List.of(task("a"), task("b")), (description, context) -> {
                if ("b".equals(taskId(context))) {
                    throw new StackOverflowError();
                }
                return WorkerResult.completed("ok");
            });

            var result = orchestrator.executeTask("anything");

            assertEquals(TaskState.COMPLETED, orchestrator.getTaskStatus("a").orElseThrow().getStatus());
            var failed = orchestrator.getTaskStatus("b").orElseThrow();
            assertEquals(TaskState.FAILED, failed.getStatus());
            assertEquals("StackOverflowError", failed.getError());
            assertEquals(List.of("a"), result.completedTasks());
            assertEquals(List.of("b"), result.failedTasks());
            assertTrue(result.pendingTasks().isEmpty());
            assertTrue(result.blockedTasks().isEmpty());
            assertEquals(1, orchestrator.getEventBus().history(MessageType.TASK_FAILED, null, 10).size());
        }

        @Test
        @DisplayName("null worker result fails the task")
        void nullResult() {
            orchestrator = orchestratorFor(List.of(task("t1")), (description, context) -> null);

            orchestrator.executeTask("anything");

            assertEquals(TaskState.FAILED, orchestrator.getTaskStatus("t1").orElseThrow().getStatus());
        }
    }

    @Nested
    @DisplayName("planning failures")
    class PlanningFailureTests {

        @Test
        @DisplayName("circular dependencies abort before any dispatch")
        void cycle() {
            Worker worker = mock(Worker.class);
            orchestrator = orchestratorFor(
                    List.of(task("t1", "t3"), task("t2", "t1"), task("t3", "t2")), worker);

            var ex = assertThrows(WorkflowPlanningException.class, () -> orchestrator.executeTask("anything"));

            assertEquals(PlanningFailure.CYCLIC_DEPENDENCY, ex.getFailure());
            assertEquals(WorkflowStatus.FAILED, orchestrator.getStatus());
            verify(worker, never()).execute(anyString(), anyMap());
            assertEquals(1.0, registry.find("taskweave.workflows.total")
                    .tag("status", "FAILED").counter().count());
        }

        @Test
        @DisplayName("unknown dependency reference aborts planning")
        void unknownReference() {
            Worker worker = mock(Worker.class);
            orchestrator = orchestratorFor(List.of(task("t1"), task("t2", "ghost")), worker);

            var ex = assertThrows(WorkflowPlanningException.class, () -> orchestrator.executeTask("anything"));

            assertEquals(PlanningFailure.UNKNOWN_TASK_REFERENCE, ex.getFailure());
            assertTrue(ex.getMessage().contains("ghost"));
            verify(worker, never()).execute(anyString(), anyMap());
        }
    }

    @Nested
    @DisplayName("dispatch modes")
    class DispatchModeTests {

        @Test
        @DisplayName("tasks of one step run concurrently when parallel dispatch is on")
        void parallelDispatch() {
            var bothRunning = new CountDownLatch(2);
            orchestrator = orchestratorFor(diamond(), (description, context) -> {
                String id = taskId(context);
                if (id.equals("t2") || id.equals("t3")) {
                    bothRunning.countDown();
                    try {
                        if (!bothRunning.await(5, TimeUnit.SECONDS)) {
                            return WorkerResult.error("sibling never started");
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return WorkerResult.error("interrupted");
                    }
                }
                return WorkerResult.completed("ok");
            });

            var result = orchestrator.executeTask("anything");

            assertEquals(WorkflowStatus.COMPLETED, result.status());
            assertEquals(1, registry.find("taskweave.step.task_count").tag("mode", "parallel").summary().count());
        }

        @Test
        @DisplayName("steps run sequentially when parallel dispatch is off")
        void sequentialDispatch() {
            properties.setParallelDispatch(false);
            List<String> order = new CopyOnWriteArrayList<>();
            orchestrator = orchestratorFor(diamond(), (description, context) -> {
                order.add(taskId(context));
                return WorkerResult.completed("ok");
            });

            orchestrator.executeTask("anything");

            assertEquals(List.of("t1", "t2", "t3", "t4"), order);
            assertNull(registry.find("taskweave.step.task_count").tag("mode", "parallel").summary());
        }

        @Test
        @DisplayName("worker ids carry the prefix and the task domain")
        void workerIds() {
            properties.setWorkerIdPrefix("agent");
            orchestrator = orchestratorFor(List.of(task("t1")), (description, context) -> WorkerResult.completed("ok"));

            orchestrator.executeTask("anything");

            assertTrue(orchestrator.getTaskStatus("t1").orElseThrow().getWorkerId().startsWith("agent-general-"));
        }
    }

    @Nested
    @DisplayName("state and queries")
    class StateTests {

        @Test
        @DisplayName("convenience constructor starts the event bus")
        void convenienceConstructorStartsBus() throws InterruptedException {
            orchestrator = new Orchestrator((description, context) -> WorkerResult.completed("ok"));
            var started = new CopyOnWriteArrayList<Message>();
            orchestrator.getEventBus().subscribe(MessageType.TASK_STARTED, "monitor", started::add);

            assertTrue(orchestrator.getEventBus().isRunning());
            orchestrator.executeTask("Create a simple Python function");

            assertTrue(orchestrator.getEventBus().awaitIdle(Duration.ofSeconds(5)));
            assertFalse(started.isEmpty());
        }

        @Test
        @DisplayName("a new run resets the previous workflow state")
        void rerunResets() {
            orchestrator = orchestratorFor(diamond(), (description, context) -> WorkerResult.completed("ok"));

            var first = orchestrator.executeTask("first");
            var second = orchestrator.executeTask("second");

            assertNotEquals(first.workflowId(), second.workflowId());
            assertEquals(4, second.results().totalResults());
            assertEquals(4, orchestrator.getProgress().taskStats().totalTasks());
        }

        @Test
        @DisplayName("progress snapshot combines tracker, results and bus")
        void progressSnapshot() {
            orchestrator = orchestratorFor(diamond(), (description, context) -> WorkerResult.completed("ok"));

            orchestrator.executeTask("anything");
            var progress = orchestrator.getProgress();

            assertEquals(WorkflowStatus.COMPLETED, progress.status());
            assertEquals(4, progress.resultStats().totalResults());
            assertTrue(progress.busStats().running());
            assertEquals(1.0, progress.overallProgress(), 1e-9);
        }

        @Test
        @DisplayName("results can be rendered in every format")
        void results() {
            orchestrator = orchestratorFor(diamond(), (description, context) -> WorkerResult.completed("ok"));
            orchestrator.executeTask("anything");

            assertTrue(orchestrator.getResults("summary").contains("Workflow completed with 4 tasks"));
            assertTrue(orchestrator.getResults(List.of("t1"), ResultFormat.DETAILED).contains("Task: t1"));
            assertTrue(orchestrator.getResults("json").contains("\"totalResults\""));
        }

        @Test
        @DisplayName("reporting progress for an unknown task is rejected")
        void unknownProgress() {
            orchestrator = orchestratorFor(diamond(), (description, context) -> WorkerResult.completed("ok"));

            assertThrows(IllegalArgumentException.class, () -> orchestrator.reportProgress("t9", 0.5));
        }

        @Test
        @DisplayName("cleanup returns to idle")
        void cleanup() {
            orchestrator = orchestratorFor(diamond(), (description, context) -> WorkerResult.completed("ok"));
            orchestrator.executeTask("anything");

            orchestrator.cleanup();

            assertEquals(WorkflowStatus.IDLE, orchestrator.getStatus());
            assertTrue(orchestrator.getTaskStatus("t1").isEmpty());
            assertTrue(orchestrator.getPlan().isEmpty());
        }

        @Test
        @DisplayName("workflow ids follow TW-YYYY-NNNN")
        void workflowIdFormat() {
            assertTrue(Orchestrator.generateWorkflowId().matches("TW-\\d{4}-\\d{4,}"));
        }
    }

    @Test
    @DisplayName("factory creates started orchestrators with their own bus")
    void factory() {
        var factory = new OrchestratorFactory(new TaskAnalyzer(), new TaskDecomposer(), new DependencyMapper(),
                new ExecutionPlanner(), properties, new TaskweaveMetrics(registry));
        Worker worker = (description, context) -> WorkerResult.completed("ok");

        try (var first = factory.create(worker); var second = factory.create(worker)) {
            assertTrue(first.getEventBus().isRunning());
            assertNotSame(first.getEventBus(), second.getEventBus());
        }
    }
}
