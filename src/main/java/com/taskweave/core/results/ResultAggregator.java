package com.taskweave.core.results;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects worker outputs and folds them per task and per workflow.
 * <p>
 * {@link #addResult} is safe to call from concurrently running workers.
 */
public class ResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    private final Map<String, Result> results = new ConcurrentHashMap<>();
    private final Map<String, CopyOnWriteArrayList<String>> resultsByTask = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ObjectMapper objectMapper;

    public ResultAggregator() {
        this(defaultObjectMapper());
    }

    public ResultAggregator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Records a worker output.
     *
     * @return the generated result id
     */
    public String addResult(String taskId, String workerId, Object output, Map<String, Object> metadata) {
        String resultId = taskId + "_" + workerId + "_" + sequence.incrementAndGet();
        var result = new Result(resultId, taskId, workerId, output, metadata, Instant.now());
        results.put(resultId, result);
        resultsByTask.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(resultId);
        log.debug("Added result {} for task {}", resultId, taskId);
        return resultId;
    }

    public Optional<Result> getResult(String resultId) {
        return Optional.ofNullable(results.get(resultId));
    }

    public List<Result> getTaskResults(String taskId) {
        var ids = resultsByTask.get(taskId);
        if (ids == null) {
            return List.of();
        }
        return ids.stream().map(results::get).filter(Objects::nonNull).toList();
    }

    public List<Result> getWorkerResults(String workerId) {
        return results.values().stream()
                .filter(r -> r.workerId().equals(workerId))
                .sorted(Comparator.comparing(Result::timestamp))
                .toList();
    }

    public TaskResultSummary aggregateTaskResults(String taskId) {
        var taskResults = new ArrayList<>(getTaskResults(taskId));
        if (taskResults.isEmpty()) {
            return TaskResultSummary.empty(taskId);
        }
        taskResults.sort(Comparator.comparing(Result::timestamp));
        var workers = new LinkedHashSet<String>();
        taskResults.forEach(r -> workers.add(r.workerId()));
        return new TaskResultSummary(taskId, TaskResultSummary.COMPLETED, List.copyOf(taskResults),
                List.copyOf(workers), taskResults.get(0).timestamp(),
                taskResults.get(taskResults.size() - 1).timestamp());
    }

    public WorkflowResultSummary aggregateWorkflowResults(List<String> taskIds) {
        var perTask = new LinkedHashMap<String, TaskResultSummary>();
        var workers = new LinkedHashSet<String>();
        int total = 0;
        for (var taskId : taskIds) {
            var summary = aggregateTaskResults(taskId);
            perTask.put(taskId, summary);
            workers.addAll(summary.workers());
            total += summary.resultCount();
        }
        return new WorkflowResultSummary(taskIds.size(), total, List.copyOf(workers), perTask);
    }

    public void clearTaskResults(String taskId) {
        var ids = resultsByTask.remove(taskId);
        if (ids != null) {
            ids.forEach(results::remove);
            log.debug("Cleared results for task {}", taskId);
        }
    }

    public void clearAll() {
        results.clear();
        resultsByTask.clear();
        log.info("Cleared all results");
    }

    public ResultStats stats() {
        long workers = results.values().stream().map(Result::workerId).distinct().count();
        return new ResultStats(results.size(), resultsByTask.size(), (int) workers);
    }

    /**
     * Renders the workflow results of the given tasks for presentation.
     */
    public String formatFinalOutput(List<String> taskIds, ResultFormat format) {
        var workflow = aggregateWorkflowResults(taskIds);
        return switch (format) {
            case JSON -> toJson(workflow);
            case DETAILED -> detailed(workflow);
            case SUMMARY -> summary(workflow);
        };
    }

    private String toJson(WorkflowResultSummary workflow) {
        try {
            return objectMapper.writeValueAsString(workflow);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize workflow results", e);
        }
    }

    private String summary(WorkflowResultSummary workflow) {
        return "Workflow completed with " + workflow.totalTasks() + " tasks\n"
                + "Total results: " + workflow.totalResults() + "\n"
                + "Workers: " + String.join(", ", workflow.workers());
    }

    private String detailed(WorkflowResultSummary workflow) {
        String rule = "=".repeat(60);
        var out = new StringBuilder();
        out.append(rule).append('\n')
                .append("WORKFLOW RESULTS\n")
                .append(rule).append('\n')
                .append("\nTotal Tasks: ").append(workflow.totalTasks()).append('\n')
                .append("Total Results: ").append(workflow.totalResults()).append('\n')
                .append("Workers Involved: ").append(String.join(", ", workflow.workers())).append('\n')
                .append('\n').append("-".repeat(60)).append('\n');

        for (var summary : workflow.taskResults().values()) {
            out.append("\nTask: ").append(summary.taskId()).append('\n')
                    .append("Status: ").append(summary.status()).append('\n');
            int i = 1;
            for (var result : summary.outputs()) {
                out.append("\n  Result ").append(i++).append(" (from ").append(result.workerId()).append("):\n")
                        .append("    ").append(result.output()).append('\n');
            }
        }
        out.append('\n').append(rule);
        return out.toString();
    }
}
