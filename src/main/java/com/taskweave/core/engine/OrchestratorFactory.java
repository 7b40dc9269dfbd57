package com.taskweave.core.engine;

import com.taskweave.core.analysis.TaskAnalyzer;
import com.taskweave.core.config.OrchestratorProperties;
import com.taskweave.core.decomposition.TaskDecomposer;
import com.taskweave.core.events.EventBus;
import com.taskweave.core.graph.DependencyMapper;
import com.taskweave.core.metrics.TaskweaveMetrics;
import com.taskweave.core.planning.ExecutionPlanner;
import com.taskweave.core.results.ResultAggregator;
import com.taskweave.core.tracking.TaskStateTracker;
import com.taskweave.core.worker.Worker;
import org.springframework.stereotype.Service;

/**
 * Builds started {@link Orchestrator} instances wired to the shared planning services.
 * <p>
 * Each orchestrator gets its own event bus, state tracker and result aggregator; nothing
 * runtime-related is shared between orchestrators.
 */
@Service
public class OrchestratorFactory {

    private final TaskAnalyzer analyzer;
    private final TaskDecomposer decomposer;
    private final DependencyMapper dependencyMapper;
    private final ExecutionPlanner planner;
    private final OrchestratorProperties properties;
    private final TaskweaveMetrics metrics;

    public OrchestratorFactory(TaskAnalyzer analyzer, TaskDecomposer decomposer,
                               DependencyMapper dependencyMapper, ExecutionPlanner planner,
                               OrchestratorProperties properties, TaskweaveMetrics metrics) {
        this.analyzer = analyzer;
        this.decomposer = decomposer;
        this.dependencyMapper = dependencyMapper;
        this.planner = planner;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Creates and starts an orchestrator dispatching to {@code worker}. Close it when done.
     */
    public Orchestrator create(Worker worker) {
        var orchestrator = new Orchestrator(analyzer, decomposer, dependencyMapper, planner, worker,
                properties, metrics, new EventBus(properties.getHistoryLimit()),
                new TaskStateTracker(), new ResultAggregator());
        orchestrator.start();
        return orchestrator;
    }
}
