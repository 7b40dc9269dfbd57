package com.taskweave.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "taskweave.orchestrator")
public class OrchestratorProperties {

    private boolean parallelDispatch = true;
    private int maxParallel = 4;
    private int maxDepth = 3;
    private int historyLimit = 1000;
    private String workerIdPrefix = "worker";

    public boolean isParallelDispatch() {
        return parallelDispatch;
    }

    public void setParallelDispatch(boolean parallelDispatch) {
        this.parallelDispatch = parallelDispatch;
    }

    public int getMaxParallel() {
        return maxParallel;
    }

    public void setMaxParallel(int maxParallel) {
        this.maxParallel = maxParallel;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    public String getWorkerIdPrefix() {
        return workerIdPrefix;
    }

    public void setWorkerIdPrefix(String workerIdPrefix) {
        this.workerIdPrefix = workerIdPrefix;
    }
}
