package com.taskweave.core.results;

public record ResultStats(int totalResults, int uniqueTasks, int uniqueWorkers) {}
