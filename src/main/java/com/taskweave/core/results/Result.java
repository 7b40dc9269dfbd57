package com.taskweave.core.results;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of one successful worker dispatch.
 *
 * @param resultId  unique id assigned by the aggregator
 * @param taskId    task the output belongs to
 * @param workerId  worker that produced it
 * @param output    opaque worker output; never inspected
 * @param metadata  worker-supplied metadata
 * @param timestamp when the result was recorded
 */
public record Result(
    String resultId,
    String taskId,
    String workerId,
    Object output,
    Map<String, Object> metadata,
    Instant timestamp
) implements Serializable {

    public Result {
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }
}
