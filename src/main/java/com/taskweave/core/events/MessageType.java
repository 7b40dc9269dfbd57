package com.taskweave.core.events;

/**
 * Types of messages published on the {@link EventBus}.
 */
public enum MessageType {
    TASK_ASSIGNED,
    TASK_STARTED,
    TASK_PROGRESS,
    TASK_COMPLETED,
    TASK_FAILED,
    AGENT_REQUEST,
    AGENT_RESPONSE,
    SYSTEM_EVENT
}
