package com.taskweave.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An immutable message on the event bus.
 *
 * @param id        unique message id
 * @param type      message type
 * @param sender    sender id (e.g. "orchestrator" or a worker id)
 * @param recipient target subscriber id; null means broadcast to every subscriber of the type
 * @param payload   arbitrary key-value data
 * @param timestamp when the message was created
 */
public record Message(
    String id,
    MessageType type,
    String sender,
    String recipient,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    public Message {
        payload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Map.of();
    }

    public static Message broadcast(MessageType type, String sender, Map<String, Object> payload) {
        return direct(type, sender, null, payload);
    }

    public static Message direct(MessageType type, String sender, String recipient, Map<String, Object> payload) {
        Instant now = Instant.now();
        String id = sender + "_" + (now.getEpochSecond() * 1_000_000_000L + now.getNano())
                + "_" + SEQUENCE.incrementAndGet();
        return new Message(id, type, sender, recipient, payload, now);
    }

    public boolean isBroadcast() {
        return recipient == null || recipient.isBlank();
    }
}
