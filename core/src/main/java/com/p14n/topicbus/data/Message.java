package com.p14n.topicbus.data;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Record describing one occurrence delivered through a topic.
 *
 * <p>
 * Only {@code sender} and {@code data} are required. The sender is checked when
 * the message is published, not when it is built, so a message with a blank
 * sender can be created but never delivered.
 * </p>
 *
 * <p>
 * {@code priority} is carried but not used for ordering; handler priority is
 * what decides delivery order.
 * </p>
 *
 * @param sender      identity of the producer, checked against topic security
 * @param data        opaque payload handed to handlers
 * @param destination optional handler name or alias to route to
 * @param messageType optional classification
 * @param timestamp   optional epoch time in milliseconds
 * @param priority    optional, reserved
 * @param metadata    optional auxiliary values, never null itself but may hold
 *                    null keys or values
 */
public record Message(String sender,
                      Object data,
                      String destination,
                      String messageType,
                      Long timestamp,
                      Integer priority,
                      Map<String, Object> metadata) {

    public Message {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(metadata));
    }

    /**
     * Creates a message with no destination, so only generic handlers receive it.
     */
    public static Message create(String sender, Object data) {
        return new Message(sender, data, null, null, null, null, null);
    }

    /**
     * Creates a message routed to the handler named (or aliased) {@code destination}.
     */
    public static Message create(String sender, Object data, String destination) {
        return new Message(sender, data, destination, null, null, null, null);
    }

    public Message withDestination(String destination) {
        return new Message(sender, data, destination, messageType, timestamp, priority, metadata);
    }

    public Message withMessageType(String messageType) {
        return new Message(sender, data, destination, messageType, timestamp, priority, metadata);
    }

    public Message withTimestamp(Long timestamp) {
        return new Message(sender, data, destination, messageType, timestamp, priority, metadata);
    }

    public Message withPriority(Integer priority) {
        return new Message(sender, data, destination, messageType, timestamp, priority, metadata);
    }

    public Message withMetadata(Map<String, Object> metadata) {
        return new Message(sender, data, destination, messageType, timestamp, priority, metadata);
    }

    /**
     * @return true when the message names a destination
     */
    public boolean hasDestination() {
        return destination != null;
    }
}
