package com.p14n.topicbus.data;

import java.util.List;

/**
 * Read-only view of a registered handler. Never exposes the callable.
 *
 * @param topicId       full id ({@code id@version}) of the owning topic
 * @param name          handler name, unique within the topic
 * @param priority      higher runs earlier
 * @param aliases       alternate destination names
 * @param generic       receives every message regardless of destination
 * @param async         dispatched to the executor instead of run inline
 * @param transactional carried as metadata only
 */
public record HandlerInfo(String topicId,
                          String name,
                          int priority,
                          List<String> aliases,
                          boolean generic,
                          boolean async,
                          boolean transactional) {

    public HandlerInfo {
        aliases = List.copyOf(aliases);
    }

    /**
     * @return true if {@code destination} is this handler's name or one of its aliases
     */
    public boolean answersTo(String destination) {
        return destination != null && (destination.equals(name) || aliases.contains(destination));
    }
}
