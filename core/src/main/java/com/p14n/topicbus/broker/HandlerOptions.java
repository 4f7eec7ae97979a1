package com.p14n.topicbus.broker;

import java.util.List;

/**
 * Registration options for a handler.
 *
 * @param aliases       alternate destination names the handler answers to
 * @param priority      higher runs earlier, equal priorities run in registration order
 * @param generic       receive every message regardless of destination
 * @param transactional recorded on the registration, no effect on delivery
 */
public record HandlerOptions(List<String> aliases, int priority, boolean generic, boolean transactional) {

    public static final HandlerOptions DEFAULTS = new HandlerOptions(List.of(), 0, false, false);

    public HandlerOptions {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    public static HandlerOptions priority(int priority) {
        return DEFAULTS.withPriority(priority);
    }

    public static HandlerOptions genericHandler() {
        return DEFAULTS.asGeneric();
    }

    public static HandlerOptions aliases(String... aliases) {
        return DEFAULTS.withAliases(aliases);
    }

    public HandlerOptions withPriority(int priority) {
        return new HandlerOptions(aliases, priority, generic, transactional);
    }

    public HandlerOptions withAliases(String... aliases) {
        return new HandlerOptions(List.of(aliases), priority, generic, transactional);
    }

    public HandlerOptions asGeneric() {
        return new HandlerOptions(aliases, priority, true, transactional);
    }

    public HandlerOptions asTransactional() {
        return new HandlerOptions(aliases, priority, generic, true);
    }
}
