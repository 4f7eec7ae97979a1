package com.p14n.topicbus.broker;

import com.p14n.topicbus.data.Message;

/**
 * A named occurrence bound to one topic. Concrete kinds decide how a message is
 * assembled before it is handed to the topic; all delivery semantics stay in
 * {@link Topic}.
 */
public abstract class Event {

    protected final String name;
    protected final Topic topic;
    protected final int priority;
    protected final String alias;
    protected final boolean allowBroadcast;

    /**
     * @param name           name of the event
     * @param topic          owning topic
     * @param priority       default priority for handlers registered through the event
     * @param alias          optional alternate name, may be null
     * @param allowBroadcast whether messages without a destination stay undirected
     */
    protected Event(String name, Topic topic, int priority, String alias, boolean allowBroadcast) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("name cannot be null or empty");
        }
        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }
        this.name = name;
        this.topic = topic;
        this.priority = priority;
        this.alias = alias;
        this.allowBroadcast = allowBroadcast;
    }

    /**
     * Fires the event with the given message.
     *
     * @param message the message to deliver
     */
    public abstract void trigger(Message message);

    public void trigger(String sender, Object data) {
        trigger(Message.create(sender, data));
    }

    /**
     * Registers a handler that answers to this event, at the event's priority.
     *
     * @return the handler, unchanged
     */
    public <H extends MessageHandler> H register(String handlerName, H handler) {
        return topic.register(handlerName, HandlerOptions.priority(priority).withAliases(target()), handler);
    }

    /**
     * @return the alias when set, otherwise the name
     */
    public String target() {
        return alias != null ? alias : name;
    }

    public String getName() {
        return name;
    }

    public Topic getTopic() {
        return topic;
    }

    public int getPriority() {
        return priority;
    }

    public String getAlias() {
        return alias;
    }

    public boolean isAllowBroadcast() {
        return allowBroadcast;
    }
}
