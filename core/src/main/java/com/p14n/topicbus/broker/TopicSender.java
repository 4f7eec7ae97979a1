package com.p14n.topicbus.broker;

import java.util.Map;
import java.util.Optional;

import com.p14n.topicbus.data.HandlerInfo;
import com.p14n.topicbus.data.Message;

/**
 * Publishes messages addressed to one registered handler through the topic's
 * broker. Obtained from {@link Topic#sender(String)}.
 *
 * <pre>{@code
 * topic.register("refresh", data -> reload(data));
 * TopicSender refresh = topic.sender("refresh");
 * button.onClick(() -> refresh.send(selection));
 * }</pre>
 */
public class TopicSender {

    private final Topic topic;
    private final HandlerInfo handler;

    TopicSender(Topic topic, HandlerInfo handler) {
        this.topic = topic;
        this.handler = handler;
    }

    /**
     * @param data payload for the handler
     * @return the published message, or empty if the topic has no broker
     */
    public Optional<Message> send(Object data) {
        return send(data, Map.of());
    }

    /**
     * @param data     payload for the handler
     * @param metadata extra values carried on the message
     * @return the published message, or empty if the topic has no broker
     */
    public Optional<Message> send(Object data, Map<String, Object> metadata) {
        return topic.sendFrom(handler, data, metadata);
    }

    public HandlerInfo getHandler() {
        return handler;
    }
}
