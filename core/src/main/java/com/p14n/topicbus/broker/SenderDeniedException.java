package com.p14n.topicbus.broker;

/**
 * A publish was rejected by the topic's blacklist or whitelist.
 * Goes through the same error path as a handler failure.
 */
public class SenderDeniedException extends TopicBusException {

    private final String sender;
    private final String topicId;

    public SenderDeniedException(String sender, String topicId) {
        super(String.format("Sender '%s' blocked by security policy in topic '%s'", sender, topicId));
        this.sender = sender;
        this.topicId = topicId;
    }

    public String getSender() {
        return sender;
    }

    public String getTopicId() {
        return topicId;
    }
}
