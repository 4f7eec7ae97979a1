package com.p14n.topicbus.broker;

/**
 * No topic is registered under the id a message was published to.
 */
public class TopicNotFoundException extends TopicBusException {

    private final String topicId;

    public TopicNotFoundException(String topicId) {
        super(String.format("Topic with id '%s' not found", topicId));
        this.topicId = topicId;
    }

    public String getTopicId() {
        return topicId;
    }
}
