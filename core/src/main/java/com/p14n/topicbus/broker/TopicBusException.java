package com.p14n.topicbus.broker;

/**
 * Base type for failures raised by topics and brokers.
 */
public class TopicBusException extends RuntimeException {

    public TopicBusException(String message) {
        super(message);
    }

    public TopicBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
