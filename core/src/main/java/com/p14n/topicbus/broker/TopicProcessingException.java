package com.p14n.topicbus.broker;

/**
 * Thrown to the publisher by topics using {@link ErrorStrategy#RAISE}.
 * The cause is the captured failure.
 */
public class TopicProcessingException extends TopicBusException {

    public TopicProcessingException(String topicId, Throwable cause) {
        super(String.format("Critical error in topic '%s': %s", topicId, cause.getMessage()), cause);
    }
}
