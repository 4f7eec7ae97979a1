package com.p14n.topicbus.broker;

/**
 * Wraps whatever a handler threw, keeping the handler's name.
 */
public class HandlerExecutionException extends TopicBusException {

    private final String handlerName;

    public HandlerExecutionException(String handlerName, Throwable cause) {
        super(String.format("Handler '%s' failed: %s", handlerName, cause.getMessage()), cause);
        this.handlerName = handlerName;
    }

    public String getHandlerName() {
        return handlerName;
    }
}
