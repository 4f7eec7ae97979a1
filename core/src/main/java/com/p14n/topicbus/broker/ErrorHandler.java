package com.p14n.topicbus.broker;

/**
 * Receives failures for topics using {@link ErrorStrategy#CUSTOM}.
 * Anything thrown from here is logged and dropped.
 */
@FunctionalInterface
public interface ErrorHandler {

    /**
     * @param error the captured failure
     * @param data  the payload being processed, or the message for a denied publish
     * @throws Exception never propagated to the publisher
     */
    void onError(Throwable error, Object data) throws Exception;
}
