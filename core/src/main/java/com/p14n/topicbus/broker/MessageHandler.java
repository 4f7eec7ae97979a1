package com.p14n.topicbus.broker;

/**
 * Callable registered with a topic to process delivered payloads.
 * Runs inline on the publishing thread.
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Called with the {@code data} of each message routed to this handler.
     *
     * @param data the message payload
     * @throws Exception any failure, handled according to the topic's strategy
     */
    void onMessage(Object data) throws Exception;
}
