package com.p14n.topicbus.broker;

/**
 * A {@link MessageHandler} that is submitted to the topic's executor instead of
 * running on the publishing thread. Publishing does not wait for it to finish.
 *
 * <pre>{@code
 * topic.register("audit", (AsyncMessageHandler) data -> auditLog.write(data));
 * }</pre>
 */
@FunctionalInterface
public interface AsyncMessageHandler extends MessageHandler {
}
