package com.p14n.topicbus.broker;

/**
 * Topic-wide policy deciding how handler failures and denied publishes surface.
 *
 * <p>
 * Whatever the strategy, the failure is first captured in the topic's failure
 * buffer.
 * </p>
 */
public enum ErrorStrategy {

    /**
     * Throw a {@link TopicProcessingException} to the publisher and stop delivery.
     */
    RAISE,

    /**
     * Log a warning and continue with the next handler.
     */
    WARN,

    /**
     * Continue silently.
     */
    IGNORE,

    /**
     * Hand the failure to the topic's {@link ErrorHandler}, falling back to the
     * built-in behaviour when none is configured.
     */
    CUSTOM
}
