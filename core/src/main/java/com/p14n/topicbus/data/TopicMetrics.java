package com.p14n.topicbus.data;

import java.time.Instant;

/**
 * Point-in-time copy of a topic's running metrics.
 *
 * @param id              full topic id
 * @param handlerCount    number of registered handlers
 * @param eventsProcessed handler invocations, successful or not
 * @param errors          failed handler invocations plus denied publishes
 * @param denied          publishes rejected by the security policy
 * @param lastProcessed   time of the latest handler invocation, null if none
 * @param latencyAvg      exponential moving average of successful handler
 *                        latency in milliseconds
 */
public record TopicMetrics(String id,
                           int handlerCount,
                           long eventsProcessed,
                           long errors,
                           long denied,
                           Instant lastProcessed,
                           double latencyAvg) {

    /**
     * Share of attempts that failed. Denied publishes count as attempts, so the
     * rate stays between 0 and 1.
     *
     * @return errors divided by handler invocations plus denied publishes, 0 when
     *         there were none
     */
    public double errorRate() {
        return (double) errors / Math.max(1, eventsProcessed + denied);
    }
}
