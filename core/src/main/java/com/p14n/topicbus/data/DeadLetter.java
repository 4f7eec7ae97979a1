package com.p14n.topicbus.data;

import java.time.Instant;

/**
 * A failure captured by a topic: the error and the payload that was being
 * processed when it happened.
 *
 * @param error    the captured failure
 * @param data     the payload, or the whole message for a denied publish
 * @param failedAt when the failure was captured
 */
public record DeadLetter(Throwable error, Object data, Instant failedAt) {
}
