package com.p14n.topicbus.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Exports OpenTelemetry metrics for a single topic. Every measurement carries
 * the topic's full id as the {@code topic} attribute.
 *
 * <p>
 * Instruments:
 * </p>
 * <ul>
 * <li>messages_published: messages accepted for delivery</li>
 * <li>messages_denied: messages rejected by the security policy</li>
 * <li>handler_invocations: handler runs, successful or not</li>
 * <li>handler_errors: handler runs that failed</li>
 * <li>registered_handlers: handlers currently registered</li>
 * <li>handler_latency: duration of successful handler runs in milliseconds</li>
 * </ul>
 */
public class TopicTelemetry {

        private static final AttributeKey<String> TOPIC = AttributeKey.stringKey("topic");

        private final Attributes attributes;
        private final LongCounter publishedMessages;
        private final LongCounter deniedMessages;
        private final LongCounter handlerInvocations;
        private final LongCounter handlerErrors;
        private final LongUpDownCounter registeredHandlers;
        private final DoubleHistogram handlerLatency;

        /**
         * Creates the instruments for a topic.
         *
         * @param meter   OpenTelemetry meter used to create the metric instruments
         * @param topicId full id of the topic being measured
         */
        public TopicTelemetry(Meter meter, String topicId) {
                this.attributes = Attributes.of(TOPIC, topicId);

                publishedMessages = meter.counterBuilder("messages_published")
                                .setDescription("Number of messages accepted for delivery")
                                .build();

                deniedMessages = meter.counterBuilder("messages_denied")
                                .setDescription("Number of messages rejected by sender security")
                                .build();

                handlerInvocations = meter.counterBuilder("handler_invocations")
                                .setDescription("Number of handler invocations")
                                .build();

                handlerErrors = meter.counterBuilder("handler_errors")
                                .setDescription("Number of failed handler invocations")
                                .build();

                registeredHandlers = meter.upDownCounterBuilder("registered_handlers")
                                .setDescription("Number of registered handlers")
                                .build();

                handlerLatency = meter.histogramBuilder("handler_latency")
                                .setDescription("Duration of successful handler invocations")
                                .setUnit("ms")
                                .build();
        }

        public void recordPublished() {
                publishedMessages.add(1, attributes);
        }

        public void recordDenied() {
                deniedMessages.add(1, attributes);
        }

        /**
         * Records one handler run.
         *
         * @param success   whether the handler completed normally
         * @param latencyMs duration, only recorded on success
         */
        public void recordInvocation(boolean success, double latencyMs) {
                handlerInvocations.add(1, attributes);
                if (success) {
                        handlerLatency.record(latencyMs, attributes);
                } else {
                        handlerErrors.add(1, attributes);
                }
        }

        public void recordHandlerRegistered() {
                registeredHandlers.add(1, attributes);
        }
}
