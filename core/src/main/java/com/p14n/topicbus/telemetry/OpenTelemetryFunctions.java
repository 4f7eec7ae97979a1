package com.p14n.topicbus.telemetry;

import java.util.function.Supplier;

import com.p14n.topicbus.data.Message;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

public class OpenTelemetryFunctions {

        private OpenTelemetryFunctions() {
        }

        public static <T> T processWithTelemetry(Tracer tracer, String spanName, String topicId, Message message,
                        String handlerName, Supplier<T> action) {

                SpanBuilder sb = tracer.spanBuilder(spanName)
                                .setAttribute("topic", topicId)
                                .setAttribute("sender", String.valueOf(message.sender()));
                if (message.destination() != null) {
                        sb.setAttribute("destination", message.destination());
                }
                if (handlerName != null) {
                        sb.setAttribute("handler", handlerName);
                }
                return inSpan(sb.startSpan(), action);
        }

        private static <T> T inSpan(Span span, Supplier<T> action) {
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }

}
