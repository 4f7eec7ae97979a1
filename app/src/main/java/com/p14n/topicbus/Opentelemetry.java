package com.p14n.topicbus;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.semconv.ResourceAttributes;

/**
 * Builds the SDK instance the dashboard hands to its broker. The caller owns it
 * and closes it on shutdown to flush the meter and tracer providers.
 */
public class Opentelemetry {

        private Opentelemetry() {
        }

        public static OpenTelemetrySdk create(String serviceName) {
                Resource resource = Resource.getDefault()
                                .merge(Resource.create(Attributes.of(ResourceAttributes.SERVICE_NAME, serviceName)));

                return OpenTelemetrySdk.builder()
                                .setMeterProvider(SdkMeterProvider.builder().setResource(resource).build())
                                .setTracerProvider(SdkTracerProvider.builder().setResource(resource).build())
                                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                                .build();
        }
}
