package com.p14n.subsync;

import java.time.Duration;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.semconv.ResourceAttributes;

public class Opentelemetry {
        public static OpenTelemetrySdk create(String serviceName, String collectorEndpoint) {
                Resource resource = Resource.create(Attributes.of(ResourceAttributes.SERVICE_NAME, serviceName));

                OtlpGrpcMetricExporter metricExporter = OtlpGrpcMetricExporter.builder()
                                .setEndpoint(collectorEndpoint)
                                .build();

                SdkMeterProvider meterProvider = SdkMeterProvider.builder()
                                .setResource(resource)
                                .registerMetricReader(PeriodicMetricReader.builder(metricExporter)
                                                .setInterval(Duration.ofSeconds(30))
                                                .build())
                                .build();

                OtlpGrpcSpanExporter spanExporter = OtlpGrpcSpanExporter.builder()
                                .setEndpoint(collectorEndpoint)
                                .build();

                SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                                .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
                                .setResource(resource)
                                .build();

                return OpenTelemetrySdk.builder()
                                .setMeterProvider(meterProvider)
                                .setTracerProvider(tracerProvider)
                                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                                .build();

        }
}
