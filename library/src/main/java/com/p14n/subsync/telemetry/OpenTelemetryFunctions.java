package com.p14n.subsync.telemetry;

import java.util.function.Supplier;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

public class OpenTelemetryFunctions {

        public static <T> T processWithTelemetry(Tracer tracer, String spanName, Attributes attributes,
                                                 Supplier<T> action) {

                Span span = tracer.spanBuilder(spanName)
                        .setAllAttributes(attributes)
                        .startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        span.setStatus(StatusCode.ERROR);
                        throw e;
                } finally {
                        span.end();
                }
        }

        public static void runWithTelemetry(Tracer tracer, String spanName, Attributes attributes,
                                            Runnable action) {
                processWithTelemetry(tracer, spanName, attributes, () -> {
                        action.run();
                        return null;
                });
        }

}
