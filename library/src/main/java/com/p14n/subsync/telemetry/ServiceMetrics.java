package com.p14n.subsync.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Counts the notifications the subscription service pushes to clients.
 */
public class ServiceMetrics {
        private static final AttributeKey<String> NOTIFICATION = AttributeKey.stringKey("notification");

        private final LongCounter sent;
        private final LongCounter failed;

        public ServiceMetrics(Meter meter) {
                sent = meter.counterBuilder("notifications_sent")
                                .setDescription("Number of notifications delivered to client control endpoints")
                                .build();

                failed = meter.counterBuilder("notifications_failed")
                                .setDescription("Number of notifications that could not be delivered")
                                .build();
        }

        public void recordSent(String notification) {
                sent.add(1, Attributes.of(NOTIFICATION, notification));
        }

        public void recordFailed(String notification) {
                failed.add(1, Attributes.of(NOTIFICATION, notification));
        }
}
