package com.p14n.subsync.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for service bus dispatch.
 * Tracks the number of published messages, delivered messages, and active
 * subscribers per message type.
 *
 * <ul>
 * <li>messages_published: Counter for total messages published per type</li>
 * <li>messages_received: Counter for total messages handed to subscribers per
 * type</li>
 * <li>active_subscribers: Up/down counter for current number of subscribers per
 * type</li>
 * </ul>
 */
public class BusMetrics {
        private static final AttributeKey<String> MESSAGE_TYPE = AttributeKey.stringKey("message_type");

        private final LongCounter publishedMessages;
        private final LongCounter receivedMessages;
        private final LongUpDownCounter activeSubscribers;

        /**
         * Creates a new BusMetrics instance with the provided OpenTelemetry meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public BusMetrics(Meter meter) {
                publishedMessages = meter.counterBuilder("messages_published")
                                .setDescription("Number of messages published")
                                .build();

                receivedMessages = meter.counterBuilder("messages_received")
                                .setDescription("Number of messages received by subscribers")
                                .build();

                activeSubscribers = meter.upDownCounterBuilder("active_subscribers")
                                .setDescription("Number of active subscribers")
                                .build();
        }

        public void recordPublished(String messageType) {
                publishedMessages.add(1, Attributes.of(MESSAGE_TYPE, messageType));
        }

        public void recordReceived(String messageType) {
                receivedMessages.add(1, Attributes.of(MESSAGE_TYPE, messageType));
        }

        public void recordSubscriberAdded(String messageType) {
                activeSubscribers.add(1, Attributes.of(MESSAGE_TYPE, messageType));
        }

        public void recordSubscriberRemoved(String messageType) {
                activeSubscribers.add(-1, Attributes.of(MESSAGE_TYPE, messageType));
        }
}
