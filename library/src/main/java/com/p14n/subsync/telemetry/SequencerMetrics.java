package com.p14n.subsync.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

public class SequencerMetrics {
        private final Attributes attributes;
        private final LongCounter completed;
        private final LongCounter failed;
        private final LongUpDownCounter pending;

        public SequencerMetrics(Meter meter, String sequencer) {
                attributes = Attributes.of(AttributeKey.stringKey("sequencer"), sequencer);

                completed = meter.counterBuilder("sequencer_items_completed")
                                .setDescription("Number of work items that ran to completion")
                                .build();

                failed = meter.counterBuilder("sequencer_items_failed")
                                .setDescription("Number of work items that threw")
                                .build();

                pending = meter.upDownCounterBuilder("sequencer_items_pending")
                                .setDescription("Number of work items queued and not yet finished")
                                .build();
        }

        public void recordSubmitted() {
                pending.add(1, attributes);
        }

        public void recordCompleted() {
                pending.add(-1, attributes);
                completed.add(1, attributes);
        }

        public void recordFailed() {
                pending.add(-1, attributes);
                failed.add(1, attributes);
        }

        public void recordAbandoned(int count) {
                pending.add(-count, attributes);
        }
}
