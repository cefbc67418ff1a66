package com.p14n.subsync.vertx.codec;

import java.util.List;
import java.util.UUID;

import com.p14n.subsync.data.EndpointAddress;
import com.p14n.subsync.data.Envelope;
import com.p14n.subsync.data.Subscription;
import com.p14n.subsync.data.SubscriptionClientRemoved;
import com.p14n.subsync.data.SubscriptionRefresh;

import io.vertx.core.buffer.Buffer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeCodecTest {

    private final EnvelopeCodec codec = new EnvelopeCodec(MessageTypes.defaults());

    @Test
    void shouldCarrySnapshotAndSourceAcrossTheWire() {
        var refresh = new SubscriptionRefresh(List.of(
                Subscription.create("OrderPlaced", "q://orders"),
                Subscription.create("OrderShipped", "q://shipping")));
        var envelope = new Envelope(refresh, EndpointAddress.parse("vertx://subscription-service"));
        Buffer buffer = Buffer.buffer().appendString("prefix");

        codec.encodeToWire(buffer, envelope);
        Envelope decoded = codec.decodeFromWire(6, buffer);

        assertEquals(envelope, decoded);
    }

    @Test
    void shouldAllowMissingSourceAndNullFields() {
        var removed = new SubscriptionClientRemoved(EndpointAddress.parse("ctl://x"), UUID.randomUUID(), null);
        Buffer buffer = Buffer.buffer();

        codec.encodeToWire(buffer, new Envelope(removed, null));
        Envelope decoded = codec.decodeFromWire(0, buffer);

        assertEquals(removed, decoded.message());
        assertNull(decoded.sourceAddress());
    }

    @Test
    void shouldRejectUnknownMessageType() {
        Buffer buffer = Buffer.buffer();
        new EnvelopeCodec(new MessageTypes().register(Unknown.class))
                .encodeToWire(buffer, new Envelope(new Unknown("x"), null));

        assertThrows(IllegalArgumentException.class, () -> codec.decodeFromWire(0, buffer));
    }

    @Test
    void shouldRejectClashingTypeNames() {
        var types = new MessageTypes().register(SubscriptionRefresh.class);

        assertDoesNotThrow(() -> types.register(SubscriptionRefresh.class));
        assertThrows(IllegalArgumentException.class, () -> types.register(Other.SubscriptionRefresh.class));
    }

    record Unknown(String value) {
    }

    static class Other {
        record SubscriptionRefresh(String value) {
        }
    }
}
