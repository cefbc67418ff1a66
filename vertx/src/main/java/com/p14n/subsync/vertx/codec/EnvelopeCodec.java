package com.p14n.subsync.vertx.codec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.subsync.data.EndpointAddress;
import com.p14n.subsync.data.Envelope;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.MessageCodec;

/**
 * MessageCodec for sending {@link Envelope}s across the Vert.x EventBus.
 *
 * <p>
 * Wire format:
 * [4 bytes: length][JSON string]
 * </p>
 *
 * <p>
 * The JSON carries the message type name, the source address and the message
 * itself. The type name is resolved through {@link MessageTypes} on decode.
 * Local delivery passes the envelope through untouched.
 * </p>
 */
public class EnvelopeCodec implements MessageCodec<Envelope, Envelope> {

    public static final String NAME = "subsync-envelope";

    private final MessageTypes types;
    private final ObjectMapper mapper;

    public EnvelopeCodec(MessageTypes types) {
        this(types, new ObjectMapper());
    }

    public EnvelopeCodec(MessageTypes types, ObjectMapper mapper) {
        this.types = types;
        this.mapper = mapper;
    }

    @Override
    public void encodeToWire(Buffer buffer, Envelope envelope) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", envelope.messageType());
        if (envelope.sourceAddress() != null) {
            node.put("source", envelope.sourceAddress().toString());
        }
        node.set("message", mapper.valueToTree(envelope.message()));

        byte[] jsonBytes = node.toString().getBytes(StandardCharsets.UTF_8);
        buffer.appendInt(jsonBytes.length);
        buffer.appendBytes(jsonBytes);
    }

    @Override
    public Envelope decodeFromWire(int pos, Buffer buffer) {
        int length = buffer.getInt(pos);
        byte[] jsonBytes = buffer.getBytes(pos + 4, pos + 4 + length);

        try {
            JsonNode node = mapper.readTree(jsonBytes);
            Class<?> type = types.resolve(node.path("type").asText());
            Object message = mapper.treeToValue(node.get("message"), type);
            EndpointAddress source = node.hasNonNull("source")
                    ? EndpointAddress.parse(node.get("source").asText())
                    : null;
            return new Envelope(message, source);
        } catch (IOException e) {
            throw new IllegalArgumentException("Unreadable envelope", e);
        }
    }

    @Override
    public Envelope transform(Envelope envelope) {
        return envelope;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public byte systemCodecID() {
        return -1;
    }
}
