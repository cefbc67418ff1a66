package com.p14n.subsync.data;

/**
 * A message as delivered to a receive endpoint, tagged with the address of
 * the endpoint that sent it.
 */
public record Envelope(Object message, EndpointAddress sourceAddress) {

    public Envelope {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
    }

    public String messageType() {
        return message.getClass().getSimpleName();
    }
}
