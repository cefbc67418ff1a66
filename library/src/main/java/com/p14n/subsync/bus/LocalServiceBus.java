package com.p14n.subsync.bus;

import java.util.concurrent.ConcurrentHashMap;

import com.p14n.subsync.data.EndpointAddress;
import com.p14n.subsync.data.Envelope;

import io.opentelemetry.api.OpenTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process {@link ServiceBus}. Receive endpoints are connected with
 * {@link #connect}; a send is delivered synchronously to the receiver on the
 * sending thread.
 */
public class LocalServiceBus extends DefaultServiceBus {

    private static final Logger logger = LoggerFactory.getLogger(LocalServiceBus.class);

    private final ConcurrentHashMap<EndpointAddress, MessageSubscriber<Envelope>> receivers = new ConcurrentHashMap<>();

    public LocalServiceBus(EndpointAddress address, OpenTelemetry ot) {
        super(address, ot, "local_bus");
    }

    public LocalServiceBus(EndpointAddress address, AsyncExecutor asyncExecutor, OpenTelemetry ot) {
        super(address, asyncExecutor, ot, "local_bus");
    }

    /**
     * Connects a receiver to an address so that sends to it are delivered.
     *
     * @param address  the address to receive at
     * @param receiver gets every envelope sent to the address
     * @return the action that disconnects the receiver
     */
    public UnsubscribeAction connect(EndpointAddress address, MessageSubscriber<Envelope> receiver) {
        if (closed.get()) {
            throw new IllegalStateException("Bus is closed");
        }
        if (address == null || receiver == null) {
            throw new IllegalArgumentException("Address and receiver are required");
        }
        if (receivers.putIfAbsent(address, receiver) != null) {
            throw new IllegalStateException("A receiver is already connected at " + address);
        }
        logger.atDebug().addArgument(address).log("Receiver connected at {}");
        return () -> receivers.remove(address, receiver);
    }

    @Override
    public Endpoint getEndpoint(EndpointAddress address) {
        if (closed.get()) {
            throw new IllegalStateException("Bus is closed");
        }
        if (address == null) {
            throw new IllegalArgumentException("Address cannot be null");
        }
        return new LocalEndpoint(address);
    }

    @Override
    public void close() {
        super.close();
        receivers.clear();
    }

    private class LocalEndpoint implements Endpoint {
        private final EndpointAddress address;

        LocalEndpoint(EndpointAddress address) {
            this.address = address;
        }

        @Override
        public EndpointAddress address() {
            return address;
        }

        @Override
        public void send(Object message, SendOptions options) {
            if (message == null) {
                throw new IllegalArgumentException("Message cannot be null");
            }
            MessageSubscriber<Envelope> receiver = receivers.get(address);
            if (receiver == null) {
                throw new EndpointException(address, "No receiver connected");
            }
            try {
                receiver.onMessage(new Envelope(message, options.sourceAddress()));
            } catch (RuntimeException e) {
                throw new EndpointException(address, "Receiver failed", e);
            }
        }
    }
}
