package com.p14n.subsync.bus;

import java.util.Set;

import com.p14n.subsync.data.EndpointAddress;
import com.p14n.subsync.saga.SagaStore;

/**
 * The message bus as seen by services running on it.
 *
 * <p>
 * Subscribers may be invoked from several dispatch threads at once.
 * Implementations must be thread-safe.
 * </p>
 */
public interface ServiceBus extends AutoCloseable {

    /**
     * Gets the address of this bus instance, used as the source address of the
     * messages services send through it.
     *
     * @return the bus address
     */
    EndpointAddress address();

    /**
     * Publishes a message to every subscriber of its type.
     * If there are no subscribers the message is silently dropped.
     *
     * @param message the message to publish
     */
    void publish(Object message);

    /**
     * Adds a subscriber for messages of the given type.
     *
     * @param messageType the message class, matched exactly
     * @param subscriber  the subscriber to add
     * @param <T>         the message type
     * @return the action that removes the subscriber again
     */
    <T> UnsubscribeAction subscribe(Class<T> messageType, MessageSubscriber<T> subscriber);

    /**
     * Registers a saga store for generic saga dispatch.
     *
     * @param store the store to register
     * @return the action that removes the registration again
     */
    UnsubscribeAction subscribeSaga(SagaStore<?> store);

    /**
     * Gets the saga stores currently registered.
     *
     * @return the registered stores
     */
    Set<SagaStore<?>> sagaStores();

    /**
     * Resolves an address into something that can be sent to.
     *
     * @param address the endpoint address
     * @return the endpoint
     */
    Endpoint getEndpoint(EndpointAddress address);

    /**
     * Closes the bus and releases its connection.
     * After closing, no more messages can be published or subscribers added.
     */
    @Override
    void close();
}
