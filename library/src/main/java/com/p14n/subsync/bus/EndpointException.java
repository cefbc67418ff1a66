package com.p14n.subsync.bus;

import com.p14n.subsync.data.EndpointAddress;

/**
 * Raised when a message cannot be delivered to an endpoint.
 */
public class EndpointException extends RuntimeException {

    private final EndpointAddress address;

    public EndpointException(EndpointAddress address, String message) {
        super(message + ": " + address);
        this.address = address;
    }

    public EndpointException(EndpointAddress address, String message, Throwable cause) {
        super(message + ": " + address, cause);
        this.address = address;
    }

    public EndpointAddress address() {
        return address;
    }
}
