package com.p14n.subsync.data;

import java.net.URI;
import java.net.URISyntaxException;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Logical address of an endpoint on the bus, for example {@code ctl://x} for a
 * client's control queue or {@code q://orders} for a data endpoint.
 *
 * <p>
 * Addresses are validated when they are created, so a malformed value is
 * reported to whoever supplied it rather than to the worker that later tries
 * to send to it.
 * </p>
 */
public record EndpointAddress(URI uri) {

    public EndpointAddress {
        if (uri == null) {
            throw new IllegalArgumentException("Address cannot be null");
        }
        if (uri.getScheme() == null) {
            throw new IllegalArgumentException("Address must have a scheme: " + uri);
        }
        if (uri.getAuthority() == null && (uri.getPath() == null || uri.getPath().isEmpty())) {
            throw new IllegalArgumentException("Address must name a host or path: " + uri);
        }
    }

    /**
     * Parses an address from its string form.
     *
     * @param address the address, for example {@code ctl://x}
     * @return the parsed address
     * @throws IllegalArgumentException if the value is null, blank or not a
     *                                  valid URI with a scheme
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EndpointAddress parse(String address) {
        if (address == null || address.trim().isEmpty()) {
            throw new IllegalArgumentException("Address cannot be null or empty");
        }
        try {
            return new EndpointAddress(new URI(address.trim()));
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid endpoint address: " + address, e);
        }
    }

    public String scheme() {
        return uri.getScheme();
    }

    @JsonValue
    @Override
    public String toString() {
        return uri.toString();
    }
}
