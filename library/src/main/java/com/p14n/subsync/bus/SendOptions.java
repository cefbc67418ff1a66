package com.p14n.subsync.bus;

import com.p14n.subsync.data.EndpointAddress;

/**
 * Per-send settings.
 *
 * @param sourceAddress address the message is tagged as coming from, may be
 *                      null
 */
public record SendOptions(EndpointAddress sourceAddress) {

    public static SendOptions none() {
        return new SendOptions(null);
    }

    public static SendOptions from(EndpointAddress sourceAddress) {
        return new SendOptions(sourceAddress);
    }
}
