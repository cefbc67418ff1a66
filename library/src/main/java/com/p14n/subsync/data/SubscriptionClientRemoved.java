package com.p14n.subsync.data;

import java.util.UUID;

/**
 * Published on the bus when a client disconnects.
 */
public record SubscriptionClientRemoved(EndpointAddress controlAddress, UUID clientId, UUID correlationId) {
}
