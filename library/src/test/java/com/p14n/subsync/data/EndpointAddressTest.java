package com.p14n.subsync.data;

import java.util.ArrayList;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EndpointAddressTest {

    @Test
    void shouldParseControlAddress() {
        var address = EndpointAddress.parse("ctl://x");
        assertEquals("ctl", address.scheme());
        assertEquals("ctl://x", address.toString());
    }

    @Test
    void shouldTreatEqualStringsAsEqualAddresses() {
        assertEquals(EndpointAddress.parse("q://orders"), EndpointAddress.parse(" q://orders "));
    }

    @Test
    void shouldRejectMalformedAddresses() {
        assertThrows(IllegalArgumentException.class, () -> EndpointAddress.parse(null));
        assertThrows(IllegalArgumentException.class, () -> EndpointAddress.parse("  "));
        assertThrows(IllegalArgumentException.class, () -> EndpointAddress.parse("no-scheme"));
        assertThrows(IllegalArgumentException.class, () -> EndpointAddress.parse("ctl://bad host"));
    }

    @Test
    void shouldValidateSubscriptionFields() {
        var address = EndpointAddress.parse("q://orders");
        assertThrows(IllegalArgumentException.class, () -> Subscription.create(null, "OrderPlaced", address));
        assertThrows(IllegalArgumentException.class, () -> Subscription.create(UUID.randomUUID(), " ", address));
        assertThrows(IllegalArgumentException.class,
                () -> Subscription.create(UUID.randomUUID(), "OrderPlaced", null));
    }

    @Test
    void shouldCopySnapshotList() {
        var list = new ArrayList<Subscription>();
        list.add(Subscription.create("OrderPlaced", "q://orders"));
        var refresh = new SubscriptionRefresh(list);
        list.clear();
        assertEquals(1, refresh.subscriptions().size());
        assertTrue(new SubscriptionRefresh(null).subscriptions().isEmpty());
    }
}
