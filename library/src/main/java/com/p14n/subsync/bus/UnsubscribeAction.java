package com.p14n.subsync.bus;

/**
 * Undoes a registration made on the bus.
 */
@FunctionalInterface
public interface UnsubscribeAction {

    void unsubscribe();

    static UnsubscribeAction none() {
        return () -> {
        };
    }

    /**
     * Combines this action with another, running this one first.
     *
     * @param next the action to run afterwards
     * @return the combined action
     */
    default UnsubscribeAction andThen(UnsubscribeAction next) {
        return () -> {
            unsubscribe();
            next.unsubscribe();
        };
    }
}
