package com.p14n.subsync.saga;

/**
 * Lifecycle states shared by subscription and client sagas.
 *
 * <ul>
 * <li>{@code Initial}: created but not yet activated</li>
 * <li>{@code Active}: eligible for broadcasts and cache snapshots</li>
 * <li>{@code Removed}: retired, terminal</li>
 * </ul>
 */
public enum SagaState {

    Initial,

    Active,

    Removed;

    /**
     * Whether a saga in this state may move to {@code next}.
     *
     * @param next the requested state
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(SagaState next) {
        switch (this) {
            case Initial:
                return next == Active || next == Removed;
            case Active:
                return next == Removed;
            default:
                return false;
        }
    }

    public boolean isTerminal() {
        return this == Removed;
    }
}
