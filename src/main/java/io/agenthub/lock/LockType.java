package io.agenthub.lock;

public enum LockType {
    EXCLUSIVE,
    SHARED,
    /** Announces an upcoming exclusive acquisition; blocks new shared holders but not existing ones. */
    INTENT;

    /**
     * Whether a holder of this type may be granted while {@code other} is held by a different owner.
     */
    public boolean compatibleWith(LockType other) {
        return switch (this) {
            case EXCLUSIVE -> false;
            case SHARED, INTENT -> other == SHARED;
        };
    }
}
