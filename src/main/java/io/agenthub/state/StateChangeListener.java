package io.agenthub.state;

@FunctionalInterface
public interface StateChangeListener {
    /**
     * @param entry the new entry, or {@code null} after a delete
     */
    void onChange(Scope scope, String key, StateEntry entry);
}
