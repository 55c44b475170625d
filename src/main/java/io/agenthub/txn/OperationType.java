package io.agenthub.txn;

public enum OperationType {
    SET,
    DELETE,
    /** Removes every entry of a scope; the key is ignored. */
    CLEAR_SCOPE,
    /** Writes a snapshotted entry back with its original version. */
    RESTORE_ENTRY
}
