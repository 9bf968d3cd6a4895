package io.jobgtm.store;

public enum InsertOutcome {
    INSERTED,
    /** A row with the same natural key or posting URL already exists. */
    DUPLICATE
}
