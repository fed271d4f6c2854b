package com.duckql.generator;

import java.util.Locale;

/**
 * Shape of a compiled operation.
 */
public enum OperationKind {

    /** One row, selected by filter; LIMIT is forced to 1. */
    SINGLE,

    /** Any number of rows with ordering and pagination. */
    LIST,

    /** Grouped rows with aggregate columns. */
    AGGREGATE;

    /**
     * Returns the lower-case name used in metrics and logs.
     *
     * @return "single", "list" or "aggregate"
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
