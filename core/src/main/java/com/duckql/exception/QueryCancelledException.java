package com.duckql.exception;

/**
 * Exception recorded when an execution is cancelled by its caller before
 * it produced a result.
 */
public class QueryCancelledException extends DuckQLException {

    public QueryCancelledException(String table) {
        super("Query on '" + table + "' was cancelled", ErrorKind.CANCELLED, null, null, null);
        putContext("table", table);
    }
}
