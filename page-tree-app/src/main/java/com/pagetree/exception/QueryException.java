package com.pagetree.exception;

/**
 * A caller-supplied id query failed to execute or returned rows of the wrong shape.
 */
public class QueryException extends ResolverException {

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
