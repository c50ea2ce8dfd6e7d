package com.pagetree.exception;

/**
 * The data source could not be opened or did not answer a validity check.
 */
public class ConnectionException extends ResolverException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
