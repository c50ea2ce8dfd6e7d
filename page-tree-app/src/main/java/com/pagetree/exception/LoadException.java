package com.pagetree.exception;

/**
 * The pages or domains relation could not be read at startup.
 */
public class LoadException extends ResolverException {

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
