package com.pagetree.exception;

/**
 * Missing or malformed command line option.
 */
public class UsageException extends ResolverException {

    public UsageException(String message) {
        super(message);
    }
}
