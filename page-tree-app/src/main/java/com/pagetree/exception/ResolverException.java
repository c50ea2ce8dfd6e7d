package com.pagetree.exception;

/**
 * Base class for every failure that ends a resolver run.
 * All subclasses are fatal: the run logs the message and exits non-zero.
 */
public abstract class ResolverException extends RuntimeException {

    protected ResolverException(String message) {
        super(message);
    }

    protected ResolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
