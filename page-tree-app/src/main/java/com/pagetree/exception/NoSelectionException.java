package com.pagetree.exception;

public class NoSelectionException extends ResolverException {

    public NoSelectionException() {
        super("No page ids selected");
    }
}
