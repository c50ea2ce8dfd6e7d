package com.pagetree.exception;

/**
 * The parent pointers of the pages relation loop back on themselves.
 */
public class CycleException extends ResolverException {

    public CycleException(int startId, int pageId) {
        super("Cycle in page tree: page " + pageId + " visited twice while walking from page " + startId);
    }
}
