package org.hexroute.routing.search;

/**
 * Thrown when attempting to extract from an empty {@link OpenSet}.
 */
public class EmptyQueueException extends IllegalStateException {
    public EmptyQueueException(String message) {
        super(message);
    }
}
