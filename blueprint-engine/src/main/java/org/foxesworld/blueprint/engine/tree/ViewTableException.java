package org.foxesworld.blueprint.engine.tree;

/** Programmer error in a tree operation: unknown or stale id, unregistered type, malformed structure. */
public class ViewTableException extends IllegalStateException {

    public ViewTableException(String message) {
        super(message);
    }

    public ViewTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
