package org.foxesworld.blueprint.engine.view;

/** Closed set of render node kinds. Tree operations switch on it instead of downcasting. */
public enum ViewKind {
    GENERIC,
    TEXT,
    IMAGE,
    SCROLL_CONTAINER,
    SCROLL_CONTENT,
    RAW_TEXT;

    /** Raw text lives inside its Text parent and never owns a geometry node. */
    public boolean hasGeometry() {
        return this != RAW_TEXT;
    }
}
