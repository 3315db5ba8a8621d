package org.foxesworld.blueprint.core;

/**
 * Native marker for a script-side {@code undefined}.
 *
 * <p>Java {@code null} stands for the script {@code null} (an absent value); this marker is the
 * only way to tell the two apart after a value crossed the boundary.</p>
 */
public enum Undefined {
    INSTANCE;

    public static boolean isAbsent(Object value) {
        return value == null || value == INSTANCE;
    }

    @Override
    public String toString() {
        return "undefined";
    }
}
