package org.foxesworld.blueprint.engine;

/** Lifecycle of a {@link ReactApplicationRoot}: UNINITIALIZED → READY ⇄ RELOADING → DESTROYED. */
public enum RootState {
    UNINITIALIZED,
    READY,
    RELOADING,
    DESTROYED
}
