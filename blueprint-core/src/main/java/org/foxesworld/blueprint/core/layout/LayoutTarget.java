package org.foxesworld.blueprint.core.layout;

/** Receiver of flushed layout bounds; implemented by the render node paired with a shadow node. */
@FunctionalInterface
public interface LayoutTarget {

    void applyLayout(LayoutBounds bounds);

    LayoutTarget NONE = bounds -> {};
}
