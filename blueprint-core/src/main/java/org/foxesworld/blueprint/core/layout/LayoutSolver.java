package org.foxesworld.blueprint.core.layout;

/**
 * Geometry solver invoked from the root shadow node with the available viewport size.
 *
 * <p>Implementations assign {@code x/y/width/height} to every node of the tree (positions relative
 * to the parent) and clear the dirty flags. They must be deterministic: laying out an unchanged
 * tree twice yields the same bounds.</p>
 */
@FunctionalInterface
public interface LayoutSolver {

    void layout(ShadowView root, float width, float height);
}
