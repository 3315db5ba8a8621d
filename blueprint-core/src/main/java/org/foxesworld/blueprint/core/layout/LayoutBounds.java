package org.foxesworld.blueprint.core.layout;

/** Final layout output for one node, relative to its parent. */
public record LayoutBounds(float x, float y, float width, float height) {

    public static final LayoutBounds ZERO = new LayoutBounds(0f, 0f, 0f, 0f);

    public float right() {
        return x + width;
    }

    public float bottom() {
        return y + height;
    }
}
