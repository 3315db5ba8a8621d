package org.foxesworld.blueprint.core.layout;

public record LayoutSize(float width, float height) {

    public static final LayoutSize ZERO = new LayoutSize(0f, 0f);
}
