package org.foxesworld.blueprint.core.layout;

/**
 * Measures a run of text. {@code maxWidth} is {@link Float#NaN} or infinite when the text may
 * grow without wrapping.
 */
@FunctionalInterface
public interface TextMeasure {

    LayoutSize measure(String text, float fontSize, float lineHeight, float maxWidth);
}
