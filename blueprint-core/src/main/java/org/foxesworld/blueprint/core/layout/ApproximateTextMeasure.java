package org.foxesworld.blueprint.core.layout;

/**
 * Font-less text measure: every glyph advances {@code fontSize * advanceFactor}, words wrap
 * greedily at {@code maxWidth} and explicit newlines always break.
 */
public final class ApproximateTextMeasure implements TextMeasure {

    public static final float DEFAULT_ADVANCE = 0.6f;

    private final float advanceFactor;

    public ApproximateTextMeasure() {
        this(DEFAULT_ADVANCE);
    }

    public ApproximateTextMeasure(float advanceFactor) {
        if (!(advanceFactor > 0f)) throw new IllegalArgumentException("advanceFactor must be > 0");
        this.advanceFactor = advanceFactor;
    }

    @Override
    public LayoutSize measure(String text, float fontSize, float lineHeight, float maxWidth) {
        if (text == null || text.isEmpty()) return LayoutSize.ZERO;

        final float advance = Math.max(0f, fontSize) * advanceFactor;
        final boolean wrap = !Float.isNaN(maxWidth) && !Float.isInfinite(maxWidth) && maxWidth > 0f;

        int lines = 0;
        float widest = 0f;

        for (String paragraph : text.split("\n", -1)) {
            lines++;
            if (!wrap) {
                widest = Math.max(widest, paragraph.length() * advance);
                continue;
            }

            float line = 0f;
            for (String word : paragraph.split(" ", -1)) {
                float w = word.length() * advance;
                float withSpace = line == 0f ? w : line + advance + w;
                if (line > 0f && withSpace > maxWidth) {
                    widest = Math.max(widest, line);
                    lines++;
                    line = w;
                } else {
                    line = withSpace;
                }
            }
            widest = Math.max(widest, line);
        }

        if (wrap) widest = Math.min(widest, maxWidth);
        return new LayoutSize(widest, lines * lineHeight);
    }
}
