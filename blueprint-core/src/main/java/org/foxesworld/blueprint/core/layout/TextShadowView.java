package org.foxesworld.blueprint.core.layout;

import org.foxesworld.blueprint.core.ViewId;

import java.util.Objects;
import java.util.Set;

/** Measured leaf for {@code Text}: its size comes from the concatenated raw text of the view. */
public class TextShadowView extends ShadowView {

    private final TextContent content;
    private final TextMeasure textMeasure;

    public TextShadowView(ViewId viewId, LayoutTarget target, TextContent content, TextMeasure textMeasure) {
        super(viewId, target);
        this.content = Objects.requireNonNull(content, "content");
        this.textMeasure = Objects.requireNonNull(textMeasure, "textMeasure");
    }

    @Override
    public boolean setProperty(String key, Object value) {
        Set<String> before = styleKeys();
        if (super.setProperty(key, value)) return true;
        boolean affectsText = STYLE.equals(key)
                ? before.stream().anyMatch(TextShadowView::isFontKey)
                        || styleKeys().stream().anyMatch(TextShadowView::isFontKey)
                : isFontKey(key);
        if (affectsText) markDirty();
        return affectsText;
    }

    private static boolean isFontKey(String key) {
        return "fontSize".equals(key) || "lineHeight".equals(key) || "fontFamily".equals(key);
    }

    @Override
    public boolean isMeasured() {
        return true;
    }

    @Override
    public LayoutSize measure(float maxWidth) {
        return textMeasure.measure(content.text(), content.fontSize(), content.lineHeight(), maxWidth);
    }
}
