package org.foxesworld.blueprint.engine.view;

import org.foxesworld.blueprint.core.ViewId;
import org.foxesworld.blueprint.core.layout.TextContent;

import java.util.Map;

public class TextView extends View implements TextContent {

    public static final float DEFAULT_FONT_SIZE = 15f;
    public static final float LINE_HEIGHT_FACTOR = 1.2f;

    public TextView(ViewId id) {
        super(id, ViewKind.TEXT);
    }

    /** Concatenated text of every raw text child, in child order. */
    @Override
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (View c : children()) {
            if (c instanceof RawTextView raw) sb.append(raw.text());
        }
        return sb.toString();
    }

    @Override
    public float fontSize() {
        return number(textProperty("fontSize"), DEFAULT_FONT_SIZE);
    }

    @Override
    public float lineHeight() {
        return number(textProperty("lineHeight"), fontSize() * LINE_HEIGHT_FACTOR);
    }

    /** Direct property first, then the same key inside a {@code style} map. */
    private Object textProperty(String key) {
        Object direct = property(key);
        if (direct != null) return direct;
        return property("style") instanceof Map<?, ?> style ? style.get(key) : null;
    }

    private static float number(Object v, float def) {
        if (v instanceof Number n && Double.isFinite(n.doubleValue()) && n.doubleValue() > 0) {
            return n.floatValue();
        }
        return def;
    }
}
