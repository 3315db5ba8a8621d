package org.foxesworld.blueprint.core.layout;

import java.util.Locale;

/**
 * Layout inputs of a shadow node. Undefined lengths are {@link Float#NaN}.
 *
 * <p>Values arrive as decoded script values: numbers, numeric strings, or absent
 * ({@code null}/undefined), which resets a key to its default.</p>
 */
public final class LayoutStyle {

    public enum FlexDirection { ROW, COLUMN }

    public enum Justify { FLEX_START, CENTER, FLEX_END, SPACE_BETWEEN, SPACE_AROUND }

    public enum Align { STRETCH, FLEX_START, CENTER, FLEX_END }

    public enum Position { RELATIVE, ABSOLUTE }

    static final int LEFT = 0, TOP = 1, RIGHT = 2, BOTTOM = 3;

    float width = Float.NaN;
    float height = Float.NaN;

    FlexDirection flexDirection = FlexDirection.COLUMN;
    Justify justifyContent = Justify.FLEX_START;
    Align alignItems = Align.STRETCH;
    float flexGrow = 0f;
    float gap = 0f;

    final float[] padding = new float[4];
    final float[] margin = new float[4];

    Position position = Position.RELATIVE;
    float left = Float.NaN;
    float top = Float.NaN;

    static FlexDirection flexDirectionOf(String s) {
        if (s == null) return FlexDirection.COLUMN;
        return switch (s) {
            case "row" -> FlexDirection.ROW;
            case "column" -> FlexDirection.COLUMN;
            default -> FlexDirection.COLUMN;
        };
    }

    static Justify justifyOf(String s) {
        if (s == null) return Justify.FLEX_START;
        return switch (s) {
            case "center" -> Justify.CENTER;
            case "flex-end" -> Justify.FLEX_END;
            case "space-between" -> Justify.SPACE_BETWEEN;
            case "space-around" -> Justify.SPACE_AROUND;
            default -> Justify.FLEX_START;
        };
    }

    static Align alignOf(String s) {
        if (s == null) return Align.STRETCH;
        return switch (s) {
            case "flex-start" -> Align.FLEX_START;
            case "center" -> Align.CENTER;
            case "flex-end" -> Align.FLEX_END;
            default -> Align.STRETCH;
        };
    }

    static Position positionOf(String s) {
        return "absolute".equals(s) ? Position.ABSOLUTE : Position.RELATIVE;
    }

    /**
     * Applies one property.
     *
     * @return true if {@code key} is a layout property, false if it is ignored by geometry
     */
    public boolean apply(String key, Object value) {
        if (key == null) return false;

        switch (key) {
            case "width" -> width = length(value, Float.NaN);
            case "height" -> height = length(value, Float.NaN);
            case "flexDirection" -> flexDirection = flexDirectionOf(keyword(value));
            case "justifyContent" -> justifyContent = justifyOf(keyword(value));
            case "alignItems" -> alignItems = alignOf(keyword(value));
            case "flexGrow" -> flexGrow = Math.max(0f, length(value, 0f));
            case "gap" -> gap = Math.max(0f, length(value, 0f));
            case "position" -> position = positionOf(keyword(value));
            case "left" -> left = length(value, Float.NaN);
            case "top" -> top = length(value, Float.NaN);

            case "padding" -> fill(padding, length(value, 0f));
            case "paddingHorizontal" -> { padding[LEFT] = length(value, 0f); padding[RIGHT] = padding[LEFT]; }
            case "paddingVertical" -> { padding[TOP] = length(value, 0f); padding[BOTTOM] = padding[TOP]; }
            case "paddingLeft" -> padding[LEFT] = length(value, 0f);
            case "paddingTop" -> padding[TOP] = length(value, 0f);
            case "paddingRight" -> padding[RIGHT] = length(value, 0f);
            case "paddingBottom" -> padding[BOTTOM] = length(value, 0f);

            case "margin" -> fill(margin, length(value, 0f));
            case "marginHorizontal" -> { margin[LEFT] = length(value, 0f); margin[RIGHT] = margin[LEFT]; }
            case "marginVertical" -> { margin[TOP] = length(value, 0f); margin[BOTTOM] = margin[TOP]; }
            case "marginLeft" -> margin[LEFT] = length(value, 0f);
            case "marginTop" -> margin[TOP] = length(value, 0f);
            case "marginRight" -> margin[RIGHT] = length(value, 0f);
            case "marginBottom" -> margin[BOTTOM] = length(value, 0f);

            default -> {
                return false;
            }
        }
        return true;
    }

    // -----------------------------
    // Read access
    // -----------------------------

    public float width() { return width; }
    public float height() { return height; }
    public FlexDirection flexDirection() { return flexDirection; }
    public Justify justifyContent() { return justifyContent; }
    public Align alignItems() { return alignItems; }
    public float flexGrow() { return flexGrow; }
    public float gap() { return gap; }
    public Position position() { return position; }
    public float left() { return left; }
    public float top() { return top; }

    public float padding(int edge) { return padding[edge]; }
    public float margin(int edge) { return margin[edge]; }

    float paddingX() { return padding[LEFT] + padding[RIGHT]; }
    float paddingY() { return padding[TOP] + padding[BOTTOM]; }
    float marginX() { return margin[LEFT] + margin[RIGHT]; }
    float marginY() { return margin[TOP] + margin[BOTTOM]; }

    // -----------------------------
    // Value coercion
    // -----------------------------

    private static void fill(float[] edges, float v) {
        edges[LEFT] = v;
        edges[TOP] = v;
        edges[RIGHT] = v;
        edges[BOTTOM] = v;
    }

    static float length(Object v, float def) {
        if (v instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? (float) d : def;
        }
        if (v instanceof String s) {
            String t = s.trim();
            if (t.endsWith("px")) t = t.substring(0, t.length() - 2).trim();
            try {
                float f = Float.parseFloat(t);
                return Float.isFinite(f) ? f : def;
            } catch (NumberFormatException ignored) {
                return def;
            }
        }
        return def;
    }

    private static String keyword(Object v) {
        return (v instanceof String s) ? s.trim().toLowerCase(Locale.ROOT) : null;
    }
}
