package org.foxesworld.blueprint.core.layout;

import java.util.ArrayList;
import java.util.List;

import static org.foxesworld.blueprint.core.layout.LayoutStyle.BOTTOM;
import static org.foxesworld.blueprint.core.layout.LayoutStyle.LEFT;
import static org.foxesworld.blueprint.core.layout.LayoutStyle.RIGHT;
import static org.foxesworld.blueprint.core.layout.LayoutStyle.TOP;

/**
 * Compact single-line flexbox pass.
 *
 * Rules:
 *  - coordinates are top-left origin, x right, y down, relative to the parent
 *  - ABSOLUTE children are taken out of the flow and placed by left/top inside the parent
 *  - auto-sized nodes take their intrinsic size (children, or measured text)
 *  - no wrapping, no shrinking: overflowing children keep their size
 */
public final class FlexLayoutSolver implements LayoutSolver {

    @Override
    public void layout(ShadowView root, float width, float height) {
        if (root == null) return;

        final LayoutStyle s = root.style();
        float w = defined(s.width) ? s.width : (defined(width) ? width : intrinsicWidth(root, Float.NaN));
        float h = defined(s.height) ? s.height : (defined(height) ? height : intrinsicHeight(root, w));

        root.setFrame(0f, 0f, w, h);
        layoutChildren(root);
    }

    private static void layoutChildren(ShadowView node) {
        final LayoutStyle s = node.style();
        final boolean row = s.flexDirection == LayoutStyle.FlexDirection.ROW;

        final float innerW = Math.max(0f, node.width() - s.paddingX());
        final float innerH = Math.max(0f, node.height() - s.paddingY());
        final float innerMain = row ? innerW : innerH;
        final float innerCross = row ? innerH : innerW;

        final List<ShadowView> flow = new ArrayList<>(node.childCount());
        for (ShadowView c : node.children()) {
            if (c.style().position == LayoutStyle.Position.ABSOLUTE) placeAbsolute(node, c, innerW);
            else flow.add(c);
        }

        final int n = flow.size();
        if (n > 0) {
            final float[] main = new float[n];
            final float[] cross = new float[n];

            float used = s.gap * (n - 1);
            float totalGrow = 0f;

            // Pass 1: base sizes
            for (int i = 0; i < n; i++) {
                ShadowView c = flow.get(i);
                LayoutStyle cs = c.style();

                if (c.sizesToContent()) {
                    float cw = defined(cs.width) ? cs.width
                            : Math.max(intrinsicWidth(c, Float.NaN), innerW - cs.marginX());
                    float ch = defined(cs.height) ? cs.height
                            : Math.max(intrinsicHeight(c, cw), innerH - cs.marginY());
                    main[i] = row ? cw : ch;
                    cross[i] = row ? ch : cw;
                } else if (row) {
                    main[i] = defined(cs.width) ? cs.width : intrinsicWidth(c, innerW - cs.marginX());
                    totalGrow += cs.flexGrow;
                } else {
                    cross[i] = crossWidth(c, s.alignItems, innerW);
                    main[i] = defined(cs.height) ? cs.height : intrinsicHeight(c, cross[i]);
                    totalGrow += cs.flexGrow;
                }
                used += main[i] + (row ? cs.marginX() : cs.marginY());
            }

            // Pass 2: grow
            final float free = innerMain - used;
            if (free > 0f && totalGrow > 0f) {
                for (int i = 0; i < n; i++) {
                    ShadowView c = flow.get(i);
                    if (c.sizesToContent()) continue;
                    float g = free * (c.style().flexGrow / totalGrow);
                    main[i] += g;
                    used += g;
                }
            }

            // Row cross sizes depend on the final width (wrapped text)
            if (row) {
                for (int i = 0; i < n; i++) {
                    ShadowView c = flow.get(i);
                    if (c.sizesToContent()) continue;
                    LayoutStyle cs = c.style();
                    if (defined(cs.height)) cross[i] = cs.height;
                    else if (s.alignItems == LayoutStyle.Align.STRETCH) cross[i] = Math.max(0f, innerH - cs.marginY());
                    else cross[i] = intrinsicHeight(c, main[i]);
                }
            }

            // Pass 3: justify + align
            final float remaining = innerMain - used;
            final float spare = Math.max(0f, remaining);
            float lead = 0f;
            float between = s.gap;
            switch (s.justifyContent) {
                case CENTER -> lead = remaining / 2f;
                case FLEX_END -> lead = remaining;
                case SPACE_BETWEEN -> between += n > 1 ? spare / (n - 1) : 0f;
                case SPACE_AROUND -> {
                    lead = spare / n / 2f;
                    between += spare / n;
                }
                default -> { }
            }

            float cursor = (row ? s.padding[LEFT] : s.padding[TOP]) + lead;
            final float padCross = row ? s.padding[TOP] : s.padding[LEFT];

            for (int i = 0; i < n; i++) {
                ShadowView c = flow.get(i);
                LayoutStyle cs = c.style();

                float mLead = row ? cs.margin[LEFT] : cs.margin[TOP];
                float mTrail = row ? cs.margin[RIGHT] : cs.margin[BOTTOM];
                float cLead = row ? cs.margin[TOP] : cs.margin[LEFT];
                float cTrail = row ? cs.margin[BOTTOM] : cs.margin[RIGHT];

                float mainPos = cursor + mLead;
                cursor = mainPos + main[i] + mTrail + between;

                float crossPos = switch (s.alignItems) {
                    case CENTER -> padCross + cLead + (innerCross - cLead - cTrail - cross[i]) / 2f;
                    case FLEX_END -> padCross + innerCross - cTrail - cross[i];
                    default -> padCross + cLead;
                };

                if (row) c.setFrame(mainPos, crossPos, main[i], cross[i]);
                else c.setFrame(crossPos, mainPos, cross[i], main[i]);

                layoutChildren(c);
            }
        }

        node.clearDirty();
    }

    private static void placeAbsolute(ShadowView parent, ShadowView c, float innerW) {
        final LayoutStyle ps = parent.style();
        final LayoutStyle cs = c.style();

        float w = defined(cs.width) ? cs.width : intrinsicWidth(c, innerW - cs.marginX());
        float h = defined(cs.height) ? cs.height : intrinsicHeight(c, w);
        float x = (defined(cs.left) ? cs.left : ps.padding[LEFT]) + cs.margin[LEFT];
        float y = (defined(cs.top) ? cs.top : ps.padding[TOP]) + cs.margin[TOP];

        c.setFrame(x, y, w, h);
        layoutChildren(c);
    }

    private static float crossWidth(ShadowView c, LayoutStyle.Align align, float innerW) {
        LayoutStyle cs = c.style();
        if (defined(cs.width)) return cs.width;
        if (align == LayoutStyle.Align.STRETCH) return Math.max(0f, innerW - cs.marginX());
        return intrinsicWidth(c, innerW - cs.marginX());
    }

    // -----------------------------
    // Intrinsic sizes
    // -----------------------------

    /** Content width of {@code node}; {@code maxWidth} NaN means unbounded. */
    static float intrinsicWidth(ShadowView node, float maxWidth) {
        final LayoutStyle s = node.style();
        if (defined(s.width)) return s.width;

        final float innerMax = Float.isNaN(maxWidth) ? Float.NaN : Math.max(0f, maxWidth - s.paddingX());
        if (node.isMeasured()) return node.measure(innerMax).width() + s.paddingX();

        final boolean row = s.flexDirection == LayoutStyle.FlexDirection.ROW;
        float content = 0f;
        int count = 0;
        for (ShadowView c : node.children()) {
            LayoutStyle cs = c.style();
            if (cs.position == LayoutStyle.Position.ABSOLUTE) continue;
            float childMax = Float.isNaN(innerMax) ? Float.NaN : innerMax - cs.marginX();
            float cw = intrinsicWidth(c, childMax) + cs.marginX();
            content = row ? content + cw : Math.max(content, cw);
            count++;
        }
        if (row && count > 1) content += s.gap * (count - 1);
        return content + s.paddingX();
    }

    /** Content height of {@code node} when laid out at {@code width}. */
    static float intrinsicHeight(ShadowView node, float width) {
        final LayoutStyle s = node.style();
        if (defined(s.height)) return s.height;

        final float innerW = Math.max(0f, width - s.paddingX());
        if (node.isMeasured()) return node.measure(innerW).height() + s.paddingY();

        final boolean row = s.flexDirection == LayoutStyle.FlexDirection.ROW;
        float content = 0f;
        int count = 0;
        for (ShadowView c : node.children()) {
            LayoutStyle cs = c.style();
            if (cs.position == LayoutStyle.Position.ABSOLUTE) continue;
            float cw = row
                    ? (defined(cs.width) ? cs.width : intrinsicWidth(c, innerW - cs.marginX()))
                    : crossWidth(c, s.alignItems, innerW);
            float ch = intrinsicHeight(c, cw) + cs.marginY();
            content = row ? Math.max(content, ch) : content + ch;
            count++;
        }
        if (!row && count > 1) content += s.gap * (count - 1);
        return content + s.paddingY();
    }

    private static boolean defined(float v) {
        return !Float.isNaN(v);
    }
}
