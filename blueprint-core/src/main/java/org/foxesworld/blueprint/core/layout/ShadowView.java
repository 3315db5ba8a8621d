package org.foxesworld.blueprint.core.layout;

import org.foxesworld.blueprint.core.ViewId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Geometry node of the layout tree.
 *
 * <p>Mirrors the topology of the render tree (raw text excepted) and holds layout inputs plus the
 * last computed frame. The paired render node is referenced through {@link LayoutTarget} only;
 * it is owned by the tree manager, never by this node.</p>
 */
public class ShadowView {

    public static final String STYLE = "style";

    private final ViewId viewId;
    private final LayoutTarget target;
    private final LayoutStyle style = new LayoutStyle();
    private Set<String> styleKeys = Set.of();

    private ShadowView parent;
    private final List<ShadowView> children = new ArrayList<>();

    private boolean dirty = true;

    private float x;
    private float y;
    private float width;
    private float height;

    public ShadowView(ViewId viewId, LayoutTarget target) {
        this.viewId = Objects.requireNonNull(viewId, "viewId");
        this.target = target != null ? target : LayoutTarget.NONE;
    }

    public final ViewId viewId() { return viewId; }
    public final LayoutTarget target() { return target; }
    public final LayoutStyle style() { return style; }
    public final ShadowView parent() { return parent; }

    public final List<ShadowView> children() {
        return Collections.unmodifiableList(children);
    }

    public final int childCount() {
        return children.size();
    }

    // -----------------------------
    // Inputs
    // -----------------------------

    /**
     * Applies a property. Keys that do not affect geometry are ignored. A {@code style} map applies
     * each of its entries; keys the previous style map set and the new one lacks go back to their
     * defaults, and a {@code style} that is not a map clears them all.
     *
     * @return true when the node consumed the key (and is now dirty)
     */
    public boolean setProperty(String key, Object value) {
        boolean consumed = STYLE.equals(key)
                ? applyStyle(value instanceof Map<?, ?> map ? map : Map.of())
                : style.apply(key, value);
        if (consumed) markDirty();
        return consumed;
    }

    private boolean applyStyle(Map<?, ?> map) {
        Set<String> next = new LinkedHashSet<>();
        for (Object k : map.keySet()) next.add(String.valueOf(k));

        boolean consumed = false;
        for (String stale : styleKeys) {
            if (!next.contains(stale)) consumed |= style.apply(stale, null);
        }
        for (Map.Entry<?, ?> e : map.entrySet()) {
            consumed |= style.apply(String.valueOf(e.getKey()), e.getValue());
        }
        styleKeys = Collections.unmodifiableSet(next);
        return consumed;
    }

    /** Keys of the last applied {@code style} map. */
    protected final Set<String> styleKeys() {
        return styleKeys;
    }

    /** Marks this node and every ancestor dirty. */
    public final void markDirty() {
        for (ShadowView n = this; n != null; n = n.parent) n.dirty = true;
    }

    public final boolean isDirty() {
        return dirty;
    }

    /** Called by solvers once the node has been laid out. */
    public final void clearDirty() {
        dirty = false;
    }

    // -----------------------------
    // Tree ops
    // -----------------------------

    /** Inserts {@code child} at {@code index}; {@code -1} or an out-of-range index appends. */
    public final void addChild(ShadowView child, int index) {
        Objects.requireNonNull(child, "child");
        if (child == this) throw new IllegalArgumentException("node cannot be its own child: " + viewId);

        if (child.parent != null) child.parent.removeChild(child);

        if (index < 0 || index > children.size()) children.add(child);
        else children.add(index, child);

        child.parent = this;
        child.markDirty();
        markDirty();
    }

    public final boolean removeChild(ShadowView child) {
        if (child == null || child.parent != this) return false;
        children.remove(child);
        child.parent = null;
        markDirty();
        return true;
    }

    // -----------------------------
    // Measurement hooks
    // -----------------------------

    /** Leaves that size themselves from content (text) return true and implement {@link #measure}. */
    public boolean isMeasured() {
        return false;
    }

    public LayoutSize measure(float maxWidth) {
        return LayoutSize.ZERO;
    }

    /** Scroll content grows with its children and is never smaller than its container. */
    public boolean sizesToContent() {
        return false;
    }

    // -----------------------------
    // Output
    // -----------------------------

    public final void computeViewLayout(LayoutSolver solver, float availableWidth, float availableHeight) {
        Objects.requireNonNull(solver, "solver").layout(this, availableWidth, availableHeight);
    }

    /** Pushes computed bounds to the paired render node, then to every descendant. */
    public final void flushViewLayout() {
        target.applyLayout(bounds());
        for (ShadowView c : children) c.flushViewLayout();
    }

    public final void setFrame(float x, float y, float width, float height) {
        this.x = x;
        this.y = y;
        this.width = Math.max(0f, width);
        this.height = Math.max(0f, height);
    }

    public final LayoutBounds bounds() {
        return new LayoutBounds(x, y, width, height);
    }

    public final float x() { return x; }
    public final float y() { return y; }
    public final float width() { return width; }
    public final float height() { return height; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + viewId + "[" + x + "," + y + " " + width + "x" + height + "]";
    }
}
