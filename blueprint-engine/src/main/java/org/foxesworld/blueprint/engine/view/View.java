package org.foxesworld.blueprint.engine.view;

import com.jme3.renderer.queue.RenderQueue;
import com.jme3.scene.Node;
import com.jme3.scene.Spatial;
import org.foxesworld.blueprint.core.Undefined;
import org.foxesworld.blueprint.core.ViewId;
import org.foxesworld.blueprint.core.layout.LayoutBounds;
import org.foxesworld.blueprint.core.layout.LayoutTarget;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Render node. Owns its children and a jME {@link Node} in the GUI bucket; receives bounds from the
 * paired shadow node through {@link LayoutTarget}.
 */
public class View implements LayoutTarget {

    private final ViewId id;
    private final ViewKind kind;
    protected final Node node;

    private View parent;
    private final List<View> children = new ArrayList<>();
    private final Map<String, Object> props = new LinkedHashMap<>();

    private String refId;
    private LayoutBounds bounds = LayoutBounds.ZERO;
    private RenderSurface surface;
    private int repaints;

    public View(ViewId id) {
        this(id, ViewKind.GENERIC);
    }

    public View(ViewId id, ViewKind kind) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.node = new Node("blueprint:" + kind.name().toLowerCase(Locale.ROOT) + id);

        this.node.setQueueBucket(RenderQueue.Bucket.Gui);
        this.node.setCullHint(Spatial.CullHint.Never);
    }

    public final ViewId id() { return id; }
    public final ViewKind kind() { return kind; }
    public final Node node() { return node; }
    public final View parent() { return parent; }
    public final String refId() { return refId; }
    public final LayoutBounds bounds() { return bounds; }
    public final int repaintCount() { return repaints; }

    public final List<View> children() {
        return Collections.unmodifiableList(children);
    }

    // -----------------------------
    // Properties
    // -----------------------------

    /** Stores the value; an absent value (null/undefined) removes the key. */
    public void setProperty(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (Undefined.isAbsent(value)) props.remove(key);
        else props.put(key, value);

        switch (key) {
            case "refId" -> refId = Undefined.isAbsent(value) ? null : String.valueOf(value);
            case "display" -> node.setCullHint("none".equals(value)
                    ? Spatial.CullHint.Always
                    : Spatial.CullHint.Never);
            default -> onPropertyChanged(key, value);
        }
    }

    /** Hook for kinds that react to their own keys. */
    protected void onPropertyChanged(String key, Object value) {}

    public final Object property(String key) {
        return props.get(key);
    }

    public final Map<String, Object> properties() {
        return Collections.unmodifiableMap(props);
    }

    // -----------------------------
    // Tree ops
    // -----------------------------

    /** Inserts {@code child} at {@code index}; {@code -1} or an out-of-range index appends. */
    public final void addChild(View child, int index) {
        Objects.requireNonNull(child, "child");
        if (child == this || child.isAncestorOf(this)) {
            throw new IllegalArgumentException("attaching " + child.id + " under " + id + " creates a cycle");
        }

        if (child.parent != null) child.parent.removeChild(child);

        int at = (index < 0 || index > children.size()) ? children.size() : index;
        children.add(at, child);
        child.parent = this;
        childContainer().attachChildAt(child.node, at);
    }

    public final boolean removeChild(View child) {
        if (child == null || child.parent != this) return false;

        children.remove(child);
        child.parent = null;
        child.node.removeFromParent();
        return true;
    }

    public final boolean isAncestorOf(View other) {
        for (View p = other.parent; p != null; p = p.parent) {
            if (p == this) return true;
        }
        return false;
    }

    /** Node that child nodes are attached to. */
    protected Node childContainer() {
        return node;
    }

    // -----------------------------
    // Layout / paint
    // -----------------------------

    @Override
    public void applyLayout(LayoutBounds bounds) {
        this.bounds = Objects.requireNonNull(bounds, "bounds");
        // GUI space is y-up, layout space is y-down
        node.setLocalTranslation(bounds.x(), -bounds.y(), 0f);
    }

    public final void setSurface(RenderSurface surface) {
        this.surface = surface;
    }

    /** Requests a repaint through the surface of the nearest ancestor that has one. */
    public final void repaint() {
        repaints++;
        for (View v = this; v != null; v = v.parent) {
            if (v.surface != null) {
                v.surface.repaint(this);
                return;
            }
        }
    }

    @Override
    public String toString() {
        return kind + "" + id;
    }
}
