package org.foxesworld.blueprint.engine.tree;

import com.jme3.renderer.queue.RenderQueue;
import com.jme3.scene.Node;
import com.jme3.scene.Spatial;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.blueprint.core.ViewId;
import org.foxesworld.blueprint.core.layout.LayoutSolver;
import org.foxesworld.blueprint.core.layout.ShadowView;
import org.foxesworld.blueprint.engine.view.RawTextView;
import org.foxesworld.blueprint.engine.view.RenderSurface;
import org.foxesworld.blueprint.engine.view.View;
import org.foxesworld.blueprint.engine.view.ViewKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the render tree and the layout tree in sync under mutation commands.
 *
 * <p>Every command that changes geometry ends with exactly one layout pass. Structural mistakes
 * (unknown ids, wrong parent, raw text in the wrong place) throw {@link ViewTableException}.
 * Not thread-safe: the owning root confines it to one thread.</p>
 */
public final class ViewTreeManager {

    private static final Logger log = LogManager.getLogger(ViewTreeManager.class);

    private final ViewFactoryRegistry registry;
    private final LayoutSolver solver;
    private final ViewTable table = new ViewTable();
    private final boolean debug;

    /** Stable attach point for the host; the root view node hangs off it and is swapped on reset. */
    private final Node sceneNode = new Node("blueprint:scene");

    private View rootView;
    private ShadowView rootShadow;
    private RenderSurface surface = RenderSurface.NONE;

    private float viewportWidth;
    private float viewportHeight;
    private long layoutPasses;

    public ViewTreeManager(ViewFactoryRegistry registry, LayoutSolver solver, boolean debug) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.solver = Objects.requireNonNull(solver, "solver");
        this.debug = debug;

        sceneNode.setQueueBucket(RenderQueue.Bucket.Gui);
        sceneNode.setCullHint(Spatial.CullHint.Never);
        createRoot();
    }

    // -----------------------------
    // Creation
    // -----------------------------

    public ViewId createInstance(String typeId) {
        ViewFactory factory = registry.find(typeId);
        if (factory == null) throw new ViewTableException("Unregistered view type: " + typeId);

        ViewId id = table.allocate();
        ViewPair pair;
        try {
            pair = factory.create(id);
            checkPair(typeId, id, pair);
        } catch (RuntimeException e) {
            table.release(id);
            throw e;
        }
        table.bind(id, pair);

        dbg("create {} type={}", id, typeId);
        return id;
    }

    public ViewId createTextInstance(String text) {
        ViewId id = table.allocate();
        table.bind(id, new ViewPair(new RawTextView(id, text), null));
        dbg("create {} rawText='{}'", id, text);
        return id;
    }

    private static void checkPair(String typeId, ViewId id, ViewPair pair) {
        if (pair == null) throw new ViewTableException("Factory for " + typeId + " returned null");
        if (!id.equals(pair.view().id())) {
            throw new ViewTableException("Factory for " + typeId + " built view " + pair.view().id() + ", expected " + id);
        }
        if (pair.view().kind().hasGeometry() != pair.hasShadow()) {
            throw new ViewTableException("Factory for " + typeId + " built " + pair.view().kind()
                    + (pair.hasShadow() ? " with" : " without") + " a geometry node");
        }
        if (pair.hasShadow() && !id.equals(pair.shadow().viewId())) {
            throw new ViewTableException("Factory for " + typeId + " built geometry " + pair.shadow().viewId() + ", expected " + id);
        }
    }

    // -----------------------------
    // Mutation
    // -----------------------------

    public void setProperty(ViewId id, String key, Object value) {
        ViewPair p = lookup(id);
        p.view().setProperty(key, value);
        if (p.hasShadow()) p.shadow().setProperty(key, value);

        dbg("set {} {}={}", id, key, value);
        recomputeLayout();
        p.view().repaint();
    }

    public void setRawText(ViewId id, String text) {
        ViewPair p = lookup(id);
        if (p.view().kind() != ViewKind.RAW_TEXT) {
            log.warn("[tree] setRawText on {} which is {}, ignored", id, p.view().kind());
            return;
        }

        ((RawTextView) p.view()).setText(text);
        dbg("rawText {}='{}'", id, text);

        View parent = p.view().parent();
        if (parent == null || parent.kind() != ViewKind.TEXT) return;

        ViewPair pp = lookup(parent.id());
        if (pp.hasShadow()) pp.shadow().markDirty();
        recomputeLayout();
        parent.repaint();
    }

    public void addChild(ViewId parentId, ViewId childId) {
        addChild(parentId, childId, -1);
    }

    /** Inserts at {@code index}; {@code -1} or an out-of-range index appends. */
    public void addChild(ViewId parentId, ViewId childId, int index) {
        if (childId.isRoot()) throw new ViewTableException("Root view cannot be attached as a child");

        ViewPair parent = lookup(parentId);
        ViewPair child = lookup(childId);
        View pv = parent.view();
        View cv = child.view();
        View textParent = null;
        View previousText = null;

        switch (pv.kind()) {
            case RAW_TEXT -> throw new ViewTableException("Raw text " + parentId + " cannot have children");
            case TEXT -> {
                if (cv.kind() != ViewKind.RAW_TEXT || child.hasShadow()) {
                    throw new ViewTableException("Text " + parentId + " accepts raw text only, got " + cv);
                }
                View previous = cv.parent();
                pv.addChild(cv, index);
                parent.shadow().markDirty();
                if (previous != null && previous != pv) {
                    markTextDirty(previous);
                    previousText = previous;
                }
                textParent = pv;
            }
            default -> {
                if (cv.kind() == ViewKind.RAW_TEXT) {
                    throw new ViewTableException("Raw text " + childId + " must be placed under a Text view, not " + pv);
                }
                if (cv == pv || cv.isAncestorOf(pv)) {
                    throw new ViewTableException("Attaching " + childId + " under " + parentId + " creates a cycle");
                }
                pv.addChild(cv, index);
                parent.shadow().addChild(child.shadow(), index);
            }
        }

        dbg("add {} -> {} at {}", childId, parentId, index);
        recomputeLayout();
        if (textParent != null) textParent.repaint();
        if (previousText != null) previousText.repaint();
    }

    public void removeChild(ViewId parentId, ViewId childId) {
        ViewPair parent = lookup(parentId);
        ViewPair child = lookup(childId);
        if (child.view().parent() != parent.view()) {
            throw new ViewTableException(childId + " is not a child of " + parentId);
        }

        List<ViewId> doomed = new ArrayList<>();
        collectPostOrder(child.view(), doomed);

        parent.view().removeChild(child.view());
        if (parent.hasShadow() && child.hasShadow()) {
            parent.shadow().removeChild(child.shadow());
        } else if (parent.view().kind() == ViewKind.TEXT) {
            markTextDirty(parent.view());
        }

        for (ViewId id : doomed) table.release(id);

        dbg("remove {} from {} (purged {})", childId, parentId, doomed.size());
        recomputeLayout();
        if (parent.view().kind() == ViewKind.TEXT) parent.view().repaint();
    }

    private void markTextDirty(View text) {
        ViewPair pair = lookup(text.id());
        if (pair.hasShadow()) pair.shadow().markDirty();
    }

    /** Ids of {@code id} and all its descendants, children before their parent. */
    public List<ViewId> collectSubtreeIds(ViewId id) {
        List<ViewId> out = new ArrayList<>();
        collectPostOrder(lookup(id).view(), out);
        return out;
    }

    private static void collectPostOrder(View v, List<ViewId> out) {
        for (View c : v.children()) collectPostOrder(c, out);
        out.add(v.id());
    }

    // -----------------------------
    // Lookup
    // -----------------------------

    public ViewPair lookup(ViewId id) {
        Objects.requireNonNull(id, "id");
        if (id.isRoot()) return new ViewPair(rootView, rootShadow);

        ViewPair p = table.get(id);
        if (p == null) throw new ViewTableException("No view for " + table.describe(id) + " id " + id);
        return p;
    }

    public boolean contains(ViewId id) {
        return id != null && (id.isRoot() || table.contains(id));
    }

    public Optional<View> lookupByRefId(String refId) {
        if (refId == null) return Optional.empty();
        if (refId.equals(rootView.refId())) return Optional.of(rootView);

        View[] found = new View[1];
        table.forEach((id, pair) -> {
            if (found[0] == null && refId.equals(pair.view().refId())) found[0] = pair.view();
        });
        return Optional.ofNullable(found[0]);
    }

    // -----------------------------
    // Layout
    // -----------------------------

    public void recomputeLayout() {
        rootShadow.computeViewLayout(solver, viewportWidth, viewportHeight);
        rootShadow.flushViewLayout();
        layoutPasses++;
    }

    /** @return true if the viewport changed and layout was recomputed */
    public boolean setViewport(float width, float height) {
        if (Float.compare(width, viewportWidth) == 0 && Float.compare(height, viewportHeight) == 0) return false;
        viewportWidth = width;
        viewportHeight = height;
        recomputeLayout();
        return true;
    }

    public float viewportWidth() { return viewportWidth; }
    public float viewportHeight() { return viewportHeight; }
    public long layoutPasses() { return layoutPasses; }

    // -----------------------------
    // Lifecycle
    // -----------------------------

    /** Releases every view (outstanding ids turn stale) and starts over with a fresh root. */
    public void reset() {
        int released = table.size();
        table.clear();
        rootView.node().removeFromParent();
        createRoot();
        log.info("[tree] reset, released {} views", released);
    }

    public void setSurface(RenderSurface surface) {
        this.surface = surface != null ? surface : RenderSurface.NONE;
        rootView.setSurface(this.surface);
    }

    private void createRoot() {
        rootView = new View(ViewId.ROOT);
        rootShadow = new ShadowView(ViewId.ROOT, rootView);
        rootView.setSurface(surface);
        sceneNode.attachChild(rootView.node());
    }

    public View rootView() { return rootView; }
    public ShadowView rootShadow() { return rootShadow; }
    public Node sceneNode() { return sceneNode; }
    public int size() { return table.size(); }

    private void dbg(String fmt, Object... args) {
        if (!debug) return;
        log.info("[tree] " + fmt, args);
    }
}
