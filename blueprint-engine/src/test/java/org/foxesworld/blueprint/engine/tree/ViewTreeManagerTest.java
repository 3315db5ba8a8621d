package org.foxesworld.blueprint.engine.tree;

import org.foxesworld.blueprint.core.ViewId;
import org.foxesworld.blueprint.core.layout.ApproximateTextMeasure;
import org.foxesworld.blueprint.core.layout.FlexLayoutSolver;
import org.foxesworld.blueprint.core.layout.LayoutSolver;
import org.foxesworld.blueprint.core.layout.ShadowView;
import org.foxesworld.blueprint.engine.view.TextView;
import org.foxesworld.blueprint.engine.view.View;
import org.foxesworld.blueprint.engine.view.ViewKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ViewTreeManagerTest {

    /** Records which nodes were dirty when layout ran, then clears them. */
    private static final class DirtyRecorder implements LayoutSolver {
        final Set<ViewId> dirty = new HashSet<>();

        @Override
        public void layout(ShadowView root, float width, float height) {
            dirty.clear();
            collect(root);
        }

        private void collect(ShadowView n) {
            if (n.isDirty()) dirty.add(n.viewId());
            n.clearDirty();
            for (ShadowView c : n.children()) collect(c);
        }
    }

    private static ViewFactoryRegistry builtIns() {
        ViewFactoryRegistry registry = new ViewFactoryRegistry();
        BuiltInViews.install(registry, new ApproximateTextMeasure());
        return registry;
    }

    private static ViewTreeManager newTree() {
        return new ViewTreeManager(builtIns(), new FlexLayoutSolver(), true);
    }

    @Test
    void testRawTextUnderTextHasNoGeometryAndDirtiesParent() {
        DirtyRecorder solver = new DirtyRecorder();
        ViewTreeManager tree = new ViewTreeManager(builtIns(), solver, false);

        ViewId text = tree.createInstance("Text");
        ViewId raw = tree.createTextInstance("hi");
        assertEquals(1L, text.value());
        assertEquals(2L, raw.value());

        tree.addChild(ViewId.ROOT, text);
        assertFalse(tree.lookup(text).shadow().isDirty());

        tree.addChild(text, raw);

        ViewPair rawPair = tree.lookup(raw);
        assertEquals(ViewKind.RAW_TEXT, rawPair.view().kind());
        assertNull(rawPair.shadow());
        assertTrue(solver.dirty.contains(text));
        assertEquals(0, tree.lookup(text).shadow().childCount());
        assertEquals("hi", ((TextView) tree.lookup(text).view()).text());
    }

    @Test
    void testMovingRawTextDirtiesAndRepaintsBothTexts() {
        DirtyRecorder solver = new DirtyRecorder();
        ViewTreeManager tree = new ViewTreeManager(builtIns(), solver, false);

        ViewId from = tree.createInstance("Text");
        ViewId to = tree.createInstance("Text");
        ViewId raw = tree.createTextInstance("moved");
        tree.addChild(ViewId.ROOT, from);
        tree.addChild(ViewId.ROOT, to);
        tree.addChild(from, raw);

        int fromRepaints = tree.lookup(from).view().repaintCount();
        int toRepaints = tree.lookup(to).view().repaintCount();

        tree.addChild(to, raw);

        assertTrue(solver.dirty.containsAll(Set.of(from, to)));
        assertEquals(fromRepaints + 1, tree.lookup(from).view().repaintCount());
        assertEquals(toRepaints + 1, tree.lookup(to).view().repaintCount());
        assertEquals("", ((TextView) tree.lookup(from).view()).text());
        assertEquals("moved", ((TextView) tree.lookup(to).view()).text());
    }

    @Test
    void testSetPropertyRunsExactlyOneLayoutPass() {
        ViewTreeManager tree = newTree();
        ViewId v = tree.createInstance("View");
        tree.addChild(ViewId.ROOT, v);

        long before = tree.layoutPasses();
        tree.setProperty(v, "style", Map.of("width", 10.0, "height", 20.0, "backgroundColor", "red"));
        assertEquals(before + 1, tree.layoutPasses());

        tree.setProperty(v, "height", 20.0);
        assertEquals(before + 2, tree.layoutPasses());
        assertEquals(2, tree.lookup(v).view().repaintCount());
        assertEquals(10f, tree.lookup(v).shadow().width(), 1e-3);
    }

    @Test
    void testClearingStyleRestoresDefaultGeometry() {
        ViewTreeManager tree = newTree();
        tree.setViewport(200, 100);
        ViewId v = tree.createInstance("View");
        tree.addChild(ViewId.ROOT, v);

        tree.setProperty(v, "style", Map.of("width", 50.0, "height", 30.0));
        assertEquals(50f, tree.lookup(v).view().bounds().width(), 1e-3);

        tree.setProperty(v, "style", Map.of("height", 30.0));
        assertEquals(200f, tree.lookup(v).view().bounds().width(), 1e-3);

        tree.setProperty(v, "style", null);
        assertNull(tree.lookup(v).view().property("style"));
        assertTrue(Float.isNaN(tree.lookup(v).shadow().style().height()));
        assertEquals(0f, tree.lookup(v).view().bounds().height(), 1e-3);
    }

    @Test
    void testCreateHasNoLayoutSideEffect() {
        ViewTreeManager tree = newTree();
        long before = tree.layoutPasses();
        tree.createInstance("View");
        tree.createTextInstance("x");
        assertEquals(before, tree.layoutPasses());
    }

    @Test
    void testRemoveChildPurgesWholeSubtree() {
        ViewTreeManager tree = newTree();
        ViewId a = tree.createInstance("View");
        ViewId b = tree.createInstance("View");
        ViewId t = tree.createInstance("Text");
        ViewId raw = tree.createTextInstance("leaf");
        tree.addChild(ViewId.ROOT, a);
        tree.addChild(a, b);
        tree.addChild(b, t);
        tree.addChild(t, raw);

        assertEquals(List.of(raw, t, b, a), tree.collectSubtreeIds(a));

        tree.removeChild(ViewId.ROOT, a);

        for (ViewId id : List.of(a, b, t, raw)) {
            assertFalse(tree.contains(id));
            assertThrows(ViewTableException.class, () -> tree.lookup(id));
        }
        assertEquals(0, tree.size());
        assertEquals(0, tree.rootShadow().childCount());
        assertTrue(tree.rootView().children().isEmpty());
    }

    @Test
    void testRemoveRawTextDirtiesTextParent() {
        DirtyRecorder solver = new DirtyRecorder();
        ViewTreeManager tree = new ViewTreeManager(builtIns(), solver, false);
        ViewId text = tree.createInstance("Text");
        ViewId raw = tree.createTextInstance("bye");
        tree.addChild(ViewId.ROOT, text);
        tree.addChild(text, raw);
        assertFalse(tree.lookup(text).shadow().isDirty());

        tree.removeChild(text, raw);

        assertTrue(solver.dirty.contains(text));
        assertFalse(tree.contains(raw));
    }

    @Test
    void testRemoveNonChildFails() {
        ViewTreeManager tree = newTree();
        ViewId a = tree.createInstance("View");
        ViewId b = tree.createInstance("View");
        tree.addChild(ViewId.ROOT, a);
        assertThrows(ViewTableException.class, () -> tree.removeChild(a, b));
    }

    @Test
    void testEveryLiveIdIsReachableFromRoot() {
        ViewTreeManager tree = newTree();
        Random rnd = new Random(42);
        List<ViewId> attached = new ArrayList<>();
        attached.add(ViewId.ROOT);

        for (int step = 0; step < 400; step++) {
            if (attached.size() > 1 && rnd.nextInt(4) == 0) {
                ViewId victim = attached.get(1 + rnd.nextInt(attached.size() - 1));
                View parent = tree.lookup(victim).view().parent();
                tree.removeChild(parent.id(), victim);
                attached.removeIf(id -> !tree.contains(id));
            } else {
                ViewId parent = attached.get(rnd.nextInt(attached.size()));
                ViewId child = tree.createInstance(rnd.nextBoolean() ? "View" : "ScrollView");
                int index = rnd.nextInt(3) - 1;
                tree.addChild(parent, child, index);
                attached.add(child);
            }

            List<ViewId> reachable = tree.collectSubtreeIds(ViewId.ROOT);
            assertEquals(tree.size(), reachable.size() - 1, "step " + step);
            assertEquals(new HashSet<>(attached), new HashSet<>(reachable), "step " + step);
        }
    }

    @Test
    void testAddChildAtIndexKeepsBothTreesInOrder() {
        ViewTreeManager tree = newTree();
        ViewId x = tree.createInstance("View");
        ViewId y = tree.createInstance("View");
        ViewId z = tree.createInstance("View");
        tree.addChild(ViewId.ROOT, x);
        tree.addChild(ViewId.ROOT, y);
        tree.addChild(ViewId.ROOT, z, 1);

        List<ViewId> render = new ArrayList<>();
        for (View v : tree.rootView().children()) render.add(v.id());
        List<ViewId> geometry = new ArrayList<>();
        for (ShadowView s : tree.rootShadow().children()) geometry.add(s.viewId());

        assertEquals(List.of(x, z, y), render);
        assertEquals(render, geometry);
    }

    @Test
    void testAddChildMovesBetweenParents() {
        ViewTreeManager tree = newTree();
        ViewId a = tree.createInstance("View");
        ViewId b = tree.createInstance("View");
        ViewId c = tree.createInstance("View");
        tree.addChild(ViewId.ROOT, a);
        tree.addChild(ViewId.ROOT, b);
        tree.addChild(a, c);

        tree.addChild(b, c);

        assertTrue(tree.lookup(a).view().children().isEmpty());
        assertEquals(0, tree.lookup(a).shadow().childCount());
        assertSame(tree.lookup(b).view(), tree.lookup(c).view().parent());
        assertSame(tree.lookup(b).shadow(), tree.lookup(c).shadow().parent());
    }

    @Test
    void testStructuralMistakesAreRejected() {
        ViewTreeManager tree = newTree();
        ViewId view = tree.createInstance("View");
        ViewId inner = tree.createInstance("View");
        ViewId text = tree.createInstance("Text");
        ViewId raw = tree.createTextInstance("r");
        tree.addChild(ViewId.ROOT, view);
        tree.addChild(view, inner);

        assertThrows(ViewTableException.class, () -> tree.addChild(view, raw));
        assertThrows(ViewTableException.class, () -> tree.addChild(text, inner));
        assertThrows(ViewTableException.class, () -> tree.addChild(raw, inner));
        assertThrows(ViewTableException.class, () -> tree.addChild(view, ViewId.ROOT));
        assertThrows(ViewTableException.class, () -> tree.addChild(inner, view));
        assertThrows(ViewTableException.class, () -> tree.addChild(view, view));
    }

    @Test
    void testUnregisteredTypeAndBadFactory() {
        ViewFactoryRegistry registry = builtIns();
        registry.register("Broken", id -> new ViewPair(new View(id, ViewKind.GENERIC), null));
        registry.register("Throwing", id -> {
            throw new IllegalStateException("boom");
        });
        ViewTreeManager tree = new ViewTreeManager(registry, new FlexLayoutSolver(), false);

        assertThrows(ViewTableException.class, () -> tree.createInstance("Nope"));
        assertThrows(ViewTableException.class, () -> tree.createInstance("Broken"));
        assertThrows(IllegalStateException.class, () -> tree.createInstance("Throwing"));
        assertEquals(0, tree.size());
    }

    @Test
    void testSetRawTextRelayoutsOnlyUnderText() {
        ViewTreeManager tree = newTree();
        ViewId text = tree.createInstance("Text");
        ViewId raw = tree.createTextInstance("a");
        ViewId loose = tree.createTextInstance("b");
        tree.addChild(ViewId.ROOT, text);
        tree.addChild(text, raw);

        long passes = tree.layoutPasses();
        int repaints = tree.lookup(text).view().repaintCount();

        tree.setRawText(raw, "hello");
        assertEquals(passes + 1, tree.layoutPasses());
        assertEquals(repaints + 1, tree.lookup(text).view().repaintCount());

        tree.setRawText(loose, "c");
        assertEquals(passes + 1, tree.layoutPasses());

        // not raw text: warned and ignored
        tree.setRawText(text, "x");
        assertEquals(passes + 1, tree.layoutPasses());
    }

    @Test
    void testTextIsMeasuredFromRawChildren() {
        ViewTreeManager tree = newTree();
        tree.setViewport(300, 200);
        ViewId text = tree.createInstance("Text");
        ViewId raw = tree.createTextInstance("abc");
        tree.setProperty(ViewId.ROOT, "alignItems", "flex-start");
        tree.addChild(ViewId.ROOT, text);
        tree.addChild(text, raw);

        // default font size 15, advance 0.6 → 9 per glyph; line height 18
        assertEquals(27f, tree.lookup(text).view().bounds().width(), 1e-3);
        assertEquals(18f, tree.lookup(text).view().bounds().height(), 1e-3);

        tree.setProperty(text, "fontSize", 20.0);
        assertEquals(36f, tree.lookup(text).view().bounds().width(), 1e-3);
        assertEquals(24f, tree.lookup(text).view().bounds().height(), 1e-3);
    }

    @Test
    void testLayoutIsFlushedToViews() {
        ViewTreeManager tree = newTree();
        ViewId a = tree.createInstance("View");
        ViewId b = tree.createInstance("View");
        tree.addChild(ViewId.ROOT, a);
        tree.addChild(ViewId.ROOT, b);
        tree.setProperty(a, "height", 40.0);
        tree.setProperty(b, "height", 10.0);

        assertTrue(tree.setViewport(200, 100));
        assertFalse(tree.setViewport(200, 100));

        View vb = tree.lookup(b).view();
        assertEquals(40f, vb.bounds().y(), 1e-3);
        assertEquals(200f, vb.bounds().width(), 1e-3);
        assertEquals(-40f, vb.node().getLocalTranslation().y, 1e-3);
    }

    @Test
    void testLookupByRefIdChecksRootFirst() {
        ViewTreeManager tree = newTree();
        ViewId a = tree.createInstance("View");
        tree.addChild(ViewId.ROOT, a);
        tree.setProperty(a, "refId", "main");
        tree.setProperty(ViewId.ROOT, "refId", "main");

        assertSame(tree.rootView(), tree.lookupByRefId("main").orElseThrow());

        tree.setProperty(ViewId.ROOT, "refId", null);
        assertSame(tree.lookup(a).view(), tree.lookupByRefId("main").orElseThrow());
        assertTrue(tree.lookupByRefId("other").isEmpty());
    }

    @Test
    void testRepaintGoesToSurface() {
        ViewTreeManager tree = newTree();
        List<View> painted = new ArrayList<>();
        tree.setSurface(painted::add);
        ViewId a = tree.createInstance("Image");
        tree.addChild(ViewId.ROOT, a);

        tree.setProperty(a, "source", "logo.png");

        assertEquals(List.of(tree.lookup(a).view()), painted);
    }

    @Test
    void testResetMakesOldIdsStale() {
        ViewTreeManager tree = newTree();
        ViewId a = tree.createInstance("View");
        tree.addChild(ViewId.ROOT, a);
        View oldRoot = tree.rootView();

        tree.reset();

        assertFalse(tree.contains(a));
        assertThrows(ViewTableException.class, () -> tree.lookup(a));
        assertNotSame(oldRoot, tree.rootView());
        assertSame(tree.sceneNode(), tree.rootView().node().getParent());
        assertNull(oldRoot.node().getParent());

        ViewId fresh = tree.createInstance("View");
        assertNotEquals(a.value(), fresh.value());
    }
}
