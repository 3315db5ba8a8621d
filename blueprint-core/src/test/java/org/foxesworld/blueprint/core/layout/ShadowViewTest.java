package org.foxesworld.blueprint.core.layout;

import org.foxesworld.blueprint.core.ViewId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ShadowViewTest {

    @Test
    void testMarkDirtyPropagatesToAncestors() {
        ShadowView root = new ShadowView(ViewId.ROOT, null);
        ShadowView mid = new ShadowView(new ViewId(1, 0), null);
        ShadowView leaf = new ShadowView(new ViewId(2, 0), null);
        root.addChild(mid, -1);
        mid.addChild(leaf, -1);

        new FlexLayoutSolver().layout(root, 10, 10);
        assertFalse(root.isDirty());

        assertFalse(leaf.setProperty("backgroundColor", "red"));
        assertFalse(root.isDirty());

        assertTrue(leaf.setProperty("height", 3));
        assertTrue(leaf.isDirty());
        assertTrue(mid.isDirty());
        assertTrue(root.isDirty());
    }

    @Test
    void testAddChildAtIndexAndMove() {
        ShadowView a = new ShadowView(new ViewId(1, 0), null);
        ShadowView b = new ShadowView(new ViewId(2, 0), null);
        ShadowView x = new ShadowView(new ViewId(3, 0), null);
        ShadowView y = new ShadowView(new ViewId(4, 0), null);

        a.addChild(x, -1);
        a.addChild(y, 0);
        assertEquals(List.of(y, x), a.children());

        b.addChild(y, 99);
        assertEquals(List.of(x), a.children());
        assertEquals(List.of(y), b.children());
        assertSame(b, y.parent());

        assertTrue(b.removeChild(y));
        assertNull(y.parent());
        assertFalse(b.removeChild(y));
    }

    @Test
    void testSelfChildRejected() {
        ShadowView a = new ShadowView(new ViewId(1, 0), null);
        assertThrows(IllegalArgumentException.class, () -> a.addChild(a, -1));
    }

    @Test
    void testFlushPushesBoundsToTargetsPreOrder() {
        List<String> seen = new ArrayList<>();
        ShadowView root = new ShadowView(ViewId.ROOT, b -> seen.add("root " + b.width()));
        ShadowView child = new ShadowView(new ViewId(1, 0), b -> seen.add("child " + b.height()));
        child.setProperty("height", 5);
        root.addChild(child, -1);

        root.computeViewLayout(new FlexLayoutSolver(), 20, 30);
        root.flushViewLayout();

        assertEquals(List.of("root 20.0", "child 5.0"), seen);
    }

    @Test
    void testTextShadowConsumesFontKeys() {
        TextContent content = new TextContent() {
            @Override public String text() { return "x"; }
            @Override public float fontSize() { return 10f; }
            @Override public float lineHeight() { return 10f; }
        };
        TextShadowView text = new TextShadowView(new ViewId(1, 0), null, content, new ApproximateTextMeasure());
        assertTrue(text.isMeasured());
        assertTrue(text.setProperty("fontSize", 20));
        assertFalse(text.setProperty("color", "blue"));
    }

    @Test
    void testReplacedStyleResetsMissingKeys() {
        ShadowView n = new ShadowView(new ViewId(1, 0), null);
        assertTrue(n.setProperty("style", Map.of("width", 10, "padding", 4, "flexDirection", "row")));

        n.clearDirty();
        assertTrue(n.setProperty("style", Map.of("width", 12)));
        assertTrue(n.isDirty());
        assertEquals(12f, n.style().width(), 1e-6);
        assertEquals(0f, n.style().padding(LayoutStyle.LEFT), 1e-6);
        assertEquals(LayoutStyle.FlexDirection.COLUMN, n.style().flexDirection());

        assertTrue(n.setProperty("style", null));
        assertTrue(Float.isNaN(n.style().width()));

        // nothing left to reset
        assertFalse(n.setProperty("style", null));
    }

    @Test
    void testClearingFontStyleDirtiesText() {
        TextContent content = new TextContent() {
            @Override public String text() { return "x"; }
            @Override public float fontSize() { return 10f; }
            @Override public float lineHeight() { return 10f; }
        };
        TextShadowView text = new TextShadowView(new ViewId(1, 0), null, content, new ApproximateTextMeasure());
        assertTrue(text.setProperty("style", Map.of("fontSize", 20)));

        text.clearDirty();
        assertTrue(text.setProperty("style", Map.of("color", "red")));
        assertTrue(text.isDirty());
        assertFalse(text.setProperty("style", Map.of("color", "blue")));
    }
}
