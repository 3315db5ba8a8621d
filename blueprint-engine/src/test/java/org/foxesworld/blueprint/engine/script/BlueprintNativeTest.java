package org.foxesworld.blueprint.engine.script;

import org.foxesworld.blueprint.core.ViewId;
import org.foxesworld.blueprint.core.layout.ApproximateTextMeasure;
import org.foxesworld.blueprint.core.layout.FlexLayoutSolver;
import org.foxesworld.blueprint.core.util.OwnerThread;
import org.foxesworld.blueprint.engine.script.cache.ScriptSourceCache;
import org.foxesworld.blueprint.engine.tree.BuiltInViews;
import org.foxesworld.blueprint.engine.tree.ViewFactoryRegistry;
import org.foxesworld.blueprint.engine.tree.ViewTreeManager;
import org.foxesworld.blueprint.engine.view.TextView;
import org.foxesworld.blueprint.engine.view.View;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BlueprintNativeTest {

    private ScriptBridge bridge;
    private ViewTreeManager tree;
    private final List<ScriptFailure> failures = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ViewFactoryRegistry types = new ViewFactoryRegistry();
        BuiltInViews.install(types, new ApproximateTextMeasure());
        tree = new ViewTreeManager(types, new FlexLayoutSolver(), false);
        tree.setViewport(320, 240);

        bridge = new ScriptBridge(OwnerThread.current(), new ScriptSourceCache(8));
        bridge.setErrorSink(failures::add);
        BlueprintNative.install(bridge, tree, types);
    }

    @AfterEach
    void tearDown() {
        bridge.close();
    }

    private void run(String code) {
        assertTrue(bridge.evalScript("t.js", "var N = __BlueprintNative__;\n" + code), () -> failures.toString());
    }

    private Object global(String name) {
        return bridge.codec().decode(bridge.context().getBindings("js").getMember(name));
    }

    @Test
    void testScriptBuildsTree() {
        run("var root = N.getRootInstanceId();"
                + "var box = N.createViewInstance('View');"
                + "var label = N.createViewInstance('Text');"
                + "var raw = N.createTextViewInstance('Hi');"
                + "N.setViewProperty(box, 'style', {height: 50, padding: 4});"
                + "N.setViewProperty(box, 'refId', 'box');"
                + "N.addChild(root, box);"
                + "N.addChild(box, label);"
                + "N.addChild(label, raw);");

        assertEquals(0.0, global("root"));
        View box = tree.lookupByRefId("box").orElseThrow();
        assertEquals(50f, box.bounds().height(), 1e-3);
        assertEquals(320f, box.bounds().width(), 1e-3);
        assertEquals(1, box.children().size());

        TextView label = (TextView) box.children().get(0);
        assertEquals("Hi", label.text());
        assertEquals(4f, label.bounds().x(), 1e-3);
        assertEquals(Map.of("height", 50.0, "padding", 4.0), box.property("style"));
    }

    @Test
    void testRawTextUpdateAndRemoval() {
        run("var t = N.createViewInstance('Text');"
                + "var raw = N.createTextViewInstance('a');"
                + "N.addChild(N.getRootInstanceId(), t);"
                + "N.addChild(t, raw);"
                + "N.setRawTextValue(raw, 'abc');");

        ViewId t = ViewId.of(((Double) global("t")).longValue());
        assertEquals("abc", ((TextView) tree.lookup(t).view()).text());

        run("N.removeChild(N.getRootInstanceId(), t);");
        assertFalse(tree.contains(t));
        assertEquals(0, tree.size());
    }

    @Test
    void testInsertAtIndex() {
        run("var a = N.createViewInstance('View'), b = N.createViewInstance('View'), c = N.createViewInstance('View');"
                + "N.addChild(0, a); N.addChild(0, b); N.addChild(0, c, 0);");

        List<View> kids = tree.rootView().children();
        assertEquals(3, kids.size());
        assertEquals(ViewId.of(((Double) global("c")).longValue()), kids.get(0).id());
    }

    @Test
    void testUndefinedPropertyClearsValue() {
        run("var v = N.createViewInstance('View');"
                + "N.setViewProperty(v, 'refId', 'x');"
                + "N.setViewProperty(v, 'refId', undefined);");
        ViewId v = ViewId.of(((Double) global("v")).longValue());
        assertNull(tree.lookup(v).view().refId());
        assertNull(tree.lookup(v).view().property("refId"));
    }

    @Test
    void testBoundaryErrorsAreCatchableInScript() {
        run("var errors = [];"
                + "function attempt(f) { try { f(); errors.push(false); } catch (e) { errors.push(true); } }"
                + "var v = N.createViewInstance('View');"
                + "var raw = N.createTextViewInstance('r');"
                + "attempt(function () { N.createViewInstance('Nope'); });"
                + "attempt(function () { N.createViewInstance(7); });"
                + "attempt(function () { N.addChild(0, 999999); });"
                + "attempt(function () { N.addChild(v, raw); });"
                + "attempt(function () { N.addChild(0, v, 'first'); });"
                + "attempt(function () { N.setViewProperty('v', 'x', 1); });"
                + "attempt(function () { N.setViewProperty(v, 'onPress', function () {}); });"
                + "attempt(function () { N.removeChild(0, v); });");

        @SuppressWarnings("unchecked")
        List<Object> errors = (List<Object>) global("errors");
        assertEquals(8, errors.size());
        for (Object caught : errors) assertEquals(true, caught);
        assertEquals(0, tree.rootView().children().size());
        assertTrue(failures.isEmpty());
    }

    @Test
    void testStaleIdIsRejected() {
        run("var v = N.createViewInstance('View'); N.addChild(0, v); N.removeChild(0, v);"
                + "var caught = false; try { N.setViewProperty(v, 'refId', 'x'); } catch (e) { caught = true; }");
        assertEquals(true, global("caught"));
    }

    @Test
    void testUncaughtBoundaryErrorFailsEvaluation() {
        assertFalse(bridge.evalScript("t.js", "__BlueprintNative__.addChild(0, 123456);"));
        assertEquals(1, failures.size());
        assertTrue(failures.get(0).description().contains("IllegalArgumentException"));
    }
}
