package org.foxesworld.blueprint.engine.script;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.blueprint.core.Undefined;
import org.foxesworld.blueprint.core.ViewId;
import org.foxesworld.blueprint.engine.tree.ViewFactoryRegistry;
import org.foxesworld.blueprint.engine.tree.ViewTableException;
import org.foxesworld.blueprint.engine.tree.ViewTreeManager;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;

import java.util.Objects;

/**
 * Tree protocol exposed to script on {@code __BlueprintNative__}.
 *
 * <p>Everything coming from script is validated here before the tree manager sees it. Bad input is
 * reported as {@link IllegalArgumentException}, which script can catch; structural errors the tree
 * manager detects are reported the same way.</p>
 */
public final class BlueprintNative {

    private static final Logger log = LogManager.getLogger(BlueprintNative.class);

    private final ViewTreeManager tree;
    private final ViewFactoryRegistry types;
    private final ValueCodec codec;

    private BlueprintNative(ViewTreeManager tree, ViewFactoryRegistry types, ValueCodec codec) {
        this.tree = tree;
        this.types = types;
        this.codec = codec;
    }

    public static void install(ScriptBridge bridge, ViewTreeManager tree, ViewFactoryRegistry types) {
        Objects.requireNonNull(bridge, "bridge");
        BlueprintNative n = new BlueprintNative(
                Objects.requireNonNull(tree, "tree"),
                Objects.requireNonNull(types, "types"),
                bridge.codec());

        bridge.installFunction("createViewInstance", n.guard("createViewInstance", args -> {
            String typeId = string(args, 0, "typeId");
            if (!n.types.contains(typeId)) throw new IllegalArgumentException("Unknown view type: " + typeId);
            return n.tree.createInstance(typeId).value();
        }));

        bridge.installFunction("createTextViewInstance", n.guard("createTextViewInstance", args ->
                n.tree.createTextInstance(string(args, 0, "text")).value()));

        bridge.installFunction("setViewProperty", n.guard("setViewProperty", args -> {
            ViewId id = n.viewId(args, 0, "viewId");
            String key = string(args, 1, "key");
            Object value = args.length > 2 ? n.codec.decode(args[2]) : Undefined.INSTANCE;
            n.tree.setProperty(id, key, value);
            return n.codec.undefined();
        }));

        bridge.installFunction("setRawTextValue", n.guard("setRawTextValue", args -> {
            n.tree.setRawText(n.viewId(args, 0, "viewId"), string(args, 1, "text"));
            return n.codec.undefined();
        }));

        bridge.installFunction("addChild", n.guard("addChild", args -> {
            ViewId parent = n.viewId(args, 0, "parentId");
            ViewId child = n.viewId(args, 1, "childId");
            n.tree.addChild(parent, child, index(args, 2));
            return n.codec.undefined();
        }));

        bridge.installFunction("removeChild", n.guard("removeChild", args -> {
            n.tree.removeChild(n.viewId(args, 0, "parentId"), n.viewId(args, 1, "childId"));
            return n.codec.undefined();
        }));

        bridge.installFunction("getRootInstanceId", args -> ViewId.ROOT.value());
    }

    /** Logs rejected calls and turns tree structure errors into script-catchable ones. */
    private ProxyExecutable guard(String name, ProxyExecutable body) {
        return args -> {
            try {
                return body.execute(args);
            } catch (ViewTableException e) {
                log.warn("[bridge] {} rejected: {}", name, e.getMessage());
                throw new IllegalArgumentException(e.getMessage(), e);
            } catch (IllegalArgumentException e) {
                log.warn("[bridge] {} rejected: {}", name, e.getMessage());
                throw e;
            }
        };
    }

    // -----------------------------
    // Argument checks
    // -----------------------------

    private ViewId viewId(Value[] args, int i, String what) {
        Value v = i < args.length ? args[i] : null;
        if (v == null || !v.isNumber() || !v.fitsInLong()) {
            throw new IllegalArgumentException(what + " must be an integral view id, got " + v);
        }
        ViewId id = ViewId.of(v.asLong());
        if (!tree.contains(id)) throw new IllegalArgumentException("Unknown or stale " + what + ": " + id);
        return id;
    }

    private static String string(Value[] args, int i, String what) {
        Value v = i < args.length ? args[i] : null;
        if (v == null || !v.isString()) throw new IllegalArgumentException(what + " must be a string, got " + v);
        return v.asString();
    }

    private static int index(Value[] args, int i) {
        Value v = i < args.length ? args[i] : null;
        if (v == null || v.isNull()) return -1;
        if (!v.isNumber() || !v.fitsInInt()) throw new IllegalArgumentException("index must be an integer, got " + v);
        return v.asInt();
    }
}
