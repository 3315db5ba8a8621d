package org.foxesworld.blueprint.engine.script;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.blueprint.core.ViewId;
import org.foxesworld.blueprint.core.util.OwnerThread;
import org.foxesworld.blueprint.engine.script.cache.ScriptSourceCache;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;

import java.io.Closeable;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * One GraalJS context plus the {@code __BlueprintNative__} namespace, the native method registry and
 * the two event dispatch paths into script.
 *
 * <p>Thread confined to the owner handed in at construction.</p>
 *
 * <p>Security: host class lookup is disabled; host access is restricted to members annotated with
 * {@link HostAccess.Export}. Native functions are exposed as proxies only.</p>
 *
 * <p>Script failures never escape: they are logged, forwarded to the failure sink and reported as
 * {@code false}. Marshaling errors (unsupported Java values) do escape as
 * {@link IllegalArgumentException}.</p>
 */
public final class ScriptBridge implements Closeable {

    private static final Logger log = LogManager.getLogger(ScriptBridge.class);

    public static final String NATIVE_NAMESPACE = "__BlueprintNative__";
    public static final String SCHEDULER_INTERRUPT = "__schedulerInterrupt__";
    public static final String DISPATCH_VIEW_EVENT = "dispatchViewEvent";
    public static final String DISPATCH_EVENT = "dispatchEvent";

    /** Process-wide engine; contexts built on it share parsed code across reloads. */
    private static final class SharedEngine {
        static final Engine INSTANCE = Engine.newBuilder()
                .option("engine.WarnInterpreterOnly", "false")
                .build();
    }

    private final OwnerThread owner;
    private final ScriptSourceCache sources;
    private final Context ctx;
    private final ValueCodec codec;
    private final NativeMethodRegistry methods = new NativeMethodRegistry();
    private final Value nativeNamespace;

    private Consumer<ScriptFailure> errorSink;
    private int callDepth;
    private String lastInterruptFailure;
    private boolean closed;

    public ScriptBridge(OwnerThread owner, ScriptSourceCache sources) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.sources = Objects.requireNonNull(sources, "sources");
        owner.check("ScriptBridge.<init>");

        this.ctx = Context.newBuilder("js")
                .engine(SharedEngine.INSTANCE)
                .allowHostAccess(HostAccess.newBuilder(HostAccess.NONE)
                        .allowAccessAnnotatedBy(HostAccess.Export.class)
                        .build())
                .allowHostClassLookup(className -> false)
                .allowAllAccess(false)
                .build();

        this.codec = new ValueCodec(ctx);

        // a real script object, so the bundle can add dispatchEvent/dispatchViewEvent to it
        this.nativeNamespace = ctx.eval("js", "({})");
        ctx.getBindings("js").putMember(NATIVE_NAMESPACE, nativeNamespace);

        log.debug("[bridge] context created on {}", owner.thread().getName());
    }

    public ValueCodec codec() { return codec; }
    public Context context() { return ctx; }
    public NativeMethodRegistry methods() { return methods; }
    public int callDepth() { return callDepth; }
    public boolean isClosed() { return closed; }

    /** Receives every script failure after it has been logged. */
    public void setErrorSink(Consumer<ScriptFailure> sink) {
        this.errorSink = sink;
    }

    // -----------------------------
    // Namespace
    // -----------------------------

    /** Installs a host function on {@code __BlueprintNative__}. */
    public void installFunction(String name, ProxyExecutable fn) {
        checkOpen("installFunction");
        Objects.requireNonNull(name, "name");
        nativeNamespace.putMember(name, Objects.requireNonNull(fn, "fn"));
    }

    /**
     * Appends {@code method} to the registry and exposes it as {@code __BlueprintNative__[name]}.
     *
     * @return the magic index of the method
     */
    public int registerNativeMethod(String name, NativeMethod method) {
        checkOpen("registerNativeMethod");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(method, "method");
        if (nativeNamespace.hasMember(name)) {
            throw new IllegalStateException(NATIVE_NAMESPACE + "." + name + " is already defined");
        }

        int index = methods.add(name, method);
        nativeNamespace.putMember(name, new MagicFunction(methods, index, codec));
        log.debug("[bridge] native method '{}' registered at {}", name, index);
        return index;
    }

    // -----------------------------
    // Evaluation
    // -----------------------------

    public boolean evalScript(String name, String code) {
        checkOpen("evalScript");
        Objects.requireNonNull(code, "code");
        String sourceName = name != null ? name : "bundle.js";

        callDepth++;
        try {
            ctx.eval(sources.source(sourceName, code));
            log.info("[bridge] evaluated {} ({} chars)", sourceName, code.length());
            return true;
        } catch (PolyglotException e) {
            fail("eval " + sourceName, ScriptErrors.describe(e));
            return false;
        } finally {
            callDepth--;
        }
    }

    // -----------------------------
    // Native -> script events
    // -----------------------------

    public boolean dispatchViewEvent(ViewId viewId, String eventType, Object... args) {
        checkOpen("dispatchViewEvent");
        Objects.requireNonNull(viewId, "viewId");
        Objects.requireNonNull(eventType, "eventType");
        return dispatch(DISPATCH_VIEW_EVENT, prepend(viewId.value(), eventType, args));
    }

    public boolean dispatchEvent(String eventType, Object... args) {
        checkOpen("dispatchEvent");
        Objects.requireNonNull(eventType, "eventType");
        return dispatch(DISPATCH_EVENT, prepend(null, eventType, args));
    }

    private Object[] prepend(Long viewId, String eventType, Object[] args) {
        int extra = args == null ? 0 : args.length;
        int head = viewId != null ? 2 : 1;
        Object[] out = new Object[head + extra];
        int i = 0;
        if (viewId != null) out[i++] = codec.encode(viewId);
        out[i] = codec.encode(eventType);
        for (int k = 0; k < extra; k++) out[head + k] = codec.encode(args[k]);
        return out;
    }

    private boolean dispatch(String fnName, Object[] encoded) {
        Value fn = nativeNamespace.getMember(fnName);
        if (fn == null || !fn.canExecute()) {
            fail(fnName, NATIVE_NAMESPACE + "." + fnName + " is not a function");
            return false;
        }

        callDepth++;
        try {
            fn.execute(encoded);
            return true;
        } catch (PolyglotException e) {
            fail(fnName, ScriptErrors.describe(e));
            return false;
        } finally {
            callDepth--;
        }
    }

    /**
     * Calls the global {@code __schedulerInterrupt__()}. A failure identical to the previous one is
     * logged at debug level only.
     */
    public boolean schedulerInterrupt() {
        checkOpen("schedulerInterrupt");

        Value fn = ctx.getBindings("js").getMember(SCHEDULER_INTERRUPT);
        if (fn == null || !fn.canExecute()) {
            interruptFailed(SCHEDULER_INTERRUPT + " is not a function");
            return false;
        }

        callDepth++;
        try {
            fn.execute();
            lastInterruptFailure = null;
            return true;
        } catch (PolyglotException e) {
            interruptFailed(ScriptErrors.describe(e));
            return false;
        } finally {
            callDepth--;
        }
    }

    private void interruptFailed(String description) {
        if (description.equals(lastInterruptFailure)) {
            log.debug("[bridge] {} failed again: {}", SCHEDULER_INTERRUPT, description);
            return;
        }
        lastInterruptFailure = description;
        fail(SCHEDULER_INTERRUPT, description);
    }

    private void fail(String where, String description) {
        log.error("[bridge] {} failed: {}", where, description);
        Consumer<ScriptFailure> sink = errorSink;
        if (sink == null) return;
        try {
            sink.accept(new ScriptFailure(where, description));
        } catch (RuntimeException e) {
            log.warn("[bridge] failure sink threw", e);
        }
    }

    // -----------------------------
    // Lifecycle
    // -----------------------------

    private void checkOpen(String where) {
        owner.check("ScriptBridge." + where);
        if (closed) throw new IllegalStateException("ScriptBridge is closed (" + where + ")");
    }

    /** Closes the context and clears the native method registry. Idempotent. */
    @Override
    public void close() {
        owner.check("ScriptBridge.close");
        if (closed) return;
        closed = true;

        int dropped = methods.size();
        methods.clear();
        try {
            ctx.close(true);
        } catch (Exception e) {
            log.warn("[bridge] error closing context", e);
        }
        log.info("[bridge] closed, {} native methods dropped", dropped);
    }
}
