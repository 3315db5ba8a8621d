package org.foxesworld.blueprint.engine;

import com.jme3.scene.Node;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.blueprint.core.BlueprintPlatform;
import org.foxesworld.blueprint.core.ViewId;
import org.foxesworld.blueprint.core.layout.ApproximateTextMeasure;
import org.foxesworld.blueprint.core.layout.FlexLayoutSolver;
import org.foxesworld.blueprint.core.layout.LayoutSolver;
import org.foxesworld.blueprint.core.layout.TextMeasure;
import org.foxesworld.blueprint.core.util.OwnerThread;
import org.foxesworld.blueprint.engine.script.BlueprintNative;
import org.foxesworld.blueprint.engine.script.NativeMethod;
import org.foxesworld.blueprint.engine.script.ScriptBridge;
import org.foxesworld.blueprint.engine.script.ScriptFailure;
import org.foxesworld.blueprint.engine.script.ScriptJobQueue;
import org.foxesworld.blueprint.engine.script.cache.ScriptSourceCache;
import org.foxesworld.blueprint.engine.tree.BuiltInViews;
import org.foxesworld.blueprint.engine.tree.ViewFactory;
import org.foxesworld.blueprint.engine.tree.ViewFactoryRegistry;
import org.foxesworld.blueprint.engine.tree.ViewTreeManager;
import org.foxesworld.blueprint.engine.view.RenderSurface;
import org.foxesworld.blueprint.engine.view.View;

import java.io.Closeable;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Root of one script-driven view hierarchy.
 *
 * <p>Owns the view type registry, the tree manager, the script bridge and the scheduler tick, and
 * sequences their lifecycle: construction ends in {@link RootState#READY}; {@link #reload()} passes
 * through {@link RootState#RELOADING}; {@link #close()} is terminal.</p>
 *
 * <p>Thread confined to the constructing thread. Other threads hand work over with
 * {@link #post(Runnable)} / {@link #call(Supplier)}; it runs on the next {@link #update(float)}.</p>
 */
public final class ReactApplicationRoot implements Closeable {

    private static final Logger log = LogManager.getLogger(ReactApplicationRoot.class);

    public static final String DEFAULT_BUNDLE_NAME = "bundle.js";

    private final BlueprintSettings settings;
    private final OwnerThread owner;
    private final TextMeasure textMeasure;
    private final ViewFactoryRegistry types = new ViewFactoryRegistry();
    private final ViewTreeManager tree;
    private final ScriptSourceCache sources;
    private final ScriptJobQueue jobs = new ScriptJobQueue();
    private final SchedulerTick tick;

    private ScriptBridge bridge;
    private Consumer<ScriptFailure> failureSink;
    private volatile RootState state = RootState.UNINITIALIZED;

    public ReactApplicationRoot() {
        this(BlueprintSettings.fromSystemProperties());
    }

    public ReactApplicationRoot(BlueprintSettings settings) {
        this(settings, new FlexLayoutSolver(), new ApproximateTextMeasure());
    }

    public ReactApplicationRoot(BlueprintSettings settings, LayoutSolver solver, TextMeasure textMeasure) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.owner = OwnerThread.current();

        this.textMeasure = Objects.requireNonNull(textMeasure, "textMeasure");
        BuiltInViews.install(types, textMeasure);
        this.tree = new ViewTreeManager(types, solver, settings.debug());
        this.sources = new ScriptSourceCache(settings.sourceCacheSize());
        this.tick = new SchedulerTick(settings.tickMillis());
        this.jobs.setOnError(t -> log.error("[root] posted job failed", t));

        this.bridge = createBridge();
        this.state = RootState.READY;

        log.info("[root] {} ready: java={}, os={}, thread={}, tick={}ms",
                BlueprintPlatform.NAME, BlueprintPlatform.java(), BlueprintPlatform.os(),
                BlueprintPlatform.threadName(), settings.tickMillis());
    }

    private ScriptBridge createBridge() {
        ScriptBridge b = new ScriptBridge(owner, sources);
        b.setErrorSink(this::onScriptFailure);
        BlueprintNative.install(b, tree, types);
        return b;
    }

    private void onScriptFailure(ScriptFailure failure) {
        Consumer<ScriptFailure> sink = failureSink;
        if (sink != null) sink.accept(failure);
    }

    // -----------------------------
    // Script
    // -----------------------------

    public boolean evalScript(String code) {
        return evalScript(DEFAULT_BUNDLE_NAME, code);
    }

    /** Evaluates a bundle, then starts the scheduler tick whether or not evaluation succeeded. */
    public boolean evalScript(String name, String code) {
        requireReady("evalScript");
        boolean ok = bridge.evalScript(name, code);
        tick.start();
        return ok;
    }

    public int registerNativeMethod(String name, NativeMethod method) {
        requireReady("registerNativeMethod");
        return bridge.registerNativeMethod(name, method);
    }

    public boolean dispatchViewEvent(ViewId viewId, String eventType, Object... args) {
        requireReady("dispatchViewEvent");
        return bridge.dispatchViewEvent(viewId, eventType, args);
    }

    public boolean dispatchEvent(String eventType, Object... args) {
        requireReady("dispatchEvent");
        return bridge.dispatchEvent(eventType, args);
    }

    /** Receives every script failure (evaluation, dispatch, interrupt) after it was logged. */
    public void setFailureSink(Consumer<ScriptFailure> sink) {
        this.failureSink = sink;
    }

    // -----------------------------
    // Tick
    // -----------------------------

    /**
     * Host frame/timer callback: runs posted jobs, then fires {@code __schedulerInterrupt__} when a
     * tick period has elapsed. Script failures never stop the tick.
     *
     * @param tpf seconds since the previous call
     */
    public void update(float tpf) {
        requireReady("update");
        jobs.drainBudgeted(settings.maxJobsPerUpdate(), settings.jobBudgetNanos());

        // a job may have closed the root
        if (state != RootState.READY) return;
        if (tick.advance(tpf)) bridge.schedulerInterrupt();
    }

    // -----------------------------
    // Reload / resize / close
    // -----------------------------

    /**
     * Tears down the script context, the view tree and every registry, then starts over with the
     * built-in view types only. Custom view types and native methods must be registered again
     * before the caller evaluates the bundle again.
     */
    public void reload() {
        requireReady("reload");
        if (bridge.callDepth() > 0) {
            throw new IllegalStateException("reload() called from inside a script call (depth " + bridge.callDepth() + ")");
        }

        state = RootState.RELOADING;
        log.info("[root] reload requested");

        tick.stop();
        int dropped = jobs.clear();
        bridge.close();
        tree.reset();
        types.clear();
        BuiltInViews.install(types, textMeasure);
        bridge = createBridge();

        state = RootState.READY;
        log.info("[root] reloaded (dropped {} pending jobs)", dropped);
    }

    /** @return true if the bounds changed and layout was recomputed */
    public boolean setBounds(float width, float height) {
        requireReady("setBounds");
        if (!(width >= 0f) || !(height >= 0f)) {
            throw new IllegalArgumentException("bounds must be >= 0, got " + width + "x" + height);
        }
        boolean changed = tree.setViewport(width, height);
        if (changed) log.debug("[root] bounds {}x{}", width, height);
        return changed;
    }

    @Override
    public void close() {
        if (state == RootState.DESTROYED) return;
        owner.check("ReactApplicationRoot.close");

        tick.stop();
        jobs.clear();
        try {
            bridge.close();
        } finally {
            state = RootState.DESTROYED;
            log.info("[root] closed");
        }
    }

    // -----------------------------
    // Cross-thread hand-off
    // -----------------------------

    public void post(Runnable job) {
        requireAlive("post");
        jobs.post(job);
    }

    public <T> CompletableFuture<T> call(Supplier<T> supplier) {
        requireAlive("call");
        return jobs.call(supplier);
    }

    // -----------------------------
    // Views
    // -----------------------------

    public void registerViewType(String typeId, ViewFactory factory) {
        requireReady("registerViewType");
        types.register(typeId, factory);
    }

    public Optional<View> getViewByRefId(String refId) {
        requireReady("getViewByRefId");
        return tree.lookupByRefId(refId);
    }

    public void setRenderSurface(RenderSurface surface) {
        requireReady("setRenderSurface");
        tree.setSurface(surface);
    }

    /** Stable GUI node the host attaches once; survives reloads. */
    public Node sceneNode() {
        return tree.sceneNode();
    }

    public ViewTreeManager tree() { return tree; }
    public ScriptBridge bridge() { return bridge; }
    public RootState state() { return state; }
    public BlueprintSettings settings() { return settings; }
    public SchedulerTick tick() { return tick; }
    public int pendingJobs() { return jobs.size(); }
    public Thread ownerThread() { return owner.thread(); }

    private void requireReady(String where) {
        owner.check("ReactApplicationRoot." + where);
        RootState s = state;
        if (s != RootState.READY) throw new IllegalStateException(where + " not allowed in state " + s);
    }

    private void requireAlive(String where) {
        if (state == RootState.DESTROYED) throw new IllegalStateException(where + " after close");
    }
}
