package org.foxesworld.blueprint.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.blueprint.engine.hotreload.BundleWatcher;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs a {@link ReactApplicationRoot} on its own application thread: builds the root there, evaluates
 * a bundle file, drives {@link ReactApplicationRoot#update(float)} at the tick rate and, when
 * watching, reloads and re-evaluates on bundle changes.
 */
public final class BundleHost implements Closeable {

    private static final Logger log = LogManager.getLogger(BundleHost.class);

    private final Path bundle;
    private final BlueprintSettings settings;
    private final Consumer<ReactApplicationRoot> configure;
    private final ScheduledExecutorService app;
    private final ReactApplicationRoot root;
    private final BundleWatcher watcher;
    private final ScheduledFuture<?> ticker;

    private volatile boolean closed;

    /**
     * @param configure runs on the application thread after the root is built and after every reload,
     *                  before the bundle is evaluated; the place to register native methods and view types
     */
    public BundleHost(Path bundle, BlueprintSettings settings, boolean watch, Consumer<ReactApplicationRoot> configure) {
        this.bundle = Objects.requireNonNull(bundle, "bundle").toAbsolutePath().normalize();
        this.settings = Objects.requireNonNull(settings, "settings");
        this.configure = configure;
        this.app = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "blueprint-app");
            t.setDaemon(true);
            return t;
        });

        ReactApplicationRoot built = null;
        BundleWatcher w = null;
        try {
            built = await(app.submit(() -> {
                ReactApplicationRoot r = new ReactApplicationRoot(settings);
                try {
                    configureAndEval(r);
                } catch (RuntimeException e) {
                    r.close();
                    throw e;
                }
                return r;
            }), "start");
            this.root = built;

            w = watch ? new BundleWatcher(this.bundle.getParent(), settings.watchExtensions()) : null;
            this.watcher = w;

            long period = settings.tickMillis();
            this.ticker = app.scheduleAtFixedRate(this::frame, period, period, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            abortStart(built, w, e);
            throw e;
        }
        log.info("[host] running {} (watch={})", this.bundle, watch);
    }

    private void abortStart(ReactApplicationRoot built, BundleWatcher w, RuntimeException cause) {
        log.error("[host] failed to start {}", bundle, cause);
        if (w != null) w.close();
        try {
            if (built != null) await(app.submit(built::close), "abort");
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        } finally {
            app.shutdownNow();
        }
    }

    private void frame() {
        if (closed) return;
        try {
            if (watcher != null && !watcher.pollChanged().isEmpty()) {
                log.info("[host] bundle changed, reloading");
                reloadAndEval();
            }
            root.update(settings.tickSeconds());
        } catch (RuntimeException e) {
            // an exception would cancel the periodic task
            log.error("[host] frame failed", e);
        }
    }

    private boolean evalBundle(ReactApplicationRoot r) {
        final String code;
        try {
            code = Files.readString(bundle, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("[host] cannot read bundle {}", bundle, e);
            return false;
        }
        return r.evalScript(bundle.getFileName().toString(), code);
    }

    private boolean configureAndEval(ReactApplicationRoot r) {
        if (configure != null) configure.accept(r);
        return evalBundle(r);
    }

    private boolean reloadAndEval() {
        root.reload();
        return configureAndEval(root);
    }

    /** Reloads and re-evaluates the bundle on the application thread. */
    public Future<Boolean> reloadNow() {
        return app.submit(this::reloadAndEval);
    }

    public void post(Runnable job) {
        root.post(job);
    }

    public <T> CompletableFuture<T> call(Supplier<T> supplier) {
        return root.call(supplier);
    }

    public ReactApplicationRoot root() {
        return root;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;

        ticker.cancel(false);
        try {
            await(app.submit(root::close), "close");
        } finally {
            if (watcher != null) watcher.close();
            app.shutdown();
        }
        log.info("[host] stopped");
    }

    private static <T> T await(Future<T> f, String what) {
        try {
            return f.get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted during " + what, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("host " + what + " failed", e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("host " + what + " timed out", e);
        }
    }

    /** {@code BundleHost <bundle.js> [--watch]}: runs until the JVM is stopped. */
    public static void main(String[] args) throws InterruptedException {
        if (args.length < 1) {
            System.err.println("usage: BundleHost <bundle.js> [--watch]");
            System.exit(2);
        }
        boolean watch = args.length > 1 && "--watch".equals(args[1]);

        CountDownLatch stop = new CountDownLatch(1);
        BundleHost host = new BundleHost(Path.of(args[0]), BlueprintSettings.fromSystemProperties(), watch, null);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            host.close();
            stop.countDown();
        }, "blueprint-shutdown"));
        stop.await();
    }
}
