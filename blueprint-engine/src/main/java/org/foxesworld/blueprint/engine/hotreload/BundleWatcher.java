package org.foxesworld.blueprint.engine.hotreload;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;
import static org.foxesworld.blueprint.core.util.SystemProps.readCsvProperty;

/**
 * Recursive watch over a bundle directory. {@link #pollChanged()} is non-blocking and meant to be
 * called from the host's update loop.
 */
public final class BundleWatcher implements Closeable {

    private static final Logger log = LogManager.getLogger(BundleWatcher.class);

    // directory names never descended into
    private static final Set<String> IGNORED_DIRS =
            readCsvProperty("blueprint.watch.ignore.dirs", Set.of("node_modules", ".git"));

    private final Path root;
    private final Set<String> exts;
    private final WatchService watchService;

    private final Set<Path> registered = ConcurrentHashMap.newKeySet();

    public BundleWatcher(Path rootDirectory, Set<String> extensions) {
        this.root = rootDirectory.toAbsolutePath().normalize();
        this.exts = lower(extensions);
        try {
            this.watchService = FileSystems.getDefault().newWatchService();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to watch " + root, e);
        }
        try {
            registerAll(root);
        } catch (IOException e) {
            UncheckedIOException failure = new UncheckedIOException("Failed to watch " + root, e);
            try {
                watchService.close();
            } catch (IOException closeFailure) {
                failure.addSuppressed(closeFailure);
            }
            throw failure;
        }
        log.info("[host] watching {} for {}", root, exts);
    }

    public Path root() {
        return root;
    }

    private void registerAll(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (isIgnoredDir(dir)) return FileVisitResult.SKIP_SUBTREE;
                Path norm = dir.toAbsolutePath().normalize();
                if (registered.add(norm)) norm.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private boolean isIgnoredDir(Path absDir) {
        Path abs = absDir.toAbsolutePath().normalize();
        if (!abs.startsWith(root)) return true;
        for (Path seg : root.relativize(abs)) {
            if (IGNORED_DIRS.contains(seg.toString())) return true;
        }
        return false;
    }

    private boolean isInteresting(Path abs) {
        String name = abs.getFileName() == null ? "" : abs.getFileName().toString().toLowerCase(Locale.ROOT);
        if (exts.isEmpty()) return true;
        for (String e : exts) {
            if (name.endsWith(e)) return true;
        }
        return false;
    }

    /** Changed files (relative to the root, '/'-separated) since the previous call. */
    public Set<String> pollChanged() {
        Set<String> changed = new HashSet<>();

        WatchKey key;
        while ((key = watchService.poll()) != null) {
            Path dir = (Path) key.watchable();

            for (WatchEvent<?> ev : key.pollEvents()) {
                if (ev.kind() == OVERFLOW) continue;

                Path abs = dir.resolve((Path) ev.context()).normalize();

                if (ev.kind() == ENTRY_CREATE && Files.isDirectory(abs) && !isIgnoredDir(abs)) {
                    try {
                        registerAll(abs);
                    } catch (IOException e) {
                        log.debug("[host] cannot watch new dir {}", abs, e);
                    }
                    continue;
                }

                if (isIgnoredDir(abs.getParent()) || !isInteresting(abs)) continue;

                changed.add(root.relativize(abs).toString().replace('\\', '/'));
                log.debug("[host] change: {} {}", ev.kind().name(), abs);
            }

            if (!key.reset()) registered.remove(dir);
        }

        return changed.isEmpty() ? Set.of() : Collections.unmodifiableSet(changed);
    }

    @Override
    public void close() {
        try {
            watchService.close();
        } catch (IOException e) {
            log.debug("[host] watch service close failed", e);
        }
        registered.clear();
    }

    private static Set<String> lower(Set<String> exts) {
        if (exts == null) return Set.of();
        Set<String> out = new HashSet<>();
        for (String e : exts) out.add(e.toLowerCase(Locale.ROOT));
        return Set.copyOf(out);
    }
}
