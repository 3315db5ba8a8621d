package org.foxesworld.blueprint.engine.script.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.graalvm.polyglot.Source;

import java.time.Duration;
import java.util.Objects;

/**
 * Evaluated bundle sources keyed by (name, content hash).
 *
 * <p>Sources are context independent, so one cache outlives reloads: re-evaluating an unchanged
 * bundle after a reload hands the shared engine the same {@link Source} and skips re-parsing.</p>
 */
public final class ScriptSourceCache {

    private final Cache<SourceKey, Source> sources;

    public ScriptSourceCache(int maxSize) {
        this.sources = Caffeine.newBuilder()
                .maximumSize(Math.max(1, maxSize))
                .expireAfterAccess(Duration.ofMinutes(10))
                .build();
    }

    public Source source(String name, String code) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(code, "code");
        return sources.get(SourceKey.of(name, code), k -> Source.newBuilder("js", code, name).buildLiteral());
    }

    /** Drops every cached version of {@code name}. */
    public void invalidate(String name) {
        if (name == null) return;
        sources.asMap().keySet().removeIf(k -> name.equals(k.name()));
    }

    public void invalidateAll() {
        sources.invalidateAll();
    }

    public long size() {
        sources.cleanUp();
        return sources.estimatedSize();
    }

    /** The hash stands in for the content so keys stay small. */
    record SourceKey(String name, long contentHash) {

        static SourceKey of(String name, String content) {
            return new SourceKey(name, fnv1a64(content));
        }

        @Override
        public String toString() {
            return "SourceKey{" + name + ", hash=" + Long.toHexString(contentHash) + '}';
        }
    }

    static long fnv1a64(String s) {
        long h = 0xcbf29ce484222325L;
        for (int i = 0; i < s.length(); i++) {
            h ^= s.charAt(i);
            h *= 0x100000001b3L;
        }
        return h;
    }
}
