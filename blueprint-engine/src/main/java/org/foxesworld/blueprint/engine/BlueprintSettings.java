package org.foxesworld.blueprint.engine;

import org.foxesworld.blueprint.core.util.SystemProps;

import java.util.Set;

/**
 * Runtime knobs, read once from system properties.
 *
 * @param tickMillis        period of {@code __schedulerInterrupt__} calls ({@code blueprint.tick.ms})
 * @param debug             per-mutation debug traces ({@code blueprint.debug})
 * @param maxJobsPerUpdate  cap on posted jobs drained per update ({@code blueprint.jobs.max})
 * @param jobBudgetNanos    time budget for draining posted jobs ({@code blueprint.jobs.budget.ns})
 * @param sourceCacheSize   evaluated-source cache size ({@code blueprint.sources.max})
 * @param watchExtensions   file extensions the bundle watcher reacts to ({@code blueprint.watch.exts})
 */
public record BlueprintSettings(long tickMillis,
                                boolean debug,
                                int maxJobsPerUpdate,
                                long jobBudgetNanos,
                                int sourceCacheSize,
                                Set<String> watchExtensions) {

    public static final long DEFAULT_TICK_MS = 4L;

    public BlueprintSettings {
        if (tickMillis <= 0) throw new IllegalArgumentException("tickMillis must be > 0");
        if (maxJobsPerUpdate < 0) throw new IllegalArgumentException("maxJobsPerUpdate must be >= 0");
        watchExtensions = watchExtensions == null ? Set.of() : Set.copyOf(watchExtensions);
    }

    public static BlueprintSettings defaults() {
        return new BlueprintSettings(DEFAULT_TICK_MS, false, 4096, 2_000_000L, 64, Set.of(".js"));
    }

    public static BlueprintSettings fromSystemProperties() {
        BlueprintSettings d = defaults();
        return new BlueprintSettings(
                Math.max(1L, SystemProps.longProperty("blueprint.tick.ms", d.tickMillis())),
                SystemProps.boolProperty("blueprint.debug", d.debug()),
                Math.max(0, SystemProps.intProperty("blueprint.jobs.max", d.maxJobsPerUpdate())),
                SystemProps.longProperty("blueprint.jobs.budget.ns", d.jobBudgetNanos()),
                SystemProps.intProperty("blueprint.sources.max", d.sourceCacheSize()),
                SystemProps.readCsvProperty("blueprint.watch.exts", d.watchExtensions()));
    }

    public BlueprintSettings withDebug(boolean debug) {
        return new BlueprintSettings(tickMillis, debug, maxJobsPerUpdate, jobBudgetNanos, sourceCacheSize, watchExtensions);
    }

    public float tickSeconds() {
        return tickMillis / 1000f;
    }
}
