package org.foxesworld.blueprint.engine;

/**
 * Fixed-period timer driven by frame deltas. Fires at most once per {@link #advance(float)};
 * whole periods of lag beyond that are dropped, not replayed.
 */
public final class SchedulerTick {

    private final float periodSec;

    private boolean running;
    private float accumulator;
    private long fired;

    public SchedulerTick(long periodMillis) {
        if (periodMillis <= 0) throw new IllegalArgumentException("periodMillis must be > 0");
        this.periodSec = periodMillis / 1000f;
    }

    public void start() {
        if (running) return;
        running = true;
        accumulator = 0f;
    }

    public void stop() {
        running = false;
        accumulator = 0f;
    }

    public boolean isRunning() {
        return running;
    }

    /** @return true if a period elapsed and the caller should fire the interrupt now */
    public boolean advance(float tpf) {
        if (!running) return false;
        if (tpf > 0f && Float.isFinite(tpf)) accumulator += tpf;
        if (accumulator < periodSec) return false;

        accumulator %= periodSec;
        fired++;
        return true;
    }

    public long firedCount() {
        return fired;
    }

    public float periodSeconds() {
        return periodSec;
    }
}
