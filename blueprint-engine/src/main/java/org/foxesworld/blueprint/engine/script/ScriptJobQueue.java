package org.foxesworld.blueprint.engine.script;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Hand-off from any thread onto the owner thread of a root.
 *
 * <ul>
 *   <li>{@link #post(Runnable)}: fire-and-forget, callable from any thread</li>
 *   <li>{@link #call(Supplier)}: result delivered through a {@link CompletableFuture}</li>
 *   <li>{@link #drainBudgeted(int, long)}: owner thread only, once per update</li>
 * </ul>
 */
public final class ScriptJobQueue {

    private final Queue<Runnable> q = new ConcurrentLinkedQueue<>();
    private volatile Consumer<Throwable> onError;

    public void post(Runnable job) {
        q.add(Objects.requireNonNull(job, "job"));
    }

    public <T> CompletableFuture<T> call(Supplier<T> supplier) {
        Objects.requireNonNull(supplier, "supplier");
        CompletableFuture<T> f = new CompletableFuture<>();
        post(() -> {
            if (f.isDone()) return; // cancelled by the caller meanwhile
            try {
                f.complete(supplier.get());
            } catch (Throwable t) {
                f.completeExceptionally(t);
            }
        });
        return f;
    }

    /** Receives exceptions thrown by posted jobs. Runs on the owner thread. */
    public ScriptJobQueue setOnError(Consumer<Throwable> onError) {
        this.onError = onError;
        return this;
    }

    /**
     * Runs queued jobs in posting order.
     *
     * @param maxJobs         cap on jobs run by this call
     * @param timeBudgetNanos 0 for no budget; otherwise stop once exceeded (checked every 16 jobs)
     * @return number of jobs run
     */
    public int drainBudgeted(int maxJobs, long timeBudgetNanos) {
        final int limit = Math.max(0, maxJobs);
        final long deadline = timeBudgetNanos > 0L ? System.nanoTime() + timeBudgetNanos : Long.MAX_VALUE;

        int n = 0;
        while (n < limit) {
            Runnable job = q.poll();
            if (job == null) break;

            try {
                job.run();
            } catch (Throwable t) {
                Consumer<Throwable> h = onError;
                if (h != null) h.accept(t);
                else throw t;
            }
            n++;

            if ((n & 0xF) == 0 && System.nanoTime() >= deadline) break;
        }
        return n;
    }

    /** Drops pending jobs. @return how many were dropped */
    public int clear() {
        int dropped = 0;
        while (q.poll() != null) dropped++;
        return dropped;
    }

    public boolean isEmpty() {
        return q.isEmpty();
    }

    public int size() {
        return q.size();
    }
}
