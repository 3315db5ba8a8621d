package org.foxesworld.blueprint.engine.tree;

import org.foxesworld.blueprint.core.ViewId;

import java.util.Arrays;
import java.util.BitSet;
import java.util.function.BiConsumer;

/**
 * Generational arena keyed by {@link ViewId}. One slot holds a view together with its geometry
 * node. Releasing a slot bumps its generation so old ids turn stale; a slot that runs out of
 * generations is retired, so an id is never handed out twice.
 *
 * <p>Slot 0 belongs to the root and is never allocated here.</p>
 */
public final class ViewTable {

    private int nextSlot = 1;
    private final BitSet alive = new BitSet();

    private int[] generations = new int[256];
    private ViewPair[] pairs = new ViewPair[256];

    // free-list without boxing
    private int[] free = new int[256];
    private int freeSize = 0;

    private int size = 0;

    public ViewId allocate() {
        final int slot;
        if (freeSize > 0) {
            slot = free[--freeSize];
        } else {
            if (nextSlot == Integer.MAX_VALUE) throw new ViewTableException("view table exhausted");
            slot = nextSlot++;
            ensureCapacity(slot);
        }
        alive.set(slot);
        size++;
        return new ViewId(slot, generations[slot]);
    }

    public void bind(ViewId id, ViewPair pair) {
        if (!isCurrent(id)) throw new ViewTableException("cannot bind " + describe(id) + " id " + id);
        if (pairs[id.slot()] != null) throw new ViewTableException("slot already bound: " + id);
        pairs[id.slot()] = pair;
    }

    /** @return false if {@code id} was not live */
    public boolean release(ViewId id) {
        if (!isCurrent(id)) return false;

        final int slot = id.slot();
        alive.clear(slot);
        pairs[slot] = null;
        size--;

        if (generations[slot] == ViewId.MAX_GENERATION) return true; // retired

        generations[slot]++;
        if (freeSize == free.length) free = Arrays.copyOf(free, free.length << 1);
        free[freeSize++] = slot;
        return true;
    }

    /** Bound pair for a live id, or {@code null} when the id is stale, unknown or unbound. */
    public ViewPair get(ViewId id) {
        return isCurrent(id) ? pairs[id.slot()] : null;
    }

    public boolean contains(ViewId id) {
        return get(id) != null;
    }

    public int size() {
        return size;
    }

    /** Visits bound pairs in slot order. */
    public void forEach(BiConsumer<ViewId, ViewPair> action) {
        for (int slot = alive.nextSetBit(1); slot >= 0; slot = alive.nextSetBit(slot + 1)) {
            ViewPair p = pairs[slot];
            if (p != null) action.accept(new ViewId(slot, generations[slot]), p);
        }
    }

    /** Releases every live slot; all outstanding ids become stale. */
    public void clear() {
        for (int slot = alive.nextSetBit(1); slot >= 0; slot = alive.nextSetBit(slot + 1)) {
            release(new ViewId(slot, generations[slot]));
        }
    }

    /** "stale", "unknown" or "live", for diagnostics. */
    public String describe(ViewId id) {
        if (id == null) return "null";
        int slot = id.slot();
        if (slot <= 0 || slot >= nextSlot) return "unknown";
        if (id.generation() > generations[slot]) return "unknown";
        return alive.get(slot) && generations[slot] == id.generation() ? "live" : "stale";
    }

    private boolean isCurrent(ViewId id) {
        if (id == null) return false;
        int slot = id.slot();
        return slot > 0 && slot < nextSlot && alive.get(slot) && generations[slot] == id.generation();
    }

    private void ensureCapacity(int slot) {
        if (slot < generations.length) return;
        int n = Math.max(generations.length << 1, slot + 1);
        generations = Arrays.copyOf(generations, n);
        pairs = Arrays.copyOf(pairs, n);
    }
}
