package org.foxesworld.blueprint.core;

/**
 * Identifier of a view/shadow pair.
 *
 * <p>Packs an arena slot and the slot generation into one non-negative {@code long}, small enough
 * to travel through a JS number unchanged. Slot 0 is reserved for the root.</p>
 */
public record ViewId(int slot, int generation) {

    /** Generations are kept below 2^21 so that {@link #value()} stays a safe JS integer. */
    public static final int MAX_GENERATION = (1 << 21) - 1;

    public static final ViewId ROOT = new ViewId(0, 0);

    public ViewId {
        if (slot < 0) throw new IllegalArgumentException("slot must be >= 0, got " + slot);
        if (generation < 0 || generation > MAX_GENERATION) {
            throw new IllegalArgumentException("generation out of range: " + generation);
        }
    }

    public long value() {
        return ((long) generation << 32) | (slot & 0xFFFF_FFFFL);
    }

    public boolean isRoot() {
        return slot == 0 && generation == 0;
    }

    public static ViewId of(long value) {
        if (value < 0) throw new IllegalArgumentException("view id must be >= 0, got " + value);
        long gen = value >>> 32;
        long slot = value & 0xFFFF_FFFFL;
        if (gen > MAX_GENERATION || slot > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("not a view id: " + value);
        }
        return new ViewId((int) slot, (int) gen);
    }

    @Override
    public String toString() {
        return generation == 0 ? "#" + slot : "#" + slot + "g" + generation;
    }
}
