package org.foxesworld.blueprint.core.util;

import java.util.Objects;

/**
 * Explicit thread token: the thread that created the owning object is the only one allowed to
 * touch it afterwards. Instances are passed to collaborators instead of consulting a global
 * "current UI thread".
 */
public final class OwnerThread {

    private final Thread owner;

    private OwnerThread(Thread owner) {
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    public static OwnerThread current() {
        return new OwnerThread(Thread.currentThread());
    }

    public boolean isOwner() {
        return Thread.currentThread() == owner;
    }

    public Thread thread() {
        return owner;
    }

    public void check(String where) {
        Thread t = Thread.currentThread();
        if (t != owner) {
            throw new IllegalStateException(where + " is thread confined. Owner=" + owner.getName()
                    + ", current=" + t.getName());
        }
    }
}
