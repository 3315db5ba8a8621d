package org.foxesworld.blueprint.engine.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Append-only table of native methods; the position is the magic index a script function carries. */
public final class NativeMethodRegistry {

    private final List<NativeMethod> methods = new ArrayList<>();
    private final List<String> names = new ArrayList<>();

    public int add(String name, NativeMethod method) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(method, "method");
        methods.add(method);
        names.add(name);
        return methods.size() - 1;
    }

    public NativeMethod get(int index) {
        if (index < 0 || index >= methods.size()) {
            throw new IllegalStateException("No native method at index " + index + " (registry size " + methods.size() + ")");
        }
        return methods.get(index);
    }

    public List<String> names() {
        return Collections.unmodifiableList(names);
    }

    public int size() {
        return methods.size();
    }

    /** Only done together with tearing down the context that holds the magic functions. */
    void clear() {
        methods.clear();
        names.clear();
    }
}
