package org.foxesworld.blueprint.engine.script;

import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Script function bound to one registry slot. Resolves the closure through the registry it was
 * created with, so no global lookup is involved. Always returns {@code undefined}.
 */
final class MagicFunction implements ProxyExecutable {

    private final NativeMethodRegistry registry;
    private final int index;
    private final ValueCodec codec;

    MagicFunction(NativeMethodRegistry registry, int index, ValueCodec codec) {
        this.registry = registry;
        this.index = index;
        this.codec = codec;
    }

    @Override
    public Object execute(Value... arguments) {
        NativeMethod method = registry.get(index);

        List<Object> args = new ArrayList<>(arguments.length);
        for (int i = 0; i < arguments.length; i++) args.add(codec.decodeArgument(arguments[i], i));

        method.invoke(Collections.unmodifiableList(args));
        return codec.undefined();
    }
}
