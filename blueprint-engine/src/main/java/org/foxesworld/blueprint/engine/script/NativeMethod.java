package org.foxesworld.blueprint.engine.script;

import java.util.List;

/**
 * Host closure callable from script. Arguments are already decoded: each one is a
 * {@link String}, {@link Double} or {@link Boolean}.
 */
@FunctionalInterface
public interface NativeMethod {

    void invoke(List<Object> args);
}
