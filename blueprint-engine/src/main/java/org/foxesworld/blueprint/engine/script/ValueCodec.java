package org.foxesworld.blueprint.engine.script;

import org.foxesworld.blueprint.core.Undefined;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts between script values of one context and plain Java values.
 *
 * <p>Native side kinds: {@code null}, {@link Undefined#INSTANCE}, {@link Boolean}, {@link Number}
 * (decoded as {@link Double}), {@link String}, {@link List} and {@link Map} with string keys.
 * Anything else is rejected with {@link IllegalArgumentException}.</p>
 */
public final class ValueCodec {

    static final int MAX_DEPTH = 64;

    private final Context ctx;
    private final Value undefined;
    private final Value isUndefined;
    private final Value newArray;
    private final Value newObject;

    public ValueCodec(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.undefined = ctx.eval("js", "undefined");
        // isNull() is true for both null and undefined
        this.isUndefined = ctx.eval("js", "(v) => v === undefined");
        this.newArray = ctx.eval("js", "() => []");
        this.newObject = ctx.eval("js", "() => ({})");
    }

    public Value undefined() {
        return undefined;
    }

    // -----------------------------
    // Java -> script
    // -----------------------------

    public Value encode(Object v) {
        return encode(v, 0);
    }

    private Value encode(Object v, int depth) {
        if (depth > MAX_DEPTH) throw new IllegalArgumentException("value nested deeper than " + MAX_DEPTH);

        if (v == null) return ctx.asValue(null);
        if (v == Undefined.INSTANCE) return undefined;
        if (v instanceof Value val) return val;
        if (v instanceof Boolean || v instanceof String) return ctx.asValue(v);
        if (v instanceof CharSequence cs) return ctx.asValue(cs.toString());

        if (v instanceof Number n) {
            if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte) {
                return ctx.asValue(n.longValue());
            }
            return ctx.asValue(n.doubleValue());
        }

        if (v instanceof List<?> list) {
            Value arr = newArray.execute();
            for (Object e : list) arr.invokeMember("push", encode(e, depth + 1));
            return arr;
        }
        if (v instanceof Object[] items) {
            Value arr = newArray.execute();
            for (Object e : items) arr.invokeMember("push", encode(e, depth + 1));
            return arr;
        }
        if (v instanceof Map<?, ?> map) {
            Value obj = newObject.execute();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                obj.putMember(String.valueOf(e.getKey()), encode(e.getValue(), depth + 1));
            }
            return obj;
        }

        throw new IllegalArgumentException("Cannot pass " + v.getClass().getName() + " to script");
    }

    /** Encodes each element; convenience for call sites building argument lists. */
    public Object[] encodeAll(Object... values) {
        Object[] out = new Object[values == null ? 0 : values.length];
        for (int i = 0; i < out.length; i++) out[i] = encode(values[i]);
        return out;
    }

    // -----------------------------
    // Script -> Java
    // -----------------------------

    public Object decode(Value v) {
        return decode(v, 0);
    }

    private Object decode(Value v, int depth) {
        if (depth > MAX_DEPTH) throw new IllegalArgumentException("value nested deeper than " + MAX_DEPTH);

        if (v == null) return null;
        if (v.isNull()) return isUndefined.execute(v).asBoolean() ? Undefined.INSTANCE : null;
        if (v.isBoolean()) return v.asBoolean();
        if (v.isNumber()) return number(v);
        if (v.isString()) return v.asString();

        if (v.hasArrayElements()) {
            long size = v.getArraySize();
            List<Object> out = new ArrayList<>((int) Math.min(size, 1024));
            for (long i = 0; i < size; i++) out.add(decode(v.getArrayElement(i), depth + 1));
            return out;
        }

        if (v.canExecute() || v.isHostObject() || v.isProxyObject()) {
            throw new IllegalArgumentException("Cannot pass " + kindOf(v) + " to native code");
        }

        if (v.hasMembers()) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (String key : v.getMemberKeys()) out.put(key, decode(v.getMember(key), depth + 1));
            return out;
        }

        throw new IllegalArgumentException("Cannot pass " + kindOf(v) + " to native code");
    }

    /** Native method argument: string, number or boolean only. */
    public Object decodeArgument(Value v, int index) {
        if (v != null) {
            if (v.isString()) return v.asString();
            if (v.isNumber()) return number(v);
            if (v.isBoolean()) return v.asBoolean();
        }
        throw new IllegalArgumentException("Argument " + index + " must be a string, number or boolean, got "
                + (v == null ? "nothing" : kindOf(v)));
    }

    private static Double number(Value v) {
        if (!v.fitsInDouble()) throw new IllegalArgumentException("Number does not fit a double: " + v);
        return v.asDouble();
    }

    private static String kindOf(Value v) {
        if (v.canExecute()) return "a function";
        if (v.isHostObject()) return "a host object";
        if (v.isNull()) return "null";
        return v.toString();
    }
}
