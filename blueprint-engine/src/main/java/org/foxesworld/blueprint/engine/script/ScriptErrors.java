package org.foxesworld.blueprint.engine.script;

import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Value;

/** Text form of errors raised while running script. */
public final class ScriptErrors {

    private ScriptErrors() {}

    /**
     * Error objects give their {@code stack}; any other thrown value gives its string form.
     * Host exceptions that crossed the script give their own class and message.
     */
    public static String describe(Throwable t) {
        if (t instanceof PolyglotException pe) return describe(pe);
        return t.getClass().getSimpleName() + ": " + t.getMessage();
    }

    public static String describe(PolyglotException e) {
        if (e.isHostException()) {
            Throwable host = e.asHostException();
            return host.getClass().getSimpleName() + ": " + host.getMessage();
        }

        Value guest = e.getGuestObject();
        if (guest != null && !guest.isNull()) {
            if (guest.hasMembers()) {
                Value stack = guest.getMember("stack");
                if (stack != null && stack.isString()) return stack.asString();
            }
            if (guest.isString()) return guest.asString();
            return guest.toString();
        }

        String msg = e.getMessage();
        return msg != null ? msg : e.getClass().getSimpleName();
    }
}
