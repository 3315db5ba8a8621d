package org.foxesworld.blueprint.engine.script;

/** A script-originated failure: where it happened and the error's stack or string form. */
public record ScriptFailure(String where, String description) {}
