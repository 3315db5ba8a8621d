package org.foxesworld.blueprint.core;

public final class BlueprintPlatform {

    public static final String NAME = "Blueprint";

    public static String java() {
        return System.getProperty("java.version") + " (" + System.getProperty("java.vendor", "?") + ")";
    }

    public static String os() {
        return System.getProperty("os.name") + " " + System.getProperty("os.version");
    }

    public static String threadName() {
        return Thread.currentThread().getName();
    }

    private BlueprintPlatform() {}
}
