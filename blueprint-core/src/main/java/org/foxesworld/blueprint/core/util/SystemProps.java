package org.foxesworld.blueprint.core.util;

import java.util.HashSet;
import java.util.Set;

/** Typed readers over {@link System#getProperty(String)} with defaults. */
public final class SystemProps {

    private SystemProps() {}

    public static Set<String> readCsvProperty(String key, Set<String> defaults) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return defaults;

        HashSet<String> out = new HashSet<>();
        for (String s : raw.split(",")) {
            String v = s.trim();
            if (!v.isEmpty()) out.add(v);
        }
        return out.isEmpty() ? defaults : Set.copyOf(out);
    }

    public static int intProperty(String key, int def) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    public static long longProperty(String key, long def) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    public static boolean boolProperty(String key, boolean def) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        String s = raw.trim();
        if (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("yes") || s.equals("1")) return true;
        if (s.equalsIgnoreCase("false") || s.equalsIgnoreCase("no") || s.equals("0")) return false;
        return def;
    }
}
