package org.foxesworld.blueprint.core.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SystemPropsTest {

    private static final String KEY = "blueprint.test.prop";

    @AfterEach
    void clear() {
        System.clearProperty(KEY);
    }

    @Test
    void testDefaultsWhenUnset() {
        assertEquals(7, SystemProps.intProperty(KEY, 7));
        assertEquals(9L, SystemProps.longProperty(KEY, 9L));
        assertTrue(SystemProps.boolProperty(KEY, true));
        assertEquals(Set.of(".js"), SystemProps.readCsvProperty(KEY, Set.of(".js")));
    }

    @Test
    void testParsesValues() {
        System.setProperty(KEY, " 12 ");
        assertEquals(12, SystemProps.intProperty(KEY, 7));
        assertEquals(12L, SystemProps.longProperty(KEY, 7L));

        System.setProperty(KEY, "yes");
        assertTrue(SystemProps.boolProperty(KEY, false));

        System.setProperty(KEY, ".js, .mjs,,");
        assertEquals(Set.of(".js", ".mjs"), SystemProps.readCsvProperty(KEY, Set.of()));
    }

    @Test
    void testMalformedFallsBackToDefault() {
        System.setProperty(KEY, "four");
        assertEquals(4, SystemProps.intProperty(KEY, 4));
        assertFalse(SystemProps.boolProperty(KEY, false));
    }
}
