package org.replaysafe.datapipeline.utils;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class PathExpansionTest {

    @AfterEach
    void cleanup() {
        System.clearProperty("replaysafe.test.dir");
        System.clearProperty("replaysafe.test.name");
    }

    @Test
    void expandPath_withoutPlaceholders_isUnchanged() {
        assertEquals("jdbc:h2:mem:merge", PathExpansion.expandPath("jdbc:h2:mem:merge"));
        assertNull(PathExpansion.expandPath(null));
    }

    @Test
    void expandPath_replacesEveryPlaceholder() {
        System.setProperty("replaysafe.test.dir", "/var/data");
        System.setProperty("replaysafe.test.name", "merge");

        assertEquals("jdbc:h2:/var/data/merge;AUTO_SERVER=TRUE",
            PathExpansion.expandPath("jdbc:h2:${replaysafe.test.dir}/${replaysafe.test.name};AUTO_SERVER=TRUE"));
    }

    @Test
    void expandPath_systemPropertyWinsOverEnvironment() {
        String anyEnvVar = System.getenv().keySet().stream().findFirst().orElse(null);
        if (anyEnvVar == null) {
            return;
        }
        System.setProperty(anyEnvVar, "from-property");
        try {
            assertEquals("from-property/x", PathExpansion.expandPath("${" + anyEnvVar + "}/x"));
        } finally {
            System.clearProperty(anyEnvVar);
        }
    }

    @Test
    void expandPath_rejectsUndefinedOrUnclosedPlaceholders() {
        IllegalArgumentException undefined = assertThrows(IllegalArgumentException.class,
            () -> PathExpansion.expandPath("${replaysafe.test.undefined.variable}/db"));
        assertTrue(undefined.getMessage().contains("replaysafe.test.undefined.variable"));

        assertThrows(IllegalArgumentException.class, () -> PathExpansion.expandPath("${replaysafe.test.dir/db"));
    }
}
