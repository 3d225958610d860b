package com.pathwise.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PathwiseConfigTest {

    @Test
    void builder_defaults() {
        PathwiseConfig config = PathwiseConfig.builder().build();

        assertEquals("config", config.getPlanLibraryDir());
        assertEquals("plan_library.json", config.getPlanLibraryFile());
        assertEquals(15, config.getMaxRouteDepth());
        assertEquals(50, config.getEventLogCapacity());
        assertEquals("contingent", config.getDefaultPaceLevel());
    }

    @Test
    void builder_overridesValues() {
        PathwiseConfig config = PathwiseConfig.builder()
                .planLibraryDir("/etc/pathwise")
                .planLibraryFile("plans.json")
                .maxRouteDepth(4)
                .eventLogCapacity(10)
                .defaultPaceLevel("alternate")
                .build();

        assertEquals("/etc/pathwise", config.getPlanLibraryDir());
        assertEquals("plans.json", config.getPlanLibraryFile());
        assertEquals(4, config.getMaxRouteDepth());
        assertEquals(10, config.getEventLogCapacity());
        assertEquals("alternate", config.getDefaultPaceLevel());
    }

    @Test
    void builder_nullStringsFallBackToDefaults() {
        PathwiseConfig config = PathwiseConfig.builder()
                .planLibraryDir(null)
                .planLibraryFile(null)
                .defaultPaceLevel(null)
                .build();

        assertEquals(PathwiseConfig.DEFAULT_PLAN_LIBRARY_DIR, config.getPlanLibraryDir());
        assertEquals(PathwiseConfig.DEFAULT_PLAN_LIBRARY_FILE, config.getPlanLibraryFile());
        assertEquals(PathwiseConfig.DEFAULT_PACE_LEVEL, config.getDefaultPaceLevel());
    }

    @Test
    void parseInt_fallsBackOnMissingInvalidOrNonPositive() {
        assertEquals(15, PathwiseConfig.parseInt(null, 15));
        assertEquals(15, PathwiseConfig.parseInt("  ", 15));
        assertEquals(15, PathwiseConfig.parseInt("deep", 15));
        assertEquals(15, PathwiseConfig.parseInt("0", 15));
        assertEquals(15, PathwiseConfig.parseInt("-3", 15));
        assertEquals(7, PathwiseConfig.parseInt(" 7 ", 15));
    }
}
