package org.syntaxforge.cst.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.syntaxforge.cst.junit.extensions.logging.AllowLog;
import org.syntaxforge.cst.junit.extensions.logging.ExpectLog;
import org.syntaxforge.cst.junit.extensions.logging.LogLevel;
import org.syntaxforge.cst.junit.extensions.logging.LogWatchExtension;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. System Properties (highest priority)
 * 2. Configuration File
 * 3. Default reference configuration (lowest priority)
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private static final String TEST_CONFIG = "org/syntaxforge/cst/config/test-cst.conf";

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("cst.mutation.verify-invariants");
        System.clearProperty("cst.properties.binding-update");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Defaults come from reference.conf when no override file exists")
    void load_withoutOverrideFile_usesReferenceDefaults() {
        Config config = ConfigLoader.load();

        TreeOptions options = TreeOptions.fromConfig(config);
        assertEquals(BindingUpdate.ALL, options.bindingUpdate());
        assertFalse(options.verifyInvariants());
    }

    @Test
    @DisplayName("Classpath override file wins over reference.conf")
    void load_overrideFile_overridesDefaults() {
        Config config = ConfigLoader.load(TEST_CONFIG);

        TreeOptions options = TreeOptions.fromConfig(config);
        assertEquals(BindingUpdate.FIRST, options.bindingUpdate());
        assertTrue(options.verifyInvariants());
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("cst.properties.binding-update", "ALL");
        System.setProperty("cst.mutation.verify-invariants", "false");
        ConfigFactory.invalidateCaches();

        TreeOptions options = TreeOptions.fromConfig(ConfigLoader.load(TEST_CONFIG));

        assertEquals(BindingUpdate.ALL, options.bindingUpdate());
        assertFalse(options.verifyInvariants());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Configuration file 'non-existent-cst.conf' not found or is empty. Using defaults.")
    @DisplayName("Explicitly requested missing file is reported and defaults are used")
    void load_missingRequestedFile_warnsAndUsesDefaults() {
        Config config = ConfigLoader.load("non-existent-cst.conf");

        assertNotNull(config);
        assertEquals(BindingUpdate.ALL, TreeOptions.fromConfig(config).bindingUpdate());
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Configuration file.*not found or is empty. Using defaults.")
    @DisplayName("Empty override file falls back to defaults")
    void load_emptyFile_usesDefaults() {
        Config config = ConfigLoader.load("org/syntaxforge/cst/config/empty.conf");

        assertFalse(TreeOptions.fromConfig(config).verifyInvariants());
    }
}
