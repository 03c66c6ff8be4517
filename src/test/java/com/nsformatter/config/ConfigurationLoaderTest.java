package com.nsformatter.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private static int breakWidth(FormatterConfig config) {
        return config.getPluginConfig(FormatterConfig.CLOJURE_PLUGIN,
                ConfigurationLoader.SINGLE_IMPORT_BREAK_WIDTH, -1);
    }

    @Test
    void loadDefaultConfig_readsBundledDefaults() {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();

        assertEquals(60, breakWidth(config));
        List<String> ignoreFiles = config.getGeneralConfig("ignoreFiles", List.of());
        assertEquals(List.of("target/**", ".cpcache/**"), ignoreFiles);
        boolean rewriteNs = config.getPluginConfig(FormatterConfig.CLOJURE_PLUGIN, ConfigurationLoader.REWRITE_NS, false);
        assertTrue(rewriteNs);
        assertSame(config, ConfigurationLoader.loadDefaultConfig());
    }

    @Test
    void loadConfig_readsUserValues() throws IOException {
        Path file = tempDir.resolve("custom.yml");
        Files.writeString(file, String.join("\n",
                "general:",
                "  ignoreFiles: [\"out/**\"]",
                "plugins:",
                "  clojure:",
                "    singleImportBreakWidth: 80",
                "    rewriteNs: false",
                ""));

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertEquals(80, breakWidth(config));
        boolean rewriteNs = config.getPluginConfig(FormatterConfig.CLOJURE_PLUGIN, ConfigurationLoader.REWRITE_NS, true);
        assertFalse(rewriteNs);
        List<String> ignoreFiles = config.getGeneralConfig("ignoreFiles", List.of());
        assertEquals(List.of("out/**"), ignoreFiles);
    }

    @Test
    void loadConfig_resetsOutOfRangeValues() throws IOException {
        Path file = tempDir.resolve("bad.yml");
        Files.writeString(file, "plugins:\n  clojure:\n    singleImportBreakWidth: 5\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertEquals(60, breakWidth(config));
    }

    @Test
    void loadConfig_fallsBackOnMissingOrBrokenFile() throws IOException {
        Path broken = tempDir.resolve("broken.yml");
        Files.writeString(broken, "plugins: [unclosed\n");

        assertSame(ConfigurationLoader.loadDefaultConfig(), ConfigurationLoader.loadConfig(tempDir.resolve("none.yml")));
        assertSame(ConfigurationLoader.loadDefaultConfig(), ConfigurationLoader.loadConfig(broken));
    }

    @Test
    void saveConfig_roundTrips() throws IOException {
        Path file = tempDir.resolve("nested/dir/.nsformatter.yml");

        ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig(), file);
        FormatterConfig reloaded = ConfigurationLoader.loadConfig(file);

        assertTrue(Files.exists(file));
        assertEquals(60, breakWidth(reloaded));
        List<String> ignoreFiles = reloaded.getGeneralConfig("ignoreFiles", List.of());
        assertEquals(List.of("target/**", ".cpcache/**"), ignoreFiles);
    }

    @Test
    void getPluginConfig_coercesStrings() {
        Map<String, Object> clojure = new HashMap<>();
        clojure.put(ConfigurationLoader.SINGLE_IMPORT_BREAK_WIDTH, " 72 ");
        Map<String, Map<String, Object>> plugins = new HashMap<>();
        plugins.put(FormatterConfig.CLOJURE_PLUGIN, clojure);
        FormatterConfig config = new FormatterConfig(new HashMap<>(), plugins);

        assertEquals(72, breakWidth(config));
    }
}
