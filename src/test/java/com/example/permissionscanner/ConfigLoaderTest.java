package com.example.permissionscanner;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    private final ConfigLoader loader = new ConfigLoader();

    @Test
    void appliesDefaults() throws Exception {
        ScannerConfig config = loader.parse("{\"targets\": [\"https://contoso.sharepoint.com/sites/hr\"]}");

        assertEquals(5000, config.pageSize());
        assertEquals(5, config.maxGroupNestingLevel());
        assertEquals(1000, config.batchSize());
        assertEquals(5, config.retryAttempts());
        assertEquals(1000L, config.retryBaseDelayMillis());
        assertEquals(60000L, config.retryMaxDelayMillis());
        assertEquals(List.of(100, 101, 119), config.includedTemplates());
        assertFalse(config.includeSubsites());
        assertTrue(config.isIgnoredPermissionLevel("Limited Access"));
        assertTrue(config.isIgnoredAccount("i:0i.t|ms.sp.ext|app@sharepoint"));
        assertTrue(config.doNotResolveGroups().contains("Everyone except external users"));
        assertFalse(config.isIgnoredAccount("c:0(.s|true"));
        assertTrue(config.doNotResolveGroups().contains("c:0(.s|true"));
        assertTrue(config.directoryCacheDirectory().isEmpty());
        assertFalse(config.deleteDirectoryCache());
        assertEquals(Path.of("output", "checkpoint.json"), config.resolvedCheckpointFile());
    }

    @Test
    void explicitListsReplaceOrExtendDefaults() throws Exception {
        ScannerConfig config = loader.parse("{\"targets\": [\"https://contoso.sharepoint.com\"],"
                + " \"ignorePermissionLevels\": [],"
                + " \"ignoreContainers\": [\"Archive\"],"
                + " \"doNotResolveGroups\": [\"All Staff\"]}");

        assertFalse(config.isIgnoredPermissionLevel("Limited Access"));
        assertTrue(config.ignoreContainers().contains("Archive"));
        assertTrue(config.ignoreContainers().contains("Style Library"));
        assertEquals(List.of("All Staff"), config.doNotResolveGroups());
    }

    @Test
    void readsTargetsFileRelativeToConfig() throws Exception {
        Path dir = Files.createTempDirectory("config-test");
        Files.writeString(dir.resolve("targets.txt"), "# sites to scan\nhttps://contoso.sharepoint.com/sites/a\n\n  https://contoso.sharepoint.com/sites/b  \n");
        Path configFile = dir.resolve("scanner.json");
        Files.writeString(configFile, "{\"targets\": [\"https://contoso.sharepoint.com/sites/first\"], \"targetsFile\": \"targets.txt\", \"outputDirectory\": \"out\","
                + " \"directoryCacheDirectory\": \"group-cache\", \"deleteDirectoryCache\": true}");

        ScannerConfig config = loader.load(configFile);

        assertEquals(List.of(
                "https://contoso.sharepoint.com/sites/first",
                "https://contoso.sharepoint.com/sites/a",
                "https://contoso.sharepoint.com/sites/b"), config.targets());
        assertEquals(dir.resolve("out"), config.outputDirectory());
        assertEquals(Optional.of(dir.resolve("group-cache")), config.directoryCacheDirectory());
        assertTrue(config.deleteDirectoryCache());
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> loader.parse("{\"targets\": []}"));
        assertThrows(IllegalArgumentException.class,
                () -> loader.parse("{\"targets\": [\"https://x\"], \"maxGroupNestingLevel\": 21}"));
        assertThrows(IllegalArgumentException.class,
                () -> loader.parse("{\"targets\": [\"https://x\"], \"maxGroupNestingLevel\": -1}"));
        assertThrows(IllegalArgumentException.class,
                () -> loader.parse("{\"targets\": [\"https://x\"], \"pageSize\": 5001}"));
        assertThrows(IllegalArgumentException.class,
                () -> loader.parse("{\"targets\": [\"https://x\"], \"s3SyncEnabled\": true}"));
    }
}
