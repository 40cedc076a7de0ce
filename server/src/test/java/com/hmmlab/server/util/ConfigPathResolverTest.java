package com.hmmlab.server.util;

import com.hmmlab.server.hmm.TrainingConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigPathResolverTest {

    @AfterEach
    public void teardown() {
        System.clearProperty(ConfigPathResolver.CONFIG_FILE_PROPERTY);
    }

    @Test
    public void testLoadConfigFromClasspath() {
        ConfigPathResolver.ConfigRoot root = ConfigPathResolver.resolveConfig();

        assertNotNull(root.training);
        // In hmm_config.json the budget matches the engine default of 50
        assertEquals(50, root.training.maxIterations);
        assertEquals(1e-10, root.training.epsilon, 0.0);
        assertEquals(42L, root.training.seed);
        assertFalse(root.training.isConvergenceCheckEnabled());
        assertEquals(20, root.defaultSampleLength);
    }

    @Test
    public void testSystemPropertyOverridesClasspath() throws Exception {
        File file = File.createTempFile("hmm_config", ".json");
        file.deleteOnExit();
        Files.write(file.toPath(),
                "{\"training\": {\"maxIterations\": 7, \"convergenceThreshold\": 1e-4, \"parallel\": true}}"
                        .getBytes(StandardCharsets.UTF_8));
        System.setProperty(ConfigPathResolver.CONFIG_FILE_PROPERTY, file.getAbsolutePath());

        ConfigPathResolver.ConfigRoot root = ConfigPathResolver.resolveConfig();

        assertEquals(7, root.training.maxIterations);
        assertTrue(root.training.isConvergenceCheckEnabled());
        assertTrue(root.training.parallel);
        // Fields missing from the file keep their defaults
        assertEquals(1e-10, root.training.epsilon, 0.0);
        assertEquals(20, root.defaultSampleLength);
    }

    @Test
    public void testMissingFileFallsBackToClasspath() {
        System.setProperty(ConfigPathResolver.CONFIG_FILE_PROPERTY, "does/not/exist.json");

        TrainingConfig config = ConfigPathResolver.resolveTrainingConfig();

        assertEquals(50, config.maxIterations);
    }
}
