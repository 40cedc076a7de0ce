package com.hmmlab.server.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hmmlab.server.hmm.TrainingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.InputStream;

public class ConfigPathResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConfigPathResolver.class);

    public static final String CONFIG_FILE_PROPERTY = "hmm.config.file";
    public static final String CONFIG_RESOURCE = "/hmm_config.json";

    public static class ConfigRoot {
        public TrainingConfig training;
        public Integer defaultSampleLength;
    }

    /**
     * Loads the config root: the file named by the {@code hmm.config.file} system
     * property if set, otherwise the classpath resource, otherwise built-in defaults.
     */
    public static ConfigRoot resolveConfig() {
        ObjectMapper mapper = new ObjectMapper();

        // 1. Check System Property
        String sysProp = System.getProperty(CONFIG_FILE_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            try {
                ConfigRoot root = mapper.readValue(new File(sysProp), ConfigRoot.class);
                logger.info("Loaded HMM config from {}", sysProp);
                return withDefaults(root);
            } catch (Exception e) {
                logger.warn("Failed to read HMM config from {}, trying classpath. Error: {}", sysProp,
                        e.getMessage());
            }
        }

        // 2. Check Config Resource
        try (InputStream is = ConfigPathResolver.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is != null) {
                ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
                logger.debug("Loaded HMM config from classpath {}", CONFIG_RESOURCE);
                return withDefaults(root);
            }
        } catch (Exception e) {
            logger.warn("Failed to read HMM config from classpath, using defaults. Error: {}", e.getMessage());
        }

        // 3. Default
        return withDefaults(new ConfigRoot());
    }

    public static TrainingConfig resolveTrainingConfig() {
        return resolveConfig().training;
    }

    private static ConfigRoot withDefaults(ConfigRoot root) {
        if (root.training == null) {
            root.training = TrainingConfig.defaults();
        }
        if (root.defaultSampleLength == null) {
            root.defaultSampleLength = 20;
        }
        return root;
    }
}
