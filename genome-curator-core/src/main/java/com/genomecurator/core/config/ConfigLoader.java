package com.genomecurator.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.genomecurator.core.exception.CurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code curation.yaml} into a {@link CurationConfig}.
 *
 * <p>Only an absent file means "use the defaults". A file that is present must be
 * readable and bind completely: a value of the wrong type or a key Jackson does not
 * recognise fails the load instead of quietly leaving a threshold at its default.
 *
 * <pre>{@code
 * CurationConfig config = ConfigLoader.load(Paths.get("curation.yaml"));
 * QcBatch batch = new QcBatch(config.qc());
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads curation settings.
     *
     * @param configPath path to {@code curation.yaml}
     * @return settings from the file, or {@link CurationConfig#defaults()} when there is no file
     * @throws CurationException if the file exists but cannot be read or bound
     */
    public static CurationConfig load(Path configPath) {
        if (Files.notExists(configPath)) {
            log.warn("No curation settings at {}; QC runs with default thresholds", configPath);
            return CurationConfig.defaults();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new CurationException("Curation settings " + configPath + " are not a readable file");
        }

        CurationConfig config;
        try {
            String yaml = Files.readString(configPath);
            if (yaml.isBlank()) {
                log.warn("Curation settings {} are empty; QC runs with default thresholds", configPath);
                return CurationConfig.defaults();
            }
            config = YAML_MAPPER.readValue(yaml, CurationConfig.class);
        } catch (IOException e) {
            throw new CurationException("Invalid curation settings in " + configPath + ": " + e.getMessage(), e);
        }

        if (config == null) {
            return CurationConfig.defaults();
        }
        log.info("Curation settings read from {}: {}", configPath, config.qc());
        return config;
    }
}
