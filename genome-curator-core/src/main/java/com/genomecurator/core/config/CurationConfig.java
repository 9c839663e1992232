package com.genomecurator.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.genomecurator.core.quality.QcThresholds;

/**
 * Root configuration for a curation run.
 *
 * <p>Loaded from {@code curation.yaml}. Every section is optional; missing sections and
 * values fall back to {@link #defaults()}. Keys outside the layout below are an error.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * qc:
 *   minCompleteness: 50
 *   maxContamination: 10
 *   minQuality: 50
 *   strainHeterogeneityException: 80
 *   minMarkerPercentage: 40
 *   maxContigs: 1000
 *   minN50: 5000
 *   maxAmbiguousBases: 100000
 *
 * ingestion:
 *   keepOriginPrefix: true
 *
 * output:
 *   directory: "./curation"
 *   threads: 4
 * }</pre>
 *
 * @param qc quality-control thresholds
 * @param ingestion how input tables are read
 * @param output output settings
 */
public record CurationConfig(
    @JsonProperty("qc") QcThresholds qc,
    @JsonProperty("ingestion") IngestionConfig ingestion,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Compact constructor filling missing sections with defaults.
     */
    public CurationConfig {
        qc = qc != null ? qc : QcThresholds.defaults();
        ingestion = ingestion != null ? ingestion : IngestionConfig.defaults();
        output = output != null ? output : OutputConfig.defaults();
    }

    /**
     * Configuration with every value at its default.
     *
     * @return default configuration
     */
    public static CurationConfig defaults() {
        return new CurationConfig(null, null, null);
    }

    /**
     * Ingestion settings.
     *
     * @param keepOriginPrefix whether genome ids keep their origin prefix when read
     */
        public record IngestionConfig(
        @JsonProperty("keepOriginPrefix") Boolean keepOriginPrefix
    ) {
        public IngestionConfig {
            keepOriginPrefix = keepOriginPrefix != null ? keepOriginPrefix : Boolean.TRUE;
        }

        public static IngestionConfig defaults() {
            return new IngestionConfig(null);
        }
    }

    /**
     * Output settings.
     *
     * @param directory directory receiving reports
     * @param threads worker threads for batch stages
     */
        public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("threads") Integer threads
    ) {
        public OutputConfig {
            directory = directory != null ? directory : "./curation";
            threads = threads != null && threads > 0 ? threads : 1;
        }

        public static OutputConfig defaults() {
            return new OutputConfig(null, null);
        }
    }
}
