package com.genomecurator.core.report;

import com.genomecurator.core.exception.MalformedReportException;
import com.genomecurator.core.exception.MissingFieldException;
import com.genomecurator.core.model.GtdbTaxonomy;
import com.genomecurator.core.model.MetadataRecord;
import com.genomecurator.core.util.GenomeIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the GTDB genome metadata table into {@link MetadataRecord}s.
 *
 * <p>The first column holds the genome id. Files ending in {@code .tsv} are read as
 * tab-separated, anything else as comma-separated. Columns needed for scoring and
 * quality control must be present in the header; GTDB designation and
 * representative columns are optional. Blank cells and {@code none} are read as
 * absent values, so a blank required value raises {@link MissingFieldException}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Map<String, MetadataRecord> metadata = MetadataTableReader.read(Path.of("gtdb_metadata.csv"), true);
 * Map<String, Double> scores = QualityScorer.qualityScores(metadata.keySet(), metadata);
 * }</pre>
 */
public final class MetadataTableReader {

    private static final Logger log = LoggerFactory.getLogger(MetadataTableReader.class);

    private static final Set<String> ABSENT_VALUES = Set.of("", "none", "null", "na", "n/a");
    private static final Set<String> TRUE_VALUES = Set.of("t", "true", "yes", "1");
    private static final Set<String> FALSE_VALUES = Set.of("f", "false", "no", "0");

    /** Columns that must be present in the header. */
    static final List<String> REQUIRED_COLUMNS = List.of(
        "gtdb_taxonomy",
        "checkm_completeness",
        "checkm_contamination",
        "checkm_strain_heterogeneity_100",
        "genome_size",
        "contig_count",
        "n50_contigs",
        "scaffold_count",
        "ambiguous_bases",
        "total_gap_length",
        "ssu_count",
        "ssu_length",
        "ncbi_assembly_level",
        "ncbi_genome_representation",
        "ncbi_refseq_category",
        "ncbi_type_material_designation",
        "ncbi_molecule_count",
        "ncbi_unspanned_gaps",
        "ncbi_spanned_gaps",
        "ncbi_genome_category"
    );

    private MetadataTableReader() {
        // Utility class
    }

    /**
     * Reads the metadata table.
     *
     * @param metadataFile metadata table
     * @param keepOriginPrefix whether genome ids keep their {@code RS_}/{@code GB_}/{@code U_} prefix
     * @return records keyed by genome id, in file order
     * @throws IOException if the file cannot be read
     * @throws MalformedReportException if a required column is missing or a value cannot be parsed
     * @throws MissingFieldException if a required value is blank
     */
    public static Map<String, MetadataRecord> read(Path metadataFile, boolean keepOriginPrefix) throws IOException {
        char separator = metadataFile.getFileName().toString().endsWith(".tsv") ? '\t' : ',';
        DelimitedTable table = DelimitedTable.read(metadataFile, separator);
        REQUIRED_COLUMNS.forEach(table::columnIndex);

        Map<String, MetadataRecord> metadata = new LinkedHashMap<>();
        for (List<String> row : table.rows()) {
            String genomeId = GenomeIds.canonical(DelimitedTable.cell(row, 0), keepOriginPrefix);
            metadata.put(genomeId, new RowParser(table, row, genomeId).toRecord(keepOriginPrefix));
        }

        log.info("Read metadata for {} genomes from {}", metadata.size(), metadataFile);
        return metadata;
    }

    /**
     * Parses the cells of one row.
     */
    private static final class RowParser {
        private final DelimitedTable table;
        private final List<String> row;
        private final String genomeId;

        RowParser(DelimitedTable table, List<String> row, String genomeId) {
            this.table = table;
            this.row = row;
            this.genomeId = genomeId;
        }

        MetadataRecord toRecord(boolean keepOriginPrefix) {
            String taxonomy = text("gtdb_taxonomy");
            return MetadataRecord.builder(genomeId)
                .gtdbTaxonomy(taxonomy == null ? null : parseTaxonomy(taxonomy))
                .checkmCompleteness(decimal("checkm_completeness"))
                .checkmContamination(decimal("checkm_contamination"))
                .checkmStrainHeterogeneity100(decimal("checkm_strain_heterogeneity_100"))
                .genomeSize(integer("genome_size"))
                .contigCount(intValue("contig_count"))
                .n50Contigs(integer("n50_contigs"))
                .scaffoldCount(intValue("scaffold_count"))
                .ambiguousBases(integer("ambiguous_bases"))
                .totalGapLength(integer("total_gap_length"))
                .ssuCount(intValue("ssu_count"))
                .ssuLength(intValue("ssu_length"))
                .ncbiAssemblyLevel(text("ncbi_assembly_level"))
                .ncbiGenomeRepresentation(text("ncbi_genome_representation"))
                .ncbiRefseqCategory(text("ncbi_refseq_category"))
                .ncbiTypeMaterialDesignation(text("ncbi_type_material_designation"))
                .ncbiMoleculeCount(intValue("ncbi_molecule_count"))
                .ncbiUnspannedGaps(intValue("ncbi_unspanned_gaps"))
                .ncbiSpannedGaps(intValue("ncbi_spanned_gaps"))
                .ncbiGenomeCategory(text("ncbi_genome_category"))
                .gtdbTypeDesignation(text("gtdb_type_designation"))
                .mimagHighQuality(bool("mimag_high_quality"))
                .gtdbRepresentative(Boolean.TRUE.equals(bool("gtdb_representative")))
                .gtdbClusteredGenomes(genomeList("gtdb_clustered_genomes", keepOriginPrefix))
                .build();
        }

        private String text(String column) {
            String value = DelimitedTable.cell(row, table.optionalColumnIndex(column));
            return ABSENT_VALUES.contains(value.toLowerCase(Locale.ROOT)) ? null : value;
        }

        private Double decimal(String column) {
            String value = text(column);
            if (value == null) {
                return null;
            }
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw invalid(column, value, e);
            }
        }

        private Long integer(String column) {
            Double value = decimal(column);
            if (value == null) {
                return null;
            }
            if (value != Math.rint(value)) {
                throw invalid(column, text(column), null);
            }
            return value.longValue();
        }

        private Integer intValue(String column) {
            Long value = integer(column);
            return value == null ? null : Math.toIntExact(value);
        }

        private Boolean bool(String column) {
            String value = text(column);
            if (value == null) {
                return null;
            }
            String lower = value.toLowerCase(Locale.ROOT);
            if (TRUE_VALUES.contains(lower)) {
                return Boolean.TRUE;
            }
            if (FALSE_VALUES.contains(lower)) {
                return Boolean.FALSE;
            }
            throw invalid(column, value, null);
        }

        private List<String> genomeList(String column, boolean keepOriginPrefix) {
            String value = text(column);
            if (value == null) {
                return List.of();
            }
            return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .map(id -> GenomeIds.canonical(id, keepOriginPrefix))
                .toList();
        }

        private GtdbTaxonomy parseTaxonomy(String taxonomy) {
            try {
                return GtdbTaxonomy.parse(taxonomy);
            } catch (IllegalArgumentException e) {
                throw invalid("gtdb_taxonomy", taxonomy, e);
            }
        }

        private MalformedReportException invalid(String column, String value, Throwable cause) {
            return new MalformedReportException(table.source(),
                "invalid value '" + value + "' in column " + column + " for genome " + genomeId, cause);
        }
    }
}
