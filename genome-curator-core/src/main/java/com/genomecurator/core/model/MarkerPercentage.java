package com.genomecurator.core.model;

/**
 * Marker-gene percentages for one genome from the domain report.
 *
 * @param predictedDomain domain predicted from marker genes, e.g. {@code d__Bacteria}
 * @param bacterialPercentage percentage of bacterial marker genes identified
 * @param archaealPercentage percentage of archaeal marker genes identified
 */
public record MarkerPercentage(
    String predictedDomain,
    double bacterialPercentage,
    double archaealPercentage
) {
    public static final String BACTERIA = "d__Bacteria";

    /**
     * Marker percentage for the domain predicted in the report.
     *
     * @return applicable marker percentage
     */
    public double percentage() {
        return percentageFor(predictedDomain);
    }

    /**
     * Marker percentage for the given domain call. Bacteria selects the bacterial
     * column; any other domain selects the archaeal column.
     *
     * @param domain domain call, e.g. taken from the genome's metadata
     * @return applicable marker percentage
     */
    public double percentageFor(String domain) {
        return BACTERIA.equals(domain) ? bacterialPercentage : archaealPercentage;
    }
}
