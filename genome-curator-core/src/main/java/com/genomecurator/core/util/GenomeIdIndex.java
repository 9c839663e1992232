package com.genomecurator.core.util;

import com.genomecurator.core.exception.InconsistentIdException;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Detects the same genome spelled with different origin prefixes across inputs.
 *
 * <p>Each registered id is recorded under its normalised accession together with the
 * name of the input it came from. Registering the same accession again with a
 * different raw spelling raises {@link InconsistentIdException}.
 *
 * <pre>{@code
 * GenomeIdIndex index = new GenomeIdIndex();
 * index.registerAll(metadata.keySet(), "metadata");
 * index.registerAll(markerPercentages.keySet(), "marker table");
 * }</pre>
 */
public class GenomeIdIndex {

    private final Map<String, Entry> entries = new HashMap<>();

    private record Entry(String rawId, String source) {}

    /**
     * Registers one id.
     *
     * @param rawId id as it appears in the input
     * @param source name of the input, used in error messages
     * @throws InconsistentIdException if the genome was registered with another spelling
     */
    public void register(String rawId, String source) {
        String accession = GenomeIds.strip(rawId);
        Entry existing = entries.putIfAbsent(accession, new Entry(rawId, source));
        if (existing != null && !existing.rawId().equals(rawId)) {
            throw new InconsistentIdException(existing.rawId(), existing.source(), rawId, source);
        }
    }

    /**
     * Registers every id of one input.
     *
     * @param rawIds ids as they appear in the input
     * @param source name of the input
     * @throws InconsistentIdException on the first inconsistent spelling
     */
    public void registerAll(Collection<String> rawIds, String source) {
        for (String rawId : rawIds) {
            register(rawId, source);
        }
    }

    public int size() {
        return entries.size();
    }
}
