package com.genomecurator.core.report;

import com.genomecurator.core.model.TypeRadius;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Type radii read back from a type-radius file.
 *
 * @param radii representative id to radius, in file order
 * @param species genome id to species label for representatives and their neighbours
 */
public record TypeRadiusTable(
    Map<String, TypeRadius> radii,
    Map<String, String> species
) {
    public TypeRadiusTable {
        radii = Collections.unmodifiableMap(new LinkedHashMap<>(radii));
        species = Collections.unmodifiableMap(new LinkedHashMap<>(species));
    }
}
