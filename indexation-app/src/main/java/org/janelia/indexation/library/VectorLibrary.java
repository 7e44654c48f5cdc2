package org.janelia.indexation.library;

import java.io.Reader;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.indexation.json.JsonUtils;

/**
 * Phase-keyed collection of reference vector pair catalogs.
 * Phase indexes follow list order.
 */
public class VectorLibrary
        implements Serializable {

    private final List<VectorLibraryEntry> phases;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private VectorLibrary() {
        this.phases = new ArrayList<>();
    }

    public VectorLibrary(final List<VectorLibraryEntry> phases) {
        this.phases = new ArrayList<>(phases);
    }

    public VectorLibrary(final VectorLibraryEntry... phases) {
        this(Arrays.asList(phases));
    }

    public int getPhaseCount() {
        return phases.size();
    }

    public VectorLibraryEntry getPhase(final int phaseIndex) {
        return phases.get(phaseIndex);
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static VectorLibrary fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final JsonUtils.Helper<VectorLibrary> JSON_HELPER =
            new JsonUtils.Helper<>(JsonUtils.FAST_MAPPER, VectorLibrary.class);
}
