package org.janelia.indexation.library;

import java.io.Reader;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.indexation.json.JsonUtils;

/**
 * Phase-keyed collection of simulated diffraction templates.
 * Phase indexes follow list order.
 */
public class TemplateLibrary
        implements Serializable {

    private final List<TemplateLibraryEntry> phases;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private TemplateLibrary() {
        this.phases = new ArrayList<>();
    }

    public TemplateLibrary(final List<TemplateLibraryEntry> phases) {
        this.phases = new ArrayList<>(phases);
    }

    public TemplateLibrary(final TemplateLibraryEntry... phases) {
        this(Arrays.asList(phases));
    }

    public int getPhaseCount() {
        return phases.size();
    }

    public TemplateLibraryEntry getPhase(final int phaseIndex) {
        return phases.get(phaseIndex);
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static TemplateLibrary fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final JsonUtils.Helper<TemplateLibrary> JSON_HELPER =
            new JsonUtils.Helper<>(JsonUtils.FAST_MAPPER, TemplateLibrary.class);
}
