package org.janelia.indexation.map;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.indexation.json.JsonUtils;

/**
 * Best phase and orientation for one sample position along with the metrics that describe
 * how well it is separated from the runner-up orientation and the runner-up phase.
 *
 * Orientations are Bunge Euler angles in degrees for both matching paths.
 */
public class CrystalMapEntry
        implements Serializable {

    public static final String CORRELATION = "correlation";
    public static final String MATCH_RATE = "match_rate";
    public static final String EHKLS = "ehkls";
    public static final String TOTAL_ERROR = "total_error";
    public static final String ORIENTATION_RELIABILITY = "orientation_reliability";
    public static final String PHASE_RELIABILITY = "phase_reliability";

    private final int phaseIndex;
    private final double[] orientation;
    private final Map<String, Object> metrics;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private CrystalMapEntry() {
        this(0, new double[3], new LinkedHashMap<>());
    }

    public CrystalMapEntry(final int phaseIndex,
                           final double[] orientation,
                           final Map<String, Object> metrics) {
        this.phaseIndex = phaseIndex;
        this.orientation = orientation;
        this.metrics = metrics;
    }

    public int getPhaseIndex() {
        return phaseIndex;
    }

    public double[] getOrientation() {
        return orientation.clone();
    }

    public Map<String, Object> getMetrics() {
        return Collections.unmodifiableMap(metrics);
    }

    public boolean hasMetric(final String name) {
        return metrics.containsKey(name);
    }

    /**
     * @return value of the named scalar metric.
     *
     * @throws IllegalArgumentException
     *   if the metric does not exist or is not a scalar.
     */
    public double getScalarMetric(final String name)
            throws IllegalArgumentException {
        final Object value = metrics.get(name);
        if (! (value instanceof Number)) {
            throw new IllegalArgumentException("scalar metric '" + name + "' is not defined for " + this);
        }
        return ((Number) value).doubleValue();
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return "{ \"phaseIndex\": " + phaseIndex +
               ", \"orientation\": " + Arrays.toString(orientation) +
               ", \"metricNames\": " + metrics.keySet() + " }";
    }

    private static final JsonUtils.Helper<CrystalMapEntry> JSON_HELPER =
            new JsonUtils.Helper<>(CrystalMapEntry.class);
}
