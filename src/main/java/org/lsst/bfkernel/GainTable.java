package org.lsst.bfkernel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Gains (electrons per ADU) keyed by region name. Immutable.
 */
public class GainTable {

    private final Map<String, Double> gains;
    private final Map<String, Double> nominal;

    public GainTable(Map<String, Double> gains) {
        this(gains, Collections.emptyMap());
    }

    /**
     * Create a gain table.
     *
     * @param gains The gains, which must all be positive and finite
     * @param nominal The gains from the camera model for comparison, may be empty
     */
    public GainTable(Map<String, Double> gains, Map<String, Double> nominal) {
        for (Map.Entry<String, Double> entry : gains.entrySet()) {
            double gain = entry.getValue();
            if (!(gain > 0) || Double.isInfinite(gain)) {
                throw new IllegalArgumentException("Invalid gain " + gain + " for " + entry.getKey());
            }
        }
        this.gains = Collections.unmodifiableMap(new LinkedHashMap<>(gains));
        this.nominal = Collections.unmodifiableMap(new LinkedHashMap<>(nominal));
    }

    /**
     * A table with a gain of 1 for every region of a set, used when the data
     * are already in electrons or when a single region spans amplifiers.
     *
     * @param regions The regions
     * @return The unity gain table
     */
    public static GainTable unity(RegionSet regions) {
        Map<String, Double> gains = new LinkedHashMap<>();
        for (Region region : regions) {
            gains.put(region.getName(), 1.0);
        }
        return new GainTable(gains);
    }

    public boolean hasGain(String region) {
        return gains.containsKey(region);
    }

    /**
     * @param region The region name
     * @return The gain
     * @throws IllegalArgumentException if there is no gain for the region
     */
    public double getGain(String region) {
        Double gain = gains.get(region);
        if (gain == null) {
            throw new IllegalArgumentException("No gain for region " + region);
        }
        return gain;
    }

    public Set<String> getRegionNames() {
        return gains.keySet();
    }

    public Map<String, Double> asMap() {
        return gains;
    }

    public Map<String, Double> getNominal() {
        return nominal;
    }

    @Override
    public String toString() {
        return "GainTable{" + "gains=" + gains + ", nominal=" + nominal + '}';
    }
}
