package org.lsst.bfkernel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The ordered list of regions processed in one run. At {@link KernelLevel#CCD}
 * this is a single region covering the whole detector, at
 * {@link KernelLevel#AMP} it is one region per amplifier. Everything
 * downstream treats both cases the same way.
 */
public class RegionSet implements Iterable<Region> {

    private final KernelLevel level;
    private final List<Region> regions;

    public RegionSet(KernelLevel level, List<Region> regions) {
        if (regions.isEmpty()) {
            throw new IllegalArgumentException("A region set needs at least one region");
        }
        this.level = level;
        this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
    }

    public static RegionSet forLevel(KernelLevel level, Exposure exposure) {
        switch (level) {
            case CCD:
                return new RegionSet(level, Collections.singletonList(new Region(exposure.getDetector(), exposure.getImage().getBounds())));
            case AMP:
                return new RegionSet(level, exposure.getAmplifiers());
            default:
                throw new IllegalArgumentException("Unsupported level: " + level);
        }
    }

    public KernelLevel getLevel() {
        return level;
    }

    public List<Region> getRegions() {
        return regions;
    }

    public int size() {
        return regions.size();
    }

    @Override
    public Iterator<Region> iterator() {
        return regions.iterator();
    }

    @Override
    public String toString() {
        return "RegionSet{" + "level=" + level + ", regions=" + regions + '}';
    }
}
