package org.lsst.bfkernel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The output of {@link ImagePreparer}: for every region a gain-rescaled,
 * mean-subtracted working copy, and the clipped mean of the rescaled region
 * interior.
 */
public class PreparedImage {

    private final Map<Region, FlatImage> workingImages;
    private final Map<Region, Double> means;

    PreparedImage(Map<Region, FlatImage> workingImages, Map<Region, Double> means) {
        this.workingImages = Collections.unmodifiableMap(new LinkedHashMap<>(workingImages));
        this.means = Collections.unmodifiableMap(new LinkedHashMap<>(means));
    }

    public Map<Region, FlatImage> getWorkingImages() {
        return workingImages;
    }

    public FlatImage getWorkingImage(Region region) {
        return workingImages.get(region);
    }

    public Map<Region, Double> getMeans() {
        return means;
    }

    public double getMean(Region region) {
        return means.get(region);
    }
}
