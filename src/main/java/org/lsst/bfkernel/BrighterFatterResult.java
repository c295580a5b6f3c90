package org.lsst.bfkernel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything produced by one kernel generation run of a detector: the gains,
 * a kernel for each region that succeeded, the reason each other region
 * failed, and the data quality rejections made along the way.
 */
public class BrighterFatterResult {

    private final String detector;
    private final GainTable gains;
    private final Map<String, BrighterFatterKernel> kernels;
    private final Map<String, String> failures;
    private final List<Diagnostics.Rejection> rejections;

    public BrighterFatterResult(String detector, GainTable gains, Map<String, BrighterFatterKernel> kernels, Map<String, String> failures, List<Diagnostics.Rejection> rejections) {
        this.detector = detector;
        this.gains = gains;
        this.kernels = Collections.unmodifiableMap(new LinkedHashMap<>(kernels));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.rejections = Collections.unmodifiableList(new ArrayList<>(rejections));
    }

    public String getDetector() {
        return detector;
    }

    public GainTable getGains() {
        return gains;
    }

    /**
     * @return The kernels, keyed by region name, in region order
     */
    public Map<String, BrighterFatterKernel> getKernels() {
        return kernels;
    }

    public BrighterFatterKernel getKernel(String region) {
        return kernels.get(region);
    }

    /**
     * @return The reason no kernel was produced, keyed by region name
     */
    public Map<String, String> getFailures() {
        return failures;
    }

    public List<Diagnostics.Rejection> getRejections() {
        return rejections;
    }

    @Override
    public String toString() {
        return "BrighterFatterResult{" + "detector=" + detector + ", kernels=" + kernels.keySet() + ", failures=" + failures.keySet()
                + ", rejections=" + rejections.size() + '}';
    }
}
