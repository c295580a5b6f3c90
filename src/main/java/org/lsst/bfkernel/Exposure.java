package org.lsst.bfkernel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A calibrated (bias, dark and overscan corrected, assembled) flat field
 * image of one detector, together with the layout of its amplifiers.
 */
public class Exposure {

    private final String detector;
    private final int visit;
    private final FlatImage image;
    private final List<Region> amplifiers;
    private final Map<String, Double> nominalGains;

    public Exposure(String detector, int visit, FlatImage image, List<Region> amplifiers) {
        this(detector, visit, image, amplifiers, Collections.emptyMap());
    }

    /**
     * Create an exposure.
     *
     * @param detector The detector name
     * @param visit The visit number
     * @param image The calibrated pixels
     * @param amplifiers The amplifier regions, which must lie inside the image
     * @param nominalGains The gains from the camera model, keyed by amplifier
     * name, may be empty
     */
    public Exposure(String detector, int visit, FlatImage image, List<Region> amplifiers, Map<String, Double> nominalGains) {
        this.detector = Objects.requireNonNull(detector, "detector");
        this.visit = visit;
        this.image = Objects.requireNonNull(image, "image");
        for (Region amp : amplifiers) {
            if (!image.getBounds().contains(amp.getBBox())) {
                throw new ShapeException("Amplifier " + amp + " lies outside the image " + image);
            }
        }
        this.amplifiers = Collections.unmodifiableList(new ArrayList<>(amplifiers));
        this.nominalGains = Collections.unmodifiableMap(new LinkedHashMap<>(nominalGains));
    }

    public String getDetector() {
        return detector;
    }

    public int getVisit() {
        return visit;
    }

    public FlatImage getImage() {
        return image;
    }

    public List<Region> getAmplifiers() {
        return amplifiers;
    }

    public Map<String, Double> getNominalGains() {
        return nominalGains;
    }

    @Override
    public String toString() {
        return "Exposure{" + "detector=" + detector + ", visit=" + visit + ", image=" + image + ", amplifiers=" + amplifiers.size() + '}';
    }
}
