package org.lsst.bfkernel.fits;

import java.util.Objects;

/**
 * Cache key for a loaded exposure.
 */
class ExposureKey {

    private final String detector;
    private final int visit;

    ExposureKey(String detector, int visit) {
        this.detector = detector;
        this.visit = visit;
    }

    String getDetector() {
        return detector;
    }

    int getVisit() {
        return visit;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 19 * hash + Objects.hashCode(this.detector);
        hash = 19 * hash + this.visit;
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final ExposureKey other = (ExposureKey) obj;
        return this.visit == other.visit && Objects.equals(this.detector, other.detector);
    }

    @Override
    public String toString() {
        return detector + "/" + visit;
    }
}
