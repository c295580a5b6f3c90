package org.lsst.bfkernel;

import java.io.IOException;

/**
 * Supplies calibrated exposures. Implementations perform (or look up the
 * result of) instrument signature removal; the kernel generation code only
 * ever sees the calibrated pixels.
 */
public interface ExposureSource {

    /**
     * Get the calibrated exposure of one detector for one visit.
     *
     * @param detector The detector name
     * @param visit The visit number
     * @return The exposure, which the caller must not modify
     * @throws IOException If the exposure cannot be produced
     */
    Exposure getExposure(String detector, int visit) throws IOException;
}
