package org.lsst.bfkernel;

/**
 * The granularity at which kernels are generated.
 */
public enum KernelLevel {
    /**
     * One kernel per amplifier.
     */
    AMP,
    /**
     * One kernel for the whole detector.
     */
    CCD
}
