package org.lsst.bfkernel;

/**
 * Thrown when a region, once its border has been removed, is not larger than the maximum lag.
 */
public class InsufficientRegionException extends KernelGenerationException {

    private static final long serialVersionUID = 1L;

    public InsufficientRegionException(String message) {
        super(message);
    }
}
