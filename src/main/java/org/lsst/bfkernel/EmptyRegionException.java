package org.lsst.bfkernel;

/**
 * Thrown when every sample of a region has been clipped away, or the region was empty to begin with.
 */
public class EmptyRegionException extends KernelGenerationException {

    private static final long serialVersionUID = 1L;

    public EmptyRegionException(String message) {
        super(message);
    }
}
