package org.lsst.bfkernel;

/**
 * Thrown when every correlation sample offered for a kernel was rejected.
 */
public class AllSamplesRejectedException extends KernelGenerationException {

    private static final long serialVersionUID = 1L;

    public AllSamplesRejectedException(String message) {
        super(message);
    }
}
