package org.lsst.bfkernel;

/**
 * Thrown when a fit has no usable solution, for example a zero photon transfer curve slope.
 */
public class DegenerateFitException extends KernelGenerationException {

    private static final long serialVersionUID = 1L;

    public DegenerateFitException(String message) {
        super(message);
    }
}
