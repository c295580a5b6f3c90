package org.lsst.bfkernel;

/**
 * Thrown when too few points remain to fit a line.
 */
public class InsufficientDataException extends KernelGenerationException {

    private static final long serialVersionUID = 1L;

    public InsufficientDataException(String message) {
        super(message);
    }
}
