package org.lsst.bfkernel;

/**
 * Thrown when an array does not have the shape an operation requires.
 */
public class ShapeException extends KernelGenerationException {

    private static final long serialVersionUID = 1L;

    public ShapeException(String message) {
        super(message);
    }
}
