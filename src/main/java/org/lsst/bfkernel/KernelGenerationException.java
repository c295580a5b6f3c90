package org.lsst.bfkernel;

/**
 * Base class of the errors which are fatal to the kernel (or gain) computation
 * of a single region. Callers processing several regions catch this and carry
 * on with the remaining regions.
 */
public class KernelGenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public KernelGenerationException(String message) {
        super(message);
    }

    public KernelGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
