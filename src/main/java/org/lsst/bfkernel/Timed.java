package org.lsst.bfkernel;

import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility for logging timing info
 */
public class Timed {

    private static final Logger LOG = Logger.getLogger(Timed.class.getName());
    private static final Level DEFAULT_LOG_LEVEL = Level.FINE;

    private Timed() {
    }

    public static <T> T execute(Callable<T> callable, String message, Object... args) {
        return execute(DEFAULT_LOG_LEVEL, callable, message, args);
    }

    /**
     * Run a computation and log how long it took. The elapsed milliseconds are
     * appended to {@code args} when formatting {@code message}. Exceptions
     * from the computation are rethrown unchanged.
     */
    public static <T> T execute(Level logLevel, Callable<T> callable, String message, Object... args) {
        long start = System.currentTimeMillis();
        try {
            return callable.call();
        } catch (Exception x) {
            return Timed.sneakyThrow(x);
        } finally {
            long elapsed = System.currentTimeMillis() - start;
            LOG.log(logLevel, () -> String.format(message, append(args, elapsed)));
        }
    }

    @SuppressWarnings("unchecked")
    private static <T extends Exception, R> R sneakyThrow(Exception t) throws T {
        throw (T) t;
    }

    private static Object[] append(Object[] args, Object... arg) {
        Object[] result = new Object[args.length + arg.length];
        System.arraycopy(args, 0, result, 0, args.length);
        System.arraycopy(arg, 0, result, args.length, arg.length);
        return result;
    }
}
