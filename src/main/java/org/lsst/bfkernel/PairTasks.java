package org.lsst.bfkernel;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one task per visit pair, either on the calling thread or on an
 * executor, and collects the results in submission order.
 */
final class PairTasks {

    private static final Logger LOG = Logger.getLogger(PairTasks.class.getName());

    /**
     * A per pair computation which may fail reading its exposures.
     */
    interface PairTask<T> {

        T apply(VisitPair pair) throws IOException;
    }

    private PairTasks() {
    }

    static <T> List<T> runAll(List<VisitPair> visitPairs, Executor executor, PairTask<T> task) throws IOException {
        List<CompletableFuture<T>> futures = new ArrayList<>();
        for (VisitPair pair : visitPairs) {
            if (executor == null) {
                futures.add(CompletableFuture.completedFuture(task.apply(pair)));
            } else {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        return task.apply(pair);
                    } catch (IOException x) {
                        throw new CompletionException(x);
                    }
                }, executor));
            }
        }
        try {
            LOG.log(Level.FINE, "Waiting for {0} visit pairs", futures.size());
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[futures.size()])).join();
            List<T> result = new ArrayList<>(futures.size());
            for (CompletableFuture<T> future : futures) {
                result.add(future.join());
            }
            return result;
        } catch (CompletionException x) {
            Throwable cause = x.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else {
                throw new IOException("Unexpected exception while processing visit pairs", cause);
            }
        }
    }
}
