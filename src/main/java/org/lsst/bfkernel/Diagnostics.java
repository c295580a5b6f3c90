package org.lsst.bfkernel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Collects the data quality rejections made during a run. Every rejection is
 * also logged as a warning. Safe for use from several worker threads.
 */
public class Diagnostics {

    private static final Logger LOG = Logger.getLogger(Diagnostics.class.getName());

    private final List<Rejection> rejections = Collections.synchronizedList(new ArrayList<>());

    /**
     * Record a rejection.
     *
     * @param subject What was rejected, for example a region or a visit pair
     * @param reason Why it was rejected
     * @param <T> The type of the outcome being produced
     * @return A rejected outcome carrying the same reason
     */
    public <T> Outcome<T> reject(String subject, String reason) {
        LOG.log(Level.WARNING, "Rejected {0}: {1}", new Object[]{subject, reason});
        rejections.add(new Rejection(subject, reason));
        return Outcome.rejected(reason);
    }

    public List<Rejection> getRejections() {
        synchronized (rejections) {
            return new ArrayList<>(rejections);
        }
    }

    public static class Rejection {

        private final String subject;
        private final String reason;

        Rejection(String subject, String reason) {
            this.subject = subject;
            this.reason = reason;
        }

        public String getSubject() {
            return subject;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public String toString() {
            return "Rejection{" + "subject=" + subject + ", reason=" + reason + '}';
        }
    }
}
