package org.lsst.bfkernel;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.bfkernel.stats.ClippedStatistics;

/**
 * Combines the correlation samples of one region into the solver input.
 * <p>
 * The shot noise {@code mean1+mean2} is removed from the zero-lag term of
 * each sample, which must then be negative. The sample is normalised by
 * {@code -(mean1^2+mean2^2)} and tiled to the full surface. A sample whose
 * {@code |sum|/sum(|x|)} exceeds the reject level is dropped. The surviving
 * surfaces are combined with a sigma-clipped mean at every pixel.
 */
public class KernelAggregator {

    private static final Logger LOG = Logger.getLogger(KernelAggregator.class.getName());

    private final Diagnostics diagnostics;
    private final double nSigmaClip;

    public KernelAggregator(PipelineContext context) {
        this(context.getDiagnostics(), context.config().getNSigmaClipKernelGen());
    }

    public KernelAggregator(Diagnostics diagnostics, double nSigmaClip) {
        this.diagnostics = diagnostics;
        this.nSigmaClip = nSigmaClip;
    }

    /**
     * Aggregate the samples of a region.
     *
     * @param region The region name, used when reporting rejections
     * @param samples The samples, all with quarter arrays of the same size
     * @param rejectLevel The largest acceptable {@code |sum|/sum(|x|)}
     * @return The aggregated surface
     * @throws AllSamplesRejectedException if no sample survives
     */
    public AggregatedSurface aggregate(String region, List<CorrelationSample> samples, double rejectLevel) {
        List<double[][]> surfaces = new ArrayList<>();
        for (CorrelationSample sample : samples) {
            Outcome<double[][]> outcome = normalise(region, sample, rejectLevel);
            if (outcome.isAccepted()) {
                surfaces.add(outcome.getValue());
            }
        }
        int rejected = samples.size() - surfaces.size();
        if (surfaces.isEmpty()) {
            throw new AllSamplesRejectedException("All " + samples.size() + " correlation samples of " + region + " were rejected");
        }
        LOG.log(Level.INFO, "Region {0}: aggregating {1} samples, {2} rejected", new Object[]{region, surfaces.size(), rejected});

        int size = surfaces.get(0).length;
        double[][] result = new double[size][size];
        double[] stack = new double[surfaces.size()];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                for (int k = 0; k < stack.length; k++) {
                    stack[k] = surfaces.get(k)[i][j];
                }
                result[i][j] = ClippedStatistics.clippedMean(stack, nSigmaClip);
            }
        }
        return new AggregatedSurface(result, surfaces.size(), rejected);
    }

    private Outcome<double[][]> normalise(String region, CorrelationSample sample, double rejectLevel) {
        String subject = region + " visits " + sample.getVisitPair();
        double[][] quarter = sample.getQuarter();
        double mean1 = sample.getMean1();
        double mean2 = sample.getMean2();
        quarter[0][0] -= mean1 + mean2;
        if (quarter[0][0] >= 0) {
            return diagnostics.reject(subject, "corrected zero lag correlation " + quarter[0][0] + " is not negative");
        }
        Arrays2D.scale(quarter, -1.0 / (mean1 * mean1 + mean2 * mean2));
        double[][] full;
        try {
            full = SymmetricTiler.tile(quarter);
        } catch (ShapeException x) {
            return diagnostics.reject(subject, x.getMessage());
        }
        double ratio = Math.abs(SymmetricTiler.sum(full)) / SymmetricTiler.sumOfAbs(full);
        LOG.log(Level.FINE, "{0}: xcorr sum ratio {1}", new Object[]{subject, ratio});
        if (!(ratio <= rejectLevel)) {
            return diagnostics.reject(subject, String.format("correlation sum ratio %g exceeds %g", ratio, rejectLevel));
        }
        return Outcome.accepted(full);
    }
}
