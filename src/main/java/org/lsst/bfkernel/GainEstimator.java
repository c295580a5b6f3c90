package org.lsst.bfkernel;

import java.awt.Rectangle;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.bfkernel.stats.ClippedStatistics;
import org.lsst.bfkernel.stats.LineFit;
import org.lsst.bfkernel.stats.RobustRegressor;

/**
 * Measures the gain of each amplifier with the photon transfer curve method.
 * <p>
 * For every visit pair and amplifier the sum of the two (border excluded,
 * sigma-clipped) means, the zero-lag variance of the difference image and the
 * total covariance (the sum of the tiled cross-correlation) are measured, with
 * no gain correction applied. Points failing the sanity checks are dropped.
 * The covariance is then regressed against the mean with outlier rejection and
 * the gain is the inverse of the slope.
 */
public class GainEstimator {

    private static final Logger LOG = Logger.getLogger(GainEstimator.class.getName());
    private static final double MIN_SLOPE = 1e-12;

    private final PipelineContext context;
    private final BrighterFatterConfig config;
    private final Executor executor;

    public GainEstimator(PipelineContext context) {
        this(context, null);
    }

    /**
     * Create a gain estimator.
     *
     * @param context The pipeline context
     * @param executor Executor used to process visit pairs in parallel, or
     * null to process them on the calling thread
     */
    public GainEstimator(PipelineContext context, Executor executor) {
        this.context = context;
        this.config = context.config();
        this.executor = executor;
    }

    /**
     * Estimate the gain of every amplifier of a detector.
     *
     * @param detector The detector name
     * @param visitPairs The flat pairs making up the photon transfer curve
     * @param source Supplies the calibrated exposures
     * @return The gains of the amplifiers for which a fit succeeded
     * @throws IOException If an exposure cannot be read
     */
    public GainTable estimateGains(String detector, List<VisitPair> visitPairs, ExposureSource source) throws IOException {
        Map<String, List<PtcPoint>> points = new LinkedHashMap<>();
        Map<String, Double> nominal = new LinkedHashMap<>();
        List<Map<String, Outcome<PtcPoint>>> perPair = PairTasks.runAll(visitPairs, executor, (pair) -> {
            Exposure exp1 = source.getExposure(detector, pair.getFirst());
            Exposure exp2 = source.getExposure(detector, pair.getSecond());
            synchronized (nominal) {
                nominal.putAll(exp1.getNominalGains());
            }
            return Timed.execute(() -> measure(pair, exp1, exp2), "PTC measurement of visits %s took %dms", pair);
        });
        for (Map<String, Outcome<PtcPoint>> outcomes : perPair) {
            for (Map.Entry<String, Outcome<PtcPoint>> entry : outcomes.entrySet()) {
                List<PtcPoint> list = points.computeIfAbsent(entry.getKey(), (k) -> new ArrayList<>());
                if (entry.getValue().isAccepted()) {
                    list.add(entry.getValue().getValue());
                }
            }
        }
        LOG.log(Level.INFO, "Fitting photon transfer curves for detector {0}", detector);
        return fitGains(points, nominal);
    }

    /**
     * Measure one photon transfer curve point per amplifier from a visit pair.
     *
     * @param pair The visit pair
     * @param exp1 The first exposure
     * @param exp2 The second exposure
     * @return For each amplifier, the point or the reason it was rejected
     */
    public Map<String, Outcome<PtcPoint>> measure(VisitPair pair, Exposure exp1, Exposure exp2) {
        Map<String, Outcome<PtcPoint>> result = new LinkedHashMap<>();
        RegionSet amps = RegionSet.forLevel(KernelLevel.AMP, exp1);
        for (Region amp : amps) {
            String subject = "amp " + amp.getName() + " visits " + pair;
            try {
                result.put(amp.getName(), check(subject, measure(pair, exp1.getImage(), exp2.getImage(), amp)));
            } catch (KernelGenerationException x) {
                result.put(amp.getName(), context.getDiagnostics().reject(subject, x.getMessage()));
            }
        }
        return result;
    }

    PtcPoint measure(VisitPair pair, FlatImage image1, FlatImage image2, Region amp) {
        int border = config.getNPixBorderGainCalc();
        double sigma = config.getNSigmaClipGainCalc();
        FlatImage amp1 = image1.subImage(amp.getBBox());
        FlatImage amp2 = image2.subImage(amp.getBBox());
        Rectangle interior = amp1.interior(border);
        double mean1 = ClippedStatistics.clippedMean(amp1, interior, sigma);
        double mean2 = ClippedStatistics.clippedMean(amp2, interior, sigma);
        amp1.add(-mean1);
        amp2.add(-mean2);
        double[][] xcorr = CrossCorrelator.forGain(config).correlate(amp1, amp2);
        double variance = xcorr[0][0];
        double covariance = SymmetricTiler.sum(SymmetricTiler.tile(xcorr));
        LOG.log(Level.FINE, "Amp {0} visits {1}: M1 {2} M2 {3} M_sum {4} Var {5} coVar {6}",
                new Object[]{amp.getName(), pair, mean1, mean2, mean1 + mean2, variance, covariance});
        return new PtcPoint(pair, mean1 + mean2, variance, covariance);
    }

    private Outcome<PtcPoint> check(String subject, PtcPoint point) {
        double mean = point.getMean();
        double var = point.getVariance();
        double covar = point.getCovariance();
        if (mean * 10 < var || mean * 10 < covar) {
            return context.getDiagnostics().reject(subject, String.format("sanity check failed, mean %g is small compared to variance %g or covariance %g", mean, var, covar));
        }
        if (var * 1.3 < covar || var * 0.7 > covar) {
            return context.getDiagnostics().reject(subject, String.format("covariance %g differs from variance %g by more than 30%%", covar, var));
        }
        return Outcome.accepted(point);
    }

    /**
     * Fit the photon transfer curve of each amplifier.
     *
     * @param points The accepted points, keyed by amplifier name
     * @param nominal The nominal gains, for comparison in the result
     * @return The gains of the amplifiers for which the fit succeeded
     */
    public GainTable fitGains(Map<String, List<PtcPoint>> points, Map<String, Double> nominal) {
        Map<String, Double> gains = new LinkedHashMap<>();
        for (Map.Entry<String, List<PtcPoint>> entry : points.entrySet()) {
            String amp = entry.getKey();
            try {
                double gain = fitGain(amp, entry.getValue());
                gains.put(amp, gain);
                LOG.log(Level.INFO, "Amp {0}: gain {1} (nominal {2})", new Object[]{amp, gain, nominal.get(amp)});
            } catch (KernelGenerationException x) {
                context.getDiagnostics().reject("amp " + amp, "gain fit failed: " + x.getMessage());
            }
        }
        return new GainTable(gains, nominal);
    }

    double fitGain(String amp, List<PtcPoint> points) {
        double[] means = new double[points.size()];
        double[] covariances = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            means[i] = points.get(i).getMean();
            covariances[i] = points.get(i).getCovariance();
        }
        boolean fixThroughOrigin = config.isFixPtcThroughOrigin();
        LineFit fit = RobustRegressor.fit(means, covariances, fixThroughOrigin, config.getNSigmaClipRegression(), config.getMaxIterRegression());
        logComparison(amp, means, covariances, fit);
        double slope = fit.getSlope();
        if (!(slope > MIN_SLOPE) || Double.isInfinite(slope)) {
            throw new DegenerateFitException("Photon transfer curve slope " + slope + " cannot be converted to a gain");
        }
        return 1.0 / slope;
    }

    private void logComparison(String amp, double[] means, double[] covariances, LineFit used) {
        if (!LOG.isLoggable(Level.INFO)) {
            return;
        }
        try {
            LineFit raw = RobustRegressor.leastSquares(means, covariances, false);
            LineFit fixed = RobustRegressor.fit(means, covariances, true, config.getNSigmaClipRegression(), config.getMaxIterRegression());
            LineFit unfixed = RobustRegressor.fit(means, covariances, false, config.getNSigmaClipRegression(), config.getMaxIterRegression());
            LOG.log(Level.INFO, "Amp {0}: slope of raw fit {1}, intercept {2}", new Object[]{amp, raw.getSlope(), raw.getIntercept()});
            LOG.log(Level.INFO, "Amp {0}: slope of fixed fit {1}, difference vs raw {2}", new Object[]{amp, fixed.getSlope(), fixed.getSlope() - raw.getSlope()});
            LOG.log(Level.INFO, "Amp {0}: slope of unfixed fit {1}, difference vs fixed {2}", new Object[]{amp, unfixed.getSlope(), fixed.getSlope() - unfixed.getSlope()});
        } catch (KernelGenerationException x) {
            LOG.log(Level.FINE, "Amp {0}: comparison fits unavailable ({1}), using {2}", new Object[]{amp, x.getMessage(), used});
        }
    }
}
