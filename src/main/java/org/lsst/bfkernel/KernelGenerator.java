package org.lsst.bfkernel;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generates the brighter-fatter kernels of one detector from a set of flat
 * field visit pairs.
 * <p>
 * The gains are measured first (or taken from the caller). Each visit pair is
 * then prepared with those gains and cross-correlated region by region, the
 * samples of every region are aggregated and the aggregated surface is turned
 * into a kernel by the relaxation solver. A region which fails at any stage is
 * reported in the result without affecting the other regions.
 */
public class KernelGenerator {

    private static final Logger LOG = Logger.getLogger(KernelGenerator.class.getName());

    private final ExposureSource source;
    private final PipelineContext context;
    private final BrighterFatterConfig config;
    private final GainTable suppliedGains;
    private final Executor executor;

    public KernelGenerator(ExposureSource source, PipelineContext context) {
        this(source, context, null, null);
    }

    /**
     * Create a kernel generator.
     *
     * @param source Supplies the calibrated exposures
     * @param context The pipeline context
     * @param suppliedGains Gains to use when gain calculation is disabled, may
     * be null
     * @param executor Executor for per visit pair work, or null to run
     * everything on the calling thread
     */
    public KernelGenerator(ExposureSource source, PipelineContext context, GainTable suppliedGains, Executor executor) {
        this.source = source;
        this.context = context;
        this.config = context.config();
        this.suppliedGains = suppliedGains;
        this.executor = executor;
    }

    /**
     * Generate the kernels of a detector.
     *
     * @param detector The detector name
     * @param visitPairs The flat pairs to use
     * @return The gains, kernels and failures of the run
     * @throws IOException If an exposure cannot be read
     */
    public BrighterFatterResult run(String detector, List<VisitPair> visitPairs) throws IOException {
        if (visitPairs.isEmpty()) {
            throw new IllegalArgumentException("No visit pairs given for detector " + detector);
        }
        TreeSet<Integer> visits = new TreeSet<>();
        for (VisitPair pair : visitPairs) {
            visits.add(pair.getFirst());
            visits.add(pair.getSecond());
        }
        LOG.log(Level.INFO, "Processing detector {0} at {1} level using visits {2}", new Object[]{detector, config.getLevel(), VisitPair.describe(visits)});

        GainTable gains = gains(detector, visitPairs);

        List<Map<Region, Outcome<CorrelationSample>>> perPair = PairTasks.runAll(visitPairs, executor,
                (pair) -> Timed.execute(() -> correlate(detector, pair, gains), "Cross-correlation of visits %s took %dms", pair));

        Map<Region, List<CorrelationSample>> samples = new LinkedHashMap<>();
        for (Map<Region, Outcome<CorrelationSample>> outcomes : perPair) {
            for (Map.Entry<Region, Outcome<CorrelationSample>> entry : outcomes.entrySet()) {
                List<CorrelationSample> list = samples.computeIfAbsent(entry.getKey(), (k) -> new ArrayList<>());
                if (entry.getValue().isAccepted()) {
                    list.add(entry.getValue().getValue());
                }
            }
        }

        KernelAggregator aggregator = new KernelAggregator(context);
        SorSolver solver = new SorSolver(config);
        Map<String, BrighterFatterKernel> kernels = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (Map.Entry<Region, List<CorrelationSample>> entry : samples.entrySet()) {
            String name = entry.getKey().getName();
            try {
                AggregatedSurface surface = aggregator.aggregate(name, entry.getValue(), config.getXcorrCheckRejectLevel());
                SorSolution solution = solver.solve(surface.getSurface());
                kernels.put(name, new BrighterFatterKernel(name, solution.getSolution(), solution.isConverged(), solution.getIterations(), surface.getSamplesUsed()));
                LOG.log(Level.INFO, "Generated kernel for {0} from {1} samples", new Object[]{name, surface.getSamplesUsed()});
            } catch (KernelGenerationException x) {
                context.getDiagnostics().reject(name, "kernel generation failed: " + x.getMessage());
                failures.put(name, x.getMessage());
            }
        }
        LOG.log(Level.INFO, "Detector {0}: {1} kernels generated, {2} regions failed", new Object[]{detector, kernels.size(), failures.size()});
        return new BrighterFatterResult(detector, gains, kernels, failures, context.getDiagnostics().getRejections());
    }

    private GainTable gains(String detector, List<VisitPair> visitPairs) throws IOException {
        if (config.isDoCalcGains()) {
            return Timed.execute(Level.INFO, () -> new GainEstimator(context, executor).estimateGains(detector, visitPairs, source),
                    "Gain estimation for %s took %dms", detector);
        } else if (suppliedGains != null) {
            LOG.log(Level.INFO, "Using supplied gains {0}", suppliedGains);
            return suppliedGains;
        } else {
            throw new IllegalStateException("Gain calculation is disabled and no gains were supplied");
        }
    }

    /**
     * Prepare both exposures of a visit pair and cross-correlate each region.
     */
    Map<Region, Outcome<CorrelationSample>> correlate(String detector, VisitPair pair, GainTable ampGains) throws IOException {
        Exposure exp1 = source.getExposure(detector, pair.getFirst());
        Exposure exp2 = source.getExposure(detector, pair.getSecond());
        RegionSet regions = RegionSet.forLevel(config.getLevel(), exp1);
        GainTable gains = regions.getLevel() == KernelLevel.CCD ? GainTable.unity(regions) : ampGains;

        ImagePreparer preparer = new ImagePreparer(context.getDiagnostics());
        PreparedImage prepared1 = preparer.prepare(exp1, gains, regions, config);
        PreparedImage prepared2 = preparer.prepare(exp2, gains, regions, config);
        CrossCorrelator correlator = CrossCorrelator.forKernel(config);

        Map<Region, Outcome<CorrelationSample>> result = new LinkedHashMap<>();
        for (Region region : regions) {
            FlatImage working1 = prepared1.getWorkingImage(region);
            FlatImage working2 = prepared2.getWorkingImage(region);
            if (working1 == null || working2 == null) {
                // Already reported by the preparer
                result.put(region, Outcome.rejected("region could not be prepared"));
                continue;
            }
            try {
                double[][] xcorr = correlator.correlate(working1, working2);
                CorrelationSample sample = new CorrelationSample(pair, prepared1.getMean(region), prepared2.getMean(region), xcorr);
                LOG.log(Level.FINE, "Region {0}: {1}", new Object[]{region.getName(), sample});
                result.put(region, Outcome.accepted(sample));
            } catch (KernelGenerationException x) {
                result.put(region, context.getDiagnostics().reject(region.getName() + " visits " + pair, x.getMessage()));
            }
        }
        return result;
    }
}
