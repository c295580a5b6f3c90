package org.lsst.bfkernel.util;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.lsst.bfkernel.BrighterFatterConfig;
import org.lsst.bfkernel.BrighterFatterKernel;
import org.lsst.bfkernel.BrighterFatterResult;
import org.lsst.bfkernel.KernelGenerator;
import org.lsst.bfkernel.PipelineContext;
import org.lsst.bfkernel.Timed;
import org.lsst.bfkernel.VisitPair;
import org.lsst.bfkernel.fits.FitsExposureSource;
import org.lsst.bfkernel.fits.FitsKernelWriter;

/**
 * Generates the brighter-fatter kernels of one detector from calibrated flat
 * pairs stored as FITS files.
 * <p>
 * Usage: {@code Main <detector> <exposures.txt> <visitPairs> <output.fits> [config.properties]}
 * where exposures.txt lists one {@code visit path} per line and visitPairs is
 * of the form {@code (123,124),(125,126)}.
 */
public class Main {

    public static void main(String[] args) throws IOException {
        if (args.length < 4 || args.length > 5) {
            System.err.println("Usage: Main <detector> <exposures.txt> <visitPairs> <output.fits> [config.properties]");
            System.exit(1);
        }
        String detector = args[0];
        FitsExposureSource source = FitsExposureSource.fromListing(new File(args[1]));
        List<VisitPair> visitPairs = VisitPair.parseList(args[2]);
        File output = new File(args[3]);
        BrighterFatterConfig config = args.length == 5 ? BrighterFatterConfig.fromFile(new File(args[4])) : BrighterFatterConfig.defaults();

        ExecutorService executor = Executors.newFixedThreadPool(Integer.getInteger("org.lsst.bfkernel.threads", Runtime.getRuntime().availableProcessors()));
        try {
            KernelGenerator generator = new KernelGenerator(source, new PipelineContext(config), null, executor);
            BrighterFatterResult result = Timed.execute(() -> generator.run(detector, visitPairs), "Kernel generation for %s took %dms", detector);
            new FitsKernelWriter().write(result, output);
            source.report();

            System.out.printf("Gains: %s\n", result.getGains().asMap());
            for (BrighterFatterKernel kernel : result.getKernels().values()) {
                System.out.printf("Kernel %s: %s\n", kernel.getRegion(), kernel.isConverged() ? "converged" : "NOT converged");
            }
            for (Map.Entry<String, String> failure : result.getFailures().entrySet()) {
                System.out.printf("Failed %s: %s\n", failure.getKey(), failure.getValue());
            }
        } finally {
            executor.shutdown();
        }
    }
}
