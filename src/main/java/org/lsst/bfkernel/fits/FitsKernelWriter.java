package org.lsst.bfkernel.fits;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import nom.tam.util.BufferedFile;
import org.lsst.bfkernel.BrighterFatterKernel;
import org.lsst.bfkernel.BrighterFatterResult;

/**
 * Writes the result of a run to a FITS file. The primary HDU has no data and
 * carries the detector name and the gains as {@code HIERARCH BF GAIN <amp>}
 * cards. Each kernel follows in its own image extension named after its
 * region, with the convergence flag, the number of solver iterations and the
 * number of samples used.
 */
public class FitsKernelWriter {

    private static final Logger LOG = Logger.getLogger(FitsKernelWriter.class.getName());

    static final String GAIN_PREFIX = "HIERARCH.BF.GAIN.";

    public void write(BrighterFatterResult result, File file) throws IOException {
        FitsFactory.setUseHierarch(true);
        try (Fits fits = new Fits()) {
            BasicHDU<?> primary = BasicHDU.getDummyHDU();
            Header header = primary.getHeader();
            header.addValue("DETECTOR", result.getDetector(), "Detector name");
            for (Map.Entry<String, Double> gain : result.getGains().asMap().entrySet()) {
                header.addValue(GAIN_PREFIX + gain.getKey(), gain.getValue().doubleValue(), "Measured gain (e/ADU)");
            }
            fits.addHDU(primary);
            for (BrighterFatterKernel kernel : result.getKernels().values()) {
                BasicHDU<?> hdu = FitsFactory.hduFactory(kernel.getKernel());
                Header kernelHeader = hdu.getHeader();
                kernelHeader.addValue("EXTNAME", kernel.getRegion(), "Region");
                kernelHeader.addValue("CONVERGE", kernel.isConverged(), "Solver converged");
                kernelHeader.addValue("NITER", kernel.getIterations(), "Solver iterations");
                kernelHeader.addValue("NSAMPLES", kernel.getSamplesUsed(), "Correlation samples used");
                fits.addHDU(hdu);
            }
            Files.deleteIfExists(file.toPath());
            try (BufferedFile bf = new BufferedFile(file, "rw")) {
                fits.write(bf);
            }
            LOG.log(Level.INFO, "Wrote {0} kernels to {1}", new Object[]{result.getKernels().size(), file});
        } catch (FitsException x) {
            throw new IOException("Error writing " + file, x);
        }
    }
}
