package org.lsst.bfkernel.fits;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.awt.Rectangle;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import nom.tam.fits.ImageHDU;
import nom.tam.util.ArrayFuncs;
import org.lsst.bfkernel.Exposure;
import org.lsst.bfkernel.ExposureSource;
import org.lsst.bfkernel.FlatImage;
import org.lsst.bfkernel.Region;
import org.lsst.bfkernel.Timed;

/**
 * Reads calibrated flat field exposures from FITS files, one file per visit.
 * <p>
 * A file is either a single image, treated as one amplifier, or one image
 * extension per amplifier with DATASEC and DETSEC keywords, in which case the
 * data section of every extension is placed in the assembled detector image at
 * its DETSEC (flips are honoured). BSCALE and BZERO are applied. An optional
 * GAIN keyword of each amplifier is kept as its nominal gain.
 * <p>
 * Every visit is read twice during a run (once for the gains, once for the
 * kernels) so loaded exposures are cached. The cache size can be set with the
 * system property {@code org.lsst.bfkernel.exposureCacheSize}.
 */
public class FitsExposureSource implements ExposureSource {

    private static final Logger LOG = Logger.getLogger(FitsExposureSource.class.getName());

    private final Map<Integer, File> files;
    private final LoadingCache<ExposureKey, Exposure> cache;

    public FitsExposureSource(Map<Integer, File> files) {
        FitsFactory.setUseHierarch(true);
        this.files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
        cache = Caffeine.newBuilder()
                .maximumSize(Integer.getInteger("org.lsst.bfkernel.exposureCacheSize", 16))
                .recordStats()
                .build((ExposureKey key) -> {
                    return Timed.execute(() -> {
                        return read(key);
                    }, "Loading %s took %dms", key);
                });
    }

    /**
     * Create a source from a listing file. Each line holds a visit number and
     * the path of its FITS file, separated by white space. Blank lines and
     * lines starting with # are ignored, relative paths are resolved against
     * the directory of the listing.
     *
     * @param listing The listing file
     * @return The exposure source
     * @throws IOException If the listing cannot be read or is malformed
     */
    public static FitsExposureSource fromListing(File listing) throws IOException {
        Map<Integer, File> files = new LinkedHashMap<>();
        File dir = listing.getAbsoluteFile().getParentFile();
        try (BufferedReader reader = Files.newBufferedReader(listing.toPath(), StandardCharsets.UTF_8)) {
            for (;;) {
                String line = reader.readLine();
                if (line == null) {
                    break;
                }
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                String[] tokens = line.split("\\s+", 2);
                if (tokens.length != 2) {
                    throw new IOException("Invalid line in " + listing + ": " + line);
                }
                int visit;
                try {
                    visit = Integer.parseInt(tokens[0]);
                } catch (NumberFormatException x) {
                    throw new IOException("Invalid visit number in " + listing + ": " + line, x);
                }
                File file = new File(tokens[1]);
                files.put(visit, file.isAbsolute() ? file : new File(dir, tokens[1]));
            }
        }
        return new FitsExposureSource(files);
    }

    @Override
    public Exposure getExposure(String detector, int visit) throws IOException {
        try {
            return cache.get(new ExposureKey(detector, visit));
        } catch (CompletionException x) {
            Throwable cause = x.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            } else {
                throw new IOException("Unexpected exception loading visit " + visit, cause);
            }
        }
    }

    public Map<Integer, File> getFiles() {
        return files;
    }

    public void report() {
        LOG.log(Level.INFO, "exposure Cache size {0} stats {1}", new Object[]{cache.estimatedSize(), cache.stats()});
    }

    private Exposure read(ExposureKey key) throws IOException {
        File file = files.get(key.getVisit());
        if (file == null) {
            throw new IOException("No file known for visit " + key.getVisit());
        }
        try (Fits fits = new Fits(file)) {
            List<ImageHDU> images = new ArrayList<>();
            for (BasicHDU<?> hdu : fits.read()) {
                int[] axes = hdu.getAxes();
                if (hdu instanceof ImageHDU && axes != null && axes.length == 2) {
                    images.add((ImageHDU) hdu);
                }
            }
            if (images.isEmpty()) {
                throw new IOException("No image data in " + file);
            }
            if (images.size() == 1 && !images.get(0).getHeader().containsKey("DETSEC")) {
                return readSingle(key, images.get(0));
            } else {
                return assemble(key, file, images);
            }
        } catch (FitsException x) {
            throw new IOException("Error reading " + file, x);
        }
    }

    private Exposure readSingle(ExposureKey key, ImageHDU hdu) throws FitsException {
        Header header = hdu.getHeader();
        FlatImage image = FlatImage.fromArray(pixels(hdu));
        String name = header.containsKey("EXTNAME") ? header.getStringValue("EXTNAME").trim() : "AMP00";
        Map<String, Double> nominal = new LinkedHashMap<>();
        if (header.containsKey("GAIN")) {
            nominal.put(name, header.getDoubleValue("GAIN"));
        }
        return new Exposure(key.getDetector(), key.getVisit(), image, Collections.singletonList(new Region(name, image.getBounds())), nominal);
    }

    private Exposure assemble(ExposureKey key, File file, List<ImageHDU> images) throws IOException, FitsException {
        List<Section> dataSections = new ArrayList<>();
        List<Section> detSections = new ArrayList<>();
        int width = 0;
        int height = 0;
        for (ImageHDU hdu : images) {
            Header header = hdu.getHeader();
            Section datasec = Section.parse(header.getStringValue("DATASEC"));
            Section detsec = Section.parse(header.getStringValue("DETSEC"));
            if (datasec.getWidth() != detsec.getWidth() || datasec.getHeight() != detsec.getHeight()) {
                throw new IOException("DATASEC " + datasec + " and DETSEC " + detsec + " differ in size in " + file);
            }
            Rectangle bounds = detsec.getBounds();
            width = Math.max(width, bounds.x + bounds.width);
            height = Math.max(height, bounds.y + bounds.height);
            dataSections.add(datasec);
            detSections.add(detsec);
        }
        FlatImage image = new FlatImage(width, height);
        List<Region> amplifiers = new ArrayList<>();
        Map<String, Double> nominal = new LinkedHashMap<>();
        for (int i = 0; i < images.size(); i++) {
            Header header = images.get(i).getHeader();
            double[][] pixels = pixels(images.get(i));
            Section datasec = dataSections.get(i);
            Section detsec = detSections.get(i);
            Rectangle source = datasec.getBounds();
            Rectangle target = detsec.getBounds();
            if (source.y + source.height > pixels.length || source.x + source.width > pixels[0].length) {
                throw new IOException("DATASEC " + datasec + " outside of image data in " + file);
            }
            boolean flipX = datasec.isFlippedX() != detsec.isFlippedX();
            boolean flipY = datasec.isFlippedY() != detsec.isFlippedY();
            for (int dy = 0; dy < source.height; dy++) {
                int y = target.y + (flipY ? source.height - 1 - dy : dy);
                for (int dx = 0; dx < source.width; dx++) {
                    int x = target.x + (flipX ? source.width - 1 - dx : dx);
                    image.set(x, y, pixels[source.y + dy][source.x + dx]);
                }
            }
            String name = header.containsKey("EXTNAME") ? header.getStringValue("EXTNAME").trim() : String.format("AMP%02d", i);
            amplifiers.add(new Region(name, target));
            if (header.containsKey("GAIN")) {
                nominal.put(name, header.getDoubleValue("GAIN"));
            }
        }
        LOG.log(Level.FINE, "Assembled {0} amplifiers into {1}x{2} image from {3}", new Object[]{amplifiers.size(), width, height, file});
        return new Exposure(key.getDetector(), key.getVisit(), image, amplifiers, nominal);
    }

    private static double[][] pixels(ImageHDU hdu) throws FitsException {
        Header header = hdu.getHeader();
        double bscale = header.getDoubleValue("BSCALE", 1.0);
        double bzero = header.getDoubleValue("BZERO", 0.0);
        double[][] pixels = (double[][]) ArrayFuncs.convertArray(hdu.getKernel(), double.class, true);
        if (bscale != 1.0 || bzero != 0.0) {
            for (double[] row : pixels) {
                for (int x = 0; x < row.length; x++) {
                    row[x] = bzero + bscale * row[x];
                }
            }
        }
        return pixels;
    }
}
