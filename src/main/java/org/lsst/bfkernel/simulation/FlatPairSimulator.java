package org.lsst.bfkernel.simulation;

import java.awt.Rectangle;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.lsst.bfkernel.Exposure;
import org.lsst.bfkernel.ExposureSource;
import org.lsst.bfkernel.FlatImage;
import org.lsst.bfkernel.Region;

/**
 * Simulates flat field exposures. Each pixel receives a Poisson distributed
 * number of electrons with the requested mean flux. An optional correlation
 * {@code x[y+1][x+1] += a*x[y][x]} (applied to the uncorrelated values)
 * mimics charge being shared between neighbouring pixels. The electrons of
 * each amplifier are then converted to ADU with the amplifier gain (e/ADU).
 * <p>
 * The random sequence of an exposure depends only on the seed and the visit
 * number, so exposures can be generated in any order or concurrently.
 */
public class FlatPairSimulator {

    private static final Logger LOG = Logger.getLogger(FlatPairSimulator.class.getName());

    private final long seed;
    private final int width;
    private final int height;
    private final List<Region> amplifiers;
    private final Map<String, Double> gains;
    private double correlation = 0;

    public FlatPairSimulator(long seed, int width, int height, List<Region> amplifiers, Map<String, Double> gains) {
        this.seed = seed;
        this.width = width;
        this.height = height;
        this.amplifiers = new ArrayList<>(amplifiers);
        this.gains = new LinkedHashMap<>(gains);
        for (Region amp : amplifiers) {
            if (!gains.containsKey(amp.getName())) {
                throw new IllegalArgumentException("No gain given for amplifier " + amp.getName());
            }
        }
    }

    /**
     * Create a simulator for a detector made of a row of equally sized
     * amplifiers, all with the same gain.
     *
     * @param seed The random seed
     * @param nAmps The number of amplifiers
     * @param ampWidth The width of each amplifier
     * @param ampHeight The height of each amplifier
     * @param gain The gain of every amplifier, in e/ADU
     * @return The simulator
     */
    public static FlatPairSimulator uniform(long seed, int nAmps, int ampWidth, int ampHeight, double gain) {
        List<Region> amps = new ArrayList<>();
        Map<String, Double> gains = new LinkedHashMap<>();
        for (int i = 0; i < nAmps; i++) {
            String name = String.format("C%02d", i);
            amps.add(new Region(name, new Rectangle(i * ampWidth, 0, ampWidth, ampHeight)));
            gains.put(name, gain);
        }
        return new FlatPairSimulator(seed, nAmps * ampWidth, ampHeight, amps, gains);
    }

    public double getCorrelation() {
        return correlation;
    }

    public void setCorrelation(double correlation) {
        this.correlation = correlation;
    }

    public List<Region> getAmplifiers() {
        return Collections.unmodifiableList(amplifiers);
    }

    public Map<String, Double> getGains() {
        return Collections.unmodifiableMap(gains);
    }

    /**
     * Simulate the electrons collected in each pixel.
     *
     * @param visit The visit number, which selects the random sequence
     * @param flux The mean number of electrons per pixel
     * @return The image in electrons
     */
    public FlatImage simulateElectrons(int visit, double flux) {
        RandomGenerator random = new Well19937c(seed * 1_000_003L + visit);
        PoissonDistribution poisson = new PoissonDistribution(random, flux,
                PoissonDistribution.DEFAULT_EPSILON, PoissonDistribution.DEFAULT_MAX_ITERATIONS);
        FlatImage image = new FlatImage(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.set(x, y, poisson.sample());
            }
        }
        if (correlation != 0) {
            FlatImage original = image.copy();
            for (int y = 1; y < height; y++) {
                for (int x = 1; x < width; x++) {
                    image.set(x, y, image.get(x, y) + correlation * original.get(x - 1, y - 1));
                }
            }
        }
        return image;
    }

    /**
     * Simulate a calibrated exposure, in ADU.
     *
     * @param detector The detector name
     * @param visit The visit number
     * @param flux The mean number of electrons per pixel
     * @return The exposure, carrying the simulated gains as nominal gains
     */
    public Exposure simulate(String detector, int visit, double flux) {
        FlatImage image = simulateElectrons(visit, flux);
        for (Region amp : amplifiers) {
            Rectangle box = amp.getBBox();
            double gain = gains.get(amp.getName());
            for (int y = box.y; y < box.y + box.height; y++) {
                for (int x = box.x; x < box.x + box.width; x++) {
                    image.set(x, y, image.get(x, y) / gain);
                }
            }
        }
        LOG.log(Level.FINE, "Simulated visit {0} of {1} with flux {2}", new Object[]{visit, detector, flux});
        return new Exposure(detector, visit, image, amplifiers, gains);
    }

    /**
     * Create an exposure source serving simulated visits. Each exposure is
     * generated once and then reused.
     *
     * @param fluxByVisit The mean flux in electrons of every visit
     * @return The exposure source
     */
    public ExposureSource asSource(Map<Integer, Double> fluxByVisit) {
        Map<Integer, Double> fluxes = new HashMap<>(fluxByVisit);
        Map<Integer, Exposure> generated = new HashMap<>();
        return (detector, visit) -> {
            Double flux = fluxes.get(visit);
            if (flux == null) {
                throw new IOException("No flux given for visit " + visit);
            }
            synchronized (generated) {
                return generated.computeIfAbsent(visit, (v) -> simulate(detector, v, flux));
            }
        };
    }
}
