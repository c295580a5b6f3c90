package org.lsst.bfkernel;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * Tuning parameters for gain estimation and kernel generation.
 * <p>
 * Values come from, in increasing order of precedence, the defaults shipped in
 * {@code bfkernel.properties}, any properties file given to
 * {@link #load(InputStream)}, and system properties of the form
 * {@code org.lsst.bfkernel.<key>}. The same configuration is used for every
 * region of a run, the pipeline takes a {@link #copy()} when it starts.
 */
public class BrighterFatterConfig {

    public static final String SYSTEM_PROPERTY_PREFIX = "org.lsst.bfkernel.";
    private static final String DEFAULTS_RESOURCE = "bfkernel.properties";
    private static final List<String> KEYS = Arrays.asList("doCalcGains", "maxIterRegression", "nSigmaClipGainCalc",
            "nSigmaClipRegression", "xcorrCheckRejectLevel", "maxIterSOR", "eLevelSOR", "nSigmaClipKernelGen",
            "nSigmaClipXCorr", "maxLag", "nPixBorderGainCalc", "nPixBorderXCorr", "biasCorr", "backgroundBinSize",
            "fixPtcThroughOrigin", "level");

    private boolean doCalcGains = true;
    private int maxIterRegression = 10;
    private double nSigmaClipGainCalc = 5;
    private double nSigmaClipRegression = 3;
    private double xcorrCheckRejectLevel = 1.0;
    private int maxIterSOR = 10000;
    private double eLevelSOR = 5.0e-14;
    private double nSigmaClipKernelGen = 4;
    private double nSigmaClipXCorr = 5;
    private int maxLag = 5;
    private int nPixBorderGainCalc = 10;
    private int nPixBorderXCorr = 10;
    private double biasCorr = 0.9241;
    private int backgroundBinSize = 128;
    private boolean fixPtcThroughOrigin = true;
    private KernelLevel level = KernelLevel.CCD;

    public BrighterFatterConfig() {
    }

    /**
     * Create a configuration from the shipped defaults, with system property
     * overrides applied.
     *
     * @return The configuration
     */
    public static BrighterFatterConfig defaults() {
        BrighterFatterConfig config = new BrighterFatterConfig();
        try (InputStream input = BrighterFatterConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (input == null) {
                throw new RuntimeException("Missing default configuration: " + DEFAULTS_RESOURCE);
            }
            config.load(input);
        } catch (IOException x) {
            throw new RuntimeException("Invalid default configuration " + DEFAULTS_RESOURCE, x);
        }
        config.applySystemProperties();
        return config;
    }

    public static BrighterFatterConfig fromFile(File file) throws IOException {
        BrighterFatterConfig config = defaults();
        try (InputStream input = new FileInputStream(file)) {
            config.load(input);
        }
        config.applySystemProperties();
        return config;
    }

    /**
     * Read values from a properties stream. Keys which are not present keep
     * their current value.
     *
     * @param input The properties stream
     * @throws IOException If the stream cannot be read or contains an unknown
     * key or an unparsable value
     */
    public void load(InputStream input) throws IOException {
        Properties props = new Properties();
        props.load(input);
        for (String key : props.stringPropertyNames()) {
            try {
                set(key, props.getProperty(key).trim());
            } catch (IllegalArgumentException x) {
                throw new IOException("Invalid configuration value for " + key, x);
            }
        }
    }

    void applySystemProperties() {
        Properties system = System.getProperties();
        for (String key : KEYS) {
            String value = system.getProperty(SYSTEM_PROPERTY_PREFIX + key);
            if (value != null) {
                set(key, value.trim());
            }
        }
    }

    /**
     * Set one value by name.
     *
     * @param key The property name, as used in the properties file
     * @param value The value in string form
     */
    public void set(String key, String value) {
        switch (key) {
            case "doCalcGains":
                doCalcGains = parseBoolean(value);
                break;
            case "maxIterRegression":
                maxIterRegression = Integer.parseInt(value);
                break;
            case "nSigmaClipGainCalc":
                nSigmaClipGainCalc = Double.parseDouble(value);
                break;
            case "nSigmaClipRegression":
                nSigmaClipRegression = Double.parseDouble(value);
                break;
            case "xcorrCheckRejectLevel":
                xcorrCheckRejectLevel = Double.parseDouble(value);
                break;
            case "maxIterSOR":
                maxIterSOR = Integer.parseInt(value);
                break;
            case "eLevelSOR":
                eLevelSOR = Double.parseDouble(value);
                break;
            case "nSigmaClipKernelGen":
                nSigmaClipKernelGen = Double.parseDouble(value);
                break;
            case "nSigmaClipXCorr":
                nSigmaClipXCorr = Double.parseDouble(value);
                break;
            case "maxLag":
                maxLag = Integer.parseInt(value);
                break;
            case "nPixBorderGainCalc":
                nPixBorderGainCalc = Integer.parseInt(value);
                break;
            case "nPixBorderXCorr":
                nPixBorderXCorr = Integer.parseInt(value);
                break;
            case "biasCorr":
                biasCorr = Double.parseDouble(value);
                break;
            case "backgroundBinSize":
                backgroundBinSize = Integer.parseInt(value);
                break;
            case "fixPtcThroughOrigin":
                fixPtcThroughOrigin = parseBoolean(value);
                break;
            case "level":
                level = KernelLevel.valueOf(value.toUpperCase(Locale.ROOT));
                break;
            default:
                throw new IllegalArgumentException("Unknown configuration key: " + key);
        }
    }

    private static boolean parseBoolean(String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        } else if ("false".equalsIgnoreCase(value)) {
            return false;
        } else {
            throw new IllegalArgumentException("Not a boolean: " + value);
        }
    }

    /**
     * Check that all values are usable.
     *
     * @throws IllegalArgumentException describing the first invalid value
     */
    public void validate() {
        requirePositive("maxIterRegression", maxIterRegression);
        requirePositive("nSigmaClipGainCalc", nSigmaClipGainCalc);
        requirePositive("nSigmaClipRegression", nSigmaClipRegression);
        requirePositive("xcorrCheckRejectLevel", xcorrCheckRejectLevel);
        requirePositive("maxIterSOR", maxIterSOR);
        requirePositive("eLevelSOR", eLevelSOR);
        requirePositive("nSigmaClipKernelGen", nSigmaClipKernelGen);
        requirePositive("nSigmaClipXCorr", nSigmaClipXCorr);
        requirePositive("maxLag", maxLag);
        requirePositive("biasCorr", biasCorr);
        requirePositive("backgroundBinSize", backgroundBinSize);
        if (nPixBorderGainCalc < 0) {
            throw new IllegalArgumentException("nPixBorderGainCalc must not be negative: " + nPixBorderGainCalc);
        }
        if (nPixBorderXCorr < 0) {
            throw new IllegalArgumentException("nPixBorderXCorr must not be negative: " + nPixBorderXCorr);
        }
        if (level == null) {
            throw new IllegalArgumentException("level must be set");
        }
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0)) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    public BrighterFatterConfig copy() {
        BrighterFatterConfig result = new BrighterFatterConfig();
        result.doCalcGains = doCalcGains;
        result.maxIterRegression = maxIterRegression;
        result.nSigmaClipGainCalc = nSigmaClipGainCalc;
        result.nSigmaClipRegression = nSigmaClipRegression;
        result.xcorrCheckRejectLevel = xcorrCheckRejectLevel;
        result.maxIterSOR = maxIterSOR;
        result.eLevelSOR = eLevelSOR;
        result.nSigmaClipKernelGen = nSigmaClipKernelGen;
        result.nSigmaClipXCorr = nSigmaClipXCorr;
        result.maxLag = maxLag;
        result.nPixBorderGainCalc = nPixBorderGainCalc;
        result.nPixBorderXCorr = nPixBorderXCorr;
        result.biasCorr = biasCorr;
        result.backgroundBinSize = backgroundBinSize;
        result.fixPtcThroughOrigin = fixPtcThroughOrigin;
        result.level = level;
        return result;
    }

    public boolean isDoCalcGains() {
        return doCalcGains;
    }

    public void setDoCalcGains(boolean doCalcGains) {
        this.doCalcGains = doCalcGains;
    }

    public int getMaxIterRegression() {
        return maxIterRegression;
    }

    public void setMaxIterRegression(int maxIterRegression) {
        this.maxIterRegression = maxIterRegression;
    }

    public double getNSigmaClipGainCalc() {
        return nSigmaClipGainCalc;
    }

    public void setNSigmaClipGainCalc(double nSigmaClipGainCalc) {
        this.nSigmaClipGainCalc = nSigmaClipGainCalc;
    }

    public double getNSigmaClipRegression() {
        return nSigmaClipRegression;
    }

    public void setNSigmaClipRegression(double nSigmaClipRegression) {
        this.nSigmaClipRegression = nSigmaClipRegression;
    }

    public double getXcorrCheckRejectLevel() {
        return xcorrCheckRejectLevel;
    }

    public void setXcorrCheckRejectLevel(double xcorrCheckRejectLevel) {
        this.xcorrCheckRejectLevel = xcorrCheckRejectLevel;
    }

    public int getMaxIterSOR() {
        return maxIterSOR;
    }

    public void setMaxIterSOR(int maxIterSOR) {
        this.maxIterSOR = maxIterSOR;
    }

    public double getELevelSOR() {
        return eLevelSOR;
    }

    public void setELevelSOR(double eLevelSOR) {
        this.eLevelSOR = eLevelSOR;
    }

    public double getNSigmaClipKernelGen() {
        return nSigmaClipKernelGen;
    }

    public void setNSigmaClipKernelGen(double nSigmaClipKernelGen) {
        this.nSigmaClipKernelGen = nSigmaClipKernelGen;
    }

    public double getNSigmaClipXCorr() {
        return nSigmaClipXCorr;
    }

    public void setNSigmaClipXCorr(double nSigmaClipXCorr) {
        this.nSigmaClipXCorr = nSigmaClipXCorr;
    }

    public int getMaxLag() {
        return maxLag;
    }

    public void setMaxLag(int maxLag) {
        this.maxLag = maxLag;
    }

    public int getNPixBorderGainCalc() {
        return nPixBorderGainCalc;
    }

    public void setNPixBorderGainCalc(int nPixBorderGainCalc) {
        this.nPixBorderGainCalc = nPixBorderGainCalc;
    }

    public int getNPixBorderXCorr() {
        return nPixBorderXCorr;
    }

    public void setNPixBorderXCorr(int nPixBorderXCorr) {
        this.nPixBorderXCorr = nPixBorderXCorr;
    }

    /**
     * Empirical correction for the bias sigma-clipping introduces in the mean
     * of the (non-Gaussian) pixel products. Treated as an opaque calibration
     * constant.
     *
     * @return The bias correction divisor
     */
    public double getBiasCorr() {
        return biasCorr;
    }

    public void setBiasCorr(double biasCorr) {
        this.biasCorr = biasCorr;
    }

    public int getBackgroundBinSize() {
        return backgroundBinSize;
    }

    public void setBackgroundBinSize(int backgroundBinSize) {
        this.backgroundBinSize = backgroundBinSize;
    }

    public boolean isFixPtcThroughOrigin() {
        return fixPtcThroughOrigin;
    }

    public void setFixPtcThroughOrigin(boolean fixPtcThroughOrigin) {
        this.fixPtcThroughOrigin = fixPtcThroughOrigin;
    }

    public KernelLevel getLevel() {
        return level;
    }

    public void setLevel(KernelLevel level) {
        this.level = level;
    }

    @Override
    public String toString() {
        return "BrighterFatterConfig{" + "doCalcGains=" + doCalcGains + ", maxIterRegression=" + maxIterRegression
                + ", nSigmaClipGainCalc=" + nSigmaClipGainCalc + ", nSigmaClipRegression=" + nSigmaClipRegression
                + ", xcorrCheckRejectLevel=" + xcorrCheckRejectLevel + ", maxIterSOR=" + maxIterSOR + ", eLevelSOR=" + eLevelSOR
                + ", nSigmaClipKernelGen=" + nSigmaClipKernelGen + ", nSigmaClipXCorr=" + nSigmaClipXCorr + ", maxLag=" + maxLag
                + ", nPixBorderGainCalc=" + nPixBorderGainCalc + ", nPixBorderXCorr=" + nPixBorderXCorr + ", biasCorr=" + biasCorr
                + ", backgroundBinSize=" + backgroundBinSize + ", fixPtcThroughOrigin=" + fixPtcThroughOrigin + ", level=" + level + '}';
    }
}
