package org.lsst.bfkernel;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;

public class BrighterFatterConfigTest {

    private static InputStream properties(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testDefaults() {
        BrighterFatterConfig config = BrighterFatterConfig.defaults();
        assertTrue(config.isDoCalcGains());
        assertEquals(5, config.getMaxLag());
        assertEquals(10, config.getNPixBorderXCorr());
        assertEquals(0.9241, config.getBiasCorr(), 0);
        assertEquals(5.0e-14, config.getELevelSOR(), 0);
        assertEquals(10000, config.getMaxIterSOR());
        assertEquals(KernelLevel.CCD, config.getLevel());
        config.validate();
    }

    @Test
    public void testLoad() throws IOException {
        BrighterFatterConfig config = new BrighterFatterConfig();
        config.load(properties("maxLag = 3\nlevel = amp\nfixPtcThroughOrigin = false\n"));
        assertEquals(3, config.getMaxLag());
        assertEquals(KernelLevel.AMP, config.getLevel());
        assertFalse(config.isFixPtcThroughOrigin());
        // untouched values keep their defaults
        assertEquals(4, config.getNSigmaClipKernelGen(), 0);
    }

    @Test
    public void testUnknownKey() {
        try {
            new BrighterFatterConfig().load(properties("maxLags = 3\n"));
            fail("should not reach here");
        } catch (IOException x) {
            assertTrue(x.getMessage().contains("maxLags"));
        }
    }

    @Test(expected = IOException.class)
    public void testInvalidBoolean() throws IOException {
        new BrighterFatterConfig().load(properties("doCalcGains = yes\n"));
    }

    @Test
    public void testSystemProperty() {
        System.setProperty(BrighterFatterConfig.SYSTEM_PROPERTY_PREFIX + "maxIterSOR", "250");
        try {
            assertEquals(250, BrighterFatterConfig.defaults().getMaxIterSOR());
        } finally {
            System.clearProperty(BrighterFatterConfig.SYSTEM_PROPERTY_PREFIX + "maxIterSOR");
        }
    }

    @Test
    public void testValidate() {
        BrighterFatterConfig config = new BrighterFatterConfig();
        config.setMaxLag(0);
        try {
            config.validate();
            fail("should not reach here");
        } catch (IllegalArgumentException x) {
            assertTrue(x.getMessage().contains("maxLag"));
        }
        config.setMaxLag(2);
        config.setNPixBorderXCorr(-1);
        try {
            new PipelineContext(config);
            fail("should not reach here");
        } catch (IllegalArgumentException x) {
            assertTrue(x.getMessage().contains("nPixBorderXCorr"));
        }
    }

    @Test
    public void testContextIsFrozen() {
        BrighterFatterConfig config = new BrighterFatterConfig();
        PipelineContext context = new PipelineContext(config);
        config.setMaxLag(2);
        assertEquals(5, context.getConfig().getMaxLag());
        context.getConfig().setMaxLag(3);
        assertEquals(5, context.getConfig().getMaxLag());
    }
}
