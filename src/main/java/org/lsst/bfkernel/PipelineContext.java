package org.lsst.bfkernel;

import java.util.Objects;

/**
 * Everything a processing step needs besides its data: the (frozen)
 * configuration of the run and the sink for data quality rejections.
 */
public class PipelineContext {

    private final BrighterFatterConfig config;
    private final Diagnostics diagnostics;

    public PipelineContext(BrighterFatterConfig config) {
        this(config, new Diagnostics());
    }

    public PipelineContext(BrighterFatterConfig config, Diagnostics diagnostics) {
        BrighterFatterConfig frozen = Objects.requireNonNull(config, "config").copy();
        frozen.validate();
        this.config = frozen;
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * @return A private copy of the configuration, changes to it do not
     * affect this context
     */
    public BrighterFatterConfig getConfig() {
        return config.copy();
    }

    BrighterFatterConfig config() {
        return config;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }
}
