package com.nsmctl.commandline.config;

/**
 * A config object that owns an {@link AnalyzerCollection}.
 */
public interface AnalyzerConfig {

    AnalyzerCollection getAnalyzers();
}
