package com.capreg.plugin;

/**
 * Thrown once loading completes (or stops, under {@link LoadPolicy#FAIL_FAST}) and the policy deems the load
 * failed. The report lists every module outcome up to that point.
 */
public final class PluginLoadingFailedException extends RuntimeException {

    private final LoadReport report;

    public PluginLoadingFailedException(String message, LoadReport report) {
        super(message, report.getFailures().isEmpty() ? null : report.getFailures().get(0));
        this.report = report;
    }

    public LoadReport getReport() {
        return report;
    }
}
