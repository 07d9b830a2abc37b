package io.github.jakubt4.doppler.dto;

/**
 * Status strings used in analysis responses.
 */
public final class AnalysisStatus {

    public static final String MEASURED = "MEASURED";
    public static final String CANCELLED = "CANCELLED";
    public static final String COMPUTED = "COMPUTED";
    public static final String FITTED = "FITTED";
    public static final String NOT_CONVERGED = "NOT_CONVERGED";
    public static final String REJECTED = "REJECTED";

    private AnalysisStatus() {
    }
}
