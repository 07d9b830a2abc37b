package io.github.jakubt4.doppler.service.store;

import io.github.jakubt4.doppler.model.AnalysisSnapshot;

/**
 * Persistence of analysis results.
 */
public interface ResultStore {

    void save(AnalysisSnapshot snapshot);

    /**
     * @throws io.github.jakubt4.doppler.exception.ResourceException if no snapshot with that id exists
     */
    AnalysisSnapshot load(String id);

    /**
     * @return {@code true} if a snapshot was removed
     */
    boolean delete(String id);
}
