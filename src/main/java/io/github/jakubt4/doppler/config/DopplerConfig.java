package io.github.jakubt4.doppler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.doppler.client.GlsPeriodogramEngine;
import io.github.jakubt4.doppler.client.PeriodogramEngine;
import io.github.jakubt4.doppler.model.VelocityGrid;
import io.github.jakubt4.doppler.service.component.ComponentTypeRegistry;
import io.github.jakubt4.doppler.service.mask.DirectoryMaskRepository;
import io.github.jakubt4.doppler.service.mask.MaskRepository;
import io.github.jakubt4.doppler.service.mask.MkSpectralTypeScale;
import io.github.jakubt4.doppler.service.mask.SpectralTypeScale;
import io.github.jakubt4.doppler.service.store.JsonResultStore;
import io.github.jakubt4.doppler.service.store.ResultStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the external collaborators of the analysis: periodogram engine, mask repository,
 * spectral-type scale, component type table and result store.
 */
@Slf4j
@Configuration
public class DopplerConfig {

    @Bean
    PeriodogramEngine periodogramEngine(@Value("${doppler.periodogram.oversampling:10}") final int oversampling) {
        log.info("Periodogram engine — GLS, oversampling={}", oversampling);
        return new GlsPeriodogramEngine(oversampling);
    }

    @Bean
    MaskRepository maskRepository(@Value("${doppler.masks.directory:masks}") final Path directory) {
        log.info("Mask repository — {}", directory.toAbsolutePath());
        return new DirectoryMaskRepository(directory);
    }

    @Bean
    SpectralTypeScale spectralTypeScale() {
        return new MkSpectralTypeScale();
    }

    @Bean
    ComponentTypeRegistry componentTypeRegistry() {
        return ComponentTypeRegistry.standard();
    }

    @Bean
    ResultStore resultStore(final ObjectMapper objectMapper,
                            @Value("${doppler.store.directory:results}") final Path directory) {
        return new JsonResultStore(objectMapper, directory);
    }

    @Bean
    VelocityGrid defaultVelocityGrid(@Value("${doppler.ccf.velocity-grid.start:-20}") final double start,
                                     @Value("${doppler.ccf.velocity-grid.stop:20}") final double stop,
                                     @Value("${doppler.ccf.velocity-grid.step:0.25}") final double step) {
        return new VelocityGrid(start, stop, step);
    }
}
