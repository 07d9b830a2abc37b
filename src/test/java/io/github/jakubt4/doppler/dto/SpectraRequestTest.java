package io.github.jakubt4.doppler.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.doppler.exception.DomainException;
import io.github.jakubt4.doppler.exception.ValidationException;
import io.github.jakubt4.doppler.model.FailurePolicy;
import io.github.jakubt4.doppler.model.VelocityGrid;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpectraRequestTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void sharedWavelengthGridIsUsedForEveryEpoch() throws Exception {
        final var request = objectMapper.readValue("""
                {
                    "time": [0.0, 1.0],
                    "wave": [5000.0, 5001.0, 5002.0],
                    "fluxVal": [[1.0, 0.9, 1.0], [1.0, 0.8, 1.0]],
                    "fluxErr": [[0.1, 0.1, 0.1], [0.1, 0.1, 0.1]],
                    "spectralType": "G2V",
                    "criteria": ["strong"],
                    "velocityGrid": [-10.0, 10.0, 0.5],
                    "failurePolicy": "ABORT"
                }
                """, SpectraRequest.class);

        final var spectra = request.toSpectra();
        assertThat(spectra.epochCount()).isEqualTo(2);
        assertThat(spectra.wave()[1]).containsExactly(5000.0, 5001.0, 5002.0);
        assertThat(request.failurePolicy()).isEqualTo(FailurePolicy.ABORT);
        assertThat(request.toVelocityGrid()).isEqualTo(new VelocityGrid(-10.0, 10.0, 0.5));

        final var source = request.toMaskSource();
        assertThat(source.path()).isNull();
        assertThat(source.spectralType()).isEqualTo("G2V");
        assertThat(source.criteria()).containsExactly("strong");
    }

    @Test
    void perEpochGridsAreAccepted() throws Exception {
        final var request = objectMapper.readValue("""
                {
                    "time": [0.0, 1.0],
                    "waves": [[5000.0, 5001.0], [5000.1, 5001.1]],
                    "fluxVal": [[1.0, 0.9], [1.0, 0.8]],
                    "fluxErr": [[0.1, 0.1], [0.1, 0.1]],
                    "maskPath": "masks/K5_harps.csv"
                }
                """, SpectraRequest.class);

        assertThat(request.toSpectra().wave()[1]).containsExactly(5000.1, 5001.1);
        assertThat(request.toMaskSource().path()).isEqualTo(Path.of("masks/K5_harps.csv"));
        assertThat(request.toVelocityGrid()).isNull();
    }

    @Test
    void missingFluxErrorsAreRejected() throws Exception {
        final var request = objectMapper.readValue("""
                {"time": [0.0], "wave": [5000.0, 5001.0], "fluxVal": [[1.0, 0.9]]}
                """, SpectraRequest.class);

        assertThatThrownBy(request::toSpectra)
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("flux errors");
    }

    @Test
    void degenerateVelocityGridIsRejected() throws Exception {
        final var request = objectMapper.readValue("""
                {"velocityGrid": [0.0, 1.0, 0.5]}
                """, SpectraRequest.class);

        assertThatThrownBy(request::toVelocityGrid).isInstanceOf(DomainException.class);
    }

    @Test
    void rejectedResponseSerializesWithoutSeries() throws Exception {
        final var json = objectMapper.readTree(
                objectMapper.writeValueAsString(RvResponse.rejected(AnalysisStatus.REJECTED, "bad input")));

        assertThat(json.get("status").asText()).isEqualTo("REJECTED");
        assertThat(json.get("message").asText()).isEqualTo("bad input");
        assertThat(json.get("rv").isNull()).isTrue();
        assertThat(json.get("failures").isArray()).isTrue();
    }
}
