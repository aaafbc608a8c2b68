package com.example.seer.detection;

import com.example.seer.domain.Severity;

import java.util.Optional;

/**
 * Maps a deviation expressed in sigmas to a severity.
 *
 * <p>{@link #BANDED} is canonical: every {@link com.example.seer.domain.AnomalyResult}
 * is validated against it. {@link #TIERED} only suggests a severity for manually
 * reported anomalies, where the deviation is estimated rather than measured.
 */
public enum SeverityScheme {

    /** >= 5σ Sev-1, [3σ, 5σ) Sev-2, below 3σ not an anomaly. */
    BANDED {
        @Override
        public Optional<Severity> classify(double deviationSigma) {
            if (Double.isNaN(deviationSigma)) return Optional.empty();
            if (deviationSigma >= 5.0) return Optional.of(Severity.SEV_1);
            if (deviationSigma >= 3.0) return Optional.of(Severity.SEV_2);
            return Optional.empty();
        }
    },

    /** >= 5σ Sev-1, >= 4σ Sev-2, anything else Sev-3. */
    TIERED {
        @Override
        public Optional<Severity> classify(double deviationSigma) {
            if (Double.isNaN(deviationSigma)) return Optional.empty();
            if (deviationSigma >= 5.0) return Optional.of(Severity.SEV_1);
            if (deviationSigma >= 4.0) return Optional.of(Severity.SEV_2);
            return Optional.of(Severity.SEV_3);
        }
    };

    public abstract Optional<Severity> classify(double deviationSigma);
}
