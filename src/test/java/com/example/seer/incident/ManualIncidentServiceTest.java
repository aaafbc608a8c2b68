package com.example.seer.incident;

import com.example.seer.domain.IncidentRecord;
import com.example.seer.domain.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ManualIncidentServiceTest {

    private IncidentRegistry registry;
    private ManualIncidentService service;

    @BeforeEach
    void setUp() {
        registry = mock(IncidentRegistry.class);
        when(registry.register(any())).thenReturn(new IncidentRecord());
        service = new ManualIncidentService(registry,
                Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    private NewIncident submitted() {
        ArgumentCaptor<NewIncident> captor = ArgumentCaptor.forClass(NewIncident.class);
        verify(registry).register(captor.capture());
        return captor.getValue();
    }

    @Test
    void reportedSeverityWins() {
        service.report(new ManualIncidentService.ManualReport("Checkout errors", "checkout", Severity.SEV_1,
                "5xx spike", "production", null, null, null, null));

        NewIncident request = submitted();
        assertThat(request.severity()).isEqualTo(Severity.SEV_1);
        assertThat(request.source()).isEqualTo("manual");
        assertThat(request.anomaly()).isNull();
    }

    @Test
    void estimatedDeviationAttachesAnomalyAndSuggestsSeverity() {
        // |130 - 100| / (100 * 0.1) = 3.0 sigma
        service.report(new ManualIncidentService.ManualReport("Slow API", "api", null,
                "p99 is up", "production", null, "p99_latency", 130.0, 100.0));

        NewIncident request = submitted();
        assertThat(request.severity()).isEqualTo(Severity.SEV_3);
        assertThat(request.anomaly()).isNotNull();
        assertThat(request.anomaly().deviationSigma()).isCloseTo(3.0, within(1e-9));
        assertThat(request.anomaly().severity()).isEqualTo(Severity.SEV_2);
    }

    @Test
    void smallDeviationIsReportedWithoutAnomaly() {
        service.report(new ManualIncidentService.ManualReport("Slightly slow", "api", null,
                null, "production", null, "p99_latency", 110.0, 100.0));

        NewIncident request = submitted();
        assertThat(request.anomaly()).isNull();
        assertThat(request.severity()).isEqualTo(Severity.SEV_3);
    }

    @Test
    void estimateNeedsPositiveExpectedValue() {
        assertThat(ManualIncidentService.estimateSigma(10.0, 0.0)).isEmpty();
        assertThat(ManualIncidentService.estimateSigma(null, 5.0)).isEmpty();
        assertThat(ManualIncidentService.estimateSigma(160.0, 100.0)).contains(6.0);
    }

    @Test
    void titleAndServiceAreRequired() {
        assertThatThrownBy(() -> new ManualIncidentService.ManualReport(" ", "api", null, null, null, null,
                null, null, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ManualIncidentService.ManualReport("t", null, null, null, null, null,
                null, null, null)).isInstanceOf(IllegalArgumentException.class);
    }
}
