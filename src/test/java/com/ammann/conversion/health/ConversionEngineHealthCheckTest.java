/* (C)2026 */
package com.ammann.conversion.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.conversion.enumeration.Format;
import com.ammann.conversion.model.FormatPair;
import com.ammann.conversion.service.ConversionEngine;
import com.ammann.conversion.service.EventBroadcaster;
import java.util.Set;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConversionEngineHealthCheck")
class ConversionEngineHealthCheckTest {

    private ConversionEngineHealthCheck check;

    @BeforeEach
    void setUp() {
        check = new ConversionEngineHealthCheck();
        check.engine = mock(ConversionEngine.class);
        check.broadcaster = mock(EventBroadcaster.class);
        when(check.engine.jobCount()).thenReturn(3);
        when(check.engine.supportedConversions()).thenReturn(Set.of(FormatPair.of(Format.TEXT, Format.HTML)));
        when(check.broadcaster.subscriberCount()).thenReturn(2);
    }

    @Test
    @DisplayName("should report UP with engine statistics while accepting jobs")
    void shouldReportUp() {
        when(check.engine.isAcceptingWork()).thenReturn(true);

        HealthCheckResponse response = check.call();

        assertThat(response.getName()).isEqualTo("conversion-engine");
        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).hasValueSatisfying(data -> assertThat(data)
                .containsEntry("accepting-jobs", true)
                .containsEntry("jobs", 3L)
                .containsEntry("direct-conversions", 1L)
                .containsEntry("subscribers", 2L));
    }

    @Test
    @DisplayName("should report DOWN once the executor is shut down")
    void shouldReportDown() {
        when(check.engine.isAcceptingWork()).thenReturn(false);

        assertThat(check.call().getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
    }
}
