package com.ammann.conversion.health;

import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness of the conversion service process, with its uptime.
 */
@Liveness
@ApplicationScoped
public class LivenessCheck implements HealthCheck
{
    private final Instant startedAt = Instant.now();

    @Override
    public HealthCheckResponse call()
    {
        return HealthCheckResponse.named("alive")
                .up()
                .withData("started-at", startedAt.toString())
                .withData("uptime-seconds", Duration.between(startedAt, Instant.now()).toSeconds())
                .build();
    }
}
