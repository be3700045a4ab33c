/* (C)2026 */
package com.ammann.conversion.health;

import com.ammann.conversion.service.ConversionEngine;
import com.ammann.conversion.service.EventBroadcaster;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness of the conversion engine.
 *
 * <p>Status semantics:
 * <ul>
 *   <li>UP: the conversion executor accepts new jobs</li>
 *   <li>DOWN: the executor has been shut down</li>
 * </ul>
 */
@Readiness
@ApplicationScoped
public class ConversionEngineHealthCheck implements HealthCheck {

    @Inject ConversionEngine engine;

    @Inject EventBroadcaster broadcaster;

    @Override
    public HealthCheckResponse call() {
        boolean accepting = engine.isAcceptingWork();
        return HealthCheckResponse.named("conversion-engine")
                .status(accepting)
                .withData("accepting-jobs", accepting)
                .withData("jobs", engine.jobCount())
                .withData("direct-conversions", engine.supportedConversions().size())
                .withData("subscribers", broadcaster.subscriberCount())
                .build();
    }
}
