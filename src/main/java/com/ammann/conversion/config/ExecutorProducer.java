/* (C)2026 */
package com.ammann.conversion.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the executor that runs conversion jobs.
 *
 * <p>{@code maxAsync} equals {@code conversion.jobs.max-concurrent}, which is therefore the
 * number of jobs RUNNING at once. The queue is unbounded so excess jobs wait as QUEUED
 * instead of being refused.
 */
@ApplicationScoped
public class ExecutorProducer {

    @Produces
    @Named("conversion-executor")
    @ApplicationScoped
    public ManagedExecutor createConversionExecutor(ConversionSettings settings) {
        return ManagedExecutor.builder()
                .maxAsync(settings.maxConcurrent())
                .maxQueued(-1)
                .propagated(ThreadContext.NONE)
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }

    void shutdownConversionExecutor(@Disposes @Named("conversion-executor") ManagedExecutor executor) {
        executor.shutdown();
    }
}
