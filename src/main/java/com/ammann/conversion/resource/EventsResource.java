/* (C)2026 */
package com.ammann.conversion.resource;

import com.ammann.conversion.model.LifecycleEvent;
import com.ammann.conversion.properties.ApiProperties;
import com.ammann.conversion.service.EventBroadcaster;
import com.ammann.conversion.service.Subscriber;
import com.ammann.conversion.service.Subscriber.SubscriberInfo;
import io.smallrye.mutiny.Multi;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.resteasy.reactive.RestStreamElementType;

/**
 * Server-sent event stream of conversion job lifecycle events.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Events.BASE)
@Tag(name = "Events API", description = "Live conversion job lifecycle events")
public class EventsResource {

    @Inject EventBroadcaster broadcaster;

    @GET
    @Produces(MediaType.SERVER_SENT_EVENTS)
    @RestStreamElementType(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Lifecycle event stream",
            description =
                    "Streams job_queued, job_running, job_completed, job_failed and heartbeat events."
                            + " Slow readers lose their oldest buffered events.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Event stream opened"),
        @APIResponse(responseCode = "503", description = "Subscriber limit reached")
    })
    public Multi<LifecycleEvent> stream() {
        Subscriber subscriber = broadcaster.subscribe();
        return subscriber.stream();
    }

    @GET
    @Path(ApiProperties.Events.SUBSCRIBERS)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Connected subscribers", description = "Buffer and delivery state of each subscriber")
    public List<SubscriberInfo> subscribers() {
        return broadcaster.subscribers();
    }
}
