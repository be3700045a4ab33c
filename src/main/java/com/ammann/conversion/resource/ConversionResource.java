/* (C)2026 */
package com.ammann.conversion.resource;

import com.ammann.conversion.dto.ConversionJobDTO;
import com.ammann.conversion.dto.ConversionRequestDTO;
import com.ammann.conversion.dto.ConversionStartResponseDTO;
import com.ammann.conversion.dto.FormatsResponseDTO;
import com.ammann.conversion.exception.JobConflictException;
import com.ammann.conversion.exception.JobNotFoundException;
import com.ammann.conversion.exception.ValidationException;
import com.ammann.conversion.model.JobSnapshot;
import com.ammann.conversion.properties.ApiProperties;
import com.ammann.conversion.service.ConversionEngine;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for submitting document conversions and tracking their jobs.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Conversion API", description = "Document conversion jobs")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConversionResource {

    private static final Logger LOG = Logger.getLogger(ConversionResource.class);
    private static final int MAX_LIST_LIMIT = 200;

    @Inject ConversionEngine engine;

    @GET
    @Path(ApiProperties.Formats.BASE)
    @Operation(
            summary = "Supported formats",
            description = "Lists the document formats and the direct conversions between them")
    public FormatsResponseDTO getFormats() {
        return FormatsResponseDTO.of(engine.listFormats(), engine.supportedConversions());
    }

    @POST
    @Path(ApiProperties.Conversions.BASE)
    @Operation(
            summary = "Submit conversion",
            description =
                    "Queues a conversion job. With 'wait' the response is delayed until the job"
                            + " finishes or the wait elapses.")
    @APIResponses({
        @APIResponse(
                responseCode = "202",
                description = "Job accepted",
                content = @Content(schema = @Schema(implementation = ConversionStartResponseDTO.class))),
        @APIResponse(
                responseCode = "200",
                description = "Job finished within the requested wait",
                content = @Content(schema = @Schema(implementation = ConversionJobDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid format or request body"),
        @APIResponse(responseCode = "413", description = "Payload too large"),
        @APIResponse(responseCode = "422", description = "No conversion path between the formats")
    })
    public Uni<Response> submit(
            ConversionRequestDTO request,
            @Parameter(description = "Seconds to wait for the job to finish (max 300)")
                    @QueryParam("wait")
                    @DefaultValue("0")
                    @Min(0)
                    @Max(300)
                    int waitSeconds) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }

        UUID jobId = engine.submit(request.sourceFormat(), request.targetFormat(), request.payload());
        if (waitSeconds == 0) {
            return Uni.createFrom().item(Response.accepted(ConversionStartResponseDTO.queued(jobId)).build());
        }

        LOG.debugf("Waiting up to %ds for job %s", waitSeconds, jobId);
        return engine.await(jobId, Duration.ofSeconds(waitSeconds))
                .map(ConversionJobDTO::from)
                .map(dto -> Response.status(dto.isActive() ? Response.Status.ACCEPTED : Response.Status.OK)
                        .entity(dto)
                        .build());
    }

    @GET
    @Path(ApiProperties.Conversions.BASE)
    @Operation(summary = "Recent jobs", description = "Returns the most recently submitted jobs")
    public List<ConversionJobDTO> listJobs(
            @Parameter(description = "Maximum number of jobs (max 200)")
                    @QueryParam("limit")
                    @DefaultValue("20")
                    int limit) {
        int effectiveLimit = Math.min(Math.max(1, limit), MAX_LIST_LIMIT);
        return engine.recentJobs(effectiveLimit).stream().map(ConversionJobDTO::from).toList();
    }

    @GET
    @Path(ApiProperties.Conversions.BASE + ApiProperties.Conversions.JOB)
    @Operation(summary = "Job status", description = "Status, result or error of one conversion job")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Job found",
                content = @Content(schema = @Schema(implementation = ConversionJobDTO.class))),
        @APIResponse(responseCode = "404", description = "Unknown or evicted job")
    })
    public ConversionJobDTO getJob(@PathParam("jobId") String jobId) {
        return ConversionJobDTO.from(find(jobId));
    }

    @GET
    @Path(ApiProperties.Conversions.BASE + ApiProperties.Conversions.RESULT)
    @Produces(MediaType.WILDCARD)
    @Operation(summary = "Job result", description = "Raw converted document")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Converted document"),
        @APIResponse(responseCode = "404", description = "Unknown or evicted job"),
        @APIResponse(responseCode = "409", description = "Job has not completed")
    })
    public Response getResult(@PathParam("jobId") String jobId) {
        JobSnapshot job = find(jobId);
        if (job.result() == null) {
            throw new JobConflictException(job.id(), job.status(), "download the result of");
        }
        String filename = "converted-" + job.id() + "." + job.targetFormat().extension();
        return Response.ok(job.result().content(), job.result().contentType())
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .build();
    }

    @DELETE
    @Path(ApiProperties.Conversions.BASE + ApiProperties.Conversions.JOB)
    @Operation(summary = "Delete job", description = "Removes a finished job and its result")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Job deleted"),
        @APIResponse(responseCode = "404", description = "Unknown or evicted job"),
        @APIResponse(responseCode = "409", description = "Job is still queued or running")
    })
    public Response deleteJob(@PathParam("jobId") String jobId) {
        engine.delete(parseId(jobId));
        return Response.noContent().build();
    }

    private JobSnapshot find(String jobId) {
        UUID id = parseId(jobId);
        return engine.status(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    /** Malformed ids cannot name an existing job. */
    static UUID parseId(String jobId) {
        try {
            return UUID.fromString(jobId);
        } catch (IllegalArgumentException e) {
            throw new JobNotFoundException(jobId);
        }
    }
}
