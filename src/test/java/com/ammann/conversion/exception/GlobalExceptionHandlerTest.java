package com.ammann.conversion.exception;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.conversion.enumeration.Format;
import com.ammann.conversion.enumeration.JobStatus;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
        handler.uriInfo = null;
    }

    private static GlobalExceptionHandler.ErrorResponse body(Response response) {
        return (GlobalExceptionHandler.ErrorResponse) response.getEntity();
    }

    @Test
    @DisplayName("should map unknown formats to 400")
    void mapsInvalidFormatToBadRequest() {
        Response response = handler.toResponse(ConversionRejectedException.invalidFormat("rtf"));

        assertThat(response.getStatus()).isEqualTo(400);
        assertThat(body(response).code).isEqualTo("INVALID_FORMAT");
        assertThat(body(response).message).contains("rtf");
        assertThat(body(response).path).isNull();
    }

    @Test
    @DisplayName("should map oversized payloads to 413")
    void mapsPayloadTooLarge() {
        Response response = handler.toResponse(ConversionRejectedException.payloadTooLarge(2048, 1024));

        assertThat(response.getStatus()).isEqualTo(413);
        assertThat(body(response).code).isEqualTo("PAYLOAD_TOO_LARGE");
    }

    @Test
    @DisplayName("should map unreachable targets to 422")
    void mapsUnsupportedConversion() {
        Response response = handler.toResponse(
                ConversionRejectedException.unsupportedConversion(Format.TEXT, Format.DOCX));

        assertThat(response.getStatus()).isEqualTo(ConversionRejectedException.UNPROCESSABLE_ENTITY);
        assertThat(body(response).code).isEqualTo("UNSUPPORTED_CONVERSION");
        assertThat(body(response).status).isEqualTo(422);
    }

    @Test
    @DisplayName("should map validation failures to 400")
    void mapsValidationException() {
        Response response = handler.toResponse(new ValidationException("bad input"));

        assertThat(response.getStatus()).isEqualTo(400);
        assertThat(body(response).code).isEqualTo("VALIDATION_ERROR");
    }

    @Test
    @DisplayName("should name both fields when document content is ambiguous")
    void mapsConflictingDocuments() {
        Response response = handler.toResponse(ValidationException.conflictingDocuments("content", "contentBase64"));

        assertThat(response.getStatus()).isEqualTo(400);
        assertThat(body(response).message).isEqualTo("Specify either 'content' or 'contentBase64', not both");
    }

    @Test
    @DisplayName("should map missing jobs to 404")
    void mapsMissingJob() {
        UUID id = UUID.randomUUID();

        Response response = handler.toResponse(new JobNotFoundException(id));

        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(body(response).message).contains(id.toString());
        assertThat(body(response).code).isEqualTo("NOT_FOUND");
        assertThat(handler.toResponse(new NotFoundException("missing")).getStatus()).isEqualTo(404);
    }

    @Test
    @DisplayName("should map operations on active jobs to 409")
    void mapsConflict() {
        Response response = handler.toResponse(new JobConflictException(UUID.randomUUID(), JobStatus.RUNNING, "delete"));

        assertThat(response.getStatus()).isEqualTo(409);
        assertThat(body(response).code).isEqualTo("CONFLICT");
        assertThat(body(response).message).contains("RUNNING");
    }

    @Test
    @DisplayName("should map a full subscriber list to 503")
    void mapsSubscriberLimit() {
        Response response = handler.toResponse(new SubscriberLimitException(5));

        assertThat(response.getStatus()).isEqualTo(503);
        assertThat(body(response).code).isEqualTo("SUBSCRIBER_LIMIT");
    }

    @Test
    @DisplayName("should hide details of unexpected exceptions")
    void mapsUnhandledTo500() {
        Response response = handler.toResponse(new RuntimeException("boom"));

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(body(response).code).isEqualTo("INTERNAL_ERROR");
        assertThat(body(response).message).isEqualTo("An unexpected error occurred");
    }
}
