package com.ammann.fedstats.exception;

import com.ammann.fedstats.enumeration.FailureKind;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest
{

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp()
    {
        handler = new GlobalExceptionHandler();
        handler.uriInfo = null;
    }

    private static GlobalExceptionHandler.ErrorResponse body(Response response)
    {
        return (GlobalExceptionHandler.ErrorResponse) response.getEntity();
    }

    @Test
    void mapsValidationExceptionToBadRequest()
    {
        Response response = handler.toResponse(ValidationException.missingField("tasks"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.BAD_REQUEST.getStatusCode());
        assertThat(body(response).path).isNull();
        assertThat(body(response).code).isEqualTo("VALIDATION_ERROR");
        assertThat(body(response).message).contains("tasks");
    }

    @Test
    void mapsRunNotFoundTo404()
    {
        Response response = handler.toResponse(new RunNotFoundException("run-1"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.NOT_FOUND.getStatusCode());
        assertThat(body(response).code).isEqualTo("NOT_FOUND");
        assertThat(body(response).message).contains("run-1");
    }

    @Test
    void mapsNotFoundTo404()
    {
        Response response = handler.toResponse(new NotFoundException("missing"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.NOT_FOUND.getStatusCode());
        assertThat(body(response).message).contains("missing");
    }

    @Test
    void mapsArtifactStoreExceptionToServiceUnavailable()
    {
        Response response = handler.toResponse(new ArtifactStoreException("disk full"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.SERVICE_UNAVAILABLE.getStatusCode());
        assertThat(body(response).code).isEqualTo("ARTIFACT_STORE_ERROR");
    }

    @Test
    void mapsRoundFailureToConflictWithKind()
    {
        Response response = handler.toResponse(
                new RoundFailureException(FailureKind.QUORUM_NOT_MET, "too few sites"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.CONFLICT.getStatusCode());
        assertThat(body(response).code).isEqualTo("QUORUM_NOT_MET");
        assertThat(body(response).status).isEqualTo(409);
    }

    @Test
    void mapsUnhandledTo500()
    {
        Response response = handler.toResponse(new RuntimeException("boom"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode());
        assertThat(body(response).code).isEqualTo("INTERNAL_ERROR");
        assertThat(body(response).message).doesNotContain("boom");
        assertThat(body(response).timestamp).isNotNull();
    }
}
