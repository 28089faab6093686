package com.di.featurenova.exception;

import com.di.featurenova.pipeline.error.ErrorCategory;
import com.di.featurenova.pipeline.error.IngestionException;
import com.di.featurenova.pipeline.error.SchemaValidationException;
import com.di.featurenova.pipeline.error.TransformationException;
import com.di.featurenova.pipeline.source.RecordSourceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();
    private final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/pipeline/runs");

    @Test
    @DisplayName("Should map a schema failure to 422 with the missing columns")
    void testHandleUnprocessable_Schema() {
        SchemaValidationException ex = new SchemaValidationException(Map.of("train", List.of("B")));

        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response = handler.handleUnprocessable(ex, request);

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = response.getBody();
        assertNotNull(body);
        assertEquals(422, body.getStatus());
        assertEquals("SCHEMA_ERROR", body.getErrorCategory());
        assertEquals("/api/pipeline/runs", body.getPath());
        assertEquals("validation", body.getDetails().get("stage"));
        assertEquals(Map.of("train", List.of("B")), body.getDetails().get("missingColumns"));
    }

    @Test
    @DisplayName("Should map a transformation failure to 422 with the column")
    void testHandleUnprocessable_Transformation() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
                handler.handleUnprocessable(new TransformationException("A", "bad value"), request);

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        assertEquals("transformation", response.getBody().getDetails().get("stage"));
        assertEquals("A", response.getBody().getDetails().get("column"));
    }

    @Test
    @DisplayName("Should map source failures to 502 with the root cause")
    void testHandleSource() {
        IngestionException ex = new IngestionException("read failed", 14, new RecordSourceException("reset",
                new IOException("socket closed")));

        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response = handler.handleSource(ex, request);

        assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = response.getBody();
        assertEquals("SOURCE_ERROR", body.getErrorCategory());
        assertEquals(IOException.class.getName(), body.getDetails().get("rootCauseType"));
        assertEquals("socket closed", body.getDetails().get("rootCauseMessage"));
        assertEquals(HttpStatus.BAD_GATEWAY,
                handler.handleSource(new RecordSourceException("gone"), request).getStatusCode());
    }

    @Test
    @DisplayName("Should map argument errors to 400 and missing resources to 404")
    void testHandleClientErrors() {
        assertEquals(HttpStatus.BAD_REQUEST,
                handler.handleBadRequest(new IllegalArgumentException("bad stage"), request).getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND,
                handler.handleNotFound(new NoSuchElementException("no report"), request).getStatusCode());
    }

    @Test
    @DisplayName("Should map anything else to 500")
    void testHandleGeneric() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
                handler.handleGeneric(new RuntimeException("boom"), request);

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("APPLICATION_ERROR", response.getBody().getErrorCategory());
        assertEquals("boom", response.getBody().getMessage());
        assertFalse(response.getBody().getDetails().containsKey("rootCauseType"));
    }

    @Test
    @DisplayName("Should fall back to the exception type when there is no message")
    void testBuildErrorResponse_NoMessage() {
        GlobalExceptionHandler.ErrorResponse body = GlobalExceptionHandler.buildErrorResponse(
                ErrorCategory.UNKNOWN, new NullPointerException(), HttpStatus.INTERNAL_SERVER_ERROR, "/x");

        assertEquals("NullPointerException", body.getMessage());
        assertEquals("Internal Server Error", body.getError());
        assertNotNull(body.getTimestamp());
    }
}
