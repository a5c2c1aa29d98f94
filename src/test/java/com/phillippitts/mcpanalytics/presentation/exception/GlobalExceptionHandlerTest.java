package com.phillippitts.mcpanalytics.presentation.exception;

import com.phillippitts.mcpanalytics.exception.InvalidImportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void invalidImportReturns400WithReason() {
        InvalidImportException ex = new InvalidImportException("totalRequests must be non-negative, got -5");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleInvalidImport(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("InvalidImportException");
        assertThat(response.getBody().message()).isEqualTo("Failed to import analytics");
        assertThat(response.getBody().details()).isEqualTo("totalRequests must be non-negative, got -5");
        assertThat(response.getBody().timestamp()).isNotNull();
    }

    @Test
    void unreadableBodyReturns400() {
        HttpMessageNotReadableException ex =
                new HttpMessageNotReadableException("JSON parse error", mock(HttpInputMessage.class));

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleUnreadable(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("MalformedRequest");
    }

    @Test
    void unexpectedErrorReturns500WithoutInternals() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("secret internal detail"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).doesNotContain("secret internal detail");
    }

    @Test
    void frameworkErrorsKeepTheirStatus() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new NoResourceFoundException(HttpMethod.GET, "missing"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().errorCode()).isEqualTo("NoResourceFoundException");
    }
}
