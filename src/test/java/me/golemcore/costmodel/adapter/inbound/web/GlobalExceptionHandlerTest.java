package me.golemcore.costmodel.adapter.inbound.web;

import me.golemcore.costmodel.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.costmodel.domain.exception.InsufficientDataException;
import me.golemcore.costmodel.domain.exception.InvalidRangeException;
import me.golemcore.costmodel.domain.exception.QueryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import reactor.test.StepVerifier;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldMapInvalidRangeToBadRequest() {
        InvalidRangeException ex = new InvalidRangeException("Invalid duration 'soon'");

        StepVerifier.create(handler.handleIllegalArgument(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(400, body.getStatus());
                    assertEquals("Invalid duration 'soon'", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapInsufficientDataToNotFound() {
        InsufficientDataException ex = new InsufficientDataException(
                "Not enough data available in the selected time range");

        StepVerifier.create(handler.handleInsufficientData(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(404, body.getStatus());
                    assertEquals("Not enough data available in the selected time range", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapQueryFailureToBadGateway() {
        QueryException ex = new QueryException("totalCPU", "query totalCPU failed: Prometheus returned HTTP 503",
                null);

        StepVerifier.create(handler.handleQuery(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(502, body.getStatus());
                    assertEquals("query totalCPU failed: Prometheus returned HTTP 503", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        RuntimeException ex = new RuntimeException("NullPointer somewhere deep");

        StepVerifier.create(handler.handleGeneric(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(500, body.getStatus());
                    assertEquals("Internal server error", body.getMessage());
                })
                .verifyComplete();
    }
}
