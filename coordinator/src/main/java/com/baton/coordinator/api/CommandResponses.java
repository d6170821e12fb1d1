package com.baton.coordinator.api;

import com.baton.coordinator.api.dto.ErrorResponse;
import com.baton.coordinator.service.CommandResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.function.Function;

/**
 * Maps command results to HTTP responses.
 *
 *   OK               -> okStatus (200 or 201) with the mapped body
 *   VALIDATION_ERROR -> 400
 *   NOT_FOUND        -> 404
 *   CONFLICT         -> 200; the request was already applied, nothing changed
 *   INTERNAL_ERROR   -> 503; safe to retry
 */
final class CommandResponses {

    private CommandResponses() {}

    static <T> ResponseEntity<Object> respond(CommandResult<T> result, HttpStatus okStatus,
                                              Function<T, ?> body) {
        return switch (result.status()) {
            case OK -> ResponseEntity.status(okStatus).body(body.apply(result.value()));
            case VALIDATION_ERROR -> error(HttpStatus.BAD_REQUEST, result);
            case NOT_FOUND        -> error(HttpStatus.NOT_FOUND, result);
            case CONFLICT         -> error(HttpStatus.OK, result);
            case INTERNAL_ERROR   -> error(HttpStatus.SERVICE_UNAVAILABLE, result);
        };
    }

    static <T> ResponseEntity<Object> respond(CommandResult<T> result, Function<T, ?> body) {
        return respond(result, HttpStatus.OK, body);
    }

    private static ResponseEntity<Object> error(HttpStatus http, CommandResult<?> result) {
        return ResponseEntity.status(http).body(new ErrorResponse(result.status(), result.message()));
    }
}
