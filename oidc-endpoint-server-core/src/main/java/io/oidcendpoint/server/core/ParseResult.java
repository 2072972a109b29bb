package io.oidcendpoint.server.core;

import io.oidcendpoint.message.ErrorResponse;
import io.oidcendpoint.message.Message;

import java.util.Objects;

/**
 * Outcome of {@link Endpoint#parseRequest}: a verified request, or the error response to send
 * back in its place.
 */
public sealed interface ParseResult<Q extends Message> permits ParseResult.Parsed, ParseResult.Rejected {

    record Parsed<Q extends Message>(Q request) implements ParseResult<Q> {
        public Parsed {
            Objects.requireNonNull(request, "request");
        }
    }

    /**
     * The request failed protocol validation.
     *
     * @param error an {@code invalid_request} error message of the endpoint's error type
     */
    record Rejected<Q extends Message>(ErrorResponse error) implements ParseResult<Q> {
        public Rejected {
            Objects.requireNonNull(error, "error");
        }
    }
}
