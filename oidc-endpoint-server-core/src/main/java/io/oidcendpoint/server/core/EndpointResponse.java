package io.oidcendpoint.server.core;

import io.oidcendpoint.message.Message;
import io.oidcendpoint.server.spi.HttpHeader;

import java.util.List;
import java.util.Objects;

/**
 * What {@link Endpoint#doResponse} hands back to the host.
 */
public sealed interface EndpointResponse permits EndpointResponse.Error, EndpointResponse.Formatted {

    Object response();

    /**
     * An error message, returned as built: no formatting, no headers.
     */
    record Error(Message response) implements EndpointResponse {
        public Error {
            Objects.requireNonNull(response, "response");
        }
    }

    /**
     * @param response serialized body, or redirect URL for responses placed in the URL
     * @param httpHeaders headers to send with it
     */
    record Formatted(String response, List<HttpHeader> httpHeaders) implements EndpointResponse {
        public Formatted {
            Objects.requireNonNull(response, "response");
            httpHeaders = List.copyOf(httpHeaders);
        }
    }
}
