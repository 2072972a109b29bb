package io.oidcendpoint.server.core;

/**
 * Client authentication was required and did not succeed.
 *
 * <p>Raised from request parsing; hosts map it to 401 or 403.
 */
public class UnauthorizedClientException extends RuntimeException {
    private final String endpoint;

    public UnauthorizedClientException(String endpoint, String message) {
        super(message);
        this.endpoint = endpoint;
    }

    /** Name of the endpoint that refused the client. */
    public String endpoint() {
        return endpoint;
    }
}
