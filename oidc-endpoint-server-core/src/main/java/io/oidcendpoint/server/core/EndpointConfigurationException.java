package io.oidcendpoint.server.core;

/**
 * An endpoint is set up in a way the pipeline cannot serve.
 *
 * <p>Signals a deployment or programming error, never a bad client request. Hosts should answer
 * with a server error rather than a protocol error response.
 */
public class EndpointConfigurationException extends RuntimeException {
    public EndpointConfigurationException(String message) {
        super(message);
    }
}
