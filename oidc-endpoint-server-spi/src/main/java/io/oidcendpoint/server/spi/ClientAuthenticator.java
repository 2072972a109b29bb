package io.oidcendpoint.server.spi;

import io.oidcendpoint.message.Message;

/**
 * Client authentication delegate.
 *
 * <p>Inspects the decoded request and the transport credential (typically the value of the
 * {@code Authorization} header) and tells the endpoint who the caller is. It must never invent
 * a client id: it either extracts one from a verified credential or leaves the request's own
 * {@code client_id} to the endpoint.
 */
@FunctionalInterface
public interface ClientAuthenticator {

    /**
     * @param context shared endpoint context
     * @param request the decoded, not yet verified request
     * @param authorization transport credential, may be null
     * @return the authentication outcome, never null
     */
    AuthnResult authenticate(EndpointContext context, Message request, String authorization);

    /**
     * Authenticator that recognizes no method at all.
     */
    static ClientAuthenticator none() {
        return (context, request, authorization) -> AuthnResult.noMethod();
    }
}
