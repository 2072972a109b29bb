package io.oidcendpoint.server.spi;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of client authentication.
 */
public sealed interface AuthnResult permits AuthnResult.Authenticated, AuthnResult.NoMethod, AuthnResult.Failed {

    /**
     * A recognized method succeeded.
     *
     * @param clientId the authenticated client, if the method identifies one
     * @param method name of the method that succeeded, e.g. {@code client_secret_basic}
     */
    record Authenticated(Optional<String> clientId, String method) implements AuthnResult {
        public Authenticated {
            Objects.requireNonNull(clientId, "clientId");
            Objects.requireNonNull(method, "method");
        }

        public Authenticated(String clientId, String method) {
            this(Optional.ofNullable(clientId), method);
        }
    }

    /**
     * The request carried no credential of any recognized method.
     */
    record NoMethod() implements AuthnResult {}

    /**
     * A recognized method was used but the credential was rejected.
     *
     * @param reason why the credential was rejected; not meant for the client
     */
    record Failed(String reason) implements AuthnResult {
        public Failed {
            Objects.requireNonNull(reason, "reason");
        }
    }

    static AuthnResult authenticated(String clientId, String method) {
        return new Authenticated(clientId, method);
    }

    static AuthnResult noMethod() {
        return new NoMethod();
    }

    static AuthnResult failed(String reason) {
        return new Failed(reason);
    }
}
