package io.oidcendpoint.server.spi;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registered client as seen by client authentication.
 *
 * @param clientId client identifier
 * @param clientSecret shared secret, null for public clients
 * @param tokenEndpointAuthMethod registered authentication method, null if not registered
 * @param metadata remaining registration metadata
 */
public record ClientInfo(String clientId, String clientSecret, String tokenEndpointAuthMethod, Map<String, Object> metadata) {

    public ClientInfo {
        Objects.requireNonNull(clientId, "clientId");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public ClientInfo(String clientId, String clientSecret) {
        this(clientId, clientSecret, null, Map.of());
    }

    public Optional<String> secret() {
        return Optional.ofNullable(clientSecret);
    }
}
