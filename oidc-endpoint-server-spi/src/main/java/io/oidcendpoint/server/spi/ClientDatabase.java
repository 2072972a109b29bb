package io.oidcendpoint.server.spi;

import java.util.Optional;

/**
 * Lookup of registered clients. Shared between requests; implementations must be thread-safe.
 */
@FunctionalInterface
public interface ClientDatabase {

    Optional<ClientInfo> find(String clientId);
}
