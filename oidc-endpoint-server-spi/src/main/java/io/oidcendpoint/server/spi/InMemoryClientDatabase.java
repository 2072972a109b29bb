package io.oidcendpoint.server.spi;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ClientDatabase} kept in a concurrent map.
 */
public final class InMemoryClientDatabase implements ClientDatabase {

    private final Map<String, ClientInfo> clients = new ConcurrentHashMap<>();

    public InMemoryClientDatabase register(ClientInfo client) {
        Objects.requireNonNull(client, "client");
        clients.put(client.clientId(), client);
        return this;
    }

    public boolean remove(String clientId) {
        return clients.remove(clientId) != null;
    }

    @Override
    public Optional<ClientInfo> find(String clientId) {
        if (clientId == null) return Optional.empty();
        return Optional.ofNullable(clients.get(clientId));
    }
}
