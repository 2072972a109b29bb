package io.oidcendpoint.server.spi;

import io.oidcendpoint.message.jwt.KeyRegistry;

import java.util.Optional;

/**
 * Shared, read-only execution context handed to every pipeline call.
 *
 * <p>Owned by the server process and passed by reference; endpoints never modify it. The
 * collaborators it points to are used concurrently and provide their own thread-safety.
 *
 * <p>Use {@link #builder()}:
 * <pre>{@code
 * EndpointContext ctx = EndpointContext.builder()
 *     .issuer("https://op.example/")
 *     .keyRegistry(keys)
 *     .clientDatabase(clients)
 *     .eventSink(new LoggingEventSink())
 *     .build();
 * }</pre>
 */
public final class EndpointContext {

    private final String issuer;
    private final KeyRegistry keyRegistry;
    private final boolean verifySsl;
    private final EventSink eventSink;
    private final ClientDatabase clientDatabase;

    private EndpointContext(Builder builder) {
        this.issuer = builder.issuer;
        this.keyRegistry = builder.keyRegistry;
        this.verifySsl = builder.verifySsl;
        this.eventSink = builder.eventSink;
        this.clientDatabase = builder.clientDatabase;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> issuer() {
        return Optional.ofNullable(issuer);
    }

    public Optional<KeyRegistry> keyRegistry() {
        return Optional.ofNullable(keyRegistry);
    }

    /** Whether TLS certificates are verified when keys or documents are fetched. Default: true. */
    public boolean verifySsl() {
        return verifySsl;
    }

    public Optional<EventSink> eventSink() {
        return Optional.ofNullable(eventSink);
    }

    public Optional<ClientDatabase> clientDatabase() {
        return Optional.ofNullable(clientDatabase);
    }

    /**
     * Builder for {@link EndpointContext}.
     */
    public static final class Builder {
        private String issuer;
        private KeyRegistry keyRegistry;
        private boolean verifySsl = true;
        private EventSink eventSink;
        private ClientDatabase clientDatabase;

        private Builder() {}

        /** Sets the issuer identifier of this provider. */
        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        /** Sets the key registry. Default: none. */
        public Builder keyRegistry(KeyRegistry keyRegistry) {
            this.keyRegistry = keyRegistry;
            return this;
        }

        /** Sets TLS verification for remote fetches. Default: true. */
        public Builder verifySsl(boolean verifySsl) {
            this.verifySsl = verifySsl;
            return this;
        }

        /** Sets the protocol event sink. Default: none, events are not recorded. */
        public Builder eventSink(EventSink eventSink) {
            this.eventSink = eventSink;
            return this;
        }

        /** Sets the client database. Default: none. */
        public Builder clientDatabase(ClientDatabase clientDatabase) {
            this.clientDatabase = clientDatabase;
            return this;
        }

        public EndpointContext build() {
            return new EndpointContext(this);
        }
    }
}
