package io.oidcendpoint.server.spi;

/**
 * Receives protocol events (inbound requests, issued responses) for auditing or debugging.
 *
 * <p>Called from request threads; implementations must be thread-safe.
 */
@FunctionalInterface
public interface EventSink {

    /**
     * Record an event.
     *
     * @param kind short description, e.g. {@code "Protocol request"}
     * @param payload the event data as received
     */
    void store(String kind, Object payload);
}
