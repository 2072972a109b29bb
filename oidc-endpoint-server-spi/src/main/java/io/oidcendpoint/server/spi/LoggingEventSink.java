package io.oidcendpoint.server.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventSink} writing events to the {@code io.oidcendpoint.events} logger.
 */
public final class LoggingEventSink implements EventSink {
    private static final Logger log = LoggerFactory.getLogger("io.oidcendpoint.events");

    @Override
    public void store(String kind, Object payload) {
        log.info("{}: {}", kind, payload);
    }
}
