package io.oidcendpoint.message;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Binding of a message class to the factory creating its instances.
 *
 * <p>Endpoints are configured with message types rather than classes so that instances can be
 * created without reflection.
 *
 * @param type the message class
 * @param factory creates empty instances of {@code type}
 */
public record MessageType<M extends Message>(Class<M> type, Supplier<M> factory) {

    public MessageType {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(factory, "factory");
    }

    public static <M extends Message> MessageType<M> of(Class<M> type, Supplier<M> factory) {
        return new MessageType<>(type, factory);
    }

    /** Returns a new instance without any parameter. */
    public M newInstance() {
        return factory.get();
    }

    /** Returns a new instance holding the given parameters. */
    public M from(Map<String, ?> params) {
        M message = factory.get();
        if (params != null) message.putAll(params);
        return message;
    }

    public String name() {
        return type.getSimpleName();
    }
}
