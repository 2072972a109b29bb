package io.oidcendpoint.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Resolves the {@link JsonCodec} to use through {@link ServiceLoader}.
 */
public final class JsonCodecs {

    private JsonCodecs() {}

    /**
     * Returns the codec of the first {@link JsonCodecProvider} visible to the context class loader.
     *
     * @throws IllegalStateException if no provider is on the class path
     */
    public static JsonCodec defaultCodec() {
        return Holder.DEFAULT;
    }

    /**
     * Returns the codec of the first {@link JsonCodecProvider} visible to the given class loader.
     *
     * @throws IllegalStateException if no provider is found
     */
    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> providers = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        while (providers.hasNext()) {
            JsonCodec codec = providers.next().codec();
            if (codec != null) return codec;
        }
        throw new IllegalStateException("No " + JsonCodecProvider.class.getName() + " found on the class path");
    }

    private static final class Holder {
        static final JsonCodec DEFAULT = load(classLoader());

        private static ClassLoader classLoader() {
            ClassLoader cl = Thread.currentThread().getContextClassLoader();
            return cl != null ? cl : JsonCodecs.class.getClassLoader();
        }
    }
}
