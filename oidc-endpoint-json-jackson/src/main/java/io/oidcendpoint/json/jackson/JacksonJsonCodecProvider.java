package io.oidcendpoint.json.jackson;

import io.oidcendpoint.json.spi.JsonCodec;
import io.oidcendpoint.json.spi.JsonCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    private static final JsonCodec CODEC = new JacksonJsonCodec();

    @Override
    public JsonCodec codec() {
        return CODEC;
    }
}
