package io.oidcendpoint.json.jackson;

import io.oidcendpoint.json.spi.JsonCodecs;
import io.oidcendpoint.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    @Test
    void readMapKeepsMemberOrder() throws Exception {
        Map<String, Object> map = codec.readMap("{\"b\":1,\"a\":[\"x\",\"y\"],\"c\":{\"d\":true}}");

        assertThat(map).containsOnlyKeys("b", "a", "c");
        assertThat(map.keySet()).containsExactly("b", "a", "c");
        assertThat(map.get("a")).isEqualTo(List.of("x", "y"));
        assertThat(map.get("c")).isEqualTo(Map.of("d", true));
    }

    @Test
    void readMapRejectsArrays() {
        assertThatThrownBy(() -> codec.readMap("[1,2]")).isInstanceOf(JsonException.class);
    }

    @Test
    void readMapRejectsBlankInput() {
        assertThatThrownBy(() -> codec.readMap("  ")).isInstanceOf(JsonException.class);
    }

    @Test
    void writeStringProducesCompactJson() throws Exception {
        assertThat(codec.writeString(Map.of("subject", "acct:foo@example.com")))
                .isEqualTo("{\"subject\":\"acct:foo@example.com\"}");
    }

    @Test
    void serviceLoaderResolvesJacksonCodec() {
        assertThat(JsonCodecs.defaultCodec()).isInstanceOf(JacksonJsonCodec.class);
    }
}
