package io.oidcendpoint.server.core;

import io.oidcendpoint.message.Message;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SanitizerTest {

    @Test
    void masksFormEncodedSecrets() {
        assertThat(Sanitizer.sanitize("grant_type=authorization_code&code=abc123&client_secret=hemligt"))
                .isEqualTo("grant_type=authorization_code&code=<REDACTED>&client_secret=<REDACTED>");
    }

    @Test
    void masksMapValues() {
        Map<String, Object> req = new LinkedHashMap<>();
        req.put("client_id", "client_1");
        req.put("password", "secret");

        assertThat(Sanitizer.sanitize(req)).isEqualTo("{client_id=client_1, password=<REDACTED>}");
    }

    @Test
    void masksSpacedAndListValuedSecretsInMaps() {
        Map<String, Object> req = new LinkedHashMap<>();
        req.put("password", "mycket hemligt");
        req.put("client_secret", List.of("s1", "s2"));
        req.put("scope", "openid email");

        assertThat(Sanitizer.sanitize(req))
                .isEqualTo("{password=<REDACTED>, client_secret=<REDACTED>, scope=openid email}")
                .doesNotContain("hemligt", "s2");
    }

    @Test
    void masksNestedMaps() {
        Map<String, Object> req = new LinkedHashMap<>();
        req.put("claims", Map.of("id_token", "eyJ"));

        assertThat(Sanitizer.sanitize(req)).isEqualTo("{claims={id_token=<REDACTED>}}");
    }

    @Test
    void masksMessagesByParameterName() {
        Message msg = Message.TYPE.from(Map.of("refresh_token", "rt 1"));

        assertThat(Sanitizer.sanitize(msg)).isEqualTo("Message{refresh_token=<REDACTED>}");
    }

    @Test
    void masksTextValuesUpToTheNextDelimiter() {
        assertThat(Sanitizer.sanitize("password=mycket hemligt&user=a"))
                .isEqualTo("password=<REDACTED>&user=a");
        assertThat(Sanitizer.sanitize("{\"client_secret\":[\"s1\",\"s2\"],\"x\":1}"))
                .isEqualTo("{\"client_secret\":<REDACTED>,\"x\":1}");
        assertThat(Sanitizer.sanitize("{\"password\":\"a \\\"quoted\\\" b\"}"))
                .isEqualTo("{\"password\":\"<REDACTED>\"}");
    }

    @Test
    void masksJsonValues() {
        assertThat(Sanitizer.sanitize("{\"access_token\":\"tok\",\"token_type\":\"Bearer\"}"))
                .isEqualTo("{\"access_token\":\"<REDACTED>\",\"token_type\":\"Bearer\"}");
    }

    @Test
    void leavesLookalikeKeysAlone() {
        assertThat(Sanitizer.sanitize("response_type=code&auth_code=x"))
                .isEqualTo("response_type=code&auth_code=x");
    }

    @Test
    void handlesNull() {
        assertThat(Sanitizer.sanitize(null)).isEqualTo("null");
    }
}
