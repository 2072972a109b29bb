package io.oidcendpoint.server.core;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.PlainJWT;
import com.nimbusds.jwt.SignedJWT;
import io.oidcendpoint.message.ErrorResponse;
import io.oidcendpoint.message.Message;
import io.oidcendpoint.message.MessageException;
import io.oidcendpoint.message.MessageType;
import io.oidcendpoint.message.jwt.JwkSetKeyRegistry;
import io.oidcendpoint.server.spi.AuthnResult;
import io.oidcendpoint.server.spi.ClientAuthenticator;
import io.oidcendpoint.server.spi.EndpointContext;
import io.oidcendpoint.server.spi.ExtraArgs;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EndpointParseRequestTest {

    private final EndpointContext context = EndpointContext.builder().build();

    private static EndpointConfig.Builder<TokenRequest, Message> tokenConfig() {
        return EndpointConfig.builder(TokenRequest.TYPE, Message.TYPE).name("token");
    }

    private static <Q extends Message> Q parsed(ParseResult<Q> result) {
        assertThat(result).isInstanceOf(ParseResult.Parsed.class);
        return ((ParseResult.Parsed<Q>) result).request();
    }

    private static ErrorResponse rejected(ParseResult<?> result) {
        assertThat(result).isInstanceOf(ParseResult.Rejected.class);
        return ((ParseResult.Rejected<?>) result).error();
    }

    private static Endpoint<TokenRequest, Message> capturing(EndpointConfig<TokenRequest, Message> config,
                                                             ClientAuthenticator authenticator,
                                                             AtomicReference<String> seenClientId) {
        EndpointHooks<TokenRequest> hooks = EndpointHooks.<TokenRequest>builder()
                .postParseRequest((ctx, req, clientId, extra) -> {
                    seenClientId.set(clientId);
                    return req;
                })
                .build();
        return new Endpoint<>(config, authenticator, hooks);
    }

    @Test
    void withoutRequiredMethodMissingCredentialUsesRequestClientId() {
        AtomicReference<String> seen = new AtomicReference<>();
        Endpoint<TokenRequest, Message> endpoint = capturing(tokenConfig().build(), ClientAuthenticator.none(), seen);

        TokenRequest req = parsed(endpoint.parseRequest(context,
                Map.of("grant_type", "client_credentials", "client_id", "client_1")));

        assertThat(seen.get()).isEqualTo("client_1");
        assertThat(req.get("client_id")).isEqualTo("client_1");
    }

    @Test
    void withoutRequiredMethodAndWithoutClientIdResolvesNothing() {
        AtomicReference<String> seen = new AtomicReference<>("unset");
        Endpoint<TokenRequest, Message> endpoint = capturing(tokenConfig().build(), ClientAuthenticator.none(), seen);

        TokenRequest req = parsed(endpoint.parseRequest(context, "grant_type=client_credentials"));

        assertThat(seen.get()).isNull();
        assertThat(req.containsKey("client_id")).isFalse();
    }

    @Test
    void requiredMethodWithoutCredentialIsUnauthorized() {
        Endpoint<TokenRequest, Message> endpoint = new Endpoint<>(
                tokenConfig().clientAuthMethod("client_secret_basic").build(), ClientAuthenticator.none());

        assertThatThrownBy(() -> endpoint.parseRequest(context, "grant_type=client_credentials&client_id=client_1"))
                .isInstanceOf(UnauthorizedClientException.class)
                .isNotInstanceOf(MessageException.class)
                .satisfies(e -> assertThat(((UnauthorizedClientException) e).endpoint()).isEqualTo("token"));
    }

    @Test
    void rejectedCredentialIsUnauthorizedEvenWhenNoMethodIsRequired() {
        Endpoint<TokenRequest, Message> endpoint = new Endpoint<>(
                tokenConfig().build(), (ctx, req, auth) -> AuthnResult.failed("bad secret"));

        assertThatThrownBy(() -> endpoint.parseRequest(context, "grant_type=client_credentials", "Basic eDp5", ExtraArgs.empty()))
                .isInstanceOf(UnauthorizedClientException.class)
                .hasMessage("bad secret");
    }

    @Test
    void authenticatedClientIdOverridesRequest() {
        AtomicReference<String> seen = new AtomicReference<>();
        Endpoint<TokenRequest, Message> endpoint = capturing(
                tokenConfig().clientAuthMethod("client_secret_basic").build(),
                (ctx, req, auth) -> AuthnResult.authenticated("client_1", "client_secret_basic"),
                seen);

        TokenRequest req = parsed(endpoint.parseRequest(context, "grant_type=client_credentials&client_id=other",
                "Basic Y2xpZW50XzE6aGVtbGlndA==", ExtraArgs.empty()));

        assertThat(seen.get()).isEqualTo("client_1");
        assertThat(req.get("client_id")).isEqualTo("client_1");
    }

    @Test
    void authenticatedWithoutClientIdFallsBackToRequest() {
        AtomicReference<String> seen = new AtomicReference<>();
        Endpoint<TokenRequest, Message> endpoint = capturing(
                tokenConfig().build(),
                (ctx, req, auth) -> new AuthnResult.Authenticated((String) null, "bearer_header"),
                seen);

        parsed(endpoint.parseRequest(context, "grant_type=client_credentials&client_id=client_2",
                "Bearer token", ExtraArgs.empty()));

        assertThat(seen.get()).isEqualTo("client_2");
    }

    @Test
    void authenticatorSeesDecodedRequestAndCredential() {
        List<String> seen = new ArrayList<>();
        Endpoint<TokenRequest, Message> endpoint = new Endpoint<>(tokenConfig().build(), (ctx, req, auth) -> {
            seen.add(req.getString("grant_type").orElse("?") + "|" + auth);
            return AuthnResult.noMethod();
        });

        endpoint.parseRequest(context, "grant_type=refresh_token", "Bearer x", ExtraArgs.empty());

        assertThat(seen).containsExactly("refresh_token|Bearer x");
    }

    @Test
    void urlFormatDecodesQueryComponent() {
        Endpoint<Message, Message> endpoint = new Endpoint<>(
                EndpointConfig.builder(Message.TYPE, Message.TYPE).requestFormat(RequestFormat.URL).build(),
                ClientAuthenticator.none());

        Message req = parsed(endpoint.parseRequest(context, "https://op.example/authorize?foo=bar&baz=qux"));

        assertThat(req.toDict()).isEqualTo(Map.of("foo", "bar", "baz", "qux"));
    }

    @Test
    void malformedUrlFailsDecoding() {
        Endpoint<Message, Message> endpoint = new Endpoint<>(
                EndpointConfig.builder(Message.TYPE, Message.TYPE).requestFormat(RequestFormat.URL).build(),
                ClientAuthenticator.none());

        assertThatThrownBy(() -> endpoint.parseRequest(context, "https://op.example/a b?x=1"))
                .isInstanceOf(MessageException.DecodingFailed.class);
    }

    @Test
    void jsonFormatDecodesObject() {
        Endpoint<TokenRequest, Message> endpoint = new Endpoint<>(
                tokenConfig().requestFormat("json").build(), ClientAuthenticator.none());

        TokenRequest req = parsed(endpoint.parseRequest(context, "{\"grant_type\":\"client_credentials\",\"scope\":[\"a\",\"b\"]}"));

        assertThat(req.get("scope")).isEqualTo(List.of("a", "b"));
    }

    @Test
    void jwtFormatVerifiesWithContextKeys() throws Exception {
        RSAKey key = new RSAKeyGenerator(2048).keyID("k1").generate();
        SignedJWT jwt = new SignedJWT(new JWSHeader.Builder(JWSAlgorithm.RS256).keyID("k1").build(),
                new JWTClaimsSet.Builder().issuer("client_1").claim("grant_type", "client_credentials").build());
        jwt.sign(new RSASSASigner(key));
        Endpoint<TokenRequest, Message> endpoint = new Endpoint<>(
                tokenConfig().requestFormat(RequestFormat.JWT).build(), ClientAuthenticator.none());

        EndpointContext withKeys = EndpointContext.builder()
                .keyRegistry(new JwkSetKeyRegistry().add("client_1", key.toPublicJWK()))
                .build();
        TokenRequest req = parsed(endpoint.parseRequest(withKeys, jwt.serialize()));
        assertThat(req.get("grant_type")).isEqualTo("client_credentials");

        assertThatThrownBy(() -> endpoint.parseRequest(context, jwt.serialize()))
                .isInstanceOf(MessageException.DecodingFailed.class);
    }

    @Test
    void jwtFormatRefusesUnsignedToken() throws Exception {
        RSAKey key = new RSAKeyGenerator(2048).keyID("k1").generate();
        String forged = new PlainJWT(new JWTClaimsSet.Builder()
                .issuer("attacker")
                .claim("client_id", "victim")
                .claim("grant_type", "client_credentials")
                .claim("redirect_uri", "https://evil.example/cb")
                .build()).serialize();
        Endpoint<TokenRequest, Message> endpoint = new Endpoint<>(
                tokenConfig().requestFormat(RequestFormat.JWT).build(), ClientAuthenticator.none());
        EndpointContext withKeys = EndpointContext.builder()
                .keyRegistry(new JwkSetKeyRegistry().add("victim", key.toPublicJWK()))
                .build();

        assertThatThrownBy(() -> endpoint.parseRequest(withKeys, forged))
                .isInstanceOf(MessageException.DecodingFailed.class);
    }

    @Test
    void emptyInputGivesEmptyRequest() {
        Endpoint<Message, Message> endpoint = new Endpoint<>(
                EndpointConfig.builder(Message.TYPE, Message.TYPE).build(), ClientAuthenticator.none());

        assertThat(parsed(endpoint.parseRequest(context, (String) null)).isEmpty()).isTrue();
        assertThat(parsed(endpoint.parseRequest(context, "")).isEmpty()).isTrue();
        assertThat(parsed(endpoint.parseRequest(context, Map.of())).isEmpty()).isTrue();
    }

    @Test
    void verificationFailureBecomesInvalidRequest() {
        Endpoint<TokenRequest, Message> endpoint = new Endpoint<>(tokenConfig().build(), ClientAuthenticator.none());

        ErrorResponse error = rejected(endpoint.parseRequest(context, "client_id=client_1"));

        assertThat(error.get("error")).isEqualTo("invalid_request");
        assertThat(error.getString("error_description")).hasValueSatisfying(d -> assertThat(d).contains("grant_type"));
    }

    @Test
    void invalidValueBecomesInvalidRequest() {
        Endpoint<TokenRequest, Message> endpoint = new Endpoint<>(tokenConfig().build(), ClientAuthenticator.none());

        ErrorResponse error = rejected(endpoint.parseRequest(context, "grant_type=a&grant_type=b"));

        assertThat(error.get("error")).isEqualTo("invalid_request");
        assertThat(error.getString("error_description")).isNotEmpty();
    }

    static final class TokenErrorResponse extends ErrorResponse {
        static final MessageType<TokenErrorResponse> TYPE = MessageType.of(TokenErrorResponse.class, TokenErrorResponse::new);
    }

    @Test
    void rejectionUsesConfiguredErrorType() {
        Endpoint<TokenRequest, Message> endpoint = new Endpoint<>(
                tokenConfig().errorType(TokenErrorResponse.TYPE).build(), ClientAuthenticator.none());

        assertThat(rejected(endpoint.parseRequest(context, ""))).isInstanceOf(TokenErrorResponse.class);
    }

    @Test
    void verifiedRawRequestIsRecordedAsEvent() {
        List<Object> events = new CopyOnWriteArrayList<>();
        EndpointContext withSink = EndpointContext.builder()
                .eventSink((kind, payload) -> events.add(kind + ":" + payload))
                .build();
        Endpoint<TokenRequest, Message> endpoint = new Endpoint<>(tokenConfig().build(), ClientAuthenticator.none());

        endpoint.parseRequest(withSink, "grant_type=client_credentials");
        endpoint.parseRequest(withSink, "client_id=x");

        assertThat(events).containsExactly("Protocol request:grant_type=client_credentials");
    }

    @Test
    void postParseHooksRunInOrderAndTheirResultIsReturned() {
        EndpointHooks<TokenRequest> hooks = EndpointHooks.<TokenRequest>builder()
                .postParseRequest((ctx, req, clientId, extra) -> {
                    req.put("trace", "first");
                    return req;
                })
                .postParseRequest((ctx, req, clientId, extra) -> {
                    TokenRequest copy = TokenRequest.TYPE.from(req.toDict());
                    copy.put("trace", req.get("trace") + ",second," + extra.get("tag").orElse(""));
                    return copy;
                })
                .build();
        Endpoint<TokenRequest, Message> endpoint = new Endpoint<>(tokenConfig().build(), ClientAuthenticator.none(), hooks);

        TokenRequest req = parsed(endpoint.parseRequest(context, "grant_type=client_credentials", null,
                ExtraArgs.builder().put("tag", "t").build()));

        assertThat(req.get("trace")).isEqualTo("first,second,t");
    }

    @Test
    void postParseHooksDoNotRunForRejectedRequests() {
        List<String> calls = new ArrayList<>();
        EndpointHooks<TokenRequest> hooks = EndpointHooks.<TokenRequest>builder()
                .postParseRequest((ctx, req, clientId, extra) -> {
                    calls.add("hook");
                    return req;
                })
                .build();
        Endpoint<TokenRequest, Message> endpoint = new Endpoint<>(tokenConfig().build(), ClientAuthenticator.none(), hooks);

        rejected(endpoint.parseRequest(context, "scope=x"));

        assertThat(calls).isEmpty();
    }

    @Test
    void oneInstanceServesConcurrentRequests() throws Exception {
        Endpoint<TokenRequest, Message> endpoint = new Endpoint<>(
                tokenConfig().build(),
                (ctx, req, auth) -> AuthnResult.authenticated(auth, "test"));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String clientId = "client_" + i;
                results.add(pool.submit(() -> {
                    TokenRequest req = parsed(endpoint.parseRequest(context, "grant_type=client_credentials&client_id=x",
                            clientId, ExtraArgs.empty()));
                    return clientId.equals(req.get("client_id"));
                }));
            }
            for (Future<Boolean> f : results) {
                assertThat(f.get(10, TimeUnit.SECONDS)).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
