package io.oidcendpoint.server.spi;

import io.oidcendpoint.message.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Locale;
import java.util.Optional;

/**
 * Reference {@link ClientAuthenticator} for shared-secret clients.
 *
 * <p>Recognizes {@code client_secret_basic} (HTTP Basic credential in the authorization value)
 * and {@code client_secret_post} ({@code client_id} and {@code client_secret} request
 * parameters), checked in that order against the context's {@link ClientDatabase}.
 */
public final class ClientSecretAuthenticator implements ClientAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(ClientSecretAuthenticator.class);

    public static final String CLIENT_SECRET_BASIC = "client_secret_basic";
    public static final String CLIENT_SECRET_POST = "client_secret_post";

    private static final String BASIC_PREFIX = "basic ";

    @Override
    public AuthnResult authenticate(EndpointContext context, Message request, String authorization) {
        if (authorization != null && authorization.toLowerCase(Locale.ROOT).startsWith(BASIC_PREFIX)) {
            return basic(context, request, authorization.substring(BASIC_PREFIX.length()).trim());
        }
        Optional<String> secret = request.getString("client_secret");
        if (secret.isPresent()) {
            Optional<String> clientId = request.getString("client_id");
            if (clientId.isEmpty()) {
                return AuthnResult.failed("client_secret without client_id");
            }
            return check(context, clientId.get(), secret.get(), CLIENT_SECRET_POST);
        }
        return AuthnResult.noMethod();
    }

    private AuthnResult basic(EndpointContext context, Message request, String credential) {
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(credential), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return AuthnResult.failed("Basic credential is not base64");
        }
        int colon = decoded.indexOf(':');
        if (colon < 0) {
            return AuthnResult.failed("Basic credential has no password");
        }
        // RFC 6749 2.3.1: both parts are form-urlencoded before base64
        String clientId = URLDecoder.decode(decoded.substring(0, colon), StandardCharsets.UTF_8);
        String secret = URLDecoder.decode(decoded.substring(colon + 1), StandardCharsets.UTF_8);

        Optional<String> claimed = request.getString("client_id");
        if (claimed.isPresent() && !claimed.get().equals(clientId)) {
            return AuthnResult.failed("client_id in request does not match the authenticated client");
        }
        return check(context, clientId, secret, CLIENT_SECRET_BASIC);
    }

    private AuthnResult check(EndpointContext context, String clientId, String secret, String method) {
        Optional<ClientDatabase> db = context.clientDatabase();
        if (db.isEmpty()) {
            return AuthnResult.failed("No client database to authenticate '" + clientId + "'");
        }
        Optional<ClientInfo> client = db.get().find(clientId);
        if (client.isEmpty()) {
            return AuthnResult.failed("Unknown client '" + clientId + "'");
        }
        Optional<String> expected = client.get().secret();
        if (expected.isEmpty() || !constantTimeEquals(expected.get(), secret)) {
            return AuthnResult.failed("Wrong secret for client '" + clientId + "'");
        }
        log.debug("Client '{}' authenticated with {}", clientId, method);
        return AuthnResult.authenticated(clientId, method);
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}
