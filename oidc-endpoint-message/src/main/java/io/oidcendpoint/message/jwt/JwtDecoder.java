package io.oidcendpoint.message.jwt;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWEDecrypter;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.factories.DefaultJWEDecrypterFactory;
import com.nimbusds.jose.crypto.factories.DefaultJWSVerifierFactory;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.KeyConverter;
import com.nimbusds.jwt.EncryptedJWT;
import com.nimbusds.jwt.JWT;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import com.nimbusds.jwt.SignedJWT;
import io.oidcendpoint.message.MessageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.Key;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a compact serialized JWT into its claims.
 *
 * <p>Handles signed and signed-then-encrypted tokens; unsigned tokens and encrypted tokens without
 * a signed payload are refused. Signatures are checked
 * against the keys the {@link KeyRegistry} holds for the token's issuer ({@code iss}, or
 * {@code client_id} for request objects without one). Claims are not validated beyond that:
 * expiry and audience rules belong to the message schema.
 */
public final class JwtDecoder {
    private static final Logger log = LoggerFactory.getLogger(JwtDecoder.class);

    private final DefaultJWSVerifierFactory verifierFactory = new DefaultJWSVerifierFactory();
    private final DefaultJWEDecrypterFactory decrypterFactory = new DefaultJWEDecrypterFactory();

    /**
     * @throws MessageException.DecodingFailed if the token cannot be parsed, decrypted or verified
     */
    public Map<String, Object> decode(String token, KeyRegistry keys, boolean verifySsl) {
        if (token == null || token.isBlank()) {
            throw new MessageException.DecodingFailed("Empty JWT");
        }
        KeyRegistry registry = keys != null ? keys : KeyRegistry.empty();
        JWT jwt;
        try {
            jwt = JWTParser.parse(token.trim());
        } catch (ParseException e) {
            throw new MessageException.DecodingFailed("Malformed JWT: " + e.getMessage(), e);
        }

        if (jwt instanceof EncryptedJWT encrypted) {
            decrypt(encrypted, registry);
            SignedJWT nested = encrypted.getPayload().toSignedJWT();
            if (nested == null) {
                throw new MessageException.DecodingFailed("Encrypted JWT does not carry a signed JWT");
            }
            return claims(verify(nested, registry, verifySsl));
        }
        if (jwt instanceof SignedJWT signed) {
            return claims(verify(signed, registry, verifySsl));
        }
        log.debug("Refusing unsigned JWT");
        throw new MessageException.DecodingFailed("Unsigned JWT (alg none)");
    }

    private void decrypt(EncryptedJWT jwt, KeyRegistry keys) {
        JOSEException last = null;
        for (Key key : KeyConverter.toJavaKeys(keys.decryptionKeys())) {
            if (key instanceof PublicKey) continue;
            try {
                JWEDecrypter decrypter = decrypterFactory.createJWEDecrypter(jwt.getHeader(), key);
                jwt.decrypt(decrypter);
                return;
            } catch (JOSEException e) {
                last = e;
            }
        }
        throw new MessageException.DecodingFailed("No key could decrypt the JWT (alg "
                + jwt.getHeader().getAlgorithm() + ")", last);
    }

    private SignedJWT verify(SignedJWT jwt, KeyRegistry keys, boolean verifySsl) {
        String issuer = issuer(jwt);
        List<JWK> candidates = byKeyId(keys.verificationKeys(issuer, verifySsl), jwt.getHeader().getKeyID());
        for (Key key : KeyConverter.toJavaKeys(candidates)) {
            if (key instanceof PrivateKey) continue;
            JWSVerifier verifier;
            try {
                verifier = verifierFactory.createJWSVerifier(jwt.getHeader(), key);
            } catch (JOSEException e) {
                // key type does not match the algorithm
                continue;
            }
            try {
                if (jwt.verify(verifier)) {
                    return jwt;
                }
            } catch (JOSEException e) {
                log.debug("Verification with a key of issuer '{}' failed: {}", issuer, e.getMessage());
            }
        }
        throw new MessageException.DecodingFailed("Could not verify JWT signature (alg "
                + jwt.getHeader().getAlgorithm() + ", issuer '" + issuer + "')");
    }

    private static List<JWK> byKeyId(List<JWK> keys, String kid) {
        if (kid == null) return keys;
        List<JWK> matching = new ArrayList<>();
        for (JWK k : keys) {
            if (kid.equals(k.getKeyID())) matching.add(k);
        }
        return matching.isEmpty() ? keys : matching;
    }

    private static String issuer(SignedJWT jwt) {
        try {
            JWTClaimsSet claims = jwt.getJWTClaimsSet();
            if (claims.getIssuer() != null) return claims.getIssuer();
            String clientId = claims.getStringClaim("client_id");
            return clientId != null ? clientId : KeyRegistry.OWNER;
        } catch (ParseException e) {
            throw new MessageException.DecodingFailed("JWT payload is not a claims set", e);
        }
    }

    private static Map<String, Object> claims(JWT jwt) {
        try {
            return jwt.getJWTClaimsSet().toJSONObject();
        } catch (ParseException e) {
            throw new MessageException.DecodingFailed("JWT payload is not a claims set", e);
        }
    }
}
