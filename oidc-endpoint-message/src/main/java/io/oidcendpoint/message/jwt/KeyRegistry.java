package io.oidcendpoint.message.jwt;

import com.nimbusds.jose.jwk.JWK;

import java.util.List;

/**
 * Source of the keys used to decrypt incoming JWTs and verify their signatures.
 *
 * <p>Keys are grouped by the issuer that owns them. The empty issuer {@code ""} denotes the
 * server's own keys. Implementations are shared between concurrent requests and must be
 * thread-safe.
 */
public interface KeyRegistry {

    /** Issuer id under which the server's own keys are kept. */
    String OWNER = "";

    /**
     * Keys that may have signed a token from the given issuer.
     *
     * @param issuer token issuer, {@link #OWNER} for the server itself
     * @param verifySsl whether TLS certificates must be verified if keys are fetched remotely
     * @return candidate keys, possibly empty
     */
    List<JWK> verificationKeys(String issuer, boolean verifySsl);

    /**
     * Private keys of the server that may decrypt a token addressed to it.
     */
    List<JWK> decryptionKeys();

    /**
     * A registry without any key.
     */
    static KeyRegistry empty() {
        return new KeyRegistry() {
            @Override
            public List<JWK> verificationKeys(String issuer, boolean verifySsl) {
                return List.of();
            }

            @Override
            public List<JWK> decryptionKeys() {
                return List.of();
            }
        };
    }
}
