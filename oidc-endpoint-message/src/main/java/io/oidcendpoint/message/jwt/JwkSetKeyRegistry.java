package io.oidcendpoint.message.jwt;

import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link KeyRegistry} holding JWKs per issuer.
 *
 * <p>Signature verification for an issuer considers that issuer's keys first and then the
 * server's own keys. Keys are never fetched, so the {@code verifySsl} flag has no effect here.
 */
public final class JwkSetKeyRegistry implements KeyRegistry {

    private final Map<String, List<JWK>> keysByIssuer = new ConcurrentHashMap<>();

    public JwkSetKeyRegistry add(String issuer, JWK key) {
        Objects.requireNonNull(issuer, "issuer");
        Objects.requireNonNull(key, "key");
        keysByIssuer.computeIfAbsent(issuer, k -> new CopyOnWriteArrayList<>()).add(key);
        return this;
    }

    public JwkSetKeyRegistry addAll(String issuer, JWKSet keys) {
        Objects.requireNonNull(keys, "keys");
        keys.getKeys().forEach(k -> add(issuer, k));
        return this;
    }

    /** Adds one of the server's own keys. */
    public JwkSetKeyRegistry addOwn(JWK key) {
        return add(OWNER, key);
    }

    @Override
    public List<JWK> verificationKeys(String issuer, boolean verifySsl) {
        String iss = issuer == null ? OWNER : issuer;
        List<JWK> out = new ArrayList<>();
        for (JWK k : keysFor(iss)) {
            if (usableFor(k, KeyUse.SIGNATURE)) out.add(k);
        }
        if (!iss.equals(OWNER)) {
            for (JWK k : keysFor(OWNER)) {
                if (usableFor(k, KeyUse.SIGNATURE)) out.add(k);
            }
        }
        return List.copyOf(out);
    }

    @Override
    public List<JWK> decryptionKeys() {
        List<JWK> out = new ArrayList<>();
        for (JWK k : keysFor(OWNER)) {
            if (k.isPrivate() && usableFor(k, KeyUse.ENCRYPTION)) out.add(k);
        }
        return List.copyOf(out);
    }

    private List<JWK> keysFor(String issuer) {
        return keysByIssuer.getOrDefault(issuer, List.of());
    }

    private static boolean usableFor(JWK key, KeyUse use) {
        return key.getKeyUse() == null || key.getKeyUse().equals(use);
    }
}
