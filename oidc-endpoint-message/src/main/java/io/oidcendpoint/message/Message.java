package io.oidcendpoint.message;

import io.oidcendpoint.json.spi.JsonCodecs;
import io.oidcendpoint.json.spi.JsonException;
import io.oidcendpoint.message.jwt.JwtDecoder;
import io.oidcendpoint.message.jwt.KeyRegistry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A protocol message: an ordered set of named parameters checked against a schema.
 *
 * <p>Subclasses declare their schema by overriding {@link #parameters()}; parameters the schema
 * does not name are kept as they are. Decoders populate the instance and return it, so a request
 * is typically obtained as {@code type.newInstance().fromUrlencoded(body)}.
 *
 * <p>Instances are mutable and not thread-safe. They are meant to be owned by a single request.
 */
public class Message {

    public static final MessageType<Message> TYPE = MessageType.of(Message.class, Message::new);

    private static final JwtDecoder JWT_DECODER = new JwtDecoder();

    private final Map<String, Object> params = new LinkedHashMap<>();

    /**
     * Parameters this message type knows about. The default schema is open: nothing is required.
     */
    protected Map<String, ParamSpec> parameters() {
        return Map.of();
    }

    public ParamSpec spec(String name) {
        return parameters().getOrDefault(name, ParamSpec.ANY_OPTIONAL);
    }

    // ===== Parameter access =====

    public boolean containsKey(String name) {
        return params.containsKey(name);
    }

    /** Returns the value of a parameter, or null. */
    public Object get(String name) {
        return params.get(name);
    }

    public Optional<String> getString(String name) {
        Object v = params.get(name);
        return v instanceof CharSequence s ? Optional.of(s.toString()) : Optional.empty();
    }

    /** Sets a parameter. A null value removes it. */
    public Message put(String name, Object value) {
        Objects.requireNonNull(name, "name");
        if (value == null) {
            params.remove(name);
        } else {
            params.put(name, value);
        }
        return this;
    }

    public Message putAll(Map<String, ?> values) {
        values.forEach(this::put);
        return this;
    }

    public Object remove(String name) {
        return params.remove(name);
    }

    public Set<String> keySet() {
        return Collections.unmodifiableSet(params.keySet());
    }

    public boolean isEmpty() {
        return params.isEmpty();
    }

    /** True if this message carries an {@code error} parameter. */
    public boolean isError() {
        return params.containsKey("error");
    }

    /** Returns a copy of the parameters in insertion order. */
    public Map<String, Object> toDict() {
        return new LinkedHashMap<>(params);
    }

    // ===== Decoding =====

    /** Adds the parameters of a form-urlencoded string. */
    public Message fromUrlencoded(String form) {
        return putAll(FormUrlencoded.parse(form));
    }

    /**
     * Adds the members of a JSON object.
     *
     * @throws MessageException.DecodingFailed if the text is not a JSON object
     */
    public Message fromJson(String json) {
        try {
            return putAll(JsonCodecs.defaultCodec().readMap(json));
        } catch (JsonException e) {
            throw new MessageException.DecodingFailed("Not a JSON object: " + e.getMessage(), e);
        }
    }

    /**
     * Adds the claims of a compact serialized JWT after decrypting and verifying it.
     *
     * @param keys keys used to decrypt and verify the token
     * @param verifySsl whether the key registry must verify TLS certificates when it fetches keys
     * @throws MessageException.DecodingFailed if the token cannot be parsed, decrypted or verified
     */
    public Message fromJwt(String jwt, KeyRegistry keys, boolean verifySsl) {
        return putAll(JWT_DECODER.decode(jwt, keys, verifySsl));
    }

    // ===== Verification =====

    /**
     * Checks the parameters against the schema and normalizes declared parameters to their
     * Java representation (space separated strings become lists, "true" becomes a boolean, ...).
     *
     * <p>Subclasses adding message level rules override this and call {@code super.verify} first.
     *
     * @param keys keys available to verify signed parts of the message; may be null
     * @param opponentId identifier of the party on the other end; may be null
     * @throws MessageException.MissingRequiredAttribute if a required parameter is absent
     * @throws MessageException.MissingRequiredValue if a required parameter is empty
     * @throws MessageException.InvalidValue if a value does not fit its declared type
     */
    public void verify(KeyRegistry keys, String opponentId) {
        for (Map.Entry<String, ParamSpec> e : parameters().entrySet()) {
            String name = e.getKey();
            ParamSpec spec = e.getValue();
            Object value = params.get(name);
            if (value == null) {
                if (spec.required()) throw new MessageException.MissingRequiredAttribute(name);
                continue;
            }
            Object coerced = spec.type().coerce(name, value);
            if (spec.required() && isEmptyValue(coerced)) {
                throw new MessageException.MissingRequiredValue(name);
            }
            params.put(name, coerced);
        }
    }

    private static boolean isEmptyValue(Object value) {
        if (value instanceof CharSequence s) return s.length() == 0;
        if (value instanceof Collection<?> c) return c.isEmpty();
        if (value instanceof Map<?, ?> m) return m.isEmpty();
        return false;
    }

    // ===== Encoding =====

    public String toJson() {
        try {
            return JsonCodecs.defaultCodec().writeString(params);
        } catch (JsonException e) {
            throw new IllegalStateException("Cannot serialize " + getClass().getSimpleName() + " to JSON", e);
        }
    }

    public String toUrlencoded() {
        Map<String, String> form = new LinkedHashMap<>();
        params.forEach((k, v) -> form.put(k, spec(k).type().toFormValue(v)));
        return FormUrlencoded.encode(form);
    }

    /**
     * Renders this message as a redirect to {@code location}.
     *
     * @param fragmentEnc put the parameters in the fragment instead of the query
     */
    public String request(String location, boolean fragmentEnc) {
        Objects.requireNonNull(location, "location");
        String encoded = toUrlencoded();
        if (fragmentEnc) {
            return location + (location.indexOf('#') >= 0 ? "&" : "#") + encoded;
        }
        int hash = location.indexOf('#');
        String base = hash >= 0 ? location.substring(0, hash) : location;
        String fragment = hash >= 0 ? location.substring(hash) : "";
        return base + (base.indexOf('?') >= 0 ? "&" : "?") + encoded + fragment;
    }

    public String request(String location) {
        return request(location, false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return params.equals(((Message) o).params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), params);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + params;
    }
}
