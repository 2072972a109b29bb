package io.oidcendpoint.server.spi;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Endpoint specific arguments passed along a pipeline call and into every hook.
 *
 * <p>Immutable. Well-known keys have typed accessors; anything else is available through
 * {@link #get(String)}.
 */
public final class ExtraArgs {

    /** Header list the response headers are merged into. */
    public static final String HTTP_HEADERS = "http_headers";
    /** Whether redirect responses carry their parameters in the fragment. */
    public static final String FRAGMENT_ENC = "fragment_enc";
    /** Redirect target of responses placed in the URL. */
    public static final String RETURN_URI = "return_uri";

    private static final ExtraArgs EMPTY = new ExtraArgs(Map.of());

    private final Map<String, Object> values;

    private ExtraArgs(Map<String, Object> values) {
        this.values = values;
    }

    public static ExtraArgs empty() {
        return EMPTY;
    }

    /** Copies the given map; null values are dropped. */
    public static ExtraArgs of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) return EMPTY;
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (v != null) copy.put(Objects.requireNonNull(k, "key"), v);
        });
        return new ExtraArgs(Map.copyOf(copy));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /** Returns a copy with one more (or a replaced) value. */
    public ExtraArgs with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return of(copy);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * @throws IllegalArgumentException if the value is not a list of {@link HttpHeader}
     */
    public Optional<List<HttpHeader>> httpHeaders() {
        Object v = values.get(HTTP_HEADERS);
        if (v == null) return Optional.empty();
        if (v instanceof List<?> list) {
            for (Object o : list) {
                if (!(o instanceof HttpHeader)) {
                    throw new IllegalArgumentException("'" + HTTP_HEADERS + "' must hold HttpHeader values, got " + o);
                }
            }
            @SuppressWarnings("unchecked")
            List<HttpHeader> headers = (List<HttpHeader>) list;
            return Optional.of(headers);
        }
        throw new IllegalArgumentException("'" + HTTP_HEADERS + "' must be a list, got " + v.getClass().getName());
    }

    /** Default: false. */
    public boolean fragmentEnc() {
        Object v = values.get(FRAGMENT_ENC);
        if (v instanceof Boolean b) return b;
        if (v instanceof String s) return Boolean.parseBoolean(s);
        return false;
    }

    public Optional<String> returnUri() {
        Object v = values.get(RETURN_URI);
        return v == null ? Optional.empty() : Optional.of(v.toString());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExtraArgs other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ExtraArgs" + values;
    }

    /**
     * Builder for {@link ExtraArgs}.
     */
    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {}

        public Builder httpHeaders(List<HttpHeader> headers) {
            return put(HTTP_HEADERS, headers == null ? null : List.copyOf(headers));
        }

        public Builder fragmentEnc(boolean fragmentEnc) {
            return put(FRAGMENT_ENC, fragmentEnc);
        }

        public Builder returnUri(String returnUri) {
            return put(RETURN_URI, returnUri);
        }

        public Builder put(String key, Object value) {
            values.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public ExtraArgs build() {
            return of(values);
        }
    }
}
