package io.oidcendpoint.message;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code application/x-www-form-urlencoded} reader and writer.
 */
public final class FormUrlencoded {

    private FormUrlencoded() {}

    /**
     * Parses a form string. A key seen once maps to a {@link String}; a repeated key maps to a
     * {@link List} of its values in order. A key without {@code =} maps to the empty string.
     */
    public static Map<String, Object> parse(String form) {
        if (form == null || form.isEmpty()) return Map.of();
        Map<String, Object> out = new LinkedHashMap<>();
        for (String part : form.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            String k;
            String v;
            if (eq < 0) {
                k = decode(part);
                v = "";
            } else {
                k = decode(part.substring(0, eq));
                v = decode(part.substring(eq + 1));
            }
            out.merge(k, v, FormUrlencoded::append);
        }
        return out;
    }

    /**
     * Parses the query component of a URL. Returns an empty map when there is none.
     *
     * @throws IllegalArgumentException if the URL is malformed
     */
    public static Map<String, Object> parseQuery(String url) {
        return parse(URI.create(url).getRawQuery());
    }

    /** Encodes name/value pairs in iteration order. */
    public static String encode(Map<String, String> pairs) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : pairs.entrySet()) {
            if (sb.length() > 0) sb.append('&');
            sb.append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    @SuppressWarnings("unchecked")
    private static Object append(Object existing, Object next) {
        List<Object> values;
        if (existing instanceof List<?> list) {
            values = (List<Object>) list;
        } else {
            values = new ArrayList<>();
            values.add(existing);
        }
        values.add(next);
        return values;
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}
