package io.oidcendpoint.server.core;

import io.oidcendpoint.message.Message;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks credentials in values about to be logged.
 *
 * <p>Maps and messages are masked by parameter name, nested maps included. Anything else is masked
 * on its string form, which covers JSON and form encoded text.
 */
public final class Sanitizer {
    private Sanitizer() {}

    static final String MASK = "<REDACTED>";

    private static final Set<String> SECRET_NAMES = Set.of(
            "password", "client_secret", "access_token", "refresh_token",
            "code", "id_token", "assertion", "client_assertion");

    // value: a quoted JSON string, a bracketed list, or everything up to the next pair delimiter
    private static final Pattern SECRET = Pattern.compile(
            "(?i)(?<![A-Za-z0-9_])(password|client_secret|access_token|refresh_token|code|id_token|assertion|client_assertion)"
                    + "(\"?\\s*[=:]\\s*)"
                    + "(\"(?:[^\"\\\\]|\\\\.)*\"|\\[[^\\]]*\\]|[^&,;\"}\\]\\r\\n]+)");

    public static String sanitize(Object value) {
        if (value == null) return "null";
        if (value instanceof Message message) {
            return message.getClass().getSimpleName() + mask(message.toDict());
        }
        if (value instanceof Map<?, ?> map) {
            return String.valueOf(mask(map));
        }
        return maskText(String.valueOf(value));
    }

    private static Map<Object, Object> mask(Map<?, ?> map) {
        Map<Object, Object> out = new LinkedHashMap<>();
        map.forEach((k, v) -> {
            if (k != null && SECRET_NAMES.contains(k.toString().toLowerCase(Locale.ROOT))) {
                out.put(k, MASK);
            } else if (v instanceof Map<?, ?> nested) {
                out.put(k, mask(nested));
            } else {
                out.put(k, v);
            }
        });
        return out;
    }

    private static String maskText(String text) {
        Matcher m = SECRET.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String masked = m.group(3).startsWith("\"") ? "\"" + MASK + "\"" : MASK;
            m.appendReplacement(sb, Matcher.quoteReplacement(m.group(1) + m.group(2) + masked));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
