package io.oidcendpoint.server.core;

import java.util.Locale;

/**
 * Where a request carries its parameters. Informational: decoding does not depend on it.
 */
public enum RequestPlacement {
    QUERY("query"),
    BODY("body");

    private final String value;

    RequestPlacement(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolves a configuration value, ignoring case.
     *
     * @throws EndpointConfigurationException if the value is unknown
     */
    public static RequestPlacement of(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (RequestPlacement c : values()) {
                if (c.value.equals(v)) return c;
            }
        }
        throw new EndpointConfigurationException("Unknown request placement: '" + value + "'");
    }
}
