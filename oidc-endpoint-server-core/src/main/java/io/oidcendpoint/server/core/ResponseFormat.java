package io.oidcendpoint.server.core;

import java.util.Locale;

/**
 * Wire format of successful responses placed in the body.
 */
public enum ResponseFormat {
    JSON("json"),
    URLENCODED("urlencoded");

    private final String value;

    ResponseFormat(String value) {
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
    public static ResponseFormat of(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (ResponseFormat c : values()) {
                if (c.value.equals(v)) return c;
            }
        }
        throw new EndpointConfigurationException("Unknown response format: '" + value + "'");
    }
}
