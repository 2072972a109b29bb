package io.oidcendpoint.server.core;

import java.util.Locale;

/**
 * Wire format of incoming requests.
 */
public enum RequestFormat {
    URLENCODED("urlencoded"),
    JSON("json"),
    /** Compact serialized, possibly signed and/or encrypted token. */
    JWT("jwt"),
    /** Full URL whose query carries the parameters. */
    URL("url");

    private final String value;

    RequestFormat(String value) {
        this.value = value;
    }

    /** Configuration value of this constant. */
    public String value() {
        return value;
    }

    /**
     * Resolves a configuration value, ignoring case.
     *
     * @throws EndpointConfigurationException if the value is unknown
     */
    public static RequestFormat of(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (RequestFormat c : values()) {
                if (c.value.equals(v)) return c;
            }
        }
        throw new EndpointConfigurationException("Unknown request format: '" + value + "'");
    }
}
