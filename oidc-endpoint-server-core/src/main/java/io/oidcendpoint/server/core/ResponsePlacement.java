package io.oidcendpoint.server.core;

import java.util.Locale;

/**
 * Where successful responses are put.
 */
public enum ResponsePlacement {
    /** HTTP body with a content type. */
    BODY("body"),
    /** Parameters of a redirect to the caller supplied return URI. */
    URL("url");

    private final String value;

    ResponsePlacement(String value) {
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
    public static ResponsePlacement of(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (ResponsePlacement c : values()) {
                if (c.value.equals(v)) return c;
            }
        }
        throw new EndpointConfigurationException("Unknown response placement: '" + value + "'");
    }
}
