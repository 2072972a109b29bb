package io.oidcendpoint.server.spi;

import java.util.Objects;

/**
 * One HTTP response header.
 */
public record HttpHeader(String name, String value) {

    public HttpHeader {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    public static HttpHeader of(String name, String value) {
        return new HttpHeader(name, value);
    }
}
