package io.oidcendpoint.server.core;

import io.oidcendpoint.server.spi.HttpHeader;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for response header lists.
 */
public final class HttpHeaders {
    private HttpHeaders() {}

    public static final String CONTENT_TYPE = "Content-type";

    public static final String APPLICATION_JSON = "application/json";
    public static final String APPLICATION_FORM_URLENCODED = "application/x-www-form-urlencoded";

    /** Appended to every formatted response. */
    public static final List<HttpHeader> NO_CACHE = List.of(
            HttpHeader.of("Pragma", "no-cache"),
            HttpHeader.of("Cache-Control", "no-store"));

    /**
     * Sets the content type of a header list.
     *
     * <p>If the exact pair is already present the list is returned as is. Otherwise the result is
     * a new list without any {@value #CONTENT_TYPE} entry, followed by the new pair. The argument
     * is never modified.
     */
    public static List<HttpHeader> setContentType(List<HttpHeader> headers, String contentType) {
        HttpHeader wanted = HttpHeader.of(CONTENT_TYPE, contentType);
        if (headers.contains(wanted)) {
            return headers;
        }
        List<HttpHeader> out = new ArrayList<>(headers.size() + 1);
        for (HttpHeader h : headers) {
            if (!h.name().equals(CONTENT_TYPE)) out.add(h);
        }
        out.add(wanted);
        return out;
    }
}
