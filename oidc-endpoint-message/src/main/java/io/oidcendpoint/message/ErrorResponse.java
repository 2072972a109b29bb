package io.oidcendpoint.message;

import java.util.Map;

/**
 * OAuth2 error response.
 */
public class ErrorResponse extends Message {

    public static final String INVALID_REQUEST = "invalid_request";

    public static final MessageType<ErrorResponse> TYPE = MessageType.of(ErrorResponse.class, ErrorResponse::new);

    private static final Map<String, ParamSpec> PARAMETERS = Map.of(
            "error", ParamSpec.required(ParamType.STRING),
            "error_description", ParamSpec.optional(ParamType.STRING),
            "error_uri", ParamSpec.optional(ParamType.STRING),
            "state", ParamSpec.optional(ParamType.STRING));

    @Override
    protected Map<String, ParamSpec> parameters() {
        return PARAMETERS;
    }
}
