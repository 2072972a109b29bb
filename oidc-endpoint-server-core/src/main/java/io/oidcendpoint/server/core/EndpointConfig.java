package io.oidcendpoint.server.core;

import io.oidcendpoint.message.ErrorResponse;
import io.oidcendpoint.message.Message;
import io.oidcendpoint.message.MessageType;

import java.util.Objects;

/**
 * Fixed configuration of one endpoint type: message bindings, wire formats and the client
 * authentication requirement. Immutable.
 *
 * <p>Use {@link #builder(MessageType, MessageType)}:
 * <pre>{@code
 * EndpointConfig<AccessTokenRequest, AccessTokenResponse> config =
 *     EndpointConfig.builder(AccessTokenRequest.TYPE, AccessTokenResponse.TYPE)
 *         .name("token")
 *         .requestPlacement(RequestPlacement.BODY)
 *         .clientAuthMethod("client_secret_basic")
 *         .build();
 * }</pre>
 *
 * @param <Q> request message type
 * @param <R> response message type
 */
public final class EndpointConfig<Q extends Message, R extends Message> {

    private final String name;
    private final String path;
    private final MessageType<Q> requestType;
    private final MessageType<R> responseType;
    private final MessageType<? extends ErrorResponse> errorType;
    private final RequestFormat requestFormat;
    private final RequestPlacement requestPlacement;
    private final ResponseFormat responseFormat;
    private final ResponsePlacement responsePlacement;
    private final String clientAuthMethod;

    private EndpointConfig(Builder<Q, R> builder) {
        this.name = builder.name;
        this.path = builder.path;
        this.requestType = builder.requestType;
        this.responseType = builder.responseType;
        this.errorType = builder.errorType;
        this.requestFormat = builder.requestFormat;
        this.requestPlacement = builder.requestPlacement;
        this.responseFormat = builder.responseFormat;
        this.responsePlacement = builder.responsePlacement;
        this.clientAuthMethod = builder.clientAuthMethod;
    }

    public static <Q extends Message, R extends Message> Builder<Q, R> builder(MessageType<Q> requestType, MessageType<R> responseType) {
        return new Builder<>(requestType, responseType);
    }

    public String name() {
        return name;
    }

    public String path() {
        return path;
    }

    public MessageType<Q> requestType() {
        return requestType;
    }

    public MessageType<R> responseType() {
        return responseType;
    }

    public MessageType<? extends ErrorResponse> errorType() {
        return errorType;
    }

    public RequestFormat requestFormat() {
        return requestFormat;
    }

    public RequestPlacement requestPlacement() {
        return requestPlacement;
    }

    public ResponseFormat responseFormat() {
        return responseFormat;
    }

    public ResponsePlacement responsePlacement() {
        return responsePlacement;
    }

    /** Client authentication method the endpoint insists on; empty when none is required. */
    public String clientAuthMethod() {
        return clientAuthMethod;
    }

    public boolean requiresClientAuthentication() {
        return !clientAuthMethod.isEmpty();
    }

    @Override
    public String toString() {
        return "EndpointConfig{name='" + name + "', request=" + requestType.name() + "/" + requestFormat.value()
                + ", response=" + responseType.name() + "/" + responseFormat.value() + "@" + responsePlacement.value()
                + ", clientAuthMethod='" + clientAuthMethod + "'}";
    }

    /**
     * Builder for {@link EndpointConfig}. The string setters take the configuration values
     * ({@code "jwt"}, {@code "url"}, ...) and fail immediately on unknown ones.
     */
    public static final class Builder<Q extends Message, R extends Message> {
        private final MessageType<Q> requestType;
        private final MessageType<R> responseType;
        private MessageType<? extends ErrorResponse> errorType = ErrorResponse.TYPE;
        private String name = "";
        private String path = "";
        private RequestFormat requestFormat = RequestFormat.URLENCODED;
        private RequestPlacement requestPlacement = RequestPlacement.QUERY;
        private ResponseFormat responseFormat = ResponseFormat.JSON;
        private ResponsePlacement responsePlacement = ResponsePlacement.BODY;
        private String clientAuthMethod = "";

        private Builder(MessageType<Q> requestType, MessageType<R> responseType) {
            this.requestType = Objects.requireNonNull(requestType, "requestType");
            this.responseType = Objects.requireNonNull(responseType, "responseType");
        }

        /** Sets the endpoint name used in logs and errors. Default: empty. */
        public Builder<Q, R> name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        /** Sets the URL path the host serves the endpoint on. Default: empty. */
        public Builder<Q, R> path(String path) {
            this.path = Objects.requireNonNull(path, "path");
            return this;
        }

        /** Sets the error message type. Default: {@link ErrorResponse}. */
        public Builder<Q, R> errorType(MessageType<? extends ErrorResponse> errorType) {
            this.errorType = Objects.requireNonNull(errorType, "errorType");
            return this;
        }

        /** Default: {@link RequestFormat#URLENCODED}. */
        public Builder<Q, R> requestFormat(RequestFormat requestFormat) {
            this.requestFormat = Objects.requireNonNull(requestFormat, "requestFormat");
            return this;
        }

        public Builder<Q, R> requestFormat(String requestFormat) {
            return requestFormat(RequestFormat.of(requestFormat));
        }

        /** Default: {@link RequestPlacement#QUERY}. */
        public Builder<Q, R> requestPlacement(RequestPlacement requestPlacement) {
            this.requestPlacement = Objects.requireNonNull(requestPlacement, "requestPlacement");
            return this;
        }

        public Builder<Q, R> requestPlacement(String requestPlacement) {
            return requestPlacement(RequestPlacement.of(requestPlacement));
        }

        /** Default: {@link ResponseFormat#JSON}. */
        public Builder<Q, R> responseFormat(ResponseFormat responseFormat) {
            this.responseFormat = Objects.requireNonNull(responseFormat, "responseFormat");
            return this;
        }

        public Builder<Q, R> responseFormat(String responseFormat) {
            return responseFormat(ResponseFormat.of(responseFormat));
        }

        /** Default: {@link ResponsePlacement#BODY}. */
        public Builder<Q, R> responsePlacement(ResponsePlacement responsePlacement) {
            this.responsePlacement = Objects.requireNonNull(responsePlacement, "responsePlacement");
            return this;
        }

        public Builder<Q, R> responsePlacement(String responsePlacement) {
            return responsePlacement(ResponsePlacement.of(responsePlacement));
        }

        /** Sets the required client authentication method. Default: empty, none required. */
        public Builder<Q, R> clientAuthMethod(String clientAuthMethod) {
            this.clientAuthMethod = clientAuthMethod == null ? "" : clientAuthMethod;
            return this;
        }

        public EndpointConfig<Q, R> build() {
            return new EndpointConfig<>(this);
        }
    }
}
