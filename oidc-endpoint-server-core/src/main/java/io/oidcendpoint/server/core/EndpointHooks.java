package io.oidcendpoint.server.core;

import io.oidcendpoint.message.Message;
import io.oidcendpoint.server.spi.Hook;

import java.util.Map;
import java.util.Objects;

/**
 * The three extension-point chains of an endpoint.
 *
 * <pre>{@code
 * EndpointHooks<AuthorizationRequest> hooks = EndpointHooks.<AuthorizationRequest>builder()
 *     .postParseRequest(checkRedirectUri)
 *     .preConstruct(addState)
 *     .postConstruct(signResponse)
 *     .build();
 * }</pre>
 *
 * @param <Q> request message type of the endpoint
 */
public final class EndpointHooks<Q extends Message> {

    private final HookChain<Q, String> postParseRequest;
    private final HookChain<Map<String, Object>, Q> preConstruct;
    private final HookChain<Message, Q> postConstruct;

    private EndpointHooks(Builder<Q> builder) {
        this.postParseRequest = builder.postParseRequest;
        this.preConstruct = builder.preConstruct;
        this.postConstruct = builder.postConstruct;
    }

    public static <Q extends Message> EndpointHooks<Q> none() {
        return new Builder<Q>().build();
    }

    public static <Q extends Message> Builder<Q> builder() {
        return new Builder<>();
    }

    /** Runs after a request is verified; sees the resolved client id, which may be null. */
    public HookChain<Q, String> postParseRequest() {
        return postParseRequest;
    }

    /** Runs over the response arguments before the response message is built. */
    public HookChain<Map<String, Object>, Q> preConstruct() {
        return preConstruct;
    }

    /** Runs over the built response message; may turn it into an error. */
    public HookChain<Message, Q> postConstruct() {
        return postConstruct;
    }

    /**
     * Builder for {@link EndpointHooks}. Each call appends one hook to its chain.
     */
    public static final class Builder<Q extends Message> {
        private HookChain<Q, String> postParseRequest = HookChain.empty();
        private HookChain<Map<String, Object>, Q> preConstruct = HookChain.empty();
        private HookChain<Message, Q> postConstruct = HookChain.empty();

        private Builder() {}

        public Builder<Q> postParseRequest(Hook<Q, String> hook) {
            this.postParseRequest = postParseRequest.then(Objects.requireNonNull(hook, "hook"));
            return this;
        }

        public Builder<Q> preConstruct(Hook<Map<String, Object>, Q> hook) {
            this.preConstruct = preConstruct.then(Objects.requireNonNull(hook, "hook"));
            return this;
        }

        public Builder<Q> postConstruct(Hook<Message, Q> hook) {
            this.postConstruct = postConstruct.then(Objects.requireNonNull(hook, "hook"));
            return this;
        }

        public EndpointHooks<Q> build() {
            return new EndpointHooks<>(this);
        }
    }
}
