package io.oidcendpoint.server.core;

import io.oidcendpoint.message.ErrorResponse;
import io.oidcendpoint.message.FormUrlencoded;
import io.oidcendpoint.message.Message;
import io.oidcendpoint.message.MessageException;
import io.oidcendpoint.message.jwt.KeyRegistry;
import io.oidcendpoint.server.spi.AuthnResult;
import io.oidcendpoint.server.spi.ClientAuthenticator;
import io.oidcendpoint.server.spi.EndpointContext;
import io.oidcendpoint.server.spi.ExtraArgs;
import io.oidcendpoint.server.spi.HttpHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Request/response pipeline shared by every protocol endpoint.
 *
 * <p>Call structure:
 * <pre>
 * parseRequest
 *     - decode
 *     - clientAuthentication (*)
 *     - verify
 *     - post-parse hooks (*)
 * processRequest (*)
 * doResponse
 *     - responseInfo (*)
 *         - construct
 *             - pre-construct hooks (*)
 *             - response type instantiation
 *             - post-construct hooks (*)
 *     - formatting and headers
 * </pre>
 * Steps marked (*) are the places concrete endpoints customize, by overriding or through
 * {@link EndpointHooks}.
 *
 * <p>An endpoint keeps nothing but its configuration: all per-request state lives in arguments
 * and locals, so one instance serves any number of concurrent requests.
 *
 * @param <Q> request message type
 * @param <R> response message type
 */
public class Endpoint<Q extends Message, R extends Message> {
    private static final Logger log = LoggerFactory.getLogger(Endpoint.class);

    static final String PROTOCOL_REQUEST_EVENT = "Protocol request";

    private final EndpointConfig<Q, R> config;
    private final ClientAuthenticator authenticator;
    private final EndpointHooks<Q> hooks;

    public Endpoint(EndpointConfig<Q, R> config, ClientAuthenticator authenticator, EndpointHooks<Q> hooks) {
        this.config = Objects.requireNonNull(config, "config");
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
        this.hooks = Objects.requireNonNull(hooks, "hooks");
        log.debug("{} hooks: post-parse={}, pre-construct={}, post-construct={}", config.name(),
                hooks.postParseRequest().size(), hooks.preConstruct().size(), hooks.postConstruct().size());
    }

    public Endpoint(EndpointConfig<Q, R> config, ClientAuthenticator authenticator) {
        this(config, authenticator, EndpointHooks.none());
    }

    public EndpointConfig<Q, R> config() {
        return config;
    }

    public EndpointHooks<Q> hooks() {
        return hooks;
    }

    public String name() {
        return config.name();
    }

    // ===== Parsing =====

    /**
     * Parses a request already split into parameters.
     *
     * @param request request parameters, may be null or empty
     * @param authorization transport credential, may be null
     * @throws UnauthorizedClientException if client authentication is required and did not succeed
     */
    public ParseResult<Q> parseRequest(EndpointContext context, Map<String, ?> request, String authorization, ExtraArgs extra) {
        logEntry(request);
        Q req = request == null || request.isEmpty()
                ? config.requestType().newInstance()
                : config.requestType().from(request);
        return authenticateAndVerify(context, request, req, authorization, orEmpty(extra));
    }

    /**
     * Parses a request in the endpoint's {@link RequestFormat}.
     *
     * @param request the raw request, may be null or empty
     * @param authorization transport credential, may be null
     * @throws UnauthorizedClientException if client authentication is required and did not succeed
     * @throws MessageException.DecodingFailed if the request cannot be decoded
     */
    public ParseResult<Q> parseRequest(EndpointContext context, String request, String authorization, ExtraArgs extra) {
        logEntry(request);
        Q req = decode(context, request);
        return authenticateAndVerify(context, request, req, authorization, orEmpty(extra));
    }

    public ParseResult<Q> parseRequest(EndpointContext context, String request) {
        return parseRequest(context, request, null, ExtraArgs.empty());
    }

    public ParseResult<Q> parseRequest(EndpointContext context, Map<String, ?> request) {
        return parseRequest(context, request, null, ExtraArgs.empty());
    }

    private Q decode(EndpointContext context, String raw) {
        Q req = config.requestType().newInstance();
        if (raw == null || raw.isEmpty()) {
            return req;
        }
        switch (config.requestFormat()) {
            case JWT -> req.fromJwt(raw, context.keyRegistry().orElse(KeyRegistry.empty()), context.verifySsl());
            case URL -> req.putAll(queryOf(raw));
            case JSON -> req.fromJson(raw);
            case URLENCODED -> req.fromUrlencoded(raw);
        }
        return req;
    }

    private static Map<String, Object> queryOf(String url) {
        try {
            return FormUrlencoded.parseQuery(url);
        } catch (IllegalArgumentException e) {
            throw new MessageException.DecodingFailed("Not a valid URL: " + e.getMessage(), e);
        }
    }

    private ParseResult<Q> authenticateAndVerify(EndpointContext context, Object raw, Q req, String authorization, ExtraArgs extra) {
        String clientId = resolveClientId(context, req, authorization, extra);

        try {
            req.verify(context.keyRegistry().orElse(null), clientId);
        } catch (MessageException.MissingRequiredAttribute | MessageException.MissingRequiredValue
                 | MessageException.InvalidValue e) {
            log.info("{} request rejected: {}", config.name(), e.getMessage());
            return new ParseResult.Rejected<>(errorResponse(ErrorResponse.INVALID_REQUEST, e.getMessage()));
        }

        if (log.isInfoEnabled()) {
            log.info("Parsed and verified request: {}", Sanitizer.sanitize(req));
        }
        context.eventSink().ifPresent(sink -> sink.store(PROTOCOL_REQUEST_EVENT, raw));

        return new ParseResult.Parsed<>(doPostParseRequest(context, req, clientId, extra));
    }

    private String resolveClientId(EndpointContext context, Q req, String authorization, ExtraArgs extra) {
        AuthnResult result = clientAuthentication(context, req, authorization, extra);
        if (result instanceof AuthnResult.Authenticated authenticated) {
            if (authenticated.clientId().isPresent()) {
                String clientId = authenticated.clientId().get();
                req.put("client_id", clientId);
                return clientId;
            }
            return req.getString("client_id").orElse(null);
        }
        if (result instanceof AuthnResult.Failed failed) {
            log.warn("Client authentication at {} failed: {}", config.name(), failed.reason());
            throw new UnauthorizedClientException(config.name(), failed.reason());
        }
        if (config.requiresClientAuthentication()) {
            log.warn("{} requires {} but the request carried no client credential", config.name(), config.clientAuthMethod());
            throw new UnauthorizedClientException(config.name(), "No client authentication method used");
        }
        return req.getString("client_id").orElse(null);
    }

    /**
     * Runs the client authentication delegate. Override to authenticate differently.
     */
    protected AuthnResult clientAuthentication(EndpointContext context, Q request, String authorization, ExtraArgs extra) {
        AuthnResult result = authenticator.authenticate(context, request, authorization);
        return Objects.requireNonNull(result, "authenticator returned null");
    }

    protected Q doPostParseRequest(EndpointContext context, Q request, String clientId, ExtraArgs extra) {
        return hooks.postParseRequest().run(context, request, clientId, extra);
    }

    // ===== Processing =====

    /**
     * Endpoint specific work on a verified request.
     *
     * @return the response arguments for {@link #doResponse}; none by default
     */
    public Map<String, Object> processRequest(EndpointContext context, Q request) {
        return new LinkedHashMap<>();
    }

    // ===== Response =====

    protected Map<String, Object> doPreConstruct(EndpointContext context, Map<String, Object> responseArgs, Q request, ExtraArgs extra) {
        return hooks.preConstruct().run(context, responseArgs, request, extra);
    }

    protected Message doPostConstruct(EndpointContext context, Message response, Q request, ExtraArgs extra) {
        return hooks.postConstruct().run(context, response, request, extra);
    }

    /**
     * Builds the response message from response arguments.
     *
     * @param request the parsed request, may be null
     * @return a message of the response type, or whatever the post-construct hooks turned it into
     */
    public Message construct(EndpointContext context, Map<String, ?> responseArgs, Q request, ExtraArgs extra) {
        ExtraArgs x = orEmpty(extra);
        Map<String, Object> args = responseArgs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(responseArgs);
        args = doPreConstruct(context, args, request, x);
        R response = config.responseType().from(args);
        return doPostConstruct(context, response, request, x);
    }

    /**
     * Assembles the response to send. Delegates to {@link #construct}; endpoints that need a
     * different assembly override this and keep construction as is.
     */
    public Message responseInfo(EndpointContext context, Map<String, ?> responseArgs, Q request, ExtraArgs extra) {
        return construct(context, responseArgs, request, extra);
    }

    /**
     * Produces the response in the endpoint's wire format and placement.
     *
     * <p>Error messages come back untouched as {@link EndpointResponse.Error}. Anything else is
     * serialized (or rendered as a redirect to {@link ExtraArgs#returnUri()}) and given the no-cache
     * headers. Body responses also get a content type merged into the caller's headers; redirects
     * drop the caller's headers.
     *
     * @param responseArgs response arguments, null for none
     * @param request the parsed request, may be null
     * @param extra notably {@code http_headers}, {@code fragment_enc} and {@code return_uri}
     * @throws EndpointConfigurationException if the response goes in the URL and no return URI is given
     */
    public EndpointResponse doResponse(EndpointContext context, Map<String, ?> responseArgs, Q request, ExtraArgs extra) {
        ExtraArgs x = orEmpty(extra);
        Message response = responseInfo(context, responseArgs == null ? Map.of() : responseArgs, request, x);
        if (response.isError()) {
            return new EndpointResponse.Error(response);
        }

        String contentType = null;
        String body = switch (config.responsePlacement()) {
            case BODY -> {
                if (config.responseFormat() == ResponseFormat.JSON) {
                    contentType = HttpHeaders.APPLICATION_JSON;
                    yield response.toJson();
                }
                contentType = HttpHeaders.APPLICATION_FORM_URLENCODED;
                yield response.toUrlencoded();
            }
            case URL -> {
                String returnUri = x.returnUri().orElseThrow(() -> new EndpointConfigurationException(
                        config.name() + " places responses in the URL but no " + ExtraArgs.RETURN_URI + " was given"));
                yield response.request(returnUri, x.fragmentEnc());
            }
        };

        // redirects carry nothing but the no-cache pair
        List<HttpHeader> headers = new ArrayList<>();
        if (contentType != null) {
            String ct = contentType;
            headers.addAll(x.httpHeaders()
                    .map(h -> HttpHeaders.setContentType(h, ct))
                    .orElseGet(() -> List.of(HttpHeader.of(HttpHeaders.CONTENT_TYPE, ct))));
        }
        headers.addAll(HttpHeaders.NO_CACHE);

        return new EndpointResponse.Formatted(body, headers);
    }

    public EndpointResponse doResponse(EndpointContext context, Map<String, ?> responseArgs, Q request) {
        return doResponse(context, responseArgs, request, ExtraArgs.empty());
    }

    private ErrorResponse errorResponse(String error, String description) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("error", error);
        params.put("error_description", description);
        return config.errorType().from(params);
    }

    private void logEntry(Object request) {
        log.debug("- {} -", config.name());
        if (log.isInfoEnabled()) {
            log.info("Request: {}", Sanitizer.sanitize(request));
        }
    }

    private static ExtraArgs orEmpty(ExtraArgs extra) {
        return extra == null ? ExtraArgs.empty() : extra;
    }
}
