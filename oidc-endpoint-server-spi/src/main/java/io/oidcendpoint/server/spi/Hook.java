package io.oidcendpoint.server.spi;

/**
 * One step of an extension-point chain.
 *
 * <p>Receives the value produced by the previous step and returns the value handed to the next
 * one. Hooks run on the request thread, in the order they were configured.
 *
 * <ul>
 *   <li>post-parse: value is the verified request, {@code arg} the resolved client id (may be null)</li>
 *   <li>pre-construct: value is the response argument map, {@code arg} the request</li>
 *   <li>post-construct: value is the response message, {@code arg} the request</li>
 * </ul>
 *
 * @param <V> type of the value threaded through the chain
 * @param <A> type of the side argument every hook sees
 */
@FunctionalInterface
public interface Hook<V, A> {

    V apply(EndpointContext context, V value, A arg, ExtraArgs extra);
}
