/**
 * Server-side SPI for OIDC endpoints.
 *
 * <p>Everything an endpoint consumes from its surroundings: the shared {@link io.oidcendpoint.server.spi.EndpointContext},
 * the client authentication delegate, the client database, the event sink, and the
 * {@link io.oidcendpoint.server.spi.Hook} type used by extension points. The SPI is blocking and minimal;
 * hosts adapt it to their own execution model.
 */
package io.oidcendpoint.server.spi;
