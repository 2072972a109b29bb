/**
 * JSON codec SPI.
 *
 * <p>The message module depends only on this package; a concrete codec such as the Jackson one
 * is discovered at runtime through {@link io.oidcendpoint.json.spi.JsonCodecProvider}.
 */
package io.oidcendpoint.json.spi;
