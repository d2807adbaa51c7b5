/**
 * Server-side SPI for Vera AWS.
 *
 * <p>The SPI is blocking and minimal. Resource handlers see only {@link io.veraaws.server.spi.ResourceStore}
 * and {@link io.veraaws.server.spi.ResourceFilter}; the gateway sees only
 * {@link io.veraaws.server.spi.ActionHandler} and {@link io.veraaws.server.spi.WireCodec}.
 */
package io.veraaws.server.spi;
