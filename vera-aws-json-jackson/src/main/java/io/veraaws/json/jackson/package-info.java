/**
 * Jackson implementations of {@link io.veraaws.server.spi.WireCodec}: XML responses for the EC2 and
 * query protocols, JSON documents for the JSON protocol.
 */
package io.veraaws.json.jackson;
