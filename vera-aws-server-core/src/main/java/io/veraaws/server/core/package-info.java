/**
 * Framework-neutral server core for Vera AWS.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.veraaws.server.core.AwsGateway} (decode, route, encode pipeline)</li>
 *   <li>{@link io.veraaws.server.core.InMemoryResourceStore} (the only resource store)</li>
 *   <li>{@link io.veraaws.server.core.FilterEvaluator} (provider filter semantics)</li>
 *   <li>{@link io.veraaws.server.core.ParameterDecoder} (flat query parameters to value trees)</li>
 * </ul>
 *
 * <p>Framework integrations adapt {@link io.veraaws.server.core.ServerRequest} and
 * {@link io.veraaws.server.core.ServerResponse} to their HTTP runtimes.
 */
package io.veraaws.server.core;
