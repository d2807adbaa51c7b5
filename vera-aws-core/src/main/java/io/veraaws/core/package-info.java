/**
 * Protocol-centric core for Vera AWS.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>Wire protocol constants (parameter keys, header names, content types)</li>
 *   <li>{@link io.veraaws.core.ValueTree}, the generic tree used for request parameters,
 *       resource attributes and response bodies</li>
 *   <li>{@link io.veraaws.core.AwsException}, the error taxonomy surfaced to clients</li>
 * </ul>
 *
 * <p>HTTP server bindings and storage live in other modules.
 */
package io.veraaws.core;
