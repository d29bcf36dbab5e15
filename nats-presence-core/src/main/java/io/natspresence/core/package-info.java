/**
 * Substrate-neutral core for presence tracking.
 *
 * <p>This module contains only:
 * <ul>
 *   <li>The presence key schema and bucket/key name validation</li>
 *   <li>Tracker settings and their properties binding</li>
 *   <li>The {@link io.natspresence.core.PresenceException} taxonomy</li>
 * </ul>
 *
 * <p>KV bindings live in the SPI and adapter modules.
 */
package io.natspresence.core;
