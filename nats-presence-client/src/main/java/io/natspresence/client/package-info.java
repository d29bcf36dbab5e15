/**
 * Presence tracking client.
 *
 * <p>Entry points are {@link io.natspresence.client.PresenceTracker#initialize} and
 * {@link io.natspresence.client.PresenceTracker#builder()}. The KV binding is picked up from the
 * classpath unless one is passed to the builder.
 */
package io.natspresence.client;
