/**
 * KV substrate SPI for presence tracking.
 *
 * <p>The SPI is blocking and minimal. It models only what the tracker needs from a bucket with a
 * bucket-wide TTL: create-or-attach, put, get and a bounded enumeration.
 * {@link io.natspresence.kv.spi.ReferenceKvStore} implements it in memory for tests.
 */
package io.natspresence.kv.spi;
