/**
 * Publish/subscribe and request/reply client.
 *
 * <p>Handlers receive {@link io.natspresence.messaging.ReceivedMessage} copies; nothing from the
 * transport's own message objects escapes the dispatch callback.
 */
package io.natspresence.messaging;
