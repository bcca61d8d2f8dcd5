/**
 * Blocking bot API client with long-poll update delivery.
 *
 * <p>{@link io.botpoll.client.BotApi} calls individual methods. A {@link io.botpoll.client.Listener}
 * delivers updates in order, either to an {@link io.botpoll.client.UpdateHandler} on the calling
 * thread or through an {@link io.botpoll.client.UpdateChannel} fed by a worker thread.
 */
package io.botpoll.client;
