package io.botpoll.client;

import io.botpoll.core.ListeningAction;
import io.botpoll.core.Update;

/**
 * Receives updates from {@link Listener#listen(UpdateHandler)}, one at a time and in order.
 *
 * <p>Returning normally marks the update as handled. Throwing stops the listener; the update is then
 * not considered handled and is delivered again on the next run.
 */
@FunctionalInterface
public interface UpdateHandler {
    ListeningAction handle(Update update) throws Exception;
}
