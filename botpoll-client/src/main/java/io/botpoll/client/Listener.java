package io.botpoll.client;

import io.botpoll.core.BotApiException;
import io.botpoll.core.FormParams;
import io.botpoll.core.ListeningAction;
import io.botpoll.core.ListeningMethod;
import io.botpoll.core.Protocol;
import io.botpoll.core.Update;
import io.botpoll.core.UpdateOffset;
import io.botpoll.json.spi.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Receives updates with the configured {@link ListeningMethod} and hands them to a handler.
 *
 * <p>Obtain one through {@link BotApi#listener(ListeningMethod)}. A listener owns its own
 * {@link ApiTransport} and shares no state with the {@link BotApi} it came from, so it can be moved
 * to another thread freely. A listener itself is not thread-safe.
 *
 * <p><b>Note:</b> if the process dies abnormally while listening, updates handled since the last
 * acknowledgement are delivered again on the next run. Delivery is at-least-once.
 */
public final class Listener {

    private static final Logger LOGGER = LoggerFactory.getLogger(Listener.class);

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    private static final ValueType<List<Update>> UPDATES = ValueType.listOf(Update.class);

    private final ListeningMethod method;
    private final ApiTransport transport;
    private UpdateOffset confirmed;
    private boolean consumed;

    Listener(ListeningMethod method, ApiTransport transport, UpdateOffset confirmed) {
        this.method = Objects.requireNonNull(method, "method");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.confirmed = Objects.requireNonNull(confirmed, "confirmed");
    }

    /**
     * The last offset known to have been sent to the remote side.
     */
    public UpdateOffset confirmed() {
        return confirmed;
    }

    public ListeningMethod method() {
        return method;
    }

    /**
     * Receives updates and passes each one to {@code handler}, never twice within one run.
     *
     * <p>Returns normally once the handler returns {@link ListeningAction#STOP}. If the handler throws,
     * already handled updates are acknowledged and the handler's exception is rethrown; the failing
     * update is not acknowledged. Failures while polling are logged and retried without delay.
     * Calling {@code listen} again resumes after the last acknowledged update.
     *
     * @param handler receives every update
     * @throws Exception the handler's exception, or the failure of the final acknowledgement
     */
    public void listen(UpdateHandler handler) throws Exception {
        Objects.requireNonNull(handler, "handler");
        if (consumed) {
            throw new IllegalStateException("Listener has been turned into a channel");
        }
        run(handler);
    }

    /**
     * Runs this listener on a dedicated worker thread and returns the channel it delivers to.
     *
     * <p>The listener is consumed: {@link #listen} and {@code channel} fail afterwards.
     *
     * @return the update and acknowledgement ends
     */
    public UpdateChannel channel() {
        if (consumed) {
            throw new IllegalStateException("Listener has already been turned into a channel");
        }
        consumed = true;
        return UpdateChannel.start(this);
    }

    void run(UpdateHandler handler) throws Exception {
        if (method instanceof ListeningMethod.LongPoll longPoll) {
            longPoll(longPoll.timeout() == null ? DEFAULT_TIMEOUT : longPoll.timeout(), handler);
            return;
        }
        throw new IllegalStateException("Unsupported listening method: " + method);
    }

    private void longPoll(Duration timeout, UpdateHandler handler) throws Exception {
        UpdateOffset handledUntil = confirmed;

        while (true) {
            // No limit: the remote side caps batches on its own.
            List<Update> updates;
            try {
                updates = fetchUpdates(handledUntil, timeout, null);
            } catch (BotApiException e) {
                // TODO distinguish transient from permanent failures and back off between retries
                if (Thread.currentThread().isInterrupted()) {
                    InterruptedException interrupted = new InterruptedException("Interrupted while polling for updates");
                    interrupted.initCause(e);
                    throw interrupted;
                }
                LOGGER.warn("Polling updates at offset {} failed, retrying: {}", handledUntil, e.toString());
                continue;
            }

            confirmed = handledUntil;

            for (Update update : updates) {
                ListeningAction action;
                try {
                    action = dispatch(handler, update);
                } catch (Exception e) {
                    acknowledge(handledUntil, e);
                    throw e;
                }

                handledUntil = handledUntil.advancePast(update.updateId());

                if (action == ListeningAction.STOP) {
                    acknowledge(handledUntil, null);
                    return;
                }
            }
        }
    }

    private static ListeningAction dispatch(UpdateHandler handler, Update update) throws Exception {
        ListeningAction action = handler.handle(update);
        if (action == null) {
            throw new IllegalStateException("Handler returned no action for update " + update.updateId());
        }
        return action;
    }

    /**
     * Sends a zero-limit, zero-wait poll so the remote side learns about {@code handledUntil}.
     */
    private void acknowledge(UpdateOffset handledUntil, Exception handlerFailure) {
        LOGGER.debug("Acknowledging updates below {}", handledUntil);
        try {
            fetchUpdates(handledUntil, null, 0);
        } catch (BotApiException e) {
            if (handlerFailure != null) {
                e.addSuppressed(handlerFailure);
            }
            throw e;
        }
        confirmed = handledUntil;
    }

    private List<Update> fetchUpdates(UpdateOffset offset, Duration timeout, Integer limit) {
        FormParams params = FormParams.empty()
                .add(Protocol.P_OFFSET, offset.value())
                .addOptional(Protocol.P_TIMEOUT, timeout == null ? null : timeout.toSeconds())
                .addOptional(Protocol.P_LIMIT, limit);
        return transport.send(Protocol.GET_UPDATES, params, UPDATES, timeout == null ? Duration.ZERO : timeout);
    }
}
