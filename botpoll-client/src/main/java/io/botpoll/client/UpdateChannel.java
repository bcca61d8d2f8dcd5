package io.botpoll.client;

import io.botpoll.core.ListeningAction;
import io.botpoll.core.Update;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A {@link Listener} running on its own worker thread, exposed as a pair of channels.
 *
 * <p>Updates arrive through the {@link Receiver}. Each received update must be answered with exactly
 * one acknowledgement through the {@link Acknowledger} before the next update is produced, so at most
 * one update is in flight. An acknowledgement sent while no received update awaits an answer is
 * refused. Handling is therefore not parallel; the benefit over
 * {@link Listener#listen(UpdateHandler)} is that the consuming thread can wait on other things too.
 *
 * <ul>
 *   <li>Closing the receiver makes the worker treat the next update as {@link ListeningAction#STOP}.</li>
 *   <li>Closing the acknowledger while the worker waits also counts as {@code STOP}.</li>
 *   <li>Never acknowledging leaves the worker blocked for good; there is no timeout.</li>
 * </ul>
 */
public final class UpdateChannel {

    private static final Logger LOGGER = LoggerFactory.getLogger(UpdateChannel.class);

    static final String WORKER_NAME = "botpoll-listener";

    private final HandoffChannel<Update> updates = new HandoffChannel<>();
    private final HandoffChannel<Acknowledgement> acknowledgements = new HandoffChannel<>();
    private final CompletableFuture<Void> completion = new CompletableFuture<>();
    private final AtomicBoolean unanswered = new AtomicBoolean();
    private final Receiver receiver = new Receiver();
    private final Acknowledger acknowledger = new Acknowledger();

    private UpdateChannel() {
    }

    static UpdateChannel start(Listener listener) {
        UpdateChannel channel = new UpdateChannel();
        Thread t = new Thread(() -> channel.run(listener), WORKER_NAME);
        t.setDaemon(true);
        t.start();
        return channel;
    }

    public Receiver receiver() {
        return receiver;
    }

    public Acknowledger acknowledger() {
        return acknowledger;
    }

    /**
     * Completes when the worker has stopped listening, exceptionally if it stopped on a failure.
     */
    public CompletableFuture<Void> completion() {
        return completion;
    }

    private void run(Listener listener) {
        Exception failure = null;
        try {
            listener.run(this::handOver);
        } catch (Exception e) {
            failure = e;
        } finally {
            updates.closeSender();
            acknowledgements.closeReceiver();
        }

        if (failure == null) {
            LOGGER.debug("Update channel worker stopped");
            completion.complete(null);
        } else {
            LOGGER.error("Update channel worker stopped on failure", failure);
            completion.completeExceptionally(failure);
        }
    }

    private ListeningAction handOver(Update update) throws Exception {
        if (!updates.send(update)) {
            LOGGER.debug("Update receiver closed, stopping before update {}", update.updateId());
            return ListeningAction.STOP;
        }
        Optional<Acknowledgement> ack = acknowledgements.receive();
        if (ack.isEmpty()) {
            LOGGER.debug("Acknowledger closed, stopping after update {}", update.updateId());
            return ListeningAction.STOP;
        }
        return ack.get().resolve();
    }

    private record Acknowledgement(ListeningAction action, Exception error) {
        ListeningAction resolve() throws Exception {
            if (error != null) {
                throw error;
            }
            return action;
        }
    }

    /**
     * Consuming end for updates.
     */
    public final class Receiver implements AutoCloseable {

        private Receiver() {
        }

        /**
         * Waits for the next update.
         *
         * @return the update, or empty once the worker has stopped and nothing is pending
         */
        public Optional<Update> receive() throws InterruptedException {
            return received(updates.receive());
        }

        /**
         * Waits up to {@code timeout} for the next update.
         *
         * @return the update, or empty on timeout or once the worker has stopped
         */
        public Optional<Update> receive(Duration timeout) throws InterruptedException {
            Objects.requireNonNull(timeout, "timeout");
            return received(updates.receive(timeout));
        }

        public Optional<Update> tryReceive() {
            return received(updates.tryReceive());
        }

        /**
         * True once the worker has stopped producing updates.
         */
        public boolean isDisconnected() {
            return updates.isSenderClosed();
        }

        /**
         * Stops accepting updates. The worker stops listening at the next update it would deliver.
         */
        @Override
        public void close() {
            updates.closeReceiver();
        }

        private Optional<Update> received(Optional<Update> update) {
            update.ifPresent(u -> unanswered.set(true));
            return update;
        }
    }

    /**
     * Acknowledgement end: answers the update most recently received.
     */
    public final class Acknowledger implements AutoCloseable {

        private Acknowledger() {
        }

        /**
         * Marks the received update as handled.
         *
         * @return false if the worker no longer listens, or if no received update awaits an answer
         */
        public boolean send(ListeningAction action) {
            Objects.requireNonNull(action, "action");
            return answer(new Acknowledgement(action, null));
        }

        /**
         * Fails the received update. The worker acknowledges earlier updates and stops with
         * {@code error}, which then completes {@link UpdateChannel#completion()} exceptionally.
         *
         * @return false if the worker no longer listens, or if no received update awaits an answer
         */
        public boolean sendError(Exception error) {
            Objects.requireNonNull(error, "error");
            return answer(new Acknowledgement(null, error));
        }

        @Override
        public void close() {
            acknowledgements.closeSender();
        }

        private boolean answer(Acknowledgement ack) {
            if (!unanswered.compareAndSet(true, false)) {
                return false;
            }
            return acknowledgements.send(ack);
        }
    }
}
