package io.botpoll.client;

import io.botpoll.core.ListeningAction;
import io.botpoll.core.ListeningMethod;
import io.botpoll.core.Update;
import io.botpoll.core.UpdateOffset;
import io.botpoll.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpdateChannelTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final Duration QUIET = Duration.ofMillis(300);

    private final ScriptedHttpAdapter http = new ScriptedHttpAdapter();

    @Test
    void producesNextUpdateOnlyAfterAcknowledgement() throws Exception {
        http.updates(1, 2, 3, 4).updates();
        UpdateChannel channel = listener().channel();
        UpdateChannel.Receiver receiver = channel.receiver();
        UpdateChannel.Acknowledger acknowledger = channel.acknowledger();

        assertThat(receiver.receive(WAIT).map(Update::updateId)).contains(1L);
        assertThat(receiver.receive(QUIET)).isEmpty();
        assertThat(acknowledger.send(ListeningAction.CONTINUE)).isTrue();

        assertThat(receiver.receive(WAIT).map(Update::updateId)).contains(2L);
        assertThat(acknowledger.send(ListeningAction.CONTINUE)).isTrue();

        assertThat(receiver.receive(WAIT).map(Update::updateId)).contains(3L);
        // two acknowledgements so far: update 4 must not be produced yet
        assertThat(receiver.receive(QUIET)).isEmpty();
        assertThat(receiver.tryReceive()).isEmpty();
        assertThat(http.requestCount()).isEqualTo(1);

        assertThat(acknowledger.send(ListeningAction.STOP)).isTrue();
        channel.completion().get(WAIT.toSeconds(), TimeUnit.SECONDS);

        assertThat(receiver.receive()).isEmpty();
        assertThat(receiver.isDisconnected()).isTrue();
        assertThat(http.form(1)).isEqualTo(Map.of("offset", "4", "limit", "0"));
        assertThat(acknowledger.send(ListeningAction.CONTINUE)).isFalse();
    }

    @Test
    void closingReceiverStopsWorkerAtNextUpdate() throws Exception {
        http.updates(1, 2).updates();
        UpdateChannel channel = listener().channel();

        Optional<Update> first = channel.receiver().receive(WAIT);
        assertThat(first).isPresent();
        channel.receiver().close();
        channel.acknowledger().send(ListeningAction.CONTINUE);

        channel.completion().get(WAIT.toSeconds(), TimeUnit.SECONDS);

        assertThat(channel.completion()).isCompleted();
        assertThat(channel.completion().isCompletedExceptionally()).isFalse();
        assertThat(http.requestCount()).isEqualTo(2);
        assertThat(http.form(1)).containsEntry("limit", "0");
    }

    @Test
    void errorAcknowledgementFailsWorker() throws Exception {
        http.updates(1).updates();
        UpdateChannel channel = listener().channel();
        IOException failure = new IOException("consumer failed");

        assertThat(channel.receiver().receive(WAIT)).isPresent();
        channel.acknowledger().sendError(failure);

        assertThatThrownBy(() -> channel.completion().get(WAIT.toSeconds(), TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCause(failure);
        assertThat(http.form(1)).isEqualTo(Map.of("offset", "0", "limit", "0"));
        assertThat(channel.receiver().receive(WAIT)).isEmpty();
    }

    @Test
    void closingAcknowledgerCountsAsStop() throws Exception {
        http.updates(7, 8).updates();
        UpdateChannel channel = listener().channel();

        assertThat(channel.receiver().receive(WAIT).map(Update::updateId)).contains(7L);
        channel.acknowledger().close();

        channel.completion().get(WAIT.toSeconds(), TimeUnit.SECONDS);

        assertThat(http.form(1)).isEqualTo(Map.of("offset", "8", "limit", "0"));
        assertThat(channel.receiver().receive(WAIT)).isEmpty();
    }

    @Test
    void refusesAcknowledgementWithoutUnansweredUpdate() throws Exception {
        http.updates(1, 2).updates();
        UpdateChannel channel = listener().channel();
        UpdateChannel.Receiver receiver = channel.receiver();
        UpdateChannel.Acknowledger acknowledger = channel.acknowledger();

        assertThat(acknowledger.send(ListeningAction.CONTINUE)).isFalse();
        assertThat(receiver.receive(WAIT).map(Update::updateId)).contains(1L);
        assertThat(acknowledger.send(ListeningAction.CONTINUE)).isTrue();
        assertThat(acknowledger.send(ListeningAction.CONTINUE)).isFalse();
        assertThat(acknowledger.sendError(new IOException("late"))).isFalse();

        assertThat(receiver.receive(WAIT).map(Update::updateId)).contains(2L);
        assertThat(receiver.receive(QUIET)).isEmpty();
        assertThat(http.requestCount()).isEqualTo(1);

        assertThat(acknowledger.send(ListeningAction.STOP)).isTrue();
        channel.completion().get(WAIT.toSeconds(), TimeUnit.SECONDS);
        assertThat(http.form(1)).isEqualTo(Map.of("offset", "3", "limit", "0"));
    }

    private Listener listener() {
        ApiTransport transport = new ApiTransport(URI.create("http://localhost"), "TOKEN", http, new JacksonJsonCodec(), Duration.ofSeconds(5));
        return new Listener(ListeningMethod.longPoll(Duration.ofSeconds(1)), transport, UpdateOffset.initial());
    }
}
