package io.botpoll.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeTest {

    @Test
    void okWithResultUnwrapsToResult() {
        Envelope<List<String>> envelope = new Envelope<>(true, List.of("x"), null, null);

        assertThat(envelope.unwrap()).containsExactly("x");
    }

    @Test
    void notOkWithDescriptionIsApiError() {
        Envelope<String> envelope = Envelope.failure("Unauthorized", 401);

        assertThatThrownBy(envelope::unwrap)
                .isInstanceOfSatisfying(BotApiException.ApiError.class, e -> {
                    assertThat(e.description()).isEqualTo("Unauthorized");
                    assertThat(e.errorCode()).isEqualTo(401);
                });
    }

    @Test
    void okWithoutResultIsInvalidState() {
        Envelope<String> envelope = new Envelope<>(true, null, null, null);

        assertThatThrownBy(envelope::unwrap).isInstanceOf(BotApiException.InvalidState.class);
    }

    @Test
    void notOkWithoutDescriptionIsInvalidState() {
        Envelope<String> envelope = new Envelope<>(false, null, null, 500);

        assertThatThrownBy(envelope::unwrap).isInstanceOf(BotApiException.InvalidState.class);
    }

    @Test
    void falseResultStillCountsAsPresent() {
        assertThat(Envelope.success(Boolean.FALSE).unwrap()).isFalse();
    }
}
