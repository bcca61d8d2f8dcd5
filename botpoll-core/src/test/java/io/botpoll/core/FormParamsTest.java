package io.botpoll.core;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class FormParamsTest {

    @Test
    void encodesInInsertionOrderAndSkipsMissingOptionals() {
        FormParams params = FormParams.empty()
                .add(Protocol.P_OFFSET, 12L)
                .addOptional(Protocol.P_LIMIT, null)
                .addOptional(Protocol.P_TIMEOUT, 30);

        assertThat(params.encode()).isEqualTo("offset=12&timeout=30");
        assertThat(params.get(Protocol.P_LIMIT)).isNull();
    }

    @Test
    void percentEncodesValues() {
        FormParams params = FormParams.empty()
                .add(Protocol.P_TEXT, "Hi, Jo & co = ?")
                .add(Protocol.P_ACTION, ChatAction.UPLOAD_PHOTO);

        assertThat(params.encode()).isEqualTo("text=Hi%2C+Jo+%26+co+%3D+%3F&action=upload_photo");
    }

    @Test
    void emptyParamsEncodeToEmptyBody() {
        assertThat(FormParams.empty().isEmpty()).isTrue();
        assertThat(FormParams.empty().encodeBytes()).isEmpty();
    }

    @Test
    void methodUrlAppendsTokenAndMethod() {
        assertThat(Protocol.methodUrl(Protocol.DEFAULT_ENDPOINT, "123:abc", Protocol.GET_UPDATES))
                .isEqualTo(URI.create("https://api.telegram.org/bot123:abc/getUpdates"));
        assertThat(Protocol.methodUrl(URI.create("http://localhost:8080/api/"), "t", Protocol.GET_ME))
                .isEqualTo(URI.create("http://localhost:8080/api/bott/getMe"));
    }
}
