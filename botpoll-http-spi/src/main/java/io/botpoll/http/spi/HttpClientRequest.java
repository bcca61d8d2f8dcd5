package io.botpoll.http.spi;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * One bot API call as sent over HTTP: a {@code POST} of {@code body} to {@code uri}.
 *
 * @param uri method URL, token included
 * @param contentType media type of {@code body}, or {@code null} to send none
 * @param body encoded parameters; empty when the method takes none
 * @param timeout upper bound for receiving the response, or {@code null} for the adapter's defaults.
 *                Long polls set it to cover the time the remote side may hold the request.
 */
public record HttpClientRequest(URI uri, String contentType, byte[] body, Duration timeout) {

    public HttpClientRequest {
        Objects.requireNonNull(uri, "uri");
        body = body == null ? new byte[0] : body;
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
    }

    public HttpClientRequest withTimeout(Duration timeout) {
        return new HttpClientRequest(uri, contentType, body, timeout);
    }
}
