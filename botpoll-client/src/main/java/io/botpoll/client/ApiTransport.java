package io.botpoll.client;

import io.botpoll.core.BotApiException;
import io.botpoll.core.Envelope;
import io.botpoll.core.FormParams;
import io.botpoll.core.Protocol;
import io.botpoll.http.spi.HttpClientAdapter;
import io.botpoll.http.spi.HttpClientException;
import io.botpoll.http.spi.HttpClientRequest;
import io.botpoll.http.spi.HttpClientResponse;
import io.botpoll.json.spi.JsonCodec;
import io.botpoll.json.spi.JsonException;
import io.botpoll.json.spi.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Performs one API method call and decodes its response envelope.
 *
 * <p>Each call is a blocking form-encoded {@code POST} to {@code <endpoint>/bot<token>/<method>}.
 * The only state is the immutable configuration, but the underlying {@link HttpClientAdapter} is not
 * shared across threads: every {@link Listener} gets its own transport.
 */
public final class ApiTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiTransport.class);

    private final URI endpoint;
    private final String token;
    private final HttpClientAdapter http;
    private final JsonCodec codec;
    private final Duration readTimeout;

    public ApiTransport(URI endpoint, String token, HttpClientAdapter http, JsonCodec codec, Duration readTimeout) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.token = Objects.requireNonNull(token, "token");
        this.http = Objects.requireNonNull(http, "http");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
    }

    public <T> T send(String method, FormParams params, ValueType<T> resultType) {
        return send(method, params, resultType, Duration.ZERO);
    }

    /**
     * Calls {@code method} and returns its decoded result.
     *
     * @param method API method name
     * @param params form parameters
     * @param resultType type of the envelope's {@code result}
     * @param longPollWait how long the remote side may hold the request before answering; added to
     *                     the read timeout
     * @return the decoded result
     * @throws BotApiException.TransportFailure if the exchange failed or timed out
     * @throws BotApiException.MalformedResponse if the body is not a decodable envelope
     * @throws BotApiException.ApiError if the remote side reported a failure
     * @throws BotApiException.InvalidState if the envelope violates its contract
     */
    public <T> T send(String method, FormParams params, ValueType<T> resultType, Duration longPollWait) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(resultType, "resultType");

        HttpClientRequest request = new HttpClientRequest(Protocol.methodUrl(endpoint, token, method),
                Protocol.CT_FORM_URLENCODED, params.encodeBytes(), readTimeout.plus(longPollWait));

        HttpClientResponse response;
        try {
            response = http.send(request);
        } catch (HttpClientException e) {
            throw new BotApiException.TransportFailure("Request " + method + " failed: " + e.getMessage(), e);
        }
        LOGGER.debug("{} answered with HTTP {}", method, response.statusCode());

        Envelope<T> envelope;
        try {
            envelope = codec.readValue(response.body(), envelopeOf(resultType));
        } catch (JsonException e) {
            throw new BotApiException.MalformedResponse(
                    "Response to " + method + " is not a valid envelope (HTTP " + response.statusCode() + ")", e);
        }
        if (envelope == null) {
            throw new BotApiException.MalformedResponse("Response to " + method + " is empty", null);
        }
        return envelope.unwrap();
    }

    JsonCodec codec() {
        return codec;
    }

    private static <T> ValueType<Envelope<T>> envelopeOf(ValueType<T> resultType) {
        return ValueType.parameterized(Envelope.class, resultType);
    }
}
