package io.botpoll.client;

import io.botpoll.core.BotApiException;
import io.botpoll.core.Protocol;
import io.botpoll.http.spi.HttpClientAdapter;
import io.botpoll.http.spi.JdkHttpClientAdapter;
import io.botpoll.http.spi.OkHttpClientAdapter;
import io.botpoll.json.spi.JsonCodec;
import io.botpoll.json.spi.JsonCodecs;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

public final class BotApiBuilder {

    static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(5);
    static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofSeconds(5);

    private String token;
    private URI endpoint = Protocol.DEFAULT_ENDPOINT;
    private Duration readTimeout = DEFAULT_READ_TIMEOUT;
    private Duration writeTimeout = DEFAULT_WRITE_TIMEOUT;
    private JsonCodec codec;
    private Supplier<HttpClientAdapter> httpClientFactory;
    private HttpClient jdkHttpClient;

    BotApiBuilder() {
    }

    public BotApiBuilder token(String token) {
        this.token = token;
        return this;
    }

    /**
     * Reads the token from the environment variable {@code variable}.
     *
     * @throws BotApiException.InvalidEnvironmentVariable if the variable is unset or empty
     */
    public BotApiBuilder tokenFromEnv(String variable) {
        return tokenFromEnv(variable, System::getenv);
    }

    BotApiBuilder tokenFromEnv(String variable, Function<String, String> environment) {
        Objects.requireNonNull(variable, "variable");
        String value = environment.apply(variable);
        if (value == null || value.isEmpty()) {
            throw new BotApiException.InvalidEnvironmentVariable("Environment variable " + variable + " is not set");
        }
        this.token = value;
        return this;
    }

    public BotApiBuilder endpoint(URI endpoint) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        return this;
    }

    public BotApiBuilder readTimeout(Duration readTimeout) {
        this.readTimeout = requirePositive(readTimeout, "readTimeout");
        return this;
    }

    public BotApiBuilder writeTimeout(Duration writeTimeout) {
        this.writeTimeout = requirePositive(writeTimeout, "writeTimeout");
        return this;
    }

    public BotApiBuilder codec(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
        return this;
    }

    /**
     * Supplies a new adapter for every transport, i.e. one for the {@link BotApi} and one per
     * {@link Listener}.
     */
    public BotApiBuilder httpClientFactory(Supplier<HttpClientAdapter> httpClientFactory) {
        this.httpClientFactory = Objects.requireNonNull(httpClientFactory, "httpClientFactory");
        this.jdkHttpClient = null;
        return this;
    }

    /**
     * Uses the JDK client. The client is thread-safe and shared; each transport still wraps it in its
     * own adapter bounded by the read timeout.
     */
    public BotApiBuilder jdkHttpClient(HttpClient httpClient) {
        this.jdkHttpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.httpClientFactory = null;
        return this;
    }

    public BotApi build() {
        String resolvedToken = validateToken(token, endpoint);
        JsonCodec resolvedCodec = codec != null ? codec : JsonCodecs.discover();

        Supplier<HttpClientAdapter> factory = httpClientFactory;
        if (factory == null) {
            Duration read = readTimeout;
            Duration write = writeTimeout;
            HttpClient jdk = jdkHttpClient;
            factory = jdk != null
                    ? () -> new JdkHttpClientAdapter(jdk, read)
                    : () -> OkHttpClientAdapter.create(read, write);
        }
        return new BotApi(endpoint, resolvedToken, factory, resolvedCodec, readTimeout);
    }

    static String validateToken(String token, URI endpoint) {
        if (token == null || token.isBlank()) {
            throw new BotApiException.InvalidToken("Bot token must not be empty");
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (Character.isWhitespace(c) || c == '/' || c == '?' || c == '#') {
                throw new BotApiException.InvalidToken("Bot token contains a character not allowed in a URL path");
            }
        }
        try {
            Protocol.methodUrl(endpoint, token, Protocol.GET_ME);
        } catch (IllegalArgumentException e) {
            throw new BotApiException.InvalidToken("Bot token does not form a valid API URL", e);
        }
        return token;
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return d;
    }
}
