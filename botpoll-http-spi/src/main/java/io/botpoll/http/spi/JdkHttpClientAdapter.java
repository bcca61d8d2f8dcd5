package io.botpoll.http.spi;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link HttpClientAdapter} implementation using the JDK 11+ HttpClient.
 *
 * <p>The JDK client has no separate read and write timeouts; the per-request timeout bounds the
 * whole exchange instead.
 */
public final class JdkHttpClientAdapter implements HttpClientAdapter {

    private final HttpClient httpClient;
    private final Duration defaultTimeout;

    public JdkHttpClientAdapter(HttpClient httpClient, Duration defaultTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.defaultTimeout = defaultTimeout;
    }

    /**
     * Creates a new adapter with a default HttpClient.
     * @param defaultTimeout timeout for requests that do not carry their own, or null for none
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create(Duration defaultTimeout) {
        return new JdkHttpClientAdapter(HttpClient.newHttpClient(), defaultTimeout);
    }

    /**
     * Creates a new adapter with the specified HttpClient.
     * @param httpClient the HttpClient to use
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create(HttpClient httpClient) {
        return new JdkHttpClientAdapter(httpClient, null);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        try {
            HttpRequest jdkRequest = toJdkRequest(request);
            HttpResponse<byte[]> response = httpClient.send(jdkRequest, HttpResponse.BodyHandlers.ofByteArray());
            return new ByteArrayResponse(response);
        } catch (java.net.http.HttpTimeoutException e) {
            throw new HttpTimeoutException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpClientException("Request interrupted", e);
        } catch (Exception e) {
            throw new HttpClientException(e);
        }
    }

    private HttpRequest toJdkRequest(HttpClientRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
                .POST(HttpRequest.BodyPublishers.ofByteArray(request.body()));
        if (request.contentType() != null) {
            builder.header("Content-Type", request.contentType());
        }

        Duration timeout = request.timeout() != null ? request.timeout() : defaultTimeout;
        if (timeout != null) {
            builder.timeout(timeout);
        }

        return builder.build();
    }

    private static final class ByteArrayResponse implements HttpClientResponse {
        private final HttpResponse<byte[]> response;

        ByteArrayResponse(HttpResponse<byte[]> response) {
            this.response = response;
        }

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public Optional<String> header(String name) {
            return response.headers().firstValue(name);
        }

        @Override
        public byte[] body() {
            return response.body() == null ? new byte[0] : response.body();
        }
    }
}
