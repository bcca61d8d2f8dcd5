package io.botpoll.http.spi;

/**
 * Abstraction for HTTP client implementations.
 *
 * <p>This interface allows the bot client to work with different HTTP client libraries
 * (JDK HttpClient, OkHttp) without direct dependency on any specific implementation.
 *
 * <p>Implementations are blocking. A single adapter is used by one caller at a time; callers that
 * run on several threads create one adapter each.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = OkHttpClientAdapter.create(Duration.ofSeconds(5), Duration.ofSeconds(5));
 * HttpClientRequest request = new HttpClientRequest(URI.create("https://example.com/botTOKEN/getMe"), null, null, null);
 * HttpClientResponse response = adapter.send(request);
 * }</pre>
 */
public interface HttpClientAdapter {

    /**
     * Sends an HTTP request and reads the whole response body into memory.
     *
     * <p>Non-2xx statuses are returned as responses, not thrown.
     *
     * @param request the HTTP request to send
     * @return the HTTP response with body as bytes
     * @throws HttpClientException if the request fails
     * @throws HttpTimeoutException if the request times out
     */
    HttpClientResponse send(HttpClientRequest request) throws HttpClientException;
}
