package io.botpoll.http.spi;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClientAdapter} implementation using OkHttp.
 *
 * <p>The wrapped client's read and write timeouts apply to every request. A request that carries
 * its own timeout (a long poll) gets that value as read and call timeout instead; the write timeout
 * stays as configured.
 */
public final class OkHttpClientAdapter implements HttpClientAdapter {

    private final OkHttpClient httpClient;

    public OkHttpClientAdapter(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * Creates an adapter around a fresh client with the given read and write timeouts.
     */
    public static OkHttpClientAdapter create(Duration readTimeout, Duration writeTimeout) {
        OkHttpClient client = new OkHttpClient.Builder()
                .readTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .writeTimeout(writeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .build();
        return new OkHttpClientAdapter(client);
    }

    public static OkHttpClientAdapter create(OkHttpClient httpClient) {
        return new OkHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        OkHttpClient client = clientWithTimeout(request);
        Request okRequest = toOkHttpRequest(request);
        try (Response response = client.newCall(okRequest).execute()) {
            return new ByteArrayResponse(response);
        } catch (SocketTimeoutException e) {
            throw new HttpTimeoutException(e);
        } catch (InterruptedIOException e) {
            // OkHttp reports an expired call timeout this way
            throw new HttpTimeoutException(e);
        } catch (IOException e) {
            throw new HttpClientException(e);
        }
    }

    private OkHttpClient clientWithTimeout(HttpClientRequest request) {
        if (request.timeout() == null) {
            return httpClient;
        }
        long millis = request.timeout().toMillis();
        return httpClient.newBuilder()
                .readTimeout(millis, TimeUnit.MILLISECONDS)
                .callTimeout(millis, TimeUnit.MILLISECONDS)
                .build();
    }

    private static Request toOkHttpRequest(HttpClientRequest request) {
        MediaType mediaType = request.contentType() != null ? MediaType.parse(request.contentType()) : null;
        return new Request.Builder()
                .url(request.uri().toString())
                .post(RequestBody.create(request.body(), mediaType))
                .build();
    }

    private static final class ByteArrayResponse implements HttpClientResponse {
        private final int status;
        private final okhttp3.Headers headers;
        private final byte[] body;

        ByteArrayResponse(Response response) throws IOException {
            this.status = response.code();
            this.headers = response.headers();
            ResponseBody responseBody = response.body();
            this.body = responseBody != null ? responseBody.bytes() : new byte[0];
        }

        @Override public int statusCode() { return status; }
        @Override public Optional<String> header(String name) { return Optional.ofNullable(headers.get(name)); }
        @Override public byte[] body() { return body; }
    }
}
