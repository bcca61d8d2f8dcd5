package io.botpoll.client;

import io.botpoll.http.spi.HttpClientAdapter;
import io.botpoll.http.spi.HttpClientException;
import io.botpoll.http.spi.HttpClientRequest;
import io.botpoll.http.spi.HttpClientResponse;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Answers requests from a fixed script and records what was sent. Safe to drive from a worker thread.
 */
final class ScriptedHttpAdapter implements HttpClientAdapter {

    private final Deque<Object> script = new ArrayDeque<>();
    private final List<HttpClientRequest> requests = new ArrayList<>();

    synchronized ScriptedHttpAdapter respond(String json) {
        script.addLast(json);
        return this;
    }

    synchronized ScriptedHttpAdapter updates(long... ids) {
        StringBuilder sb = new StringBuilder("{\"ok\":true,\"result\":[");
        for (int i = 0; i < ids.length; i++) {
            if (i > 0) sb.append(',');
            sb.append("{\"update_id\":").append(ids[i])
                    .append(",\"message\":{\"message_id\":").append(100 + ids[i])
                    .append(",\"date\":0,\"chat\":{\"id\":1,\"type\":\"private\"},\"text\":\"u")
                    .append(ids[i]).append("\"}}");
        }
        script.addLast(sb.append("]}").toString());
        return this;
    }

    synchronized ScriptedHttpAdapter fail(HttpClientException e) {
        script.addLast(e);
        return this;
    }

    @Override
    public synchronized HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        requests.add(request);
        Object next = script.pollFirst();
        if (next == null) {
            throw new AssertionError("Unexpected request #" + requests.size() + ": " + form(request));
        }
        if (next instanceof HttpClientException e) {
            throw e;
        }
        byte[] body = ((String) next).getBytes(StandardCharsets.UTF_8);
        return new HttpClientResponse() {
            @Override public int statusCode() { return 200; }
            @Override public Optional<String> header(String name) { return Optional.empty(); }
            @Override public byte[] body() { return body; }
        };
    }

    synchronized List<HttpClientRequest> requests() {
        return List.copyOf(requests);
    }

    synchronized int requestCount() {
        return requests.size();
    }

    synchronized Map<String, String> form(int index) {
        return form(requests.get(index));
    }

    static Map<String, String> form(HttpClientRequest request) {
        Map<String, String> out = new LinkedHashMap<>();
        if (request.body() == null || request.body().length == 0) return out;
        for (String pair : new String(request.body(), StandardCharsets.UTF_8).split("&")) {
            int eq = pair.indexOf('=');
            out.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                    URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
        }
        return out;
    }
}
