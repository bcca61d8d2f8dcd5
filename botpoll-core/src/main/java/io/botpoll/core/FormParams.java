package io.botpoll.core;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered method parameters, encoded as an {@code application/x-www-form-urlencoded} body.
 *
 * <p>Values are converted with {@link String#valueOf(Object)}; enums such as {@link ChatAction}
 * render their wire names. Optional parameters with a {@code null} value are skipped.
 */
public final class FormParams {

    private final List<Map.Entry<String, String>> entries = new ArrayList<>();

    public static FormParams empty() {
        return new FormParams();
    }

    public FormParams add(String name, Object value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, () -> "parameter " + name);
        entries.add(Map.entry(name, String.valueOf(value)));
        return this;
    }

    public FormParams addOptional(String name, Object value) {
        if (value == null) return this;
        return add(name, value);
    }

    public List<Map.Entry<String, String>> entries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * Returns the first value recorded for {@code name}, or {@code null}.
     */
    public String get(String name) {
        for (Map.Entry<String, String> e : entries) {
            if (e.getKey().equals(name)) return e.getValue();
        }
        return null;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public String encode() {
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (Map.Entry<String, String> e : entries) {
            if (!first) sb.append('&');
            first = false;
            sb.append(encode(e.getKey())).append('=').append(encode(e.getValue()));
        }
        return sb.toString();
    }

    public byte[] encodeBytes() {
        return encode().getBytes(StandardCharsets.UTF_8);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return encode();
    }
}
