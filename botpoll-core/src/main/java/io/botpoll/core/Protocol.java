package io.botpoll.core;

import java.net.URI;
import java.util.Objects;

/**
 * Bot API protocol constants (method names, parameter keys, and well-known values).
 *
 * <p>This module intentionally contains no HTTP client bindings and no JSON library dependencies.
 * It only models protocol-level concerns shared by every client implementation.
 */
public final class Protocol {
    private Protocol() {}

    /** Default API endpoint; methods live under {@code /bot<token>/<method>}. */
    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.telegram.org");

    public static final String BOT_PATH_PREFIX = "bot";

    // Methods
    public static final String GET_ME = "getMe";
    public static final String SEND_MESSAGE = "sendMessage";
    public static final String FORWARD_MESSAGE = "forwardMessage";
    public static final String SEND_LOCATION = "sendLocation";
    public static final String SEND_CHAT_ACTION = "sendChatAction";
    public static final String GET_USER_PROFILE_PHOTOS = "getUserProfilePhotos";
    public static final String GET_UPDATES = "getUpdates";
    public static final String SET_WEBHOOK = "setWebhook";

    // Parameter keys
    public static final String P_OFFSET = "offset";
    public static final String P_LIMIT = "limit";
    public static final String P_TIMEOUT = "timeout";
    public static final String P_CHAT_ID = "chat_id";
    public static final String P_FROM_CHAT_ID = "from_chat_id";
    public static final String P_MESSAGE_ID = "message_id";
    public static final String P_TEXT = "text";
    public static final String P_PARSE_MODE = "parse_mode";
    public static final String P_DISABLE_WEB_PAGE_PREVIEW = "disable_web_page_preview";
    public static final String P_REPLY_TO_MESSAGE_ID = "reply_to_message_id";
    public static final String P_REPLY_MARKUP = "reply_markup";
    public static final String P_LATITUDE = "latitude";
    public static final String P_LONGITUDE = "longitude";
    public static final String P_ACTION = "action";
    public static final String P_USER_ID = "user_id";
    public static final String P_URL = "url";

    // HTTP
    public static final String CT_FORM_URLENCODED = "application/x-www-form-urlencoded";

    /**
     * Builds the URL of a single API method.
     *
     * @param endpoint the API endpoint, e.g. {@link #DEFAULT_ENDPOINT}
     * @param token the bot token
     * @param method the method name, e.g. {@link #GET_UPDATES}
     * @return {@code endpoint/bot<token>/<method>}
     */
    public static URI methodUrl(URI endpoint, String token, String method) {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(method, "method");
        String base = endpoint.toString();
        if (!base.endsWith("/")) base = base + "/";
        return URI.create(base + BOT_PATH_PREFIX + token + "/" + method);
    }
}
