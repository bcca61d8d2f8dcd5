package io.botpoll.client;

import io.botpoll.core.BotApiException;
import io.botpoll.core.ChatAction;
import io.botpoll.core.FormParams;
import io.botpoll.core.ListeningMethod;
import io.botpoll.core.Message;
import io.botpoll.core.ParseMode;
import io.botpoll.core.Protocol;
import io.botpoll.core.ReplyMarkup;
import io.botpoll.core.Update;
import io.botpoll.core.UpdateOffset;
import io.botpoll.core.User;
import io.botpoll.core.UserProfilePhotos;
import io.botpoll.http.spi.HttpClientAdapter;
import io.botpoll.json.spi.JsonCodec;
import io.botpoll.json.spi.JsonException;
import io.botpoll.json.spi.ValueType;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Entry point for calling a bot API.
 *
 * <p>Create one per bot token via {@link #fromToken(String)}, {@link #fromEnv(String)} or
 * {@link #builder()}. Each method corresponds to one remote method of the same name. To receive
 * updates, use {@link #listener(ListeningMethod)} instead of calling {@link #getUpdates} directly.
 *
 * <pre>{@code
 * BotApi api = BotApi.fromEnv("BOT_TOKEN");
 * api.listener(ListeningMethod.longPoll()).listen(update -> {
 *     update.anyMessage().ifPresent(m -> api.sendMessage(m.chat().id(), "Hi!"));
 *     return ListeningAction.CONTINUE;
 * });
 * }</pre>
 */
public final class BotApi {

    private static final ValueType<User> USER = ValueType.of(User.class);
    private static final ValueType<Message> MESSAGE = ValueType.of(Message.class);
    private static final ValueType<Boolean> BOOLEAN = ValueType.of(Boolean.class);
    private static final ValueType<UserProfilePhotos> PROFILE_PHOTOS = ValueType.of(UserProfilePhotos.class);
    private static final ValueType<List<Update>> UPDATES = ValueType.listOf(Update.class);

    private final URI endpoint;
    private final String token;
    private final Supplier<HttpClientAdapter> httpClientFactory;
    private final JsonCodec codec;
    private final Duration readTimeout;
    private final ApiTransport transport;

    BotApi(URI endpoint, String token, Supplier<HttpClientAdapter> httpClientFactory, JsonCodec codec, Duration readTimeout) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.token = Objects.requireNonNull(token, "token");
        this.httpClientFactory = Objects.requireNonNull(httpClientFactory, "httpClientFactory");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
        this.transport = newTransport();
    }

    /**
     * Creates an API object for the given token. The token is only checked for being usable in a URL;
     * call {@link #getMe()} to verify it against the remote side.
     *
     * @throws BotApiException.InvalidToken if the token cannot form a valid API URL
     */
    public static BotApi fromToken(String token) {
        return builder().token(token).build();
    }

    /**
     * Creates an API object with the token stored in environment variable {@code variable}.
     *
     * @throws BotApiException.InvalidEnvironmentVariable if the variable is unset or empty
     * @throws BotApiException.InvalidToken if the token cannot form a valid API URL
     */
    public static BotApi fromEnv(String variable) {
        return builder().tokenFromEnv(variable).build();
    }

    public static BotApiBuilder builder() {
        return new BotApiBuilder();
    }

    public User getMe() {
        return transport.send(Protocol.GET_ME, FormParams.empty(), USER);
    }

    public Message sendMessage(long chatId, String text) {
        return sendMessage(chatId, text, null, null, null, null);
    }

    public Message sendMessage(long chatId, String text, ParseMode parseMode, Boolean disableWebPagePreview,
                               Long replyToMessageId, ReplyMarkup replyMarkup) {
        FormParams params = FormParams.empty()
                .add(Protocol.P_CHAT_ID, chatId)
                .add(Protocol.P_TEXT, text)
                .addOptional(Protocol.P_PARSE_MODE, parseMode == null ? null : parseMode.wireName())
                .addOptional(Protocol.P_DISABLE_WEB_PAGE_PREVIEW, disableWebPagePreview)
                .addOptional(Protocol.P_REPLY_TO_MESSAGE_ID, replyToMessageId)
                .addOptional(Protocol.P_REPLY_MARKUP, encodeReplyMarkup(replyMarkup));
        return transport.send(Protocol.SEND_MESSAGE, params, MESSAGE);
    }

    public Message forwardMessage(long chatId, long fromChatId, long messageId) {
        FormParams params = FormParams.empty()
                .add(Protocol.P_CHAT_ID, chatId)
                .add(Protocol.P_FROM_CHAT_ID, fromChatId)
                .add(Protocol.P_MESSAGE_ID, messageId);
        return transport.send(Protocol.FORWARD_MESSAGE, params, MESSAGE);
    }

    public Message sendLocation(long chatId, double latitude, double longitude, Long replyToMessageId,
                                ReplyMarkup replyMarkup) {
        FormParams params = FormParams.empty()
                .add(Protocol.P_CHAT_ID, chatId)
                .add(Protocol.P_LATITUDE, latitude)
                .add(Protocol.P_LONGITUDE, longitude)
                .addOptional(Protocol.P_REPLY_TO_MESSAGE_ID, replyToMessageId)
                .addOptional(Protocol.P_REPLY_MARKUP, encodeReplyMarkup(replyMarkup));
        return transport.send(Protocol.SEND_LOCATION, params, MESSAGE);
    }

    public boolean sendChatAction(long chatId, ChatAction action) {
        FormParams params = FormParams.empty()
                .add(Protocol.P_CHAT_ID, chatId)
                .add(Protocol.P_ACTION, action.wireName());
        return transport.send(Protocol.SEND_CHAT_ACTION, params, BOOLEAN);
    }

    public UserProfilePhotos getUserProfilePhotos(long userId, Integer offset, Integer limit) {
        FormParams params = FormParams.empty()
                .add(Protocol.P_USER_ID, userId)
                .addOptional(Protocol.P_OFFSET, offset)
                .addOptional(Protocol.P_LIMIT, limit);
        return transport.send(Protocol.GET_USER_PROFILE_PHOTOS, params, PROFILE_PHOTOS);
    }

    /**
     * Calls {@code getUpdates} once.
     *
     * <p><b>Note:</b> this does not track the offset. See {@link #listener(ListeningMethod)} for
     * receiving updates in a loop.
     *
     * @param timeout long-poll timeout in seconds, or null for an immediate answer
     */
    public List<Update> getUpdates(Long offset, Integer limit, Integer timeout) {
        FormParams params = FormParams.empty()
                .addOptional(Protocol.P_OFFSET, offset)
                .addOptional(Protocol.P_LIMIT, limit)
                .addOptional(Protocol.P_TIMEOUT, timeout);
        Duration wait = timeout == null ? Duration.ZERO : Duration.ofSeconds(timeout);
        return transport.send(Protocol.GET_UPDATES, params, UPDATES, wait);
    }

    /**
     * Calls {@code setWebhook}; {@code null} removes the webhook.
     *
     * <p><b>Note:</b> this library does not receive updates via webhook. This is only the raw call.
     */
    public boolean setWebhook(URI url) {
        FormParams params = FormParams.empty()
                .add(Protocol.P_URL, url == null ? "" : url.toString());
        return transport.send(Protocol.SET_WEBHOOK, params, BOOLEAN);
    }

    /**
     * Creates a listener with its own transport and HTTP client; it shares no state with this object.
     */
    public Listener listener(ListeningMethod method) {
        return new Listener(method, newTransport(), UpdateOffset.initial());
    }

    private ApiTransport newTransport() {
        return new ApiTransport(endpoint, token, httpClientFactory.get(), codec, readTimeout);
    }

    private String encodeReplyMarkup(ReplyMarkup replyMarkup) {
        if (replyMarkup == null) return null;
        try {
            return codec.writeString(replyMarkup);
        } catch (JsonException e) {
            throw new IllegalArgumentException("Cannot encode reply markup " + replyMarkup, e);
        }
    }
}
