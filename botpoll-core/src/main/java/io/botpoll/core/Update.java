package io.botpoll.core;

import java.util.Optional;

/**
 * One incoming update.
 *
 * <p>{@code updateId} is assigned by the remote side and strictly increases. At most one of the
 * payload fields is set; {@link #kind()} tells which one.
 *
 * @param updateId unique, ascending update identifier
 * @param message a new incoming message
 * @param editedMessage a new version of a known message
 * @param channelPost a new channel post
 * @param editedChannelPost a new version of a known channel post
 */
public record Update(
        long updateId,
        Message message,
        Message editedMessage,
        Message channelPost,
        Message editedChannelPost
) {

    public enum Kind {
        MESSAGE,
        EDITED_MESSAGE,
        CHANNEL_POST,
        EDITED_CHANNEL_POST,
        UNKNOWN
    }

    public Kind kind() {
        if (message != null) return Kind.MESSAGE;
        if (editedMessage != null) return Kind.EDITED_MESSAGE;
        if (channelPost != null) return Kind.CHANNEL_POST;
        if (editedChannelPost != null) return Kind.EDITED_CHANNEL_POST;
        return Kind.UNKNOWN;
    }

    /**
     * Returns whichever message payload this update carries.
     */
    public Optional<Message> anyMessage() {
        if (message != null) return Optional.of(message);
        if (editedMessage != null) return Optional.of(editedMessage);
        if (channelPost != null) return Optional.of(channelPost);
        return Optional.ofNullable(editedChannelPost);
    }
}
