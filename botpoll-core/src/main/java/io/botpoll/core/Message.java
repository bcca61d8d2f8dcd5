package io.botpoll.core;

import java.util.List;

/**
 * A message as delivered inside an {@link Update} or returned by the send methods.
 *
 * @param messageId identifier unique within the chat
 * @param from sender, absent for channel posts
 * @param date unix time the message was sent
 * @param chat conversation the message belongs to
 * @param text text content for text messages
 * @param location shared location
 * @param photo available sizes of a shared photo
 */
public record Message(
        long messageId,
        User from,
        long date,
        Chat chat,
        String text,
        Location location,
        List<PhotoSize> photo
) {

    public enum Kind {
        TEXT,
        LOCATION,
        PHOTO,
        OTHER
    }

    public Message {
        photo = photo == null ? List.of() : List.copyOf(photo);
    }

    public Kind kind() {
        if (text != null) return Kind.TEXT;
        if (location != null) return Kind.LOCATION;
        if (!photo.isEmpty()) return Kind.PHOTO;
        return Kind.OTHER;
    }
}
