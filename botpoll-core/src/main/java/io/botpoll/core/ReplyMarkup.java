package io.botpoll.core;

import java.util.List;

/**
 * Additional interface options attached to a sent message.
 *
 * <p>Sent JSON-encoded in the {@code reply_markup} parameter. Optional components left {@code null}
 * are omitted on the wire.
 */
public sealed interface ReplyMarkup permits ReplyMarkup.ReplyKeyboardMarkup, ReplyMarkup.ReplyKeyboardRemove, ReplyMarkup.ForceReply {

    /**
     * A custom keyboard; each inner list is one row of button labels.
     */
    record ReplyKeyboardMarkup(
            List<List<String>> keyboard,
            Boolean resizeKeyboard,
            Boolean oneTimeKeyboard,
            Boolean selective
    ) implements ReplyMarkup {
        public ReplyKeyboardMarkup {
            if (keyboard == null || keyboard.isEmpty()) {
                throw new IllegalArgumentException("keyboard must have at least one row");
            }
            keyboard = keyboard.stream().map(List::copyOf).toList();
        }

        public static ReplyKeyboardMarkup of(List<List<String>> keyboard) {
            return new ReplyKeyboardMarkup(keyboard, null, null, null);
        }
    }

    /**
     * Removes the current custom keyboard. {@code removeKeyboard} is always {@code true}.
     */
    record ReplyKeyboardRemove(boolean removeKeyboard, Boolean selective) implements ReplyMarkup {
        public ReplyKeyboardRemove {
            if (!removeKeyboard) {
                throw new IllegalArgumentException("removeKeyboard must be true");
            }
        }

        public static ReplyKeyboardRemove of(Boolean selective) {
            return new ReplyKeyboardRemove(true, selective);
        }
    }

    /**
     * Shows a reply interface to the user. {@code forceReply} is always {@code true}.
     */
    record ForceReply(boolean forceReply, Boolean selective) implements ReplyMarkup {
        public ForceReply {
            if (!forceReply) {
                throw new IllegalArgumentException("forceReply must be true");
            }
        }

        public static ForceReply of(Boolean selective) {
            return new ForceReply(true, selective);
        }
    }
}
