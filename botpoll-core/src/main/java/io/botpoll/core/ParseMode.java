package io.botpoll.core;

/**
 * Formatting applied to message text.
 */
public enum ParseMode {
    MARKDOWN("Markdown"),
    MARKDOWN_V2("MarkdownV2"),
    HTML("HTML");

    private final String wireName;

    ParseMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName();
    }
}
