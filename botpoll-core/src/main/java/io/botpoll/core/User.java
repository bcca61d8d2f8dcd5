package io.botpoll.core;

/**
 * A user or bot.
 */
public record User(long id, boolean isBot, String firstName, String lastName, String username) {}
