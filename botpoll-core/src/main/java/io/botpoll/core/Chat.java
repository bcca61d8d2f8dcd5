package io.botpoll.core;

/**
 * A chat. {@code type} is one of {@code private}, {@code group}, {@code supergroup} or {@code channel}.
 */
public record Chat(long id, String type, String title, String username, String firstName, String lastName) {}
