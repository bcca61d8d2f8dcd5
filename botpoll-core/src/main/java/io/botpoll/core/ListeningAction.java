package io.botpoll.core;

/**
 * Directive a handler returns after each update.
 *
 * <p>Both values mark the update as handled; it will not be passed to a handler again.
 */
public enum ListeningAction {
    CONTINUE,
    STOP
}
