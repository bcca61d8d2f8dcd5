/**
 * Protocol-centric core for botpoll.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants and the wire data model (updates, messages, users, chats)</li>
 *   <li>The response {@link io.botpoll.core.Envelope} and its validation rules</li>
 *   <li>The update offset used as the acknowledgement cursor</li>
 *   <li>A form-body encoder and the exception hierarchy</li>
 * </ul>
 *
 * <p>HTTP and JSON bindings live in other modules.
 */
package io.botpoll.core;
