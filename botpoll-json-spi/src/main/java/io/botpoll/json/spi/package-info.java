/**
 * JSON codec service provider interface.
 *
 * <p>The client depends only on these types; a concrete codec is supplied explicitly or discovered
 * through {@link java.util.ServiceLoader}.
 */
package io.botpoll.json.spi;
