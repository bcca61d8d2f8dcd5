package io.botpoll.core;

/**
 * One size of a photo or thumbnail.
 *
 * @param fileId identifier usable to download or resend the file
 * @param width photo width
 * @param height photo height
 * @param fileSize file size in bytes, if known
 */
public record PhotoSize(String fileId, int width, int height, Long fileSize) {}
