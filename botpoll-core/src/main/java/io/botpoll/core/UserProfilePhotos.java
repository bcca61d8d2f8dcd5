package io.botpoll.core;

import java.util.List;

/**
 * Result of {@code getUserProfilePhotos}.
 *
 * @param totalCount total number of profile pictures the user has
 * @param photos requested pictures, each in up to four sizes
 */
public record UserProfilePhotos(int totalCount, List<List<PhotoSize>> photos) {
    public UserProfilePhotos {
        photos = photos == null ? List.of() : List.copyOf(photos);
    }
}
