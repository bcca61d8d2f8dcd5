package io.botpoll.core;

/**
 * Acknowledgement cursor for {@code getUpdates}.
 *
 * <p>Every update with an identifier below the offset is considered handled. Once an offset has been
 * sent to the remote side, updates below it are never returned again. Offsets only move forward:
 * {@link #advancePast(long)} never yields a smaller value.
 */
public final class UpdateOffset implements Comparable<UpdateOffset> {

    private static final UpdateOffset INITIAL = new UpdateOffset(0);

    private final long value;

    public UpdateOffset(long value) {
        this.value = value;
    }

    /**
     * Offset used by a fresh listener: nothing acknowledged yet.
     */
    public static UpdateOffset initial() {
        return INITIAL;
    }

    public long value() {
        return value;
    }

    /**
     * Returns the offset after handling the update with the given identifier.
     *
     * @param updateId identifier of the handled update
     * @return {@code max(this, updateId + 1)}
     */
    public UpdateOffset advancePast(long updateId) {
        long next = updateId + 1;
        return next > value ? new UpdateOffset(next) : this;
    }

    @Override
    public int compareTo(UpdateOffset o) {
        return Long.compare(value, o.value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof UpdateOffset)) return false;
        return value == ((UpdateOffset) other).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
