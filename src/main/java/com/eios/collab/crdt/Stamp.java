package com.eios.collab.crdt;

import java.util.Comparator;

/**
 * Logical timestamp attached to every operation: a Lamport counter plus the id of
 * the session that produced it.
 *
 * <p>Stamps are totally ordered by counter first and origin second. Two stamps are
 * equal only when both parts are equal, which identifies a single operation.
 */
public record Stamp(long counter, String origin) implements Comparable<Stamp> {

    private static final Comparator<Stamp> ORDER = Comparator
        .comparingLong(Stamp::counter)
        .thenComparing(Stamp::origin);

    public Stamp {
        if (origin == null || origin.isBlank()) {
            throw new IllegalArgumentException("stamp origin required");
        }
    }

    public boolean isAfter(Stamp other) {
        return other == null || compareTo(other) > 0;
    }

    @Override
    public int compareTo(Stamp other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return counter + "@" + origin;
    }
}
