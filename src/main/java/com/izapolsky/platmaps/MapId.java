package com.izapolsky.platmaps;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

/**
 * Identifier of a single plat map, {@code <community>-<sequence>}, e.g. {@code 001-07}.
 * Equality and ordering follow the canonical string form.
 */
public final class MapId implements Comparable<MapId> {

    private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

    private final String community;
    private final int sequence;
    private final String canonical;

    private MapId(String community, int sequence) {
        this.community = community;
        this.sequence = sequence;
        this.canonical = String.format("%1$s-%2$02d", community, sequence);
    }

    public static MapId of(String community, int sequence) {
        Preconditions.checkArgument(community != null && !community.isEmpty() && DIGITS.matchesAllOf(community),
                "Community has to be numeric: %s", community);
        Preconditions.checkArgument(sequence >= 1, "Sequence has to be positive: %s", sequence);
        return new MapId(community, sequence);
    }

    /**
     * Parses canonical or unpadded form ({@code 001-7} is {@code 001-07})
     *
     * @param text
     * @return parsed id
     * @throws IllegalArgumentException if text is not {@code <digits>-<digits>} or sequence is 0
     */
    public static MapId parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Map id is missing");
        }
        int dash = text.indexOf('-');
        if (dash < 0 || dash != text.lastIndexOf('-')) {
            throw new IllegalArgumentException(String.format("Map id %1$s has to contain exactly one '-'", text));
        }
        String community = text.substring(0, dash);
        String sequence = text.substring(dash + 1);
        if (community.isEmpty() || sequence.isEmpty() || !DIGITS.matchesAllOf(community) || !DIGITS.matchesAllOf(sequence)) {
            throw new IllegalArgumentException(String.format("Map id %1$s has to be numeric on both sides of '-'", text));
        }
        int parsedSequence;
        try {
            parsedSequence = Integer.parseInt(sequence);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Sequence of map id %1$s is out of range", text), e);
        }
        if (parsedSequence < 1) {
            throw new IllegalArgumentException(String.format("Sequence of map id %1$s has to be positive", text));
        }
        return new MapId(community, parsedSequence);
    }

    public static boolean sameCommunity(MapId a, MapId b) {
        return a.community.equals(b.community);
    }

    public boolean sameCommunity(MapId other) {
        return sameCommunity(this, other);
    }

    /**
     * Sibling map within the same community
     */
    public MapId withSequence(int otherSequence) {
        return of(community, otherSequence);
    }

    public String getCommunity() {
        return community;
    }

    public int getSequence() {
        return sequence;
    }

    public String format() {
        return canonical;
    }

    @Override
    public int compareTo(MapId o) {
        return canonical.compareTo(o.canonical);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof MapId && canonical.equals(((MapId) o).canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public String toString() {
        return canonical;
    }
}
