package com.di.buildtrace.diff;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Classification of every key of two snapshots.
 *
 * <p>{@code added}, {@code removed}, {@code modified} and {@code unchanged} are disjoint and
 * together cover the union of both key sets. {@code moves} only annotates pairs drawn from
 * {@code added} and {@code removed}; moved keys stay in those sets and in their counts.
 */
@Value
@Builder
public class ChangeSet {

    SortedSet<String> added;
    SortedSet<String> removed;
    SortedSet<String> modified;
    SortedSet<String> unchanged;

    /** Ordered by {@code fromKey}. */
    List<MovePair> moves;

    /** Fingerprint of each {@code added} key in the current snapshot. */
    SortedMap<String, String> addedFingerprints;

    /** One entry per {@code modified} key, ordered by key. */
    List<FingerprintChange> modifications;

    public boolean hasChanges() {
        return !added.isEmpty() || !removed.isEmpty() || !modified.isEmpty();
    }

    public SortedSet<String> movedFromKeys() {
        return moves.stream().map(MovePair::fromKey).collect(Collectors.toCollection(TreeSet::new));
    }

    public SortedSet<String> movedToKeys() {
        return moves.stream().map(MovePair::toKey).collect(Collectors.toCollection(TreeSet::new));
    }
}
