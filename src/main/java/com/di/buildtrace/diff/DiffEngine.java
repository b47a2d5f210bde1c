package com.di.buildtrace.diff;

import com.di.buildtrace.snapshot.Snapshot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Compares two snapshots key by key.
 *
 * <h3>Classification</h3>
 * <ul>
 *   <li><b>added</b> – key only in {@code current}</li>
 *   <li><b>removed</b> – key only in {@code previous}</li>
 *   <li><b>modified</b> – key in both, fingerprints differ</li>
 *   <li><b>unchanged</b> – key in both, fingerprints equal</li>
 * </ul>
 *
 * <h3>Move detection</h3>
 * A removed key and an added key carrying the same fingerprint form a move. When several keys
 * on either side share a fingerprint, both sides are sorted lexicographically and paired
 * position by position; surplus keys on the longer side stay unpaired. No key is paired twice.
 *
 * <p>Fingerprints are compared with {@link String#equals}. Stateless and thread-safe.
 */
@Component
public class DiffEngine {

    public ChangeSet diff(Snapshot previous, Snapshot current) {
        if (previous == null || current == null) {
            throw new IllegalArgumentException("Both snapshots are required (previous="
                    + (previous != null) + ", current=" + (current != null) + ")");
        }
        SortedMap<String, String> before = previous.getObjects();
        SortedMap<String, String> after  = current.getObjects();

        TreeSet<String> added     = new TreeSet<>();
        TreeMap<String, String> addedFingerprints = new TreeMap<>();
        TreeSet<String> removed   = new TreeSet<>();
        TreeSet<String> modified  = new TreeSet<>();
        TreeSet<String> unchanged = new TreeSet<>();
        List<FingerprintChange> modifications = new ArrayList<>();

        for (Map.Entry<String, String> e : after.entrySet()) {
            String key = e.getKey();
            String was = before.get(key);
            if (was == null) {
                added.add(key);
                addedFingerprints.put(key, e.getValue());
            } else if (was.equals(e.getValue())) {
                unchanged.add(key);
            } else {
                modified.add(key);
                modifications.add(new FingerprintChange(key, was, e.getValue()));
            }
        }
        for (String key : before.keySet()) {
            if (!after.containsKey(key)) {
                removed.add(key);
            }
        }

        return ChangeSet.builder()
                .added(Collections.unmodifiableSortedSet(added))
                .removed(Collections.unmodifiableSortedSet(removed))
                .modified(Collections.unmodifiableSortedSet(modified))
                .unchanged(Collections.unmodifiableSortedSet(unchanged))
                .addedFingerprints(Collections.unmodifiableSortedMap(addedFingerprints))
                .moves(Collections.unmodifiableList(detectMoves(removed, added, before, after)))
                .modifications(Collections.unmodifiableList(modifications))
                .build();
    }

    static List<MovePair> detectMoves(TreeSet<String> removed,
                                      TreeSet<String> added,
                                      Map<String, String> before,
                                      Map<String, String> after) {
        if (removed.isEmpty() || added.isEmpty()) {
            return new ArrayList<>();
        }
        // keys arrive sorted, so each group is already in lexicographic order
        Map<String, List<String>> removedByFingerprint = groupByFingerprint(removed, before);
        Map<String, List<String>> addedByFingerprint   = groupByFingerprint(added, after);

        List<MovePair> moves = new ArrayList<>();
        for (Map.Entry<String, List<String>> group : removedByFingerprint.entrySet()) {
            List<String> targets = addedByFingerprint.get(group.getKey());
            if (targets == null) {
                continue;
            }
            List<String> sources = group.getValue();
            int pairs = Math.min(sources.size(), targets.size());
            for (int i = 0; i < pairs; i++) {
                moves.add(new MovePair(sources.get(i), targets.get(i), group.getKey()));
            }
        }
        moves.sort(Comparator.comparing(MovePair::fromKey));
        return moves;
    }

    private static Map<String, List<String>> groupByFingerprint(TreeSet<String> keys, Map<String, String> objects) {
        Map<String, List<String>> groups = new TreeMap<>();
        for (String key : keys) {
            groups.computeIfAbsent(objects.get(key), fp -> new ArrayList<>()).add(key);
        }
        return groups;
    }
}
