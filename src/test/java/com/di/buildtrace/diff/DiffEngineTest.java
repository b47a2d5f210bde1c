package com.di.buildtrace.diff;

import com.di.buildtrace.snapshot.Snapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for DiffEngine.
 */
@DisplayName("DiffEngine Tests")
class DiffEngineTest {

    private final DiffEngine engine = new DiffEngine();

    private static Snapshot snapshot(long jobId, Map<String, String> objects) {
        return Snapshot.builder()
                .jobId(jobId)
                .timestamp("2024-05-01T10:00:0" + (jobId % 10) + "Z")
                .latencyMs(1000L * jobId)
                .objects(objects)
                .build();
    }

    private static Map<String, String> objects(String... keyValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    static Stream<Arguments> snapshotPairs() {
        return Stream.of(
                Arguments.of(objects(), objects()),
                Arguments.of(objects(), objects("a", "h1", "b", "h2")),
                Arguments.of(objects("a", "h1", "b", "h2"), objects()),
                Arguments.of(objects("a", "h1", "b", "h2"), objects("a", "h1", "c", "h2")),
                Arguments.of(objects("a", "h1", "b", "h2", "c", "h3"), objects("a", "h9", "b", "h2", "d", "h3", "e", "h1")),
                Arguments.of(objects("x", "same", "y", "same", "z", "other"), objects("p", "same", "q", "same", "z", "changed"))
        );
    }

    // ============================================================================
    // Properties
    // ============================================================================

    @ParameterizedTest
    @MethodSource("snapshotPairs")
    @DisplayName("Added, modified and unchanged cover the current keys; removed, modified and unchanged cover the previous keys")
    void testPartition(Map<String, String> before, Map<String, String> after) {
        ChangeSet cs = engine.diff(snapshot(1, before), snapshot(2, after));

        Set<String> currentCover = new HashSet<>(cs.getAdded());
        currentCover.addAll(cs.getModified());
        currentCover.addAll(cs.getUnchanged());
        assertEquals(after.keySet(), currentCover);

        Set<String> previousCover = new HashSet<>(cs.getRemoved());
        previousCover.addAll(cs.getModified());
        previousCover.addAll(cs.getUnchanged());
        assertEquals(before.keySet(), previousCover);

        int total = cs.getAdded().size() + cs.getRemoved().size() + cs.getModified().size() + cs.getUnchanged().size();
        Set<String> union = new HashSet<>(before.keySet());
        union.addAll(after.keySet());
        assertEquals(union.size(), total, "classes must not overlap");
    }

    @ParameterizedTest
    @MethodSource("snapshotPairs")
    @DisplayName("Diffing the same inputs twice gives equal change sets")
    void testIdempotent(Map<String, String> before, Map<String, String> after) {
        Snapshot p = snapshot(1, before);
        Snapshot c = snapshot(2, after);
        assertEquals(engine.diff(p, c), engine.diff(p, c));
    }

    @ParameterizedTest
    @MethodSource("snapshotPairs")
    @DisplayName("Swapping the snapshots swaps added and removed")
    void testSymmetry(Map<String, String> before, Map<String, String> after) {
        ChangeSet forward = engine.diff(snapshot(1, before), snapshot(2, after));
        ChangeSet backward = engine.diff(snapshot(2, after), snapshot(1, before));

        assertEquals(forward.getAdded(), backward.getRemoved());
        assertEquals(forward.getRemoved(), backward.getAdded());
        assertEquals(forward.getModified(), backward.getModified());
        assertEquals(forward.getUnchanged(), backward.getUnchanged());
    }

    @Test
    @DisplayName("A snapshot diffed against itself is entirely unchanged")
    void testNoOp() {
        Snapshot s = snapshot(3, objects("a", "h1", "b", "h2", "c", "h3"));
        ChangeSet cs = engine.diff(s, s);

        assertTrue(cs.getAdded().isEmpty());
        assertTrue(cs.getRemoved().isEmpty());
        assertTrue(cs.getModified().isEmpty());
        assertTrue(cs.getMoves().isEmpty());
        assertEquals(s.getObjects().keySet(), cs.getUnchanged());
        assertFalse(cs.hasChanges());
    }

    // ============================================================================
    // Examples
    // ============================================================================

    @Test
    @DisplayName("Same fingerprint under a new key is a move, still counted as one add and one removal")
    void testMoveDetection() {
        ChangeSet cs = engine.diff(
                snapshot(1, objects("a", "h1", "b", "h2")),
                snapshot(2, objects("a", "h1", "c", "h2")));

        assertEquals(Set.of("b"), cs.getRemoved());
        assertEquals(Set.of("c"), cs.getAdded());
        assertTrue(cs.getModified().isEmpty());
        assertEquals(Set.of("a"), cs.getUnchanged());
        assertEquals(List.of(new MovePair("b", "c", "h2")), cs.getMoves());
    }

    @Test
    @DisplayName("Different fingerprint under the same key is a modification")
    void testModification() {
        ChangeSet cs = engine.diff(snapshot(1, objects("a", "h1")), snapshot(2, objects("a", "h2")));

        assertEquals(Set.of("a"), cs.getModified());
        assertTrue(cs.getAdded().isEmpty());
        assertTrue(cs.getRemoved().isEmpty());
        assertTrue(cs.getUnchanged().isEmpty());
        assertEquals(List.of(new FingerprintChange("a", "h1", "h2")), cs.getModifications());
    }

    @Test
    @DisplayName("Empty baseline reports every key as added with its fingerprint")
    void testEmptyBaseline() {
        ChangeSet cs = engine.diff(Snapshot.empty(), snapshot(1, objects("b", "h2", "a", "h1")));

        assertEquals(List.of("a", "b"), List.copyOf(cs.getAdded()));
        assertEquals(Map.of("a", "h1", "b", "h2"), cs.getAddedFingerprints());
        assertTrue(cs.getMoves().isEmpty());
    }

    // ============================================================================
    // Move tie-break
    // ============================================================================

    @Test
    @DisplayName("Colliding fingerprints pair removed and added keys in lexicographic order")
    void testTieBreakLexicographic() {
        Snapshot p = snapshot(1, objects("r2", "dup", "r1", "dup", "keep", "k"));
        Snapshot c = snapshot(2, objects("a2", "dup", "a1", "dup", "keep", "k"));

        List<MovePair> expected = List.of(
                new MovePair("r1", "a1", "dup"),
                new MovePair("r2", "a2", "dup"));

        for (int i = 0; i < 5; i++) {
            assertEquals(expected, engine.diff(p, c).getMoves());
        }
    }

    @Test
    @DisplayName("Surplus keys with a shared fingerprint stay unpaired and no key is paired twice")
    void testTieBreakUnevenGroups() {
        Snapshot p = snapshot(1, objects("r1", "dup", "r2", "dup", "r3", "dup"));
        Snapshot c = snapshot(2, objects("a1", "dup"));

        ChangeSet cs = engine.diff(p, c);

        assertEquals(List.of(new MovePair("r1", "a1", "dup")), cs.getMoves());
        assertEquals(Set.of("r1", "r2", "r3"), cs.getRemoved());
        assertEquals(Set.of("a1"), cs.getAdded());
    }

    @Test
    @DisplayName("Moves across several fingerprints are ordered by source key")
    void testMovesOrderedBySourceKey() {
        Snapshot p = snapshot(1, objects("z-old", "aaa", "b-old", "zzz"));
        Snapshot c = snapshot(2, objects("z-new", "aaa", "b-new", "zzz"));

        assertEquals(List.of(
                new MovePair("b-old", "b-new", "zzz"),
                new MovePair("z-old", "z-new", "aaa")), engine.diff(p, c).getMoves());
    }

    @Test
    @DisplayName("Fingerprints must match exactly to form a move")
    void testMoveRequiresExactFingerprint() {
        ChangeSet cs = engine.diff(
                snapshot(1, objects("b", "door_1_2_3_4")),
                snapshot(2, objects("c", "door_1_2_3_4 ")));

        assertTrue(cs.getMoves().isEmpty());
    }

    // ============================================================================
    // Defensive checks
    // ============================================================================

    @Test
    @DisplayName("Should reject a missing snapshot")
    void testNullSnapshot() {
        Snapshot s = snapshot(1, objects("a", "h1"));
        assertThrows(IllegalArgumentException.class, () -> engine.diff(null, s));
        assertThrows(IllegalArgumentException.class, () -> engine.diff(s, null));
    }

    @Test
    @DisplayName("Change set collections are read-only")
    void testResultImmutable() {
        ChangeSet cs = engine.diff(snapshot(1, objects("a", "h1")), snapshot(2, objects("b", "h2")));
        assertThrows(UnsupportedOperationException.class, () -> cs.getAdded().add("x"));
        assertThrows(UnsupportedOperationException.class, () -> cs.getMoves().clear());
    }
}
