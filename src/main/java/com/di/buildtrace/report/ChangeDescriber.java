package com.di.buildtrace.report;

import com.di.buildtrace.diff.FingerprintChange;
import com.di.buildtrace.diff.MovePair;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns individual changes into one-line, human-readable descriptions. Geometric fingerprints
 * ({@link ObjectFingerprint}) get positional wording; anything else gets a generic line.
 */
@Component
public class ChangeDescriber {

    public String describeAdded(String key, String fingerprint) {
        return ObjectFingerprint.parse(fingerprint)
                .map(fp -> key + " (" + fp.type() + " added at x:" + fp.x() + ", y:" + fp.y() + ")")
                .orElse(key + " added");
    }

    public String describeRemoved(String key) {
        return key + " removed";
    }

    public String describeMove(MovePair move) {
        String type = ObjectFingerprint.parse(move.fingerprint())
                .map(fp -> " (" + fp.type() + ")")
                .orElse("");
        return move.fromKey() + type + " re-keyed as " + move.toKey() + ", content unchanged";
    }

    /**
     * {@code "D004 (door) moved 2 units east and 1 units south"}, or
     * {@code "D004 attributes modified (not position)."} when x and y are unchanged.
     */
    public String describeModified(FingerprintChange change) {
        Optional<ObjectFingerprint> before = ObjectFingerprint.parse(change.previous());
        Optional<ObjectFingerprint> after  = ObjectFingerprint.parse(change.current());
        if (before.isEmpty() || after.isEmpty()) {
            return change.key() + " modified";
        }
        // long: int coordinates at opposite extremes overflow an int difference
        long dx = (long) after.get().x() - before.get().x();
        long dy = (long) after.get().y() - before.get().y();
        if (dx == 0 && dy == 0) {
            return change.key() + " attributes modified (not position).";
        }

        List<String> direction = new ArrayList<>(2);
        if (dx > 0) {
            direction.add(dx + " units east");
        } else if (dx < 0) {
            direction.add(-dx + " units west");
        }
        if (dy > 0) {
            direction.add(dy + " units north");
        } else if (dy < 0) {
            direction.add(-dy + " units south");
        }
        return change.key() + " (" + before.get().type() + ") moved " + String.join(" and ", direction);
    }
}
