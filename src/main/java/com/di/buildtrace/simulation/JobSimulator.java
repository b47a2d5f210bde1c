package com.di.buildtrace.simulation;

import com.di.buildtrace.api.dto.SnapshotRequest;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Generates a sequence of job submissions over a floor plan of geometric objects, for demos and
 * load tests of {@code POST /process}.
 *
 * <ul>
 *   <li>Job 1: {@code baseObjects} objects with ids like {@code W000}, {@code D001}.</li>
 *   <li>Every later job: removes 5–10 % of objects (only when more than 5 exist), shifts
 *       10–20 % of the rest by −2..2 on x and y, and adds 2–5 objects with ids like
 *       {@code J3ND417}.</li>
 * </ul>
 * Fingerprints are {@code type_x_y_width_height}. The same seed always yields the same objects.
 */
@Slf4j
@Component
public class JobSimulator {

    static final String[] OBJECT_TYPES = {"wall", "door", "window", "column", "stair"};

    private final Clock clock;

    public JobSimulator(Clock clock) {
        this.clock = clock;
    }

    public List<SnapshotRequest> simulate(int jobs, int baseObjects, long seed) {
        if (jobs < 1) {
            throw new IllegalArgumentException("jobs must be at least 1");
        }
        if (baseObjects < 0) {
            throw new IllegalArgumentException("baseObjects must not be negative");
        }
        Random random = new Random(seed);
        Set<String> usedIds = new HashSet<>();
        Map<String, FloorObject> objects = new LinkedHashMap<>();
        Instant start = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);

        List<SnapshotRequest> submissions = new ArrayList<>(jobs);
        for (long jobId = 1; jobId <= jobs; jobId++) {
            if (jobId == 1) {
                seed(objects, usedIds, baseObjects, random);
            } else {
                applyChanges(objects, usedIds, jobId, random);
            }
            submissions.add(SnapshotRequest.builder()
                    .jobId(jobId)
                    .timestamp(start.plusSeconds(60 * (jobId - 1)).toString())
                    .latencyMs(1000L + random.nextInt(29_001))
                    .state(stateMap(objects))
                    .build());
        }
        log.info("[SIMULATE] generated {} job(s), final job has {} objects", jobs, objects.size());
        return submissions;
    }

    private static void seed(Map<String, FloorObject> objects, Set<String> usedIds, int count, Random random) {
        for (int i = 0; i < count; i++) {
            String type = OBJECT_TYPES[random.nextInt(OBJECT_TYPES.length)];
            String id = String.format("%s%03d", initial(type), i);
            usedIds.add(id);
            objects.put(id, newObject(type, random));
        }
    }

    private static void applyChanges(Map<String, FloorObject> objects, Set<String> usedIds, long jobId, Random random) {
        if (objects.size() > 5) {
            int toRemove = between(random, (int) (objects.size() * 0.05), (int) (objects.size() * 0.10));
            for (String id : sample(objects.keySet(), toRemove, random)) {
                objects.remove(id);
            }
        }

        int toModify = between(random, (int) (objects.size() * 0.10), (int) (objects.size() * 0.20));
        for (String id : sample(objects.keySet(), toModify, random)) {
            FloorObject o = objects.get(id);
            o.setX(o.getX() + between(random, -2, 2));
            o.setY(o.getY() + between(random, -2, 2));
        }

        int toAdd = between(random, 2, 5);
        for (int i = 0; i < toAdd; i++) {
            String type = OBJECT_TYPES[random.nextInt(OBJECT_TYPES.length)];
            String id;
            do {
                id = "J" + jobId + "N" + initial(type) + between(random, 100, 999);
            } while (!usedIds.add(id));
            objects.put(id, newObject(type, random));
        }
    }

    private static Map<String, String> stateMap(Map<String, FloorObject> objects) {
        Map<String, String> state = new LinkedHashMap<>();
        objects.forEach((id, o) -> state.put(id, o.fingerprint()));
        return state;
    }

    private static FloorObject newObject(String type, Random random) {
        return new FloorObject(type,
                between(random, 0, 100), between(random, 0, 100),
                between(random, 1, 10), between(random, 1, 10));
    }

    private static List<String> sample(Set<String> ids, int k, Random random) {
        List<String> pool = new ArrayList<>(ids);
        List<String> picked = new ArrayList<>(k);
        for (int i = 0; i < k && !pool.isEmpty(); i++) {
            picked.add(pool.remove(random.nextInt(pool.size())));
        }
        return picked;
    }

    /** Inclusive on both ends. */
    private static int between(Random random, int min, int max) {
        return min + random.nextInt(max - min + 1);
    }

    private static String initial(String type) {
        return type.substring(0, 1).toUpperCase();
    }

    @Data
    @AllArgsConstructor
    static class FloorObject {
        private final String type;
        private int x;
        private int y;
        private final int width;
        private final int height;

        String fingerprint() {
            return type + "_" + x + "_" + y + "_" + width + "_" + height;
        }
    }
}
