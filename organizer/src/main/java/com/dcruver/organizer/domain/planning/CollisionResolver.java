package com.dcruver.organizer.domain.planning;

import com.dcruver.organizer.io.FileNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.*;

/**
 * Makes plan destinations unique, first among the actions themselves and
 * then against what already exists on disk. Running it again on its own
 * output changes nothing.
 */
@Component
@Slf4j
public class CollisionResolver {

    static final int MAX_ATTEMPTS = 10_000;

    public List<PlanAction> resolve(List<PlanAction> actions, Path destRoot) {
        List<PlanAction> deduplicated = resolveWithinPlan(actions, destRoot);
        return resolveAgainstDisk(deduplicated, destRoot);
    }

    /**
     * Every member of a group sharing a destination is flagged; the first keeps
     * the path and the others get " (2)", " (3)" and so on.
     */
    List<PlanAction> resolveWithinPlan(List<PlanAction> actions, Path destRoot) {
        Map<String, List<Integer>> byDestination = new LinkedHashMap<>();
        Set<String> claimed = new HashSet<>();
        for (int i = 0; i < actions.size(); i++) {
            PlanAction action = actions.get(i);
            if (!action.isSkip()) {
                byDestination.computeIfAbsent(action.getTo(), k -> new ArrayList<>()).add(i);
                claimed.add(action.getTo());
            }
        }

        List<PlanAction> result = new ArrayList<>(actions);
        for (Map.Entry<String, List<Integer>> group : byDestination.entrySet()) {
            List<Integer> members = group.getValue();
            if (members.size() < 2) {
                continue;
            }
            log.debug("Collision at {}: {} actions", group.getKey(), members.size());

            Path destination = Path.of(group.getKey());
            result.set(members.get(0), result.get(members.get(0)).withHasCollision(true));

            int n = 2;
            for (int m = 1; m < members.size(); m++) {
                Path candidate = withSuffix(destination, n);
                while (claimed.contains(candidate.toString())) {
                    n++;
                    candidate = withSuffix(destination, n);
                }
                claimed.add(candidate.toString());
                n++;

                PlanAction action = result.get(members.get(m));
                result.set(members.get(m), retarget(action, candidate, destRoot,
                    "Collision resolved with suffix"));
            }
        }
        return result;
    }

    /**
     * Destinations that already exist on disk move to the first free suffix.
     */
    List<PlanAction> resolveAgainstDisk(List<PlanAction> actions, Path destRoot) {
        Set<String> claimed = new HashSet<>();
        for (PlanAction action : actions) {
            if (!action.isSkip()) {
                claimed.add(action.getTo());
            }
        }

        List<PlanAction> result = new ArrayList<>(actions.size());
        for (PlanAction action : actions) {
            if (action.isSkip() || !exists(Path.of(action.getTo()))) {
                result.add(action);
                continue;
            }
            Path free = nextFreePath(Path.of(action.getTo()), claimed);
            claimed.add(free.toString());
            log.debug("Destination {} exists, using {}", action.getTo(), free);
            result.add(retarget(action, free, destRoot, "Existing file, added suffix"));
        }
        return result;
    }

    /**
     * First {@code name (n).ext}, n starting at 2, that is neither on disk nor in {@code claimed}.
     *
     * @throws IllegalStateException when no free name is found within the attempt bound
     */
    public static Path nextFreePath(Path destination, Set<String> claimed) {
        for (int n = 2; n < MAX_ATTEMPTS + 2; n++) {
            Path candidate = withSuffix(destination, n);
            if (!claimed.contains(candidate.toString()) && !exists(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("No free name for " + destination + " after " + MAX_ATTEMPTS + " attempts");
    }

    static Path withSuffix(Path destination, int n) {
        return destination.resolveSibling(FileNames.withSuffix(destination.getFileName().toString(), n));
    }

    private static boolean exists(Path path) {
        return Files.exists(path, LinkOption.NOFOLLOW_LINKS);
    }

    private static PlanAction retarget(PlanAction action, Path newDestination, Path destRoot, String note) {
        return action.toBuilder()
            .to(newDestination.toString())
            .toRelative(destRoot.relativize(newDestination).toString().replace('\\', '/'))
            .actionType(ActionType.between(Path.of(action.getFrom()), newDestination))
            .hasCollision(true)
            .reason(action.getReason() + " | " + note)
            .build();
    }
}
