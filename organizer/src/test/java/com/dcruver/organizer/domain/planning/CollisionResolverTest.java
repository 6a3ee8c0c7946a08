package com.dcruver.organizer.domain.planning;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for destination collision handling.
 */
class CollisionResolverTest {

    private CollisionResolver resolver;

    @TempDir
    Path tempDir;

    private Path dest;

    @BeforeEach
    void setUp() throws IOException {
        resolver = new CollisionResolver();
        dest = Files.createDirectories(tempDir.resolve("dest"));
    }

    private PlanAction move(String from, String toRelative) {
        Path to = dest.resolve(toRelative);
        return PlanAction.builder()
            .id(UUID.randomUUID().toString())
            .from(tempDir.resolve("src").resolve(from).toString())
            .fromRelative(from)
            .to(to.toString())
            .toRelative(toRelative)
            .actionType(ActionType.MOVE)
            .reason("Category: Images")
            .confidence(0.8)
            .tags(List.of())
            .build();
    }

    @Test
    void testThreeWayCollisionGetsSequentialSuffixes() {
        List<PlanAction> resolved = resolver.resolve(List.of(
            move("a/photo.jpg", "Images/photo.jpg"),
            move("b/photo.jpg", "Images/photo.jpg"),
            move("c/photo.jpg", "Images/photo.jpg")), dest);

        assertEquals("Images/photo.jpg", resolved.get(0).getToRelative());
        assertEquals("Images/photo (2).jpg", resolved.get(1).getToRelative());
        assertEquals("Images/photo (3).jpg", resolved.get(2).getToRelative());
        assertTrue(resolved.stream().allMatch(PlanAction::isHasCollision));
        assertEquals(ActionType.MOVE, resolved.get(0).getActionType());
        assertEquals(ActionType.MOVE_RENAME, resolved.get(1).getActionType());
        assertTrue(resolved.get(1).getReason().endsWith("| Collision resolved with suffix"));
    }

    @Test
    void testSuffixSkipsNamesClaimedByOtherActions() {
        List<PlanAction> resolved = resolver.resolve(List.of(
            move("a/photo.jpg", "Images/photo.jpg"),
            move("b/photo.jpg", "Images/photo.jpg"),
            move("photo (2).jpg", "Images/photo (2).jpg")), dest);

        assertEquals("Images/photo.jpg", resolved.get(0).getToRelative());
        assertEquals("Images/photo (3).jpg", resolved.get(1).getToRelative());
        assertEquals("Images/photo (2).jpg", resolved.get(2).getToRelative());
        assertFalse(resolved.get(2).isHasCollision());
    }

    @Test
    void testExistingFileOnDisk() throws IOException {
        Files.createDirectories(dest.resolve("Images"));
        Files.writeString(dest.resolve("Images/photo.jpg"), "x");
        Files.writeString(dest.resolve("Images/photo (2).jpg"), "x");

        List<PlanAction> resolved = resolver.resolve(List.of(move("photo.jpg", "Images/photo.jpg")), dest);

        assertEquals("Images/photo (3).jpg", resolved.get(0).getToRelative());
        assertTrue(resolved.get(0).getReason().endsWith("| Existing file, added suffix"));
    }

    @Test
    void testCompoundExtensionKeptWhole() {
        List<PlanAction> resolved = resolver.resolve(List.of(
            move("a/backup.tar.gz", "Archives/backup.tar.gz"),
            move("b/backup.tar.gz", "Archives/backup.tar.gz")), dest);

        assertEquals("Archives/backup (2).tar.gz", resolved.get(1).getToRelative());
    }

    @Test
    void testSkipsAreIgnored() {
        PlanAction skip = move("photo.jpg", "Images/photo.jpg").toBuilder()
            .actionType(ActionType.SKIP)
            .build();

        List<PlanAction> resolved = resolver.resolve(List.of(skip, move("x/photo.jpg", "Images/photo.jpg")), dest);

        assertEquals("Images/photo.jpg", resolved.get(1).getToRelative());
        assertFalse(resolved.get(1).isHasCollision());
        assertSame(skip, resolved.get(0));
    }

    @Test
    void testResolvingTwiceChangesNothing() {
        List<PlanAction> once = resolver.resolve(List.of(
            move("a/photo.jpg", "Images/photo.jpg"),
            move("b/photo.jpg", "Images/photo.jpg")), dest);

        List<PlanAction> twice = resolver.resolve(once, dest);

        assertEquals(once, twice);
    }

    @Test
    void testNextFreePath() throws IOException {
        Path target = dest.resolve("notes.txt");
        Files.writeString(dest.resolve("notes (2).txt"), "x");

        Path free = CollisionResolver.nextFreePath(target, Set.of(dest.resolve("notes (3).txt").toString()));

        assertEquals(dest.resolve("notes (4).txt"), free);
    }
}
