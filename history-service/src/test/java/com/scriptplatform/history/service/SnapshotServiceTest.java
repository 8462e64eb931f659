package com.scriptplatform.history.service;

import com.scriptplatform.common.exception.PreconditionFailedException;
import com.scriptplatform.common.exception.ResourceNotFoundException;
import com.scriptplatform.common.exception.ValidationException;
import com.scriptplatform.common.model.DraftSnapshot;
import com.scriptplatform.common.model.Platform;
import com.scriptplatform.common.model.PublishMarker;
import com.scriptplatform.common.model.RescoreResult;
import com.scriptplatform.common.model.SnapshotInput;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.scriptplatform.history.service.DraftFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class SnapshotServiceTest {

    @Autowired
    private SnapshotService snapshotService;

    private List<DraftSnapshot> list(String user) {
        return snapshotService.list(user, "youtube", 100).collectList().block();
    }

    // ── save preconditions ─────────────────────────────────────────────────

    @Nested
    @DisplayName("save preconditions")
    class Preconditions {

        @Test
        @DisplayName("no rescore result → rejected, nothing written")
        void unrescored() {
            String user = newUser();
            SnapshotInput input = new SnapshotInput("youtube", null, null, SCRIPT, null, null);

            assertThrows(PreconditionFailedException.class, () -> snapshotService.save(user, input).block());
            assertTrue(list(user).isEmpty());
        }

        @Test
        @DisplayName("rescore of a different text → rejected, nothing written")
        void staleRescore() {
            String user = newUser();
            RescoreResult stale = rescore(SCRIPT);
            SnapshotInput input = new SnapshotInput("youtube", null, null, SCRIPT + "\nOne more line.", null, stale);

            assertThrows(PreconditionFailedException.class, () -> snapshotService.save(user, input).block());
            assertTrue(list(user).isEmpty());
        }

        @Test
        @DisplayName("unsupported platform → validation error")
        void unknownPlatform() {
            SnapshotInput input = new SnapshotInput("myspace", null, null, SCRIPT, null, rescore(SCRIPT));
            assertThrows(ValidationException.class, () -> snapshotService.save(newUser(), input).block());
        }
    }

    // ── append-only history ────────────────────────────────────────────────

    @Nested
    @DisplayName("history")
    class History {

        @Test
        @DisplayName("saved snapshot carries the rescore output and baseline delta")
        void savedFields() {
            DraftSnapshot saved = snapshotService.save(newUser(), input(SCRIPT, 40.0)).block();

            assertNotNull(saved);
            assertNotNull(saved.id());
            assertEquals(Platform.YOUTUBE, saved.platform());
            assertEquals("batch-variant_a", saved.variantId());
            assertEquals(saved.scoreBreakdown().combined(), saved.rescoredScore(), 1e-9);
            assertEquals(Math.round((saved.rescoredScore() - 40.0) * 10.0) / 10.0, saved.deltaScore(), 1e-9);
            assertEquals(7, saved.detectorRankings().size());
            assertEquals(3, saved.scoreBreakdown().weights().size());
            assertNotNull(saved.createdAt());
        }

        @Test
        @DisplayName("k saves → list returns exactly k, newest first")
        void newestFirst() {
            String user = newUser();
            for (int i = 1; i <= 5; i++) {
                snapshotService.save(user, input(SCRIPT + "\nTake " + i + " of the hook.")).block();
            }

            List<DraftSnapshot> snapshots = list(user);

            assertEquals(5, snapshots.size());
            assertTrue(snapshots.get(0).scriptText().endsWith("Take 5 of the hook."));
            for (int i = 1; i < snapshots.size(); i++) {
                assertTrue(snapshots.get(i - 1).id() > snapshots.get(i).id());
            }
        }

        @Test
        @DisplayName("concurrent saves for one scope are all visible exactly once")
        void concurrentSaves() {
            String user = newUser();
            List<DraftSnapshot> saved = Flux.range(1, 8)
                .flatMap(i -> snapshotService.save(user, input(SCRIPT + "\nVariant number " + i + " here.")))
                .collectList()
                .block();

            List<DraftSnapshot> listed = list(user);
            assertNotNull(saved);
            assertEquals(8, listed.size());
            Set<Long> savedIds = saved.stream().map(DraftSnapshot::id).collect(Collectors.toSet());
            Set<Long> listedIds = listed.stream().map(DraftSnapshot::id).collect(Collectors.toSet());
            assertEquals(savedIds, listedIds);
        }

        @Test
        @DisplayName("list is scoped by user and platform and honours the limit")
        void scopedAndLimited() {
            String user = newUser();
            snapshotService.save(user, input(SCRIPT)).block();
            snapshotService.save(user, input(SCRIPT)).block();
            snapshotService.save(user, new SnapshotInput("tiktok", null, null, SCRIPT, null, rescore(SCRIPT))).block();

            assertEquals(2, list(user).size());
            assertEquals(1, snapshotService.list(user, "tiktok", null).collectList().block().size());
            assertEquals(1, snapshotService.list(user, "youtube", 0).collectList().block().size());
            assertTrue(list(newUser()).isEmpty());
        }

        @Test
        @DisplayName("another user's snapshot is not found")
        void getScoped() {
            DraftSnapshot saved = snapshotService.save(newUser(), input(SCRIPT)).block();
            assertNotNull(saved);

            assertThrows(ResourceNotFoundException.class, () -> snapshotService.get(newUser(), saved.id()).block());
        }
    }

    // ── publish markers ────────────────────────────────────────────────────

    @Test
    @DisplayName("latest publish marker wins")
    void publishMarkers() {
        String user = newUser();
        DraftSnapshot first = snapshotService.save(user, input(SCRIPT)).block();
        DraftSnapshot second = snapshotService.save(user, input(SCRIPT)).block();
        assertNotNull(first);
        assertNotNull(second);

        assertNull(snapshotService.published(user, "youtube").block());
        snapshotService.markPublished(user, first.id()).block();
        snapshotService.markPublished(user, second.id()).block();

        PublishMarker marker = snapshotService.published(user, "youtube_shorts").block();
        assertNotNull(marker);
        assertEquals(second.id(), marker.draftSnapshotId());
    }

    @Test
    @DisplayName("limit is clamped to [1, 100], default 20")
    void clampLimit() {
        assertEquals(20, SnapshotService.clampLimit(null));
        assertEquals(1, SnapshotService.clampLimit(-4));
        assertEquals(100, SnapshotService.clampLimit(5000));
        assertEquals(37, SnapshotService.clampLimit(37));
    }
}
