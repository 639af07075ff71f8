package com.casespace.app.inventory;

import com.casespace.app.database.Database.CatalogEntry;
import com.casespace.app.database.Database.GroupMember;
import com.casespace.app.database.Database.SyncRunRow;
import com.casespace.app.database.FileStatus;
import com.casespace.app.database.JsonColumns;
import com.casespace.app.database.SourceLocation;
import com.casespace.app.inventory.TreeWalker.WalkConfig;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class SyncOrchestratorTest {

    @TempDir
    Path tempDir;

    private CatalogFixture fx;

    @BeforeEach
    void setUp() throws Exception {
        fx = CatalogFixture.open(tempDir);
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    void threeFiles_thenUnchangedResync() throws Exception {
        Path a = fx.write("a.txt", "a".repeat(100));
        fx.write("b.txt", "b".repeat(200));
        Path copy = fx.write("copy-of-a.txt", "a".repeat(100));

        List<String> progress = new ArrayList<>();
        SyncResult first = fx.orchestrator().sync(fx.caseId, fx.root, progress::add);

        assertEquals(3, first.totalFiles());
        assertEquals(3, first.inserted());
        assertEquals(0, first.updated());
        assertEquals(1, first.duplicateGroupsTouched());
        assertTrue(first.isClean());
        assertTrue(progress.stream().anyMatch(s -> s.startsWith(">> Phase 1")));

        List<String> groups = fx.dao().listGroupIds(fx.caseId);
        assertEquals(1, groups.size());
        List<GroupMember> members = fx.dao().listGroupMembers(fx.caseId, groups.get(0));
        assertEquals(2, members.size());
        assertEquals(fx.entryAt(a).id(), members.get(0).fileId());
        assertTrue(members.get(0).isPrimary());
        assertFalse(members.get(1).isPrimary());
        assertEquals(fx.entryAt(copy).id(), members.get(1).fileId());

        SyncResult second = fx.sync();

        assertEquals(0, second.inserted());
        assertEquals(0, second.updated());
        assertEquals(3, second.skipped());
        assertEquals(0, second.mutations());
    }

    @Test
    void unchangedResync_neverReadsContent() throws Exception {
        for (int i = 0; i < 25; i++) fx.write("dir" + (i % 3) + "/f" + i + ".txt", "content " + i);
        fx.sync();

        CountingFingerprinter counting = new CountingFingerprinter();
        SyncMetrics metrics = new SyncMetrics();
        SyncResult r = fx.orchestrator(counting).sync(fx.caseId, fx.root, SourceLocation.LOCAL, metrics, null);

        assertEquals(25, r.skipped());
        assertEquals(0, counting.calls.get());
        assertEquals(0L, metrics.filesHashed.sum());
        assertEquals(25L, metrics.filesClassified.sum());
    }

    @Test
    void touchedFile_isSkipped_editedFileIsUpdatedInPlace() throws Exception {
        Path touched = fx.write("touched.txt", "same");
        Path edited = fx.write("edited.txt", "before");
        fx.sync();
        String editedId = fx.entryAt(edited).id();

        fx.write("touched.txt", "same", CatalogFixture.BASE_MTIME + 5_000);
        fx.write("edited.txt", "after, longer", CatalogFixture.BASE_MTIME + 5_000);
        SyncResult r = fx.sync();

        assertEquals(1, r.updated());
        assertEquals(1, r.skipped());
        CatalogEntry e = fx.entryAt(edited);
        assertEquals(editedId, e.id());
        assertEquals(ContentFingerprinter.sha256().fingerprint(edited), e.fileHash());
        assertEquals("after, longer".length(), e.fileSize());
        // só tocou: metadata não volta pro banco
        assertEquals(CatalogFixture.BASE_MTIME, fx.entryAt(touched).modifiedTime());
    }

    @Test
    void contentChange_demotesReviewedAndFlagged_only() throws Exception {
        Path reviewed = fx.write("reviewed.txt", "r1");
        Path flagged = fx.write("flagged.txt", "f1");
        Path finalized = fx.write("finalized.txt", "z1");
        fx.sync();
        fx.dao().setStatus(fx.entryAt(reviewed).id(), FileStatus.REVIEWED.code(), 1L);
        fx.dao().setStatus(fx.entryAt(flagged).id(), FileStatus.FLAGGED.code(), 1L);
        fx.dao().setStatus(fx.entryAt(finalized).id(), FileStatus.FINALIZED.code(), 1L);

        fx.write("reviewed.txt", "r2");
        fx.write("flagged.txt", "f2");
        fx.write("finalized.txt", "z2");
        SyncResult r = fx.sync();

        assertEquals(3, r.updated());
        assertEquals(FileStatus.IN_PROGRESS, fx.entryAt(reviewed).status());
        assertEquals(FileStatus.IN_PROGRESS, fx.entryAt(flagged).status());
        assertEquals(FileStatus.FINALIZED, fx.entryAt(finalized).status());
    }

    @Test
    void unreadableFile_isReportedAndTheRestIsCataloged() throws Exception {
        fx.write("ok-1.txt", "1");
        fx.write("ok-2.txt", "2");
        Path locked = fx.write("locked.txt", "3");
        CountingFingerprinter fp = new CountingFingerprinter();
        fp.failing.add("locked.txt");

        SyncResult r = fx.orchestrator(fp).sync(fx.caseId, fx.root, s -> { });

        assertEquals(3, r.totalFiles());
        assertEquals(2, r.inserted());
        assertEquals(1, r.failed());
        assertEquals(1, r.errors().size());
        assertTrue(r.errors().get(0).startsWith(locked.toString()));
        assertTrue(r.failedPhases().isEmpty());
        assertTrue(fx.dao().findByPath(fx.caseId, locked.toString()).isEmpty());

        // próximo passe pega quando der pra ler
        SyncResult retry = fx.sync();
        assertEquals(1, retry.inserted());
        assertEquals(2, retry.skipped());
    }

    @Test
    void storeFailure_rollsBackTheWholeInsertPhase_butUpdatesStillLand() throws Exception {
        Path existing = fx.write("existing.txt", "v1");
        fx.sync();
        fx.write("existing.txt", "v2", CatalogFixture.BASE_MTIME + 1_000);
        fx.write("new-1.txt", "n1");
        fx.write("poison.txt", "n2");
        fx.db.jdbi().useHandle(h -> h.execute("""
            CREATE TRIGGER fail_poison BEFORE INSERT ON files
            WHEN NEW.file_name = 'poison'
            BEGIN
                SELECT RAISE(ABORT, 'disk quota exceeded');
            END
            """));

        SyncPhaseException ex = assertThrows(SyncPhaseException.class, () -> fx.sync());

        assertEquals(SyncOrchestrator.PHASE_INSERT, ex.phase());
        SyncResult r = ex.result();
        assertEquals(0, r.inserted());
        assertEquals(1, r.updated());
        assertEquals(List.of(SyncOrchestrator.PHASE_INSERT), r.failedPhases());
        assertTrue(fx.dao().findByPath(fx.caseId, fx.root.resolve("new-1.txt").toString()).isEmpty());
        assertEquals(ContentFingerprinter.sha256().fingerprint(existing), fx.entryAt(existing).fileHash());

        SyncRunRow run = fx.dao().listRuns(fx.caseId).get(0);
        assertEquals("FAILED", run.status());
        assertEquals(r.runId(), run.runId());
    }

    @Test
    void writesEnrichmentRecord_andRunLog() throws Exception {
        Path deep = fx.write("2024/q1/Invoice.PDF", "pdf bytes");

        SyncResult r = fx.sync();

        String json = fx.dao().findInventoryData(fx.entryAt(deep).id()).orElseThrow();
        JsonNode node = JsonColumns.read(json);
        assertEquals("Invoice.PDF", node.get("file_name").asText());
        assertEquals("pdf", node.get("file_extension").asText());
        assertEquals("q1", node.get("parent_folder").asText());
        assertEquals(2, node.get("folder_depth").asInt());

        CatalogEntry e = fx.entryAt(deep);
        assertEquals("Invoice", e.fileName());
        assertEquals("PDF", e.fileType());
        assertEquals("2024/q1", e.folderPath());
        assertEquals(fx.root.toString(), e.sourceDirectory());

        SyncRunRow run = fx.dao().listRuns(fx.caseId).get(0);
        assertEquals(r.runId(), run.runId());
        assertEquals("DONE", run.status());
        assertEquals(1, run.inserted());
        assertNotNull(run.finishedAt());
    }

    @Test
    void remoteSource_isCatalogedWithoutFingerprintsOrGroups() throws Exception {
        fx.write("a.txt", "same");
        fx.write("b.txt", "same");

        SyncResult r = fx.orchestrator().sync(fx.caseId, fx.root, SourceLocation.REMOTE, new SyncMetrics(), null);

        assertEquals(2, r.inserted());
        assertEquals(0, r.duplicateGroupsTouched());
        assertTrue(fx.liveEntries().stream().allMatch(e -> e.fileHash() == null));
        assertTrue(fx.dao().listGroupIds(fx.caseId).isEmpty());

        // vale a location registrada, não a pedida depois
        fx.orchestrator().sync(fx.caseId, fx.root, SourceLocation.LOCAL, new SyncMetrics(), null);
        assertEquals(SourceLocation.REMOTE, fx.dao().findSource(fx.caseId, fx.root.toString()).orElseThrow().location());
        assertTrue(fx.liveEntries().stream().allMatch(e -> e.fileHash() == null));
    }

    @Test
    void rejectsBadInputBeforeWriting() throws Exception {
        SyncOrchestrator o = fx.orchestrator();

        assertThrows(ValidationException.class, () -> o.sync("not-a-uuid", fx.root, null));
        assertThrows(ValidationException.class, () -> o.sync(UUID.randomUUID().toString(), fx.root, null));
        assertThrows(ValidationException.class, () -> o.sync(fx.caseId, fx.root.resolve("missing"), null));
        assertTrue(fx.dao().listRuns(fx.caseId).isEmpty());
        assertTrue(fx.dao().listSources(fx.caseId).isEmpty());
    }

    @Test
    void symlinkedRoot_isRejectedBeforeAnythingIsRecorded() throws Exception {
        fx.write("a.txt", "a");
        Path link = tempDir.resolve("link");
        try {
            Files.createSymbolicLink(link, fx.root);
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "Symbolic links not supported here");
        }

        assertThrows(ValidationException.class, () -> fx.orchestrator().sync(fx.caseId, link, null));

        assertTrue(fx.dao().listSources(fx.caseId).isEmpty());
        assertTrue(fx.dao().listRuns(fx.caseId).isEmpty());
        assertTrue(fx.liveEntries().isEmpty());
    }

    @Test
    void scanThatCannotStart_closesTheRunAsFailed() throws Exception {
        fx.write("a.txt", "a");
        // "[" não compila como glob: o walk estoura depois do run já aberto
        SyncConfig broken = new SyncConfig(2, 900, WalkConfig.defaults().withExcludeGlobs(List.of("[")));
        SyncOrchestrator o = new SyncOrchestrator(fx.db, broken, ContentFingerprinter.sha256(), fx.cache,
                fx.clock, IdGenerator.randomUuid());

        assertThrows(RuntimeException.class, () -> o.sync(fx.caseId, fx.root, null));

        List<SyncRunRow> runs = fx.dao().listRuns(fx.caseId);
        assertEquals(1, runs.size());
        assertEquals("FAILED", runs.get(0).status());
        assertNotNull(runs.get(0).finishedAt());
        assertTrue(fx.liveEntries().isEmpty());
    }

    @Test
    void walkErrors_areListedAndCountedAsFailed() throws Exception {
        Path ok = fx.write("ok.txt", "ok");
        Path deep = fx.root.resolve("deep");
        LongPathTree.bury(tempDir, deep, "buried.txt");
        try {
            SyncResult r = fx.sync();

            assertEquals(1, r.inserted());
            assertEquals(1, r.failed());
            assertEquals(1L, r.walkErrors());
            assertEquals(1, r.errors().size());
            assertTrue(r.errors().get(0).startsWith(deep.toString()), r.errors().toString());
            assertFalse(r.isClean());
            assertNotNull(fx.entryAt(ok));

            SyncRunRow run = fx.dao().listRuns(fx.caseId).get(0);
            assertEquals("DONE", run.status());
            assertEquals(1, run.failed());
        } finally {
            LongPathTree.dismantle(tempDir, deep);
        }
    }
}
