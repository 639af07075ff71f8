package com.casespace.app.inventory;

import com.casespace.app.database.Database.CatalogEntry;
import com.casespace.app.database.FileStatus;
import com.casespace.app.database.JsonColumns;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class RenameResolverTest {

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
    void movedFile_keepsIdentityStatusAndAnnotations() throws Exception {
        Path a = fx.write("inbox/evidence.pdf", "exhibit 7");
        fx.sync();
        CatalogEntry before = fx.entryAt(a);
        fx.dao().setStatus(before.id(), FileStatus.FLAGGED.code(), 1L);
        fx.dao().setTags(before.id(), JsonColumns.stringArray(List.of("hot")), 1L);
        fx.dao().insertNote(UUID.randomUUID().toString(), before.id(), "check signature", 1L);

        Path b = fx.root.resolve("sorted/evidence-final.pdf");
        Files.createDirectories(b.getParent());
        Files.move(a, b);

        SyncResult r = fx.sync();

        assertEquals(0, r.inserted());
        assertEquals(1, r.updated());
        List<CatalogEntry> live = fx.liveEntries();
        assertEquals(1, live.size());
        CatalogEntry after = live.get(0);
        assertEquals(before.id(), after.id());
        assertEquals(b.toString(), after.absolutePath());
        assertEquals("sorted", after.folderPath());
        assertEquals("evidence-final", after.fileName());
        assertEquals(FileStatus.FLAGGED, after.status());
        assertEquals(List.of("hot"), JsonColumns.parseStringArray(after.tags()));
        assertEquals(before.catalogedAt(), after.catalogedAt());
    }

    @Test
    void copyWhoseOriginalStillExists_isANewEntry() throws Exception {
        Path a = fx.write("a.txt", "same bytes");
        fx.sync();
        String originalId = fx.entryAt(a).id();

        Path copy = fx.write("copy/a.txt", "same bytes");
        SyncResult r = fx.sync();

        assertEquals(1, r.inserted());
        assertEquals(0, r.updated());
        assertEquals(originalId, fx.entryAt(a).id());
        assertNotEquals(originalId, fx.entryAt(copy).id());
    }

    @Test
    void twoCopiesOfAMovedFile_claimTheEntryOnlyOnce() throws Exception {
        Path a = fx.write("a.txt", "moved twice");
        fx.sync();
        String id = fx.entryAt(a).id();

        fx.write("x/a.txt", "moved twice");
        fx.write("y/a.txt", "moved twice");
        Files.delete(a);

        SyncResult r = fx.sync();

        assertEquals(1, r.updated());
        assertEquals(1, r.inserted());
        List<CatalogEntry> live = fx.liveEntries();
        assertEquals(2, live.size());
        assertEquals(1, live.stream().filter(e -> e.id().equals(id)).count());
    }

    @Test
    void candidates_areTriedOldestFirst() throws Exception {
        Path first = fx.write("first.txt", "dup");
        fx.sync();
        Path second = fx.write("second.txt", "dup");
        fx.sync();
        CatalogEntry older = fx.entryAt(first);
        CatalogEntry newer = fx.entryAt(second);
        assertTrue(older.catalogedAt() < newer.catalogedAt());
        Files.delete(first);
        Files.delete(second);
        Path moved = fx.write("moved.txt", "dup");

        RenameResolver resolver = new RenameResolver(fx.dao());
        String hash = ContentFingerprinter.sha256().fingerprint(moved);

        Optional<CatalogEntry> one = resolver.resolve(fx.caseId, fx.root.toString(), hash, moved);
        Optional<CatalogEntry> two = resolver.resolve(fx.caseId, fx.root.toString(), hash, moved);
        Optional<CatalogEntry> three = resolver.resolve(fx.caseId, fx.root.toString(), hash, moved);

        assertEquals(older.id(), one.orElseThrow().id());
        assertEquals(newer.id(), two.orElseThrow().id());
        assertTrue(three.isEmpty());
        assertEquals(2, resolver.claimedCount());
    }

    @Test
    void noFingerprint_meansNoRename() {
        RenameResolver resolver = new RenameResolver(fx.dao());

        assertTrue(resolver.resolve(fx.caseId, fx.root.toString(), null, fx.root.resolve("x")).isEmpty());
    }
}
