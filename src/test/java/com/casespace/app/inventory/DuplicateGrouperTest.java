package com.casespace.app.inventory;

import com.casespace.app.database.Database.CatalogEntry;
import com.casespace.app.database.Database.GroupMember;
import com.casespace.app.database.SourceLocation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class DuplicateGrouperTest {

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
    void threeIdenticalFiles_formOneGroupWithOnePrimary() throws Exception {
        fx.write("one.bin", "identical");
        fx.write("sub/two.bin", "identical");
        fx.write("sub/deeper/three.bin", "identical");
        fx.write("other.bin", "different");

        fx.sync();

        List<String> groups = fx.dao().listGroupIds(fx.caseId);
        assertEquals(1, groups.size());
        List<GroupMember> members = fx.dao().listGroupMembers(fx.caseId, groups.get(0));
        assertEquals(3, members.size());
        assertEquals(1, members.stream().filter(GroupMember::isPrimary).count());
    }

    @Test
    void laterCopy_isAppended_andPrimaryNeverChanges() throws Exception {
        Path first = fx.write("first.txt", "dup");
        fx.write("second.txt", "dup");
        fx.sync();
        String group = fx.dao().listGroupIds(fx.caseId).get(0);
        String primary = fx.dao().listGroupMembers(fx.caseId, group).get(0).fileId();
        assertEquals(fx.entryAt(first).id(), primary);

        // caminho que ordena antes NÃO rouba o primário
        Path third = fx.write("0-early.txt", "dup");
        SyncResult r = fx.sync();

        assertEquals(1, r.duplicateGroupsTouched());
        List<GroupMember> members = fx.dao().listGroupMembers(fx.caseId, group);
        assertEquals(3, members.size());
        assertEquals(primary, members.get(0).fileId());
        assertTrue(members.get(0).isPrimary());
        assertTrue(members.stream().anyMatch(m -> m.fileId().equals(fx.entryAt(third).id()) && !m.isPrimary()));
    }

    @Test
    void uniqueContent_formsNoGroup() throws Exception {
        fx.write("a.txt", "a");
        fx.write("b.txt", "b");

        SyncResult r = fx.sync();

        assertEquals(0, r.duplicateGroupsTouched());
        assertTrue(fx.dao().listGroupIds(fx.caseId).isEmpty());
    }

    @Test
    void remoteSourcesAreLeftOutOfGroups() throws Exception {
        Path remote = Files.createDirectories(tempDir.resolve("cloud"));
        Files.writeString(remote.resolve("shared.txt"), "dup");
        new CaseSyncService(fx.db, CatalogFixture.syncConfig(), ContentFingerprinter.sha256(), fx.cache,
                fx.clock, IdGenerator.randomUuid())
                .addSource(fx.caseId, remote.toString(), SourceLocation.REMOTE);
        fx.orchestrator().sync(fx.caseId, remote, null, new SyncMetrics(), null);

        fx.write("local.txt", "dup");
        fx.sync();

        assertTrue(fx.dao().listGroupIds(fx.caseId).isEmpty());
    }

    @Test
    void findDuplicates_listsTheOtherLiveCopies() throws Exception {
        Path a = fx.write("a.txt", "dup");
        Path b = fx.write("b.txt", "dup");
        fx.write("c.txt", "unique");
        fx.sync();
        DuplicateGrouper grouper = new DuplicateGrouper(fx.db.jdbi(), fx.clock);

        List<CatalogEntry> dups = grouper.findDuplicates(fx.caseId, fx.entryAt(a).id());

        assertEquals(1, dups.size());
        assertEquals(fx.entryAt(b).id(), dups.get(0).id());
    }

    @Test
    void findDuplicates_rejectsAnEntryFromAnotherCase() throws Exception {
        Path a = fx.write("a.txt", "dup");
        fx.sync();
        String otherCase = UUID.randomUUID().toString();
        fx.dao().insertCase(otherCase, "Other", 1L);
        DuplicateGrouper grouper = new DuplicateGrouper(fx.db.jdbi(), fx.clock);

        assertThrows(ValidationException.class, () -> grouper.findDuplicates(otherCase, fx.entryAt(a).id()));
        assertThrows(ValidationException.class,
                () -> grouper.findDuplicates(fx.caseId, UUID.randomUUID().toString()));
        assertThrows(ValidationException.class, () -> grouper.findDuplicates(fx.caseId, "42"));
    }
}
