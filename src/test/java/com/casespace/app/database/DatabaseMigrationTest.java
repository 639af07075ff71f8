package com.casespace.app.database;

import com.casespace.app.database.Database.EntryWrite;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class DatabaseMigrationTest {

    @TempDir
    Path tempDir;

    private Database db;

    @AfterEach
    void tearDown() {
        if (db != null) db.close();
    }

    private static EntryWrite write(String id, String caseId, String path) {
        return new EntryWrite(id, caseId, "a", "", path, "hash", "TXT", 1L, 0L, 0L, "/src", 1L, "{}", true);
    }

    @Test
    void open_createsSchema_andReopenIsANoOp() {
        db = Database.open(tempDir.resolve("catalog.db"));

        List<String> tables = db.jdbi().withHandle(h -> h.createQuery(
                "SELECT name FROM sqlite_master WHERE type = 'table' ORDER BY name")
                .mapTo(String.class)
                .list());
        for (String t : List.of("cases", "case_sources", "files", "file_metadata", "notes", "findings",
                "duplicate_groups", "sync_runs")) {
            assertTrue(tables.contains(t), "Missing table " + t);
        }
        db.close();

        db = Database.open(tempDir.resolve("catalog.db"));
        int applied = db.jdbi().withHandle(h -> h.createQuery(
                "SELECT COUNT(*) FROM flyway_schema_history WHERE success = 1 AND version IS NOT NULL AND version <> '0'")
                .mapTo(Integer.class)
                .one());
        assertEquals(2, applied);
    }

    @Test
    void livePathIsUnique_butSoftDeletedRowsDoNotBlockIt() {
        db = Database.open(tempDir.resolve("catalog.db"));
        CatalogDao dao = db.dao();
        String caseId = UUID.randomUUID().toString();
        dao.insertCase(caseId, "c", 1L);

        String first = UUID.randomUUID().toString();
        dao.insertEntries(List.of(write(first, caseId, "/src/a.txt")));

        assertThrows(UnableToExecuteStatementException.class,
                () -> dao.insertEntries(List.of(write(UUID.randomUUID().toString(), caseId, "/src/a.txt"))));

        assertEquals(1, dao.softDelete(List.of(first), 2L));
        String second = UUID.randomUUID().toString();
        dao.insertEntries(List.of(write(second, caseId, "/src/a.txt")));

        assertEquals(second, dao.findByPath(caseId, "/src/a.txt").orElseThrow().id());
        assertTrue(dao.findById(first).orElseThrow().isDeleted());
    }

    @Test
    void statusCodes_roundTripThroughTheStore() {
        db = Database.open(tempDir.resolve("catalog.db"));
        CatalogDao dao = db.dao();
        String caseId = UUID.randomUUID().toString();
        dao.insertCase(caseId, "c", 1L);
        String id = UUID.randomUUID().toString();
        dao.insertEntries(List.of(write(id, caseId, "/src/a.txt")));

        assertEquals(FileStatus.UNREVIEWED, dao.findById(id).orElseThrow().status());
        dao.setStatus(id, FileStatus.IN_PROGRESS.code(), 2L);
        assertEquals(FileStatus.IN_PROGRESS, dao.findById(id).orElseThrow().status());
        assertEquals("in_progress", FileStatus.IN_PROGRESS.code());
        assertTrue(FileStatus.FINALIZED.isCritical());
    }
}
