package db.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/**
 * Schema base: cases, fontes, entradas do catálogo e as tabelas penduradas nelas.
 * Timestamps em epoch millis.
 */
public final class V1__catalog_schema extends BaseJavaMigration {
    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();
        ensureSchema(conn);
        ensureIndexes(conn);
    }

    private void ensureSchema(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS cases (
                    id         TEXT PRIMARY KEY,
                    name       TEXT NOT NULL,
                    created_at INTEGER NOT NULL
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS case_sources (
                    case_id         TEXT NOT NULL REFERENCES cases(id) ON DELETE CASCADE,
                    source_path     TEXT NOT NULL,
                    source_location TEXT NOT NULL DEFAULT 'local',   -- local | remote
                    added_at        INTEGER NOT NULL,
                    PRIMARY KEY (case_id, source_path)
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS files (
                    id               TEXT PRIMARY KEY,
                    case_id          TEXT NOT NULL REFERENCES cases(id) ON DELETE CASCADE,
                    file_name        TEXT NOT NULL,
                    folder_path      TEXT NOT NULL,
                    absolute_path    TEXT NOT NULL,
                    file_hash        TEXT,
                    file_type        TEXT NOT NULL,
                    file_size        INTEGER NOT NULL,
                    created_time     INTEGER NOT NULL,
                    modified_time    INTEGER NOT NULL,
                    status           TEXT NOT NULL DEFAULT 'unreviewed',
                    tags             TEXT NOT NULL DEFAULT '[]',
                    source_directory TEXT NOT NULL,
                    cataloged_at     INTEGER NOT NULL,
                    updated_at       INTEGER NOT NULL,
                    deleted_at       INTEGER
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS file_metadata (
                    file_id         TEXT PRIMARY KEY REFERENCES files(id) ON DELETE CASCADE,
                    inventory_data  TEXT NOT NULL,
                    last_scanned_at INTEGER NOT NULL
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS notes (
                    id         TEXT PRIMARY KEY,
                    file_id    TEXT NOT NULL REFERENCES files(id) ON DELETE CASCADE,
                    content    TEXT NOT NULL,
                    created_at INTEGER NOT NULL
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS findings (
                    id           TEXT PRIMARY KEY,
                    case_id      TEXT NOT NULL REFERENCES cases(id) ON DELETE CASCADE,
                    title        TEXT NOT NULL,
                    linked_files TEXT NOT NULL DEFAULT '[]',          -- JSON array of file ids
                    created_at   INTEGER NOT NULL
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS duplicate_groups (
                    case_id    TEXT NOT NULL REFERENCES cases(id) ON DELETE CASCADE,
                    group_id   TEXT NOT NULL,                         -- shared fingerprint
                    file_id    TEXT NOT NULL REFERENCES files(id) ON DELETE CASCADE,
                    is_primary INTEGER NOT NULL DEFAULT 0,
                    created_at INTEGER NOT NULL,
                    PRIMARY KEY (case_id, group_id, file_id)
                )
                """);
        }
    }

    private void ensureIndexes(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            // path único só entre as linhas vivas (soft delete mantém o dele)
            st.execute("""
                CREATE UNIQUE INDEX IF NOT EXISTS ux_files_case_path_live
                ON files(case_id, absolute_path)
                WHERE deleted_at IS NULL
                """);

            // classificação: busca por path, inclusive deletados
            st.execute("""
                CREATE INDEX IF NOT EXISTS idx_files_case_path
                ON files(case_id, absolute_path)
                """);

            // candidatos a rename + duplicados
            st.execute("""
                CREATE INDEX IF NOT EXISTS idx_files_case_hash
                ON files(case_id, file_hash)
                """);

            // cleanup de órfãos por fonte
            st.execute("""
                CREATE INDEX IF NOT EXISTS idx_files_case_source
                ON files(case_id, source_directory)
                """);

            st.execute("""
                CREATE INDEX IF NOT EXISTS idx_notes_file
                ON notes(file_id)
                """);

            st.execute("""
                CREATE INDEX IF NOT EXISTS idx_findings_case
                ON findings(case_id)
                """);
        }
    }
}
