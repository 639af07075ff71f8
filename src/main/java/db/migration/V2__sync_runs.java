package db.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public final class V2__sync_runs extends BaseJavaMigration {
    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();
        ensureSchema(conn);
    }

    private void ensureSchema(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS sync_runs (
                    run_id       INTEGER PRIMARY KEY AUTOINCREMENT,
                    case_id      TEXT NOT NULL REFERENCES cases(id) ON DELETE CASCADE,
                    source_path  TEXT NOT NULL,
                    started_at   INTEGER NOT NULL,
                    finished_at  INTEGER,
                    status       TEXT NOT NULL,                       -- RUNNING | DONE | FAILED
                    inserted     INTEGER NOT NULL DEFAULT 0,
                    updated      INTEGER NOT NULL DEFAULT 0,
                    skipped      INTEGER NOT NULL DEFAULT 0,
                    failed       INTEGER NOT NULL DEFAULT 0,
                    deleted      INTEGER NOT NULL DEFAULT 0
                )
                """);

            st.execute("""
                CREATE INDEX IF NOT EXISTS idx_sync_runs_case_run
                ON sync_runs(case_id, run_id)
                """);
        }
    }
}
