package com.casespace.app.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import com.casespace.app.database.Database.CaseRow;
import com.casespace.app.database.Database.CaseSourceRow;
import com.casespace.app.database.Database.CatalogEntry;
import com.casespace.app.database.Database.EntryWrite;
import com.casespace.app.database.Database.GroupMember;
import com.casespace.app.database.Database.PathRef;
import com.casespace.app.database.Database.SyncRunRow;

@RegisterRowMapper(CatalogDao.CatalogEntryMapper.class)
public interface CatalogDao {

    String ENTRY_COLUMNS = """
        f.id, f.case_id, f.file_name, f.folder_path, f.absolute_path, f.file_hash, f.file_type,
        f.file_size, f.created_time, f.modified_time, f.status, f.tags, f.source_directory,
        f.cataloged_at, f.updated_at, f.deleted_at
        """;

    // --- Cases & sources -----------------------------------------------------

    @SqlUpdate("INSERT INTO cases(id, name, created_at) VALUES(:id, :name, :now)")
    void insertCase(@Bind("id") String id, @Bind("name") String name, @Bind("now") long now);

    @SqlQuery("""
        SELECT id, name, created_at AS createdAt
          FROM cases
         WHERE id = :id
        """)
    @RegisterConstructorMapper(CaseRow.class)
    Optional<CaseRow> findCase(@Bind("id") String id);

    @SqlQuery("""
        SELECT id, name, created_at AS createdAt
          FROM cases
         ORDER BY created_at, id
        """)
    @RegisterConstructorMapper(CaseRow.class)
    List<CaseRow> listCases();

    @SqlUpdate("""
        INSERT OR IGNORE INTO case_sources(case_id, source_path, source_location, added_at)
        VALUES(:caseId, :sourcePath, :location, :now)
        """)
    int insertSource(@Bind("caseId") String caseId,
                     @Bind("sourcePath") String sourcePath,
                     @Bind("location") String location,
                     @Bind("now") long now);

    @SqlQuery("""
        SELECT case_id AS caseId,
               source_path AS sourcePath,
               source_location AS sourceLocation,
               added_at AS addedAt
          FROM case_sources
         WHERE case_id = :caseId
           AND source_path = :sourcePath
        """)
    @RegisterConstructorMapper(CaseSourceRow.class)
    Optional<CaseSourceRow> findSource(@Bind("caseId") String caseId, @Bind("sourcePath") String sourcePath);

    @SqlQuery("""
        SELECT case_id AS caseId,
               source_path AS sourcePath,
               source_location AS sourceLocation,
               added_at AS addedAt
          FROM case_sources
         WHERE case_id = :caseId
         ORDER BY added_at, source_path
        """)
    @RegisterConstructorMapper(CaseSourceRow.class)
    List<CaseSourceRow> listSources(@Bind("caseId") String caseId);

    // --- Entry lookups -------------------------------------------------------

    /**
     * Linha naquele path; a viva ganha das soft-deletadas.
     */
    @SqlQuery("SELECT " + ENTRY_COLUMNS + """
          FROM files f
         WHERE f.case_id = :caseId
           AND f.absolute_path = :absolutePath
         ORDER BY (f.deleted_at IS NULL) DESC, f.updated_at DESC
         LIMIT 1
        """)
    Optional<CatalogEntry> findByPath(@Bind("caseId") String caseId, @Bind("absolutePath") String absolutePath);

    @SqlQuery("SELECT " + ENTRY_COLUMNS + """
          FROM files f
         WHERE f.id = :id
        """)
    Optional<CatalogEntry> findById(@Bind("id") String id);

    @SqlQuery("SELECT " + ENTRY_COLUMNS + """
          FROM files f
         WHERE f.case_id = :caseId
           AND f.deleted_at IS NULL
         ORDER BY f.absolute_path
        """)
    List<CatalogEntry> listLiveEntries(@Bind("caseId") String caseId);

    @SqlQuery("""
        SELECT COUNT(*)
          FROM files
         WHERE case_id = :caseId
           AND deleted_at IS NULL
        """)
    long countLiveEntries(@Bind("caseId") String caseId);

    /**
     * Entradas vivas do mesmo case/fonte com o mesmo fingerprint mas em outro path.
     */
    @SqlQuery("SELECT " + ENTRY_COLUMNS + """
          FROM files f
         WHERE f.case_id = :caseId
           AND f.source_directory = :sourceDirectory
           AND f.file_hash = :fileHash
           AND f.deleted_at IS NULL
           AND f.absolute_path <> :absolutePath
         ORDER BY f.cataloged_at, f.absolute_path
        """)
    List<CatalogEntry> findRenameCandidates(@Bind("caseId") String caseId,
                                            @Bind("sourceDirectory") String sourceDirectory,
                                            @Bind("fileHash") String fileHash,
                                            @Bind("absolutePath") String absolutePath);

    @SqlQuery("""
        SELECT f.id AS id, f.absolute_path AS absolutePath
          FROM files f
         WHERE f.case_id = :caseId
           AND f.source_directory = :sourceDirectory
           AND f.deleted_at IS NULL
        """)
    @RegisterConstructorMapper(PathRef.class)
    List<PathRef> listLivePaths(@Bind("caseId") String caseId, @Bind("sourceDirectory") String sourceDirectory);

    // --- Entry writes --------------------------------------------------------

    @SqlBatch("""
        INSERT INTO files
            (id, case_id, file_name, folder_path, absolute_path, file_hash, file_type, file_size,
             created_time, modified_time, status, tags, source_directory, cataloged_at, updated_at)
        VALUES
            (:id, :caseId, :fileName, :folderPath, :absolutePath, :fileHash, :fileType, :fileSize,
             :createdTime, :modifiedTime, 'unreviewed', '[]', :sourceDirectory, :scannedAt, :scannedAt)
        """)
    int[] insertEntries(@BindMethods List<EntryWrite> rows);

    /**
     * Atualiza a entrada viva no lugar. Id, tags e anotações ficam; se o conteúdo mudou,
     * reviewed/flagged voltam pra in_progress. Fingerprint null mantém o que já tinha.
     */
    @SqlBatch("""
        UPDATE files
           SET file_name     = :fileName,
               folder_path   = :folderPath,
               absolute_path = :absolutePath,
               file_hash     = COALESCE(:fileHash, file_hash),
               file_type     = :fileType,
               file_size     = :fileSize,
               created_time  = :createdTime,
               modified_time = :modifiedTime,
               status        = CASE
                                  WHEN :contentChanged AND status IN ('reviewed', 'flagged') THEN 'in_progress'
                                  ELSE status
                               END,
               updated_at    = :scannedAt
         WHERE id = :id
           AND case_id = :caseId
           AND deleted_at IS NULL
        """)
    int[] updateEntries(@BindMethods List<EntryWrite> rows);

    @SqlBatch("""
        INSERT INTO file_metadata(file_id, inventory_data, last_scanned_at)
        VALUES(:id, :inventoryData, :scannedAt)
        ON CONFLICT(file_id) DO UPDATE SET
            inventory_data = excluded.inventory_data,
            last_scanned_at = excluded.last_scanned_at
        """)
    int[] upsertMetadata(@BindMethods List<EntryWrite> rows);

    @SqlQuery("SELECT inventory_data FROM file_metadata WHERE file_id = :fileId")
    Optional<String> findInventoryData(@Bind("fileId") String fileId);

    // --- Duplicate groups ----------------------------------------------------

    /**
     * Entradas vivas com fingerprint, só das fontes locais do case, na ordem de eleição.
     */
    @SqlQuery("SELECT " + ENTRY_COLUMNS + """
          FROM files f
          JOIN case_sources cs
            ON cs.case_id = f.case_id
           AND cs.source_path = f.source_directory
           AND cs.source_location = 'local'
         WHERE f.case_id = :caseId
           AND f.file_hash = :fileHash
           AND f.deleted_at IS NULL
         ORDER BY f.cataloged_at, f.absolute_path
        """)
    List<CatalogEntry> findLocalEntriesByHash(@Bind("caseId") String caseId, @Bind("fileHash") String fileHash);

    @SqlQuery("""
        SELECT COUNT(*)
          FROM duplicate_groups
         WHERE case_id = :caseId
           AND group_id = :groupId
        """)
    int countGroupMembers(@Bind("caseId") String caseId, @Bind("groupId") String groupId);

    @SqlUpdate("""
        INSERT OR IGNORE INTO duplicate_groups(case_id, group_id, file_id, is_primary, created_at)
        VALUES(:caseId, :groupId, :fileId, :primary, :now)
        """)
    int insertGroupMember(@Bind("caseId") String caseId,
                          @Bind("groupId") String groupId,
                          @Bind("fileId") String fileId,
                          @Bind("primary") boolean primary,
                          @Bind("now") long now);

    @SqlQuery("""
        SELECT group_id AS groupId,
               file_id AS fileId,
               is_primary AS isPrimary
          FROM duplicate_groups
         WHERE case_id = :caseId
           AND group_id = :groupId
         ORDER BY is_primary DESC, created_at, file_id
        """)
    @RegisterConstructorMapper(GroupMember.class)
    List<GroupMember> listGroupMembers(@Bind("caseId") String caseId, @Bind("groupId") String groupId);

    @SqlQuery("""
        SELECT DISTINCT group_id
          FROM duplicate_groups
         WHERE case_id = :caseId
         ORDER BY group_id
        """)
    List<String> listGroupIds(@Bind("caseId") String caseId);

    @SqlQuery("SELECT " + ENTRY_COLUMNS + """
          FROM files f
          JOIN files target
            ON target.id = :fileId
           AND target.case_id = :caseId
         WHERE f.case_id = target.case_id
           AND f.file_hash = target.file_hash
           AND f.id <> target.id
           AND f.deleted_at IS NULL
         ORDER BY f.cataloged_at, f.absolute_path
        """)
    List<CatalogEntry> findDuplicatesOf(@Bind("caseId") String caseId, @Bind("fileId") String fileId);

    // --- Cleanup -------------------------------------------------------------

    /**
     * Ids de {@code ids} que o cleanup NÃO pode apagar (revisados, anotados ou citados num finding).
     */
    @SqlQuery("""
        SELECT f.id
          FROM files f
         WHERE f.id IN (<ids>)
           AND (
                f.status <> 'unreviewed'
             OR EXISTS (SELECT 1 FROM notes n WHERE n.file_id = f.id)
             OR EXISTS (
                    SELECT 1
                      FROM findings fd, json_each(fd.linked_files) je
                     WHERE fd.case_id = f.case_id
                       AND je.value = f.id
                )
           )
        """)
    List<String> findProtectedIds(@BindList("ids") List<String> ids);

    @SqlUpdate("""
        UPDATE files
           SET deleted_at = :now,
               updated_at = :now
         WHERE id IN (<ids>)
           AND deleted_at IS NULL
        """)
    int softDelete(@BindList("ids") List<String> ids, @Bind("now") long now);

    // --- Sync run log --------------------------------------------------------

    @SqlUpdate("""
        INSERT INTO sync_runs(case_id, source_path, started_at, status)
        VALUES(:caseId, :sourcePath, :now, 'RUNNING')
        """)
    @GetGeneratedKeys("run_id")
    long startRun(@Bind("caseId") String caseId, @Bind("sourcePath") String sourcePath, @Bind("now") long now);

    @SqlUpdate("""
        UPDATE sync_runs
           SET finished_at = :now,
               status = :status,
               inserted = :inserted,
               updated = :updated,
               skipped = :skipped,
               failed = :failed,
               deleted = :deleted
         WHERE run_id = :runId
           AND status = 'RUNNING'
        """)
    int finishRun(@Bind("runId") long runId,
                  @Bind("status") String status,
                  @Bind("inserted") int inserted,
                  @Bind("updated") int updated,
                  @Bind("skipped") int skipped,
                  @Bind("failed") int failed,
                  @Bind("deleted") int deleted,
                  @Bind("now") long now);

    @SqlUpdate("UPDATE sync_runs SET deleted = :deleted WHERE run_id = :runId")
    int recordRunDeletions(@Bind("runId") long runId, @Bind("deleted") int deleted);

    @SqlQuery("""
        SELECT run_id AS runId,
               case_id AS caseId,
               source_path AS sourcePath,
               started_at AS startedAt,
               finished_at AS finishedAt,
               status,
               inserted,
               updated,
               skipped,
               failed,
               deleted
          FROM sync_runs
         WHERE case_id = :caseId
         ORDER BY run_id DESC
        """)
    @RegisterConstructorMapper(SyncRunRow.class)
    List<SyncRunRow> listRuns(@Bind("caseId") String caseId);

    // --- Annotation hooks ----------------------------------------------------

    @SqlUpdate("UPDATE files SET status = :status, updated_at = :now WHERE id = :id")
    int setStatus(@Bind("id") String id, @Bind("status") String status, @Bind("now") long now);

    @SqlUpdate("UPDATE files SET tags = :tags, updated_at = :now WHERE id = :id")
    int setTags(@Bind("id") String id, @Bind("tags") String tagsJson, @Bind("now") long now);

    @SqlUpdate("INSERT INTO notes(id, file_id, content, created_at) VALUES(:id, :fileId, :content, :now)")
    void insertNote(@Bind("id") String id, @Bind("fileId") String fileId, @Bind("content") String content,
                    @Bind("now") long now);

    @SqlUpdate("""
        INSERT INTO findings(id, case_id, title, linked_files, created_at)
        VALUES(:id, :caseId, :title, :linkedFiles, :now)
        """)
    void insertFinding(@Bind("id") String id, @Bind("caseId") String caseId, @Bind("title") String title,
                       @Bind("linkedFiles") String linkedFilesJson, @Bind("now") long now);

    final class CatalogEntryMapper implements RowMapper<CatalogEntry> {
        @Override
        public CatalogEntry map(ResultSet rs, StatementContext ctx) throws SQLException {
            long deleted = rs.getLong("deleted_at");
            Long deletedAt = rs.wasNull() ? null : deleted;
            return new CatalogEntry(
                    rs.getString("id"),
                    rs.getString("case_id"),
                    rs.getString("file_name"),
                    rs.getString("folder_path"),
                    rs.getString("absolute_path"),
                    rs.getString("file_hash"),
                    rs.getString("file_type"),
                    rs.getLong("file_size"),
                    rs.getLong("created_time"),
                    rs.getLong("modified_time"),
                    FileStatus.fromCode(rs.getString("status")),
                    rs.getString("tags"),
                    rs.getString("source_directory"),
                    rs.getLong("cataloged_at"),
                    rs.getLong("updated_at"),
                    deletedAt
            );
        }
    }
}
