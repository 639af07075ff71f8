package com.casespace.app.database;

import java.nio.file.Path;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.casespace.app.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Gerencia o banco do catálogo: pool, Jdbi e migrações Flyway.
 * <p>
 * {@link #open(String)} dá uma instância isolada (uma por teste, uma por execução da CLI);
 * {@link #shared()} abre sob demanda o banco configurado no {@link Config}.
 */
public final class Database implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Database.class);

    public record CatalogEntry(
            String id,
            String caseId,
            String fileName,
            String folderPath,
            String absolutePath,
            String fileHash,
            String fileType,
            long fileSize,
            long createdTime,
            long modifiedTime,
            FileStatus status,
            String tags,
            String sourceDirectory,
            long catalogedAt,
            long updatedAt,
            Long deletedAt
    ) {
        public boolean isDeleted() {
            return deletedAt != null;
        }
    }

    /**
     * Linha dos batches de insert/update (entrada + registro de enriquecimento).
     * {@code contentChanged} é false em move puro, que mantém o status de revisão.
     */
    public record EntryWrite(
            String id,
            String caseId,
            String fileName,
            String folderPath,
            String absolutePath,
            String fileHash,
            String fileType,
            long fileSize,
            long createdTime,
            long modifiedTime,
            String sourceDirectory,
            long scannedAt,
            String inventoryData,
            boolean contentChanged
    ) {}

    public record CaseRow(String id, String name, long createdAt) {}

    public record CaseSourceRow(String caseId, String sourcePath, String sourceLocation, long addedAt) {
        public SourceLocation location() {
            return SourceLocation.fromCode(sourceLocation);
        }
    }

    public record PathRef(String id, String absolutePath) {}

    public record GroupMember(String groupId, String fileId, boolean isPrimary) {}

    public record SyncRunRow(long runId, String caseId, String sourcePath, long startedAt, Long finishedAt,
                             String status, int inserted, int updated, int skipped, int failed, int deleted) {}

    private static Database shared;
    private static volatile boolean shutdownHookRegistered = false;

    private final String jdbcUrl;
    private final HikariDataSource dataSource;
    private final Jdbi jdbi;

    private Database(String jdbcUrl, HikariDataSource dataSource, Jdbi jdbi) {
        this.jdbcUrl = jdbcUrl;
        this.dataSource = dataSource;
        this.jdbi = jdbi;
    }

    public static Database open(Path dbFile) {
        return open("jdbc:sqlite:" + dbFile.toAbsolutePath());
    }

    /**
     * Abre o pool, roda as migrações pendentes e devolve pronto pra uso.
     */
    public static Database open(String jdbcUrl) {
        HikariDataSource ds = createDataSource(jdbcUrl);
        try {
            migrate(ds);
        } catch (RuntimeException e) {
            ds.close();
            throw e;
        }
        Jdbi jdbi = Jdbi.create(ds);
        jdbi.installPlugin(new SqlObjectPlugin());
        logger.debug("Catalog store opened: {}", jdbcUrl);
        return new Database(jdbcUrl, ds, jdbi);
    }

    public static synchronized Database shared() {
        if (shared == null) {
            ensureShutdownHook();
            shared = open(Config.getDbUrl());
        }
        return shared;
    }

    public static synchronized void shutdown() {
        if (shared != null) {
            shared.close();
            shared = null;
        }
    }

    private static synchronized void ensureShutdownHook() {
        if (shutdownHookRegistered) return;
        shutdownHookRegistered = true;
        Runtime.getRuntime().addShutdownHook(new Thread(Database::shutdown, "casespace-db-shutdown"));
    }

    private static HikariDataSource createDataSource(String jdbcUrl) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setPoolName("casespace-catalog");
        config.setConnectionTestQuery("SELECT 1");
        config.setMaximumPoolSize(Config.MAX_WORKERS + 2);

        // o sqlite-jdbc aplica isso em cada conexão
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("busy_timeout", "10000");
        config.addDataSourceProperty("foreign_keys", "true");

        return new HikariDataSource(config);
    }

    private static void migrate(HikariDataSource ds) {
        Flyway flyway = Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration")
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .load();
        try {
            try {
                flyway.migrate();
            } catch (FlywayValidateException e) {
                logger.warn("Flyway validation failed; attempting repair.", e);
                flyway.repair();
                flyway.migrate();
            }
        } catch (RuntimeException e) {
            logger.error("Falha na migração do Flyway", e);
            throw new IllegalStateException("Falha na migração do Flyway", e);
        }
    }

    public Jdbi jdbi() {
        return jdbi;
    }

    /** DAO on-demand: cada chamada pega uma conexão e devolve. */
    public CatalogDao dao() {
        return jdbi.onDemand(CatalogDao.class);
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            logger.debug("Catalog store closed: {}", jdbcUrl);
        }
    }
}
