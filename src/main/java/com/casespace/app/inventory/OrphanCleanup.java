package com.casespace.app.inventory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.casespace.app.database.CatalogDao;
import com.casespace.app.database.ChunkedBatch;
import com.casespace.app.database.Database.CaseSourceRow;
import com.casespace.app.database.Database.PathRef;
import com.casespace.app.database.SourceLocation;
import com.casespace.app.inventory.TreeWalker.WalkConfig;
import com.casespace.app.inventory.TreeWalker.WalkMetrics;

/**
 * Soft delete das entradas cujo arquivo sumiu, sem encostar no que alguém já mexeu.
 * <p>
 * Protegida = status diferente de {@code unreviewed}, tem nota ou algum finding aponta pra ela.
 * Nada é apagado de verdade.
 */
public final class OrphanCleanup {

    public record CleanupResult(int filesDeleted, int filesProtected) {
        public static final CleanupResult EMPTY = new CleanupResult(0, 0);
    }

    private static final Logger logger = LoggerFactory.getLogger(OrphanCleanup.class);

    private final Jdbi jdbi;
    private final int chunkSize;
    private final Clock clock;
    private final StalenessCache cache;

    public OrphanCleanup(Jdbi jdbi, int chunkSize, Clock clock, StalenessCache cache) {
        if (chunkSize < 1 || chunkSize > ChunkedBatch.MAX_CHUNK_SIZE) {
            throw new IllegalArgumentException("chunkSize must be between 1 and " + ChunkedBatch.MAX_CHUNK_SIZE);
        }
        this.jdbi = jdbi;
        this.chunkSize = chunkSize;
        this.clock = clock;
        this.cache = cache;
    }

    /**
     * Faz o walk de {@code root} e limpa com base no que achou. Se o walk teve erro não apaga nada:
     * pasta ilegível ia parecer arquivo sumido.
     */
    public CleanupResult cleanupFromWalk(String caseId, String sourceDirectory, Path root, WalkConfig walkCfg)
            throws IOException {
        WalkMetrics metrics = new WalkMetrics();
        List<Path> seen = TreeWalker.collectPaths(root, walkCfg, metrics);
        if (metrics.walkErrors.sum() > 0) {
            throw new IOException("Walk of " + root + " had " + metrics.walkErrors.sum()
                    + " errors; cleanup skipped");
        }
        List<String> paths = new ArrayList<>(seen.size());
        for (Path p : seen) paths.add(p.toString());
        return cleanup(caseId, sourceDirectory, paths);
    }

    /**
     * @param walkedPaths caminhos absolutos que existem no disco pra essa fonte
     * @throws ValidationException case id inválido, source path ruim ou fonte remota
     */
    public CleanupResult cleanup(String caseId, String sourceDirectory, Collection<String> walkedPaths) {
        String c = ValidationException.requireUuid(caseId, "Case id");
        String source = ValidationException.requireSourcePath(sourceDirectory);
        Set<String> present = new HashSet<>(walkedPaths);
        long now = clock.millis();

        List<String> deletedIds = new ArrayList<>();
        CleanupResult result = jdbi.inTransaction(handle -> {
            CatalogDao dao = handle.attach(CatalogDao.class);

            if (dao.findCase(c).isEmpty()) {
                throw new ValidationException("Unknown case: " + c);
            }
            var registered = dao.findSource(c, source);
            if (registered.map(CaseSourceRow::location).orElse(SourceLocation.LOCAL) == SourceLocation.REMOTE) {
                throw new ValidationException("Cleanup is only supported for local sources: " + source);
            }

            List<String> missing = new ArrayList<>();
            for (PathRef ref : dao.listLivePaths(c, source)) {
                if (!present.contains(ref.absolutePath())) missing.add(ref.id());
            }
            if (missing.isEmpty()) return CleanupResult.EMPTY;

            Set<String> protectedIds = new HashSet<>(ChunkedBatch.collect(missing, chunkSize, dao::findProtectedIds));
            List<String> deletable = new ArrayList<>(missing.size());
            for (String id : missing) {
                if (!protectedIds.contains(id)) deletable.add(id);
            }

            int deleted = ChunkedBatch.sum(deletable, chunkSize, chunk -> dao.softDelete(chunk, now));
            deletedIds.addAll(deletable);
            return new CleanupResult(deleted, protectedIds.size());
        });

        cache.invalidateAll(deletedIds);
        logger.info("Cleanup of {} in case {}: {} soft-deleted, {} protected",
                source, c, result.filesDeleted(), result.filesProtected());
        return result;
    }
}
