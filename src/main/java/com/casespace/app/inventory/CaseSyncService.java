package com.casespace.app.inventory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.casespace.app.database.CatalogDao;
import com.casespace.app.database.Database;
import com.casespace.app.database.Database.CaseRow;
import com.casespace.app.database.Database.CaseSourceRow;
import com.casespace.app.database.SourceLocation;
import com.casespace.app.inventory.OrphanCleanup.CleanupResult;

/**
 * Entrada por case: cases, fontes e sync de todas as fontes do case, uma por vez.
 */
public final class CaseSyncService {

    /**
     * Resultado por fonte. {@code sync} null = nem deu pra sincronizar;
     * {@code cleanup} null = fonte remota ou cleanup não rodou.
     */
    public record SourceOutcome(String sourcePath, SourceLocation location, SyncResult sync,
                                CleanupResult cleanup, String error) {
        public boolean ok() {
            return error == null;
        }
    }

    public record CaseSyncSummary(String caseId, List<SourceOutcome> sources) {
        public int inserted() {
            return sources.stream().mapToInt(s -> s.sync() == null ? 0 : s.sync().inserted()).sum();
        }

        public int updated() {
            return sources.stream().mapToInt(s -> s.sync() == null ? 0 : s.sync().updated()).sum();
        }

        public int skipped() {
            return sources.stream().mapToInt(s -> s.sync() == null ? 0 : s.sync().skipped()).sum();
        }

        public int deleted() {
            return sources.stream().mapToInt(s -> s.cleanup() == null ? 0 : s.cleanup().filesDeleted()).sum();
        }

        public boolean ok() {
            return sources.stream().allMatch(SourceOutcome::ok);
        }
    }

    private static final Logger logger = LoggerFactory.getLogger(CaseSyncService.class);

    private final Database db;
    private final SyncConfig cfg;
    private final SyncOrchestrator orchestrator;
    private final OrphanCleanup cleanup;
    private final Clock clock;
    private final IdGenerator ids;

    public CaseSyncService(Database db, SyncConfig cfg, ContentFingerprinter fingerprinter,
                           StalenessCache cache, Clock clock, IdGenerator ids) {
        this.db = db;
        this.cfg = cfg;
        this.orchestrator = new SyncOrchestrator(db, cfg, fingerprinter, cache, clock, ids);
        this.cleanup = new OrphanCleanup(db.jdbi(), cfg.cleanupChunkSize(), clock, cache);
        this.clock = clock;
        this.ids = ids;
    }

    public CaseSyncService(Database db, StalenessCache cache) {
        this(db, SyncConfig.defaults(), ContentFingerprinter.sha256(), cache, Clock.systemUTC(),
             IdGenerator.randomUuid());
    }

    public SyncOrchestrator orchestrator() {
        return orchestrator;
    }

    public OrphanCleanup cleanup() {
        return cleanup;
    }

    public String createCase(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Case name is required");
        }
        String id = ids.newId();
        db.dao().insertCase(id, name.trim(), clock.millis());
        logger.info("Case criado: {} ({})", name.trim(), id);
        return id;
    }

    public List<CaseRow> listCases() {
        return db.dao().listCases();
    }

    /**
     * Registra uma fonte. Local vira caminho absoluto normalizado e tem que existir (link não vale);
     * remota é gravada como veio. Registrar de novo não faz nada.
     */
    public CaseSourceRow addSource(String caseId, String sourcePath, SourceLocation location) {
        String c = ValidationException.requireUuid(caseId, "Case id");
        ValidationException.requireSourcePath(sourcePath);
        SourceLocation loc = location == null ? SourceLocation.LOCAL : location;

        String stored = sourcePath;
        Path p = toDirectory(sourcePath);
        if (p != null) {
            stored = ValidationException.requireSourcePath(p.toString());
        } else if (loc == SourceLocation.LOCAL) {
            throw new ValidationException("Source is not an existing directory: " + sourcePath);
        }

        CatalogDao dao = db.dao();
        if (dao.findCase(c).isEmpty()) {
            throw new ValidationException("Unknown case: " + c);
        }
        dao.insertSource(c, stored, loc.code(), clock.millis());
        String key = stored;
        return dao.findSource(c, stored)
                .orElseThrow(() -> new IllegalStateException("Source vanished after insert: " + key));
    }

    private static Path toDirectory(String sourcePath) {
        try {
            Path p = Paths.get(sourcePath).toAbsolutePath().normalize();
            // link pra pasta fica de fora, o walker não segue links
            return Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS) ? p : null;
        } catch (InvalidPathException e) {
            return null;
        }
    }

    public List<CaseSourceRow> listSources(String caseId) {
        return db.dao().listSources(ValidationException.requireUuid(caseId, "Case id"));
    }

    /**
     * Sincroniza todas as fontes do case e depois faz o cleanup das locais.
     * Uma fonte falhando não para as outras.
     */
    public CaseSyncSummary syncAll(String caseId, Consumer<String> progress) {
        String c = ValidationException.requireUuid(caseId, "Case id");
        Consumer<String> ui = progress == null ? s -> {} : progress;
        CatalogDao dao = db.dao();
        if (dao.findCase(c).isEmpty()) {
            throw new ValidationException("Unknown case: " + c);
        }

        List<CaseSourceRow> sources = dao.listSources(c);
        List<SourceOutcome> outcomes = new ArrayList<>(sources.size());
        for (CaseSourceRow src : sources) {
            ui.accept(">> Source " + src.sourcePath() + " (" + src.sourceLocation() + ")");
            outcomes.add(syncSource(dao, c, src, ui));
        }
        CaseSyncSummary summary = new CaseSyncSummary(c, outcomes);
        logger.info("Case {} synced: {} sources, {} inserted, {} updated, {} deleted",
                c, outcomes.size(), summary.inserted(), summary.updated(), summary.deleted());
        return summary;
    }

    private SourceOutcome syncSource(CatalogDao dao, String caseId, CaseSourceRow src, Consumer<String> ui) {
        Path root = toDirectory(src.sourcePath());
        SourceLocation loc = src.location();
        if (root == null) {
            // raiz sumida NUNCA vai pro cleanup: tudo ia parecer órfão
            logger.warn("Fonte {} inacessível; pulando", src.sourcePath());
            return new SourceOutcome(src.sourcePath(), loc, null, null, "Source not reachable: " + src.sourcePath());
        }

        SyncResult result;
        String error = null;
        try {
            result = orchestrator.sync(caseId, root, loc, new SyncMetrics(), ui);
        } catch (SyncPhaseException e) {
            result = e.result();
            error = e.getMessage();
        } catch (IOException | RuntimeException e) {
            logger.error("Erro no sync de {}", src.sourcePath(), e);
            return new SourceOutcome(src.sourcePath(), loc, null, null, e.getMessage());
        }

        if (loc != SourceLocation.LOCAL || result.walkErrors() > 0) {
            return new SourceOutcome(src.sourcePath(), loc, result, null, error);
        }

        try {
            CleanupResult cr = cleanup.cleanupFromWalk(caseId, src.sourcePath(), root, cfg.walk());
            dao.recordRunDeletions(result.runId(), cr.filesDeleted());
            ui.accept(">> Cleanup: " + cr.filesDeleted() + " removed, " + cr.filesProtected() + " protected");
            return new SourceOutcome(src.sourcePath(), loc, result, cr, error);
        } catch (IOException | RuntimeException e) {
            logger.error("Erro no cleanup de {}", src.sourcePath(), e);
            return new SourceOutcome(src.sourcePath(), loc, result, null,
                    error == null ? e.getMessage() : error + "; " + e.getMessage());
        }
    }
}
