package com.casespace.app.inventory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.casespace.app.database.CatalogDao;
import com.casespace.app.database.Database;
import com.casespace.app.database.Database.CaseSourceRow;
import com.casespace.app.database.Database.EntryWrite;
import com.casespace.app.database.SourceLocation;
import com.casespace.app.inventory.ChangeClassifier.Action;
import com.casespace.app.inventory.ChangeClassifier.Classification;
import com.casespace.app.inventory.TreeWalker.Walk;
import com.casespace.app.inventory.TreeWalker.WalkedFile;

/**
 * Um passe de sync de uma fonte pra dentro de um case.
 * <p>
 * Fase 1 faz walk + classificação num pool limitado (só leitura). Fase 2 grava todos os inserts
 * numa transação, fase 3 todos os updates em outra, fase 4 agrupa duplicados entre os novos.
 * Fase de escrita que falha faz rollback sozinha; as outras rodam mesmo assim e quem chamou
 * recebe um {@link SyncPhaseException} com o resumo completo.
 */
public final class SyncOrchestrator {

    public static final String PHASE_INSERT = "insert";
    public static final String PHASE_UPDATE = "update";
    public static final String PHASE_DUPLICATES = "duplicates";

    private static final Logger logger = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final Database db;
    private final SyncConfig cfg;
    private final ContentFingerprinter fingerprinter;
    private final StalenessCache cache;
    private final Clock clock;
    private final IdGenerator ids;

    public SyncOrchestrator(Database db, SyncConfig cfg, ContentFingerprinter fingerprinter,
                            StalenessCache cache, Clock clock, IdGenerator ids) {
        this.db = db;
        this.cfg = cfg;
        this.fingerprinter = fingerprinter;
        this.cache = cache;
        this.clock = clock;
        this.ids = ids;
    }

    public SyncOrchestrator(Database db, StalenessCache cache) {
        this(db, SyncConfig.defaults(), ContentFingerprinter.sha256(), cache, Clock.systemUTC(),
             IdGenerator.randomUuid());
    }

    public SyncResult sync(String caseId, Path root, Consumer<String> progress) throws IOException {
        return sync(caseId, root, SourceLocation.LOCAL, new SyncMetrics(), progress);
    }

    /**
     * Sincroniza {@code root} em {@code caseId}; na primeira vez registra como fonte do case.
     * Fonte já registrada mantém a location gravada.
     *
     * @throws ValidationException case id inválido/desconhecido, ou root não é pasta (link pra pasta também não)
     * @throws SyncPhaseException  alguma fase de escrita fez rollback
     * @throws IOException         nem deu pra fazer o walk; o run fecha como FAILED
     */
    public SyncResult sync(String caseId, Path root, SourceLocation requested, SyncMetrics metrics,
                           Consumer<String> progress) throws IOException {
        Consumer<String> ui = progress == null ? s -> {} : progress;
        String c = ValidationException.requireUuid(caseId, "Case id");
        // mesmo critério do walker: link pra pasta não conta, senão registra a fonte e o walk estoura depois
        if (root == null || !Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS)) {
            throw new ValidationException("Source root is not a directory: " + root);
        }
        Path rootAbs = root.toAbsolutePath().normalize();
        String source = ValidationException.requireSourcePath(rootAbs.toString());

        Jdbi jdbi = db.jdbi();
        CatalogDao dao = db.dao();
        if (dao.findCase(c).isEmpty()) {
            throw new ValidationException("Unknown case: " + c);
        }
        SourceLocation location = registerSource(dao, c, source, requested);

        metrics.start = Instant.now();
        long runId = dao.startRun(c, source, clock.millis());
        logger.info("Sync run {} started: case={}, source={} ({})", runId, c, source, location.code());

        // Fase 1: walk + classificação
        ui.accept(">> Phase 1: scanning " + source);
        Classified classified;
        try {
            classified = classifyAll(c, source, location, rootAbs, dao, metrics);
        } catch (IOException | RuntimeException e) {
            // não deixa o run pendurado em RUNNING
            logger.error("Sync run {} abortado durante o scan de {}", runId, source, e);
            abortRun(dao, runId);
            throw e;
        }

        List<Classification> inserts = new ArrayList<>();
        List<Classification> updates = new ArrayList<>();
        int skipped = 0;
        for (Classification cl : classified.outcomes) {
            switch (cl.action()) {
                case INSERT -> inserts.add(cl);
                case UPDATE -> updates.add(cl);
                case SKIP -> skipped++;
            }
        }
        ui.accept(">> " + classified.outcomes.size() + " files classified: "
                + inserts.size() + " new, " + updates.size() + " changed, " + skipped + " unchanged, "
                + classified.errors.size() + " failed");

        // erros do walk entram no resumo junto com os de classificação
        List<String> walkErrors = new ArrayList<>(metrics.walk.errors);
        Collections.sort(walkErrors);
        List<String> errors = new ArrayList<>(walkErrors);
        errors.addAll(classified.errors);
        int failed = walkErrors.size() + classified.errors.size();
        List<String> failedPhases = new ArrayList<>();
        List<RuntimeException> phaseErrors = new ArrayList<>();

        // Fase 2: inserts
        int inserted = 0;
        if (!inserts.isEmpty()) {
            ui.accept(">> Phase 2: cataloging " + inserts.size() + " new files");
            List<EntryWrite> rows = toWrites(c, source, inserts);
            try {
                jdbi.useTransaction(handle -> {
                    CatalogDao tx = handle.attach(CatalogDao.class);
                    tx.insertEntries(rows);
                    tx.upsertMetadata(rows);
                });
                inserted = rows.size();
            } catch (RuntimeException e) {
                logger.error("Insert phase rolled back for run {} ({} rows)", runId, rows.size(), e);
                failedPhases.add(PHASE_INSERT);
                phaseErrors.add(e);
                errors.add("Insert phase rolled back (" + rows.size() + " files): " + safeMsg(e));
            }
        }

        // Fase 3: updates
        int updated = 0;
        if (!updates.isEmpty()) {
            ui.accept(">> Phase 3: refreshing " + updates.size() + " changed files");
            List<EntryWrite> rows = toWrites(c, source, updates);
            try {
                jdbi.useTransaction(handle -> {
                    CatalogDao tx = handle.attach(CatalogDao.class);
                    tx.updateEntries(rows);
                    tx.upsertMetadata(rows);
                });
                updated = rows.size();
                List<String> touched = new ArrayList<>(rows.size());
                for (EntryWrite w : rows) touched.add(w.id());
                cache.invalidateAll(touched);
            } catch (RuntimeException e) {
                logger.error("Update phase rolled back for run {} ({} rows)", runId, rows.size(), e);
                failedPhases.add(PHASE_UPDATE);
                phaseErrors.add(e);
                errors.add("Update phase rolled back (" + rows.size() + " files): " + safeMsg(e));
            }
        }

        // Fase 4: duplicados, só entre os arquivos novos e locais
        int groups = 0;
        if (inserted > 0 && location == SourceLocation.LOCAL) {
            ui.accept(">> Phase 4: grouping duplicates");
            List<String> fingerprints = new ArrayList<>(inserts.size());
            for (Classification cl : inserts) fingerprints.add(cl.fingerprint());
            try {
                groups = new DuplicateGrouper(jdbi, clock).groupFingerprints(c, fingerprints);
            } catch (RuntimeException e) {
                logger.error("Duplicate grouping rolled back for run {}", runId, e);
                failedPhases.add(PHASE_DUPLICATES);
                phaseErrors.add(e);
                errors.add("Duplicate grouping rolled back: " + safeMsg(e));
            }
        }

        SyncResult result = new SyncResult(
            runId,
            classified.outcomes.size() + classified.errors.size(),
            inserted,
            updated,
            skipped,
            failed,
            groups,
            metrics.walk.walkErrors.sum(),
            errors,
            failedPhases
        );

        finishRun(dao, runId, result);

        Duration took = Duration.between(metrics.start, Instant.now());
        ui.accept(">> Done: " + inserted + " inserted, " + updated + " updated, " + skipped + " skipped, "
                + result.failed() + " failed (" + took.toMillis() + " ms)");
        logger.info("Sync run {} finished: {} (hashed={}, renames={})", runId, result,
                metrics.filesHashed.sum(), metrics.renamesDetected.sum());

        if (!phaseErrors.isEmpty()) {
            SyncPhaseException ex = new SyncPhaseException(failedPhases.get(0), result, phaseErrors.get(0));
            for (int i = 1; i < phaseErrors.size(); i++) ex.addSuppressed(phaseErrors.get(i));
            throw ex;
        }
        return result;
    }

    private SourceLocation registerSource(CatalogDao dao, String caseId, String source, SourceLocation requested) {
        var existing = dao.findSource(caseId, source);
        if (existing.isPresent()) {
            SourceLocation recorded = existing.map(CaseSourceRow::location).get();
            if (requested != null && requested != recorded) {
                logger.warn("Fonte {} já registrada como {}; ignorando {}", source,
                        recorded.code(), requested.code());
            }
            return recorded;
        }
        SourceLocation loc = requested == null ? SourceLocation.LOCAL : requested;
        dao.insertSource(caseId, source, loc.code(), clock.millis());
        return loc;
    }

    private record Classified(List<Classification> outcomes, List<String> errors) {}

    private Classified classifyAll(String caseId, String source, SourceLocation location, Path root,
                                   CatalogDao dao, SyncMetrics metrics) throws IOException {
        ContentFingerprinter counting = file -> {
            metrics.filesHashed.increment();
            return fingerprinter.fingerprint(file);
        };
        ChangeClassifier classifier = new ChangeClassifier(dao, counting, new RenameResolver(dao), ids);

        Queue<Classification> outcomes = new ConcurrentLinkedQueue<>();
        Queue<String> errors = new ConcurrentLinkedQueue<>();

        int workers = Math.max(1, cfg.workers());
        Semaphore inFlight = new Semaphore(workers * 4);
        AtomicInteger seq = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "casespace-classify-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try (Walk walk = TreeWalker.walk(root, cfg.walk(), metrics.walk)) {
            while (walk.hasNext()) {
                WalkedFile f = walk.next();
                inFlight.acquire();
                pool.execute(() -> {
                    try {
                        Classification cl = classifier.classify(caseId, source, location, f);
                        if (cl.action() == Action.UPDATE && cl.renamedFrom() != null) {
                            metrics.renamesDetected.increment();
                        }
                        outcomes.add(cl);
                    } catch (IOException | RuntimeException e) {
                        metrics.fileErrors.increment();
                        logger.warn("Falha ao classificar arquivo {}: {}", f.absolutePath(), e.toString());
                        errors.add(f.absolutePath() + ": " + safeMsg(e));
                    } finally {
                        metrics.filesClassified.increment();
                        inFlight.release();
                    }
                });
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while scanning " + root, e);
        } finally {
            pool.shutdown();
            awaitPool(pool);
        }

        List<String> errorList = new ArrayList<>(errors);
        Collections.sort(errorList);
        return new Classified(new ArrayList<>(outcomes), errorList);
    }

    private static void awaitPool(ExecutorService pool) {
        try {
            while (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.debug("Waiting for classification workers...");
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private List<EntryWrite> toWrites(String caseId, String source, List<Classification> items) {
        long now = clock.millis();
        List<EntryWrite> rows = new ArrayList<>(items.size());
        for (Classification cl : items) {
            WalkedFile f = cl.file();
            rows.add(new EntryWrite(
                cl.entryId(),
                caseId,
                f.displayName(),
                f.folderPath(),
                f.absolutePath().toString(),
                cl.fingerprint(),
                f.fileType(),
                f.size(),
                f.createdMillis(),
                f.modifiedMillis(),
                source,
                now,
                InventoryData.of(f),
                cl.renamedFrom() == null
            ));
        }
        return rows;
    }

    private void finishRun(CatalogDao dao, long runId, SyncResult r) {
        String status = r.failedPhases().isEmpty() ? "DONE" : "FAILED";
        try {
            dao.finishRun(runId, status, r.inserted(), r.updated(), r.skipped(), r.failed(), 0, clock.millis());
        } catch (RuntimeException e) {
            logger.error("Erro ao fechar sync run {}", runId, e);
        }
    }

    private void abortRun(CatalogDao dao, long runId) {
        try {
            dao.finishRun(runId, "FAILED", 0, 0, 0, 0, 0, clock.millis());
        } catch (RuntimeException e) {
            logger.error("Erro ao fechar sync run {}", runId, e);
        }
    }

    private static String safeMsg(Throwable t) {
        String m = (t == null) ? null : t.getMessage();
        return (m == null || m.isBlank())
                ? (t == null ? "error" : t.getClass().getSimpleName())
                : m;
    }
}
