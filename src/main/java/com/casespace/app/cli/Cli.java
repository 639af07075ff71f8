package com.casespace.app.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.casespace.app.config.Config;
import com.casespace.app.database.Database;
import com.casespace.app.database.Database.CaseRow;
import com.casespace.app.database.Database.CaseSourceRow;
import com.casespace.app.database.Database.CatalogEntry;
import com.casespace.app.database.Database.SyncRunRow;
import com.casespace.app.database.SourceLocation;
import com.casespace.app.inventory.CaseSyncService;
import com.casespace.app.inventory.CaseSyncService.CaseSyncSummary;
import com.casespace.app.inventory.CaseSyncService.SourceOutcome;
import com.casespace.app.inventory.ContentFingerprinter;
import com.casespace.app.inventory.DuplicateGrouper;
import com.casespace.app.inventory.IdGenerator;
import com.casespace.app.inventory.OrphanCleanup.CleanupResult;
import com.casespace.app.inventory.StalenessCache;
import com.casespace.app.inventory.StalenessVerifier;
import com.casespace.app.inventory.StalenessVerifier.Verdict;
import com.casespace.app.inventory.SyncConfig;
import com.casespace.app.inventory.SyncMetrics;
import com.casespace.app.inventory.SyncOrchestrator;
import com.casespace.app.inventory.SyncPhaseException;
import com.casespace.app.inventory.SyncResult;
import com.casespace.app.inventory.ValidationException;

/**
 * CLI do catálogo. Exit codes: 0 ok, 1 falha, 2 uso errado / input rejeitado.
 */
public final class Cli {

    private final Database db;
    private final PrintStream out;
    private final PrintStream err;
    private final StalenessCache cache;
    private final CaseSyncService service;

    private Cli(Database db, PrintStream out, PrintStream err) {
        this.db = db;
        this.out = out;
        this.err = err;
        this.cache = StalenessCache.defaults();
        this.service = new CaseSyncService(db, cache);
    }

    public static void main(String[] args) {
        int exitCode = execute(args);
        if (exitCode != 0) System.exit(exitCode);
    }

    /** Roda no catálogo configurado e fecha no final. */
    public static int execute(String[] args) {
        if (args == null || args.length == 0 || isHelp(args[0])) {
            printUsage(System.out);
            return 0;
        }
        try {
            return executeEmbedded(args, Database.shared(), System.out, System.err);
        } catch (RuntimeException e) {
            System.err.println("Fatal error: " + safeMsg(e));
            return 1;
        } finally {
            Database.shutdown();
        }
    }

    /**
     * Roda num catálogo já aberto; quem chamou continua dono do {@code db}.
     */
    public static int executeEmbedded(String[] args, Database db, PrintStream out, PrintStream err) {
        if (args == null || args.length == 0) {
            printUsage(out);
            return 0;
        }
        String cmd = safeLower(args[0]);
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        return new Cli(db, out, err).dispatch(cmd, args[0], rest);
    }

    private int dispatch(String cmd, String raw, String[] rest) {
        try {
            return switch (cmd) {
                case "case-create" -> runCaseCreate(Options.parse(rest, Set.of("--name"), Set.of()));
                case "cases" -> runCases();
                case "source-add" -> runSourceAdd(Options.parse(rest, Set.of("--case", "--path"), Set.of("--remote")));
                case "sync" -> runSync(Options.parse(rest, Set.of("--case", "--root", "--workers"), Set.of("--remote")));
                case "sync-all" -> runSyncAll(Options.parse(rest, Set.of("--case"), Set.of()));
                case "cleanup" -> runCleanup(Options.parse(rest, Set.of("--case", "--root"), Set.of()));
                case "verify" -> runVerify(Options.parse(rest, Set.of("--file", "--case"), Set.of()));
                case "duplicates" -> runDuplicates(Options.parse(rest, Set.of("--case", "--file"), Set.of()));
                case "runs" -> runRuns(Options.parse(rest, Set.of("--case", "--limit"), Set.of()));
                case "help", "-h", "--help" -> {
                    printUsage(out);
                    yield 0;
                }
                default -> {
                    err.println("Unknown command: " + raw);
                    printUsage(err);
                    yield 2;
                }
            };
        } catch (UsageException | ValidationException e) {
            err.println(safeMsg(e));
            return 2;
        } catch (SyncPhaseException e) {
            err.println("Sync finished with failed phases " + e.result().failedPhases() + ": " + safeMsg(e));
            printSync(e.result());
            return 1;
        } catch (IOException | RuntimeException e) {
            err.println("Error: " + safeMsg(e));
            return 1;
        }
    }

    // ----------------- cases & sources -----------------

    private int runCaseCreate(Options o) {
        String id = service.createCase(o.require("--name"));
        out.println(id);
        return 0;
    }

    private int runCases() {
        List<CaseRow> rows = service.listCases();
        if (rows.isEmpty()) {
            out.println("No cases.");
            return 0;
        }
        out.println("id | name | created");
        for (CaseRow r : rows) {
            out.printf("%s | %s | %s%n", r.id(), r.name(), Instant.ofEpochMilli(r.createdAt()));
        }
        return 0;
    }

    private int runSourceAdd(Options o) {
        CaseSourceRow row = service.addSource(o.require("--case"), o.require("--path"), o.location());
        out.printf("Source registered: %s (%s)%n", row.sourcePath(), row.sourceLocation());
        return 0;
    }

    // ----------------- sync -----------------

    private int runSync(Options o) throws IOException {
        Path root = Path.of(o.require("--root")).toAbsolutePath().normalize();
        if (!Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS)) {
            throw new UsageException("Source root is not a directory: " + root);
        }
        SyncOrchestrator orchestrator = service.orchestrator();
        if (o.has("--workers")) {
            SyncConfig cfg = SyncConfig.defaults().withWorkers(o.intValue("--workers", Config.getSyncWorkers()));
            orchestrator = new SyncOrchestrator(db, cfg, ContentFingerprinter.sha256(), cache, Clock.systemUTC(),
                    IdGenerator.randomUuid());
        }
        SyncResult r = orchestrator.sync(o.require("--case"), root, o.location(), new SyncMetrics(), out::println);
        printSync(r);
        return r.isClean() ? 0 : 1;
    }

    private int runSyncAll(Options o) {
        CaseSyncSummary s = service.syncAll(o.require("--case"), out::println);
        out.println("source | location | inserted | updated | skipped | failed | deleted | error");
        for (SourceOutcome so : s.sources()) {
            SyncResult r = so.sync();
            out.printf("%s | %s | %d | %d | %d | %d | %d | %s%n",
                    so.sourcePath(),
                    so.location().code(),
                    r == null ? 0 : r.inserted(),
                    r == null ? 0 : r.updated(),
                    r == null ? 0 : r.skipped(),
                    r == null ? 0 : r.failed(),
                    so.cleanup() == null ? 0 : so.cleanup().filesDeleted(),
                    so.error() == null ? "-" : so.error());
        }
        return s.ok() ? 0 : 1;
    }

    private void printSync(SyncResult r) {
        out.printf("run=%d files=%d inserted=%d updated=%d skipped=%d failed=%d duplicateGroups=%d%n",
                r.runId(), r.totalFiles(), r.inserted(), r.updated(), r.skipped(), r.failed(),
                r.duplicateGroupsTouched());
        for (String e : r.errors()) {
            err.println("  ! " + e);
        }
    }

    private int runCleanup(Options o) throws IOException {
        Path root = Path.of(o.require("--root")).toAbsolutePath().normalize();
        if (!Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS)) {
            throw new UsageException("Source root is not a directory: " + root);
        }
        CleanupResult r = service.cleanup().cleanupFromWalk(o.require("--case"), root.toString(), root,
                SyncConfig.defaults().walk());
        out.printf("deleted=%d protected=%d%n", r.filesDeleted(), r.filesProtected());
        return 0;
    }

    // ----------------- queries -----------------

    private int runVerify(Options o) throws IOException {
        StalenessVerifier verifier = new StalenessVerifier(db.dao(), ContentFingerprinter.sha256(), cache);
        if (!o.has("--case")) {
            Verdict v = verifier.verify(o.require("--file"));
            out.println(v.name().toLowerCase(Locale.ROOT));
            return 0;
        }

        String caseId = ValidationException.requireUuid(o.require("--case"), "Case id");
        List<String> ids = new ArrayList<>();
        for (CatalogEntry e : db.dao().listLiveEntries(caseId)) ids.add(e.id());
        Map<String, Verdict> verdicts = verifier.verifyAll(ids);

        Map<Verdict, Integer> counts = new EnumMap<>(Verdict.class);
        for (Verdict v : Verdict.values()) counts.put(v, 0);
        for (Verdict v : verdicts.values()) counts.merge(v, 1, Integer::sum);
        out.printf("fresh=%d modified=%d deleted=%d unverified=%d%n",
                counts.get(Verdict.FRESH), counts.get(Verdict.MODIFIED), counts.get(Verdict.DELETED),
                ids.size() - verdicts.size());
        return 0;
    }

    private int runDuplicates(Options o) {
        List<CatalogEntry> dups = new DuplicateGrouper(db.jdbi(), Clock.systemUTC())
                .findDuplicates(o.require("--case"), o.require("--file"));
        if (dups.isEmpty()) {
            out.println("No duplicates.");
            return 0;
        }
        for (CatalogEntry e : dups) {
            out.printf("%s | %s | %s%n", e.id(), e.status().code(), e.absolutePath());
        }
        return 0;
    }

    private int runRuns(Options o) {
        int limit = o.intValue("--limit", 20);
        List<SyncRunRow> rows = db.dao().listRuns(ValidationException.requireUuid(o.require("--case"), "Case id"));
        if (rows.isEmpty()) {
            out.println("No sync runs.");
            return 0;
        }
        out.println("run | status | started | inserted | updated | skipped | failed | deleted | source");
        for (SyncRunRow r : rows.subList(0, Math.min(limit, rows.size()))) {
            out.printf("%d | %s | %s | %d | %d | %d | %d | %d | %s%n",
                    r.runId(), r.status(), Instant.ofEpochMilli(r.startedAt()),
                    r.inserted(), r.updated(), r.skipped(), r.failed(), r.deleted(), r.sourcePath());
        }
        return 0;
    }

    // ----------------- usage -----------------

    private static void printUsage(PrintStream ps) {
        ps.println("""
                CaseSpace catalog
                Commands:
                  case-create --name <name>
                  cases
                  source-add --case <caseId> --path <dir> [--remote]
                  sync --case <caseId> --root <dir> [--remote] [--workers <n>]
                  sync-all --case <caseId>
                  cleanup --case <caseId> --root <dir>
                  verify --file <fileId> | --case <caseId>
                  duplicates --case <caseId> --file <fileId>
                  runs --case <caseId> [--limit <n>]
                  help
                """);
    }

    // ----------------- parsing -----------------

    private static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }

    private static final class ArgCursor {
        private final String[] args;
        private int i;

        ArgCursor(String[] args) {
            this.args = args == null ? new String[0] : args;
        }

        boolean hasNext() { return i < args.length; }

        String next() { return args[i++]; }

        String requireNext(String opt) {
            if (!hasNext()) throw new UsageException("Missing value for " + opt);
            return next();
        }
    }

    private record Options(Map<String, String> values, Set<String> flags) {
        static Options parse(String[] args, Set<String> valued, Set<String> switches) {
            Map<String, String> values = new HashMap<>();
            Set<String> flags = new HashSet<>();
            ArgCursor c = new ArgCursor(args);
            while (c.hasNext()) {
                String t = c.next();
                if (valued.contains(t)) {
                    values.put(t, c.requireNext(t));
                } else if (switches.contains(t)) {
                    flags.add(t);
                } else {
                    throw new UsageException("Invalid option: " + t);
                }
            }
            return new Options(values, flags);
        }

        boolean has(String opt) {
            return !isBlank(values.get(opt));
        }

        String require(String opt) {
            String v = values.get(opt);
            if (isBlank(v)) throw new UsageException("Required option: " + opt);
            return v.trim();
        }

        int intValue(String opt, int fallback) {
            String v = values.get(opt);
            if (isBlank(v)) return fallback;
            try {
                return Math.max(1, Integer.parseInt(v.trim()));
            } catch (NumberFormatException e) {
                throw new UsageException("Invalid value for " + opt + ": " + v);
            }
        }

        /** Null sem {@code --remote}, aí a fonte registrada mantém a location dela. */
        SourceLocation location() {
            return flags.contains("--remote") ? SourceLocation.REMOTE : null;
        }
    }

    // ----------------- misc -----------------

    private static boolean isHelp(String s) {
        String l = safeLower(s);
        return l.equals("help") || l.equals("-h") || l.equals("--help");
    }

    private static String safeLower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static String safeMsg(Throwable t) {
        String m = (t == null) ? null : t.getMessage();
        return (m == null || m.isBlank())
                ? (t == null ? "Error" : t.getClass().getSimpleName())
                : m;
    }

    private static boolean isBlank(String v) {
        return v == null || v.isBlank();
    }
}
