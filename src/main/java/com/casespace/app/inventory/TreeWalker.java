package com.casespace.app.inventory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystemException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Queue;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.casespace.app.config.Config;

/**
 * Walk em largura e concorrente dos arquivos regulares debaixo de uma raiz.
 * <p>
 * As pastas saem de uma fila explícita e são listadas num pool pequeno (no máximo {@code workers}
 * ao mesmo tempo). Os arquivos vão pro consumidor por uma fila limitada, então consumidor lento
 * segura o walk. Link simbólico nunca é seguido.
 */
public final class TreeWalker {

    private static final Logger logger = LoggerFactory.getLogger(TreeWalker.class);

    private TreeWalker() {}

    public record WalkConfig(int workers, int queueCapacity, List<String> excludeGlobs) {
        public static WalkConfig defaults() {
            return new WalkConfig(Config.getWalkWorkers(), 10_000, List.of(
                "Thumbs.db",
                ".DS_Store",
                "desktop.ini",
                "~$*",
                ".git",
                "$Recycle.Bin",
                "System Volume Information"
            ));
        }

        public WalkConfig withExcludeGlobs(List<String> globs) {
            return new WalkConfig(workers, queueCapacity, List.copyOf(globs));
        }
    }

    /**
     * Um arquivo regular visto pelo walk.
     *
     * @param name        nome com extensão
     * @param folderPath  pasta pai relativa à raiz, separada por '/', vazia na raiz
     */
    public record WalkedFile(
        String name,
        String folderPath,
        Path absolutePath,
        long size,
        long createdMillis,
        long modifiedMillis
    ) {
        /** Nome sem extensão (display name da entrada). */
        public String displayName() {
            int dot = name.lastIndexOf('.');
            return dot > 0 ? name.substring(0, dot) : name;
        }

        /** Extensão em maiúsculo, vazia se não tiver. */
        public String fileType() {
            int dot = name.lastIndexOf('.');
            if (dot <= 0 || dot == name.length() - 1) return "";
            return name.substring(dot + 1).toUpperCase(Locale.ROOT);
        }
    }

    public static final class WalkMetrics {
        public final LongAdder filesSeen = new LongAdder();
        public final LongAdder dirsVisited = new LongAdder();
        public final LongAdder entriesSkipped = new LongAdder();
        public final LongAdder walkErrors = new LongAdder();
        /** "caminho: mensagem" de cada falha do walk, pra ir pro resumo do sync. */
        public final Queue<String> errors = new ConcurrentLinkedQueue<>();

        void recordError(Path path, Exception e) {
            walkErrors.increment();
            // FileSystemException já põe o caminho na mensagem, pega só o motivo
            String m = (e instanceof FileSystemException fse) ? fse.getReason() : e.getMessage();
            errors.add(path + ": " + (m == null || m.isBlank() ? e.getClass().getSimpleName() : m));
        }
    }

    public static Walk walk(Path root) throws IOException {
        return walk(root, WalkConfig.defaults(), new WalkMetrics());
    }

    /**
     * Começa o walk de {@code root} em background.
     *
     * @throws NotDirectoryException se {@code root} não é uma pasta (link não conta)
     */
    public static Walk walk(Path root, WalkConfig cfg, WalkMetrics metrics) throws IOException {
        Path rootAbs = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(rootAbs, LinkOption.NOFOLLOW_LINKS)) {
            throw new NotDirectoryException(rootAbs.toString());
        }
        Walk w = new Walk(rootAbs, cfg, metrics);
        w.start();
        return w;
    }

    /** Walk completo devolvendo os caminhos absolutos (usado no cleanup). */
    public static List<Path> collectPaths(Path root, WalkConfig cfg, WalkMetrics metrics) throws IOException {
        List<Path> out = new ArrayList<>();
        try (Walk w = walk(root, cfg, metrics)) {
            while (w.hasNext()) {
                out.add(w.next().absolutePath());
            }
        }
        return out;
    }

    private static String relNorm(Path rel) {
        return rel.toString().replace('\\', '/');
    }

    private static List<PathMatcher> compileMatchers(List<String> globs) {
        var fs = FileSystems.getDefault();
        var out = new ArrayList<PathMatcher>(globs == null ? 0 : globs.size());
        if (globs == null) return out;
        for (String g : globs) {
            if (g == null || g.isBlank()) continue;
            out.add(fs.getPathMatcher("glob:" + g));
        }
        return out;
    }

    /**
     * Sequência lazy de uso único. Fecha pra parar o walk antes.
     */
    public static final class Walk implements Iterator<WalkedFile>, AutoCloseable {
        private static final WalkedFile END = new WalkedFile("", "", Paths.get(""), -1L, 0L, 0L);

        private final Path root;
        private final WalkMetrics metrics;
        private final List<PathMatcher> matchers;
        private final int workers;

        private final BlockingQueue<Path> pendingDirs = new LinkedBlockingQueue<>();
        private final BlockingQueue<WalkedFile> out;
        private final AtomicInteger outstanding = new AtomicInteger();
        private final AtomicBoolean cancel = new AtomicBoolean(false);
        private final Semaphore permits;
        private final ExecutorService pool;
        private Thread coordinator;

        private WalkedFile next;
        private boolean finished;

        private Walk(Path root, WalkConfig cfg, WalkMetrics metrics) {
            this.root = root;
            this.metrics = metrics;
            this.matchers = compileMatchers(cfg.excludeGlobs());
            this.workers = Math.max(1, cfg.workers());
            this.out = new ArrayBlockingQueue<>(Math.max(16, cfg.queueCapacity()));
            this.permits = new Semaphore(workers);
            AtomicInteger seq = new AtomicInteger();
            this.pool = Executors.newFixedThreadPool(workers, r -> {
                Thread t = new Thread(r, "casespace-walk-" + seq.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }

        private void start() {
            outstanding.incrementAndGet();
            pendingDirs.add(root);
            coordinator = new Thread(this::coordinate, "casespace-walk-coordinator");
            coordinator.setDaemon(true);
            coordinator.start();
        }

        private void coordinate() {
            try {
                while (!cancel.get() && outstanding.get() > 0) {
                    Path dir = pendingDirs.poll(100, TimeUnit.MILLISECONDS);
                    if (dir == null) continue;
                    permits.acquire();
                    pool.execute(() -> {
                        try {
                            listDirectory(dir);
                        } finally {
                            permits.release();
                            outstanding.decrementAndGet();
                        }
                    });
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                logger.error("Coordenador do walk falhou em {}", root, e);
                metrics.recordError(root, e);
            } finally {
                pool.shutdown();
                awaitPool();
                emit(END);
            }
        }

        private void awaitPool() {
            try {
                if (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                    logger.warn("Workers do walk não pararam a tempo em {}", root);
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                pool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        private void listDirectory(Path dir) {
            if (cancel.get()) return;
            metrics.dirsVisited.increment();
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
                for (Path entry : entries) {
                    if (cancel.get()) return;
                    visit(entry);
                }
            } catch (IOException | RuntimeException e) {
                metrics.recordError(dir, e);
                logger.warn("Falha ao listar pasta {}: {}", dir, e.toString());
            }
        }

        private void visit(Path entry) {
            BasicFileAttributes attrs;
            try {
                attrs = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            } catch (IOException e) {
                // arquivo sumiu no meio do scan, sem permissão, caminho longo demais...
                metrics.recordError(entry, e);
                logger.warn("Falha ao ler atributos de {}: {}", entry, e.toString());
                return;
            }

            Path rel = root.relativize(entry);
            if (isExcluded(rel)) {
                metrics.entriesSkipped.increment();
                return;
            }

            if (attrs.isDirectory()) {
                outstanding.incrementAndGet();
                pendingDirs.add(entry);
                return;
            }
            if (!attrs.isRegularFile()) {
                // symlink, device, socket: ignora
                metrics.entriesSkipped.increment();
                return;
            }

            Path parentRel = rel.getParent();
            emit(new WalkedFile(
                entry.getFileName().toString(),
                parentRel == null ? "" : relNorm(parentRel),
                entry,
                attrs.size(),
                attrs.creationTime().toMillis(),
                attrs.lastModifiedTime().toMillis()
            ));
            metrics.filesSeen.increment();
        }

        // glob casa com o caminho relativo OU só com o nome ("Thumbs.db" pega em qualquer nível)
        private boolean isExcluded(Path rel) {
            Path name = rel.getFileName();
            for (var m : matchers) {
                if (m.matches(rel) || (name != null && m.matches(name))) return true;
            }
            return false;
        }

        private void emit(WalkedFile f) {
            while (true) {
                if (cancel.get() && f != END) return;
                try {
                    if (out.offer(f, 200, TimeUnit.MILLISECONDS)) return;
                    if (cancel.get() && f == END) return;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }

        @Override
        public boolean hasNext() {
            if (next != null) return true;
            if (finished) return false;
            try {
                WalkedFile f = out.take();
                if (f == END) {
                    finished = true;
                    return false;
                }
                next = f;
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                close();
                return false;
            }
        }

        @Override
        public WalkedFile next() {
            if (!hasNext()) throw new NoSuchElementException();
            WalkedFile f = next;
            next = null;
            return f;
        }

        /** true se o walk foi até o fim, false se fechou antes. */
        public boolean isComplete() {
            return finished && !cancel.get();
        }

        @Override
        public void close() {
            if (finished) return;
            cancel.set(true);
            finished = true;
            out.clear();
            pool.shutdownNow();
            if (coordinator != null) coordinator.interrupt();
        }
    }
}
