package com.casespace.app.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Configuração central do catálogo.
 * Resolve o local do banco e os parâmetros do sync, nessa ordem:
 * System property, variável de ambiente, {@code .env} local, default.
 */
public final class Config {

    private static final String APP_NAME = "CaseSpace";
    private static final String DEFAULT_DB_NAME = "casespace.db";

    private static final String ENV_DB_NAME = "CASESPACE_DB_NAME";
    private static final String ENV_DATA_DIR = "CASESPACE_DATA_DIR";
    private static final String ENV_SYNC_WORKERS = "CASESPACE_SYNC_WORKERS";
    private static final String ENV_WALK_WORKERS = "CASESPACE_WALK_WORKERS";
    private static final String ENV_CLEANUP_CHUNK = "CASESPACE_CLEANUP_CHUNK_SIZE";
    private static final String ENV_STALENESS_TTL = "CASESPACE_STALENESS_TTL_SECONDS";
    private static final String ENV_STALENESS_MAX = "CASESPACE_STALENESS_CACHE_SIZE";

    // overrides via System property (testes/CI)
    private static final String PROP_DB_NAME = "casespace.dbName";
    private static final String PROP_DATA_DIR = "casespace.dataDir";
    private static final String PROP_SYNC_WORKERS = "casespace.syncWorkers";
    private static final String PROP_WALK_WORKERS = "casespace.walkWorkers";
    private static final String PROP_CLEANUP_CHUNK = "casespace.cleanupChunkSize";
    private static final String PROP_STALENESS_TTL = "casespace.stalenessTtlSeconds";
    private static final String PROP_STALENESS_MAX = "casespace.stalenessCacheSize";

    // SQLite antigo limita em 999 parâmetros; 900 sobra espaço pros binds escalares
    public static final int DEFAULT_CLEANUP_CHUNK_SIZE = 900;
    public static final int MAX_WORKERS = 16;

    private static final Logger logger = LoggerFactory.getLogger(Config.class);
    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    private static volatile String cachedDbPathKey;
    private static volatile Path cachedDbPath;

    private Config() {}

    /**
     * Retorna a URL JDBC do banco padrão.
     */
    public static String getDbUrl() {
        return "jdbc:sqlite:" + getDbFilePath().toAbsolutePath();
    }

    public static Path getDbFilePath() {
        String dbFileName = resolveDbFileName();
        String overrideDir = getEnvOrDotenv(ENV_DATA_DIR);

        String key = (overrideDir == null ? "" : overrideDir) + "|" + dbFileName;
        Path current = cachedDbPath;
        if (current != null && key.equals(cachedDbPathKey)) {
            return current;
        }

        synchronized (Config.class) {
            current = cachedDbPath;
            if (current != null && key.equals(cachedDbPathKey)) {
                return current;
            }
            Path resolved = resolveDbPath(dbFileName);
            cachedDbPathKey = key;
            cachedDbPath = resolved;
            return resolved;
        }
    }

    /**
     * Tamanho do pool de classificação: 2x processadores, com teto.
     */
    public static int getSyncWorkers() {
        int fallback = Math.min(MAX_WORKERS, Runtime.getRuntime().availableProcessors() * 2);
        return clamp(getInt(ENV_SYNC_WORKERS, fallback), 1, MAX_WORKERS);
    }

    public static int getWalkWorkers() {
        int fallback = Math.min(8, Math.max(2, Runtime.getRuntime().availableProcessors()));
        return clamp(getInt(ENV_WALK_WORKERS, fallback), 1, MAX_WORKERS);
    }

    public static int getCleanupChunkSize() {
        return clamp(getInt(ENV_CLEANUP_CHUNK, DEFAULT_CLEANUP_CHUNK_SIZE), 1, DEFAULT_CLEANUP_CHUNK_SIZE);
    }

    public static Duration getStalenessTtl() {
        return Duration.ofSeconds(Math.max(1, getInt(ENV_STALENESS_TTL, 5)));
    }

    public static long getStalenessCacheSize() {
        return Math.max(16, getInt(ENV_STALENESS_MAX, 1000));
    }

    // --- Resolution ---

    private static String resolveDbFileName() {
        String name = getEnvOrDotenv(ENV_DB_NAME);
        return name == null ? DEFAULT_DB_NAME : name;
    }

    private static int getInt(String envKey, int fallback) {
        String raw = getEnvOrDotenv(envKey);
        if (raw == null) return fallback;
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            logger.warn("Valor inteiro inválido em {}: '{}' (usando {})", envKey, raw, fallback);
            return fallback;
        }
    }

    private static int clamp(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }

    /**
     * Busca a chave: System property, depois ambiente, depois {@code .env}.
     */
    private static String getEnvOrDotenv(String key) {
        String propKey = mapToSystemPropertyKey(key);
        if (propKey != null) {
            String propVal = System.getProperty(propKey);
            if (propVal != null && !propVal.isBlank()) {
                return propVal.trim();
            }
        }

        String envVal = System.getenv(key);
        if (envVal != null && !envVal.isBlank()) {
            return envVal.trim();
        }

        String fileVal = dotenv.get(key);
        if (fileVal == null || fileVal.isBlank()) {
            return null;
        }
        return fileVal.trim();
    }

    private static String mapToSystemPropertyKey(String envKey) {
        if (envKey == null) return null;
        return switch (envKey) {
            case ENV_DB_NAME -> PROP_DB_NAME;
            case ENV_DATA_DIR -> PROP_DATA_DIR;
            case ENV_SYNC_WORKERS -> PROP_SYNC_WORKERS;
            case ENV_WALK_WORKERS -> PROP_WALK_WORKERS;
            case ENV_CLEANUP_CHUNK -> PROP_CLEANUP_CHUNK;
            case ENV_STALENESS_TTL -> PROP_STALENESS_TTL;
            case ENV_STALENESS_MAX -> PROP_STALENESS_MAX;
            default -> null;
        };
    }

    private static Path resolveDbPath(String dbFileName) {
        String overrideDir = getEnvOrDotenv(ENV_DATA_DIR);
        if (overrideDir != null) {
            Path p = Paths.get(overrideDir);
            try {
                Files.createDirectories(p);
            } catch (IOException e) {
                throw new IllegalStateException("Could not create data directory: " + p, e);
            }
            logger.info("Banco do catálogo localizado em (override): {}", p.toAbsolutePath());
            return p.resolve(dbFileName);
        }

        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ROOT);
        String userHome = System.getProperty("user.home");
        Path appDataDir;

        if (os.contains("win")) {
            String localAppData = System.getenv("LOCALAPPDATA");
            if (localAppData != null && !localAppData.isBlank()) {
                appDataDir = Paths.get(localAppData, APP_NAME);
            } else {
                appDataDir = Paths.get(userHome, "AppData", "Local", APP_NAME);
            }
        } else if (os.contains("mac")) {
            appDataDir = Paths.get(userHome, "Library", "Application Support", APP_NAME);
        } else {
            // XDG (~/.local/share/CaseSpace)
            String xdgData = System.getenv("XDG_DATA_HOME");
            if (xdgData != null && !xdgData.isBlank()) {
                appDataDir = Paths.get(xdgData, APP_NAME);
            } else {
                appDataDir = Paths.get(userHome, ".local", "share", APP_NAME);
            }
        }

        try {
            Files.createDirectories(appDataDir);
            logger.info("Banco do catálogo localizado em: {}", appDataDir.toAbsolutePath());
            return appDataDir.resolve(dbFileName);
        } catch (IOException e) {
            Path localPath = Paths.get(dbFileName).toAbsolutePath();
            logger.warn("Não deu pra usar {}; caindo pro diretório atual: {}", appDataDir, localPath);
            return localPath;
        }
    }
}
