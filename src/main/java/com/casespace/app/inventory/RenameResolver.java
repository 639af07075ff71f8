package com.casespace.app.inventory;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.casespace.app.database.CatalogDao;
import com.casespace.app.database.Database.CatalogEntry;

/**
 * Detecta move: path novo com o mesmo conteúdo de uma entrada viva cujo path antigo sumiu.
 * <p>
 * Uma instância por passe. Cada entrada só pode ser reclamada por um arquivo no passe,
 * então duas cópias de um arquivo movido nunca dividem o mesmo id.
 */
public final class RenameResolver {

    private static final Logger logger = LoggerFactory.getLogger(RenameResolver.class);

    private final CatalogDao dao;
    private final Set<String> claimed = ConcurrentHashMap.newKeySet();

    public RenameResolver(CatalogDao dao) {
        this.dao = dao;
    }

    /**
     * Tenta os candidatos do mais antigo pro mais novo ({@code cataloged_at}, depois path).
     * Se o path antigo ainda existe é duplicado, não move: deixa quieto.
     */
    public Optional<CatalogEntry> resolve(String caseId, String sourceDirectory, String fingerprint, Path walkedPath) {
        if (fingerprint == null) return Optional.empty();

        List<CatalogEntry> candidates = dao.findRenameCandidates(
            caseId, sourceDirectory, fingerprint, walkedPath.toString());

        for (CatalogEntry c : candidates) {
            if (Files.exists(Paths.get(c.absolutePath()), LinkOption.NOFOLLOW_LINKS)) continue;
            if (!claimed.add(c.id())) continue;
            logger.debug("Rename detected: {} -> {} (entry {})", c.absolutePath(), walkedPath, c.id());
            return Optional.of(c);
        }
        return Optional.empty();
    }

    int claimedCount() {
        return claimed.size();
    }
}
