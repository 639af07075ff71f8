package com.casespace.app.inventory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.casespace.app.database.CatalogDao;
import com.casespace.app.database.Database.CatalogEntry;

/**
 * Diz se a entrada do catálogo ainda bate com o arquivo no disco.
 */
public final class StalenessVerifier {

    public enum Verdict { FRESH, MODIFIED, DELETED }

    private static final Logger logger = LoggerFactory.getLogger(StalenessVerifier.class);

    private final CatalogDao dao;
    private final ContentFingerprinter fingerprinter;
    private final StalenessCache cache;

    public StalenessVerifier(CatalogDao dao, ContentFingerprinter fingerprinter, StalenessCache cache) {
        this.dao = dao;
        this.fingerprinter = fingerprinter;
        this.cache = cache;
    }

    /**
     * Fica no cache pelo TTL. Com fingerprint gravado, metadata diferente não basta pra MODIFIED:
     * quem decide é o conteúdo.
     *
     * @throws ValidationException id inválido ou desconhecido
     * @throws IOException         arquivo existe mas não dá pra ler
     */
    public Verdict verify(String entryId) throws IOException {
        String id = ValidationException.requireUuid(entryId, "File id");

        var cached = cache.get(id);
        if (cached.isPresent()) return cached.get();

        CatalogEntry entry = dao.findById(id)
                .orElseThrow(() -> new ValidationException("Unknown catalog entry: " + id));

        Verdict v = compute(entry);
        cache.put(id, v);
        return v;
    }

    /** Verifica cada id; o que falhar vai pro log e fica fora do resultado. */
    public Map<String, Verdict> verifyAll(List<String> entryIds) {
        Map<String, Verdict> out = new LinkedHashMap<>();
        for (String id : entryIds) {
            try {
                out.put(id, verify(id));
            } catch (IOException | ValidationException e) {
                logger.warn("Falha ao verificar entrada {}: {}", id, e.getMessage());
            }
        }
        return out;
    }

    private Verdict compute(CatalogEntry entry) throws IOException {
        if (entry.isDeleted()) return Verdict.DELETED;

        Path file = Paths.get(entry.absolutePath());
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(file, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (NoSuchFileException e) {
            return Verdict.DELETED;
        }
        if (!attrs.isRegularFile()) return Verdict.DELETED;

        boolean metadataDiffers = attrs.size() != entry.fileSize()
                || attrs.lastModifiedTime().toMillis() != entry.modifiedTime();

        if (!metadataDiffers && !entry.status().isCritical()) return Verdict.FRESH;

        if (entry.fileHash() == null) {
            return metadataDiffers ? Verdict.MODIFIED : Verdict.FRESH;
        }

        String current;
        try {
            current = fingerprinter.fingerprint(file);
        } catch (NoSuchFileException e) {
            return Verdict.DELETED;
        }
        return current.equals(entry.fileHash()) ? Verdict.FRESH : Verdict.MODIFIED;
    }
}
