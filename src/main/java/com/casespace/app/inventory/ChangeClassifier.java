package com.casespace.app.inventory;

import java.io.IOException;
import java.util.Optional;

import com.casespace.app.database.CatalogDao;
import com.casespace.app.database.Database.CatalogEntry;
import com.casespace.app.database.SourceLocation;
import com.casespace.app.inventory.TreeWalker.WalkedFile;

/**
 * Decide por arquivo se o catálogo precisa de insert, update ou nada.
 * Só lê o banco, nunca escreve.
 */
public final class ChangeClassifier {

    public enum Action { INSERT, UPDATE, SKIP }

    /**
     * Resultado de um arquivo.
     *
     * @param entryId     id a gravar (UUID novo no insert, o existente no update/skip)
     * @param fingerprint hash calculado na classificação; null se não precisou
     * @param renamedFrom path antigo quando o update é um move detectado, senão null
     */
    public record Classification(Action action, WalkedFile file, String entryId, String fingerprint,
                                 String renamedFrom) {
        static Classification skip(WalkedFile f, String entryId) {
            return new Classification(Action.SKIP, f, entryId, null, null);
        }
    }

    private final CatalogDao dao;
    private final ContentFingerprinter fingerprinter;
    private final RenameResolver renames;
    private final IdGenerator ids;

    public ChangeClassifier(CatalogDao dao, ContentFingerprinter fingerprinter, RenameResolver renames,
                            IdGenerator ids) {
        this.dao = dao;
        this.fingerprinter = fingerprinter;
        this.renames = renames;
        this.ids = ids;
    }

    /**
     * @throws IOException se não der pra ler o conteúdo pro fingerprint
     */
    public Classification classify(String caseId, String sourceDirectory, SourceLocation location, WalkedFile f)
            throws IOException {
        String absolutePath = f.absolutePath().toString();
        Optional<CatalogEntry> found = dao.findByPath(caseId, absolutePath);

        if (found.isPresent()) {
            CatalogEntry existing = found.get();
            // removido pelo usuário não volta
            if (existing.isDeleted()) return Classification.skip(f, existing.id());
            return classifyExisting(existing, location, f);
        }

        if (location == SourceLocation.REMOTE) {
            return new Classification(Action.INSERT, f, ids.newId(), null, null);
        }

        String hash = fingerprinter.fingerprint(f.absolutePath());
        Optional<CatalogEntry> moved = renames.resolve(caseId, sourceDirectory, hash, f.absolutePath());
        if (moved.isPresent()) {
            CatalogEntry e = moved.get();
            return new Classification(Action.UPDATE, f, e.id(), hash, e.absolutePath());
        }
        return new Classification(Action.INSERT, f, ids.newId(), hash, null);
    }

    private Classification classifyExisting(CatalogEntry existing, SourceLocation location, WalkedFile f)
            throws IOException {
        boolean metadataMatches = existing.fileSize() == f.size() && existing.modifiedTime() == f.modifiedMillis();

        if (location == SourceLocation.REMOTE) {
            return metadataMatches
                ? Classification.skip(f, existing.id())
                : new Classification(Action.UPDATE, f, existing.id(), null, null);
        }

        if (metadataMatches && !existing.status().isCritical()) {
            return Classification.skip(f, existing.id());
        }

        String hash = fingerprinter.fingerprint(f.absolutePath());
        if (hash.equals(existing.fileHash())) {
            // só tocou, mesmos bytes
            return Classification.skip(f, existing.id());
        }
        return new Classification(Action.UPDATE, f, existing.id(), hash, null);
    }
}
