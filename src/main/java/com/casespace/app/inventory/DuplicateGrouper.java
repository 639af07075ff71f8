package com.casespace.app.inventory;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.casespace.app.database.CatalogDao;
import com.casespace.app.database.Database.CatalogEntry;

/**
 * Agrupa entradas vivas das fontes locais do case que têm o mesmo fingerprint.
 * <p>
 * O id do grupo é o fingerprint. O primeiro na ordem de eleição ({@code cataloged_at}, depois path)
 * vira primário quando o grupo nasce; quem chega depois só entra, o primário não é reeleito.
 */
public final class DuplicateGrouper {

    private static final Logger logger = LoggerFactory.getLogger(DuplicateGrouper.class);

    private final Jdbi jdbi;
    private final Clock clock;

    public DuplicateGrouper(Jdbi jdbi, Clock clock) {
        this.jdbi = jdbi;
        this.clock = clock;
    }

    /**
     * Cria ou estende os grupos desses fingerprints numa transação só.
     *
     * @return quantos grupos foram criados ou estendidos
     */
    public int groupFingerprints(String caseId, Collection<String> fingerprints) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String fp : fingerprints) {
            if (fp != null && !fp.isBlank()) distinct.add(fp);
        }
        if (distinct.isEmpty()) return 0;

        long now = clock.millis();
        int touched = jdbi.inTransaction(handle -> {
            CatalogDao dao = handle.attach(CatalogDao.class);
            int n = 0;
            for (String fp : distinct) {
                if (groupOne(dao, caseId, fp, now)) n++;
            }
            return n;
        });
        if (touched > 0) {
            logger.info("Duplicate groups touched in case {}: {}", caseId, touched);
        }
        return touched;
    }

    private boolean groupOne(CatalogDao dao, String caseId, String fingerprint, long now) {
        List<CatalogEntry> members = dao.findLocalEntriesByHash(caseId, fingerprint);
        if (members.size() < 2) return false;

        boolean exists = dao.countGroupMembers(caseId, fingerprint) > 0;
        int added = 0;
        for (int i = 0; i < members.size(); i++) {
            boolean primary = !exists && i == 0;
            added += dao.insertGroupMember(caseId, fingerprint, members.get(i).id(), primary, now);
        }
        return added > 0;
    }

    /**
     * Outras entradas vivas do case com o mesmo conteúdo de {@code fileId}.
     */
    public List<CatalogEntry> findDuplicates(String caseId, String fileId) {
        String c = ValidationException.requireUuid(caseId, "Case id");
        String f = ValidationException.requireUuid(fileId, "File id");
        return jdbi.withExtension(CatalogDao.class, dao -> {
            CatalogEntry target = dao.findById(f)
                    .orElseThrow(() -> new ValidationException("Unknown catalog entry: " + f));
            if (!target.caseId().equals(c)) {
                throw new ValidationException("Entry " + f + " does not belong to case " + c);
            }
            if (target.fileHash() == null) return List.of();
            return dao.findDuplicatesOf(c, f);
        });
    }
}
