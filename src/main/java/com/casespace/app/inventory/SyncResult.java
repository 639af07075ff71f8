package com.casespace.app.inventory;

import java.util.List;

/**
 * Resumo de um passe de sync.
 *
 * @param failed       arquivos que não deu pra classificar + entradas que o walk não conseguiu ler
 *                     (uma linha cada em {@code errors})
 * @param failedPhases fases de escrita que fizeram rollback
 */
public record SyncResult(
    long runId,
    int totalFiles,
    int inserted,
    int updated,
    int skipped,
    int failed,
    int duplicateGroupsTouched,
    long walkErrors,
    List<String> errors,
    List<String> failedPhases
) {
    public SyncResult {
        errors = List.copyOf(errors);
        failedPhases = List.copyOf(failedPhases);
    }

    public boolean isClean() {
        return failed == 0 && failedPhases.isEmpty() && walkErrors == 0;
    }

    /** Linhas gravadas nesse passe. */
    public int mutations() {
        return inserted + updated;
    }
}
