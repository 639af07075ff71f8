package com.casespace.app.database;

import java.util.Locale;

/**
 * Status de revisão da entrada (gravado em minúsculo).
 */
public enum FileStatus {
    UNREVIEWED,
    IN_PROGRESS,
    REVIEWED,
    FLAGGED,
    FINALIZED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Crítico sempre reconfere o conteúdo, metadata batendo não basta.
     */
    public boolean isCritical() {
        return this == REVIEWED || this == FLAGGED || this == FINALIZED;
    }

    public static FileStatus fromCode(String code) {
        if (code == null || code.isBlank()) return UNREVIEWED;
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
