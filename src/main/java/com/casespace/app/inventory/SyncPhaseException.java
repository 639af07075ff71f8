package com.casespace.app.inventory;

/**
 * Uma escrita falhou e a fase fez rollback. As outras fases rodaram;
 * {@link #result()} tem o resumo do passe inteiro.
 */
public class SyncPhaseException extends RuntimeException {
    private final String phase;
    private final transient SyncResult result;

    public SyncPhaseException(String phase, SyncResult result, Throwable cause) {
        super("Sync phase '" + phase + "' failed: " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.phase = phase;
        this.result = result;
    }

    public String phase() {
        return phase;
    }

    public SyncResult result() {
        return result;
    }
}
