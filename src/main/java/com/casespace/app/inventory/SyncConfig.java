package com.casespace.app.inventory;

import com.casespace.app.config.Config;
import com.casespace.app.inventory.TreeWalker.WalkConfig;

/**
 * Parâmetros do engine pra um orchestrator.
 *
 * @param workers          tamanho do pool de classificação
 * @param cleanupChunkSize máximo de ids por statement no cleanup
 */
public record SyncConfig(int workers, int cleanupChunkSize, WalkConfig walk) {
    public static SyncConfig defaults() {
        return new SyncConfig(Config.getSyncWorkers(), Config.getCleanupChunkSize(), WalkConfig.defaults());
    }

    /** Limitado a 1..{@link Config#MAX_WORKERS}. */
    public SyncConfig withWorkers(int n) {
        // o pool do banco é MAX_WORKERS + 2, thread a mais só fica esperando conexão
        return new SyncConfig(Math.max(1, Math.min(Config.MAX_WORKERS, n)), cleanupChunkSize, walk);
    }
}
