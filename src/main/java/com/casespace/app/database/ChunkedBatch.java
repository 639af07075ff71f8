package com.casespace.app.database;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * Roda um statement numa lista de ids em pedaços, sempre abaixo do limite
 * de parâmetros do SQLite.
 */
public final class ChunkedBatch {

    public static final int MAX_CHUNK_SIZE = 900;

    private ChunkedBatch() {}

    public static <T> List<List<T>> partition(List<T> items, int chunkSize) {
        if (chunkSize < 1 || chunkSize > MAX_CHUNK_SIZE) {
            throw new IllegalArgumentException("chunkSize must be between 1 and " + MAX_CHUNK_SIZE + ": " + chunkSize);
        }
        if (items == null || items.isEmpty()) return List.of();

        List<List<T>> out = new ArrayList<>((items.size() + chunkSize - 1) / chunkSize);
        for (int from = 0; from < items.size(); from += chunkSize) {
            int to = Math.min(items.size(), from + chunkSize);
            out.add(List.copyOf(items.subList(from, to)));
        }
        return out;
    }

    /** Roda {@code op} por pedaço e soma o retorno (normalmente linhas afetadas). */
    public static <T> int sum(List<T> items, int chunkSize, ToIntFunction<List<T>> op) {
        int total = 0;
        for (List<T> chunk : partition(items, chunkSize)) {
            total += op.applyAsInt(chunk);
        }
        return total;
    }

    /** Roda {@code op} por pedaço e junta os resultados. */
    public static <T, R> List<R> collect(List<T> items, int chunkSize, Function<List<T>, ? extends Collection<R>> op) {
        List<R> out = new ArrayList<>();
        for (List<T> chunk : partition(items, chunkSize)) {
            out.addAll(op.apply(chunk));
        }
        return out;
    }
}
