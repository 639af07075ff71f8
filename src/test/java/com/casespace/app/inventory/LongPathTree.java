package com.casespace.app.inventory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Monta uma cadeia de pastas com caminho absoluto maior que o PATH_MAX, pra leitura do arquivo
 * lá no fundo falhar. Cada passo só renomeia caminho curto (não tem outro jeito de chegar lá).
 * Chama {@link #dismantle} antes do temp dir ser limpo.
 */
final class LongPathTree {

    static final String SEGMENT = "d".repeat(200);
    private static final int LEVELS = 25;

    private LongPathTree() {}

    /** Coloca a cadeia em {@code target}; {@code scratch} tem que ser pasta de caminho curto no mesmo volume. */
    static void bury(Path scratch, Path target, String fileName) throws IOException {
        Path current = Files.createDirectories(scratch.resolve("chain"));
        Files.writeString(current.resolve(fileName), "buried");
        try {
            for (int i = 0; i < LEVELS; i++) {
                Path wrapper = Files.createDirectories(scratch.resolve("w" + i).resolve(SEGMENT));
                Files.move(current, wrapper.resolve("c"));
                current = scratch.resolve("w" + i);
            }
            Files.move(current, target);
        } catch (IOException | UnsupportedOperationException e) {
            assumeTrue(false, "Não deu pra montar caminho longo aqui: " + e);
        }
    }

    /** Desmonta a cadeia em {@code target} um nível por vez e apaga. */
    static void dismantle(Path scratch, Path target) throws IOException {
        Path top = target;
        int i = 0;
        while (Files.isDirectory(top.resolve(SEGMENT).resolve("c"))) {
            Path next = scratch.resolve("u" + i++);
            Files.move(top.resolve(SEGMENT).resolve("c"), next);
            Files.delete(top.resolve(SEGMENT));
            Files.delete(top);
            top = next;
        }
        if (Files.isDirectory(top)) {
            try (var files = Files.list(top)) {
                for (Path p : (Iterable<Path>) files::iterator) Files.delete(p);
            }
            Files.delete(top);
        }
    }
}
