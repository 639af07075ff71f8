package com.casespace.app.inventory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Fingerprint do conteúdo do arquivo. Implementação tem que ser thread safe.
 */
@FunctionalInterface
public interface ContentFingerprinter {

    /** Hash em hex minúsculo dos bytes do arquivo. */
    String fingerprint(Path file) throws IOException;

    static ContentFingerprinter sha256() {
        return Sha256.INSTANCE;
    }

    /**
     * SHA-256 lendo em blocos de 64 KiB.
     */
    final class Sha256 implements ContentFingerprinter {
        static final Sha256 INSTANCE = new Sha256();
        private static final int BUFFER_SIZE = 64 * 1024;

        private Sha256() {}

        @Override
        public String fingerprint(Path file) throws IOException {
            MessageDigest digest;
            try {
                digest = MessageDigest.getInstance("SHA-256");
            } catch (NoSuchAlgorithmException e) {
                throw new IOException("SHA-256 not available", e);
            }
            try (InputStream in = Files.newInputStream(file)) {
                byte[] buffer = new byte[BUFFER_SIZE];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    digest.update(buffer, 0, read);
                }
            }
            return HexFormat.of().formatHex(digest.digest());
        }
    }
}
