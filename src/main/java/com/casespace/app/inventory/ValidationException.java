package com.casespace.app.inventory;

import java.util.UUID;

/**
 * Input rejeitado (id inválido, case desconhecido, fonte fora do escopo). Sobe antes de qualquer escrita.
 */
public class ValidationException extends RuntimeException {

    public static final int MAX_SOURCE_PATH_LENGTH = 4096;

    public ValidationException(String message) {
        super(message);
    }

    /** Devolve {@code value} se for UUID válido. */
    public static String requireUuid(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(what + " is required");
        }
        try {
            UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(what + " is not a valid UUID: " + value);
        }
        return value.trim();
    }

    public static String requireSourcePath(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Source directory is required");
        }
        if (value.length() > MAX_SOURCE_PATH_LENGTH) {
            throw new ValidationException("Source directory is longer than " + MAX_SOURCE_PATH_LENGTH + " characters");
        }
        return value;
    }
}
