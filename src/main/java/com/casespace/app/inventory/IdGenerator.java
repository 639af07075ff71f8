package com.casespace.app.inventory;

import java.util.UUID;

/**
 * Gera ids de entradas novas.
 */
@FunctionalInterface
public interface IdGenerator {

    String newId();

    static IdGenerator randomUuid() {
        return () -> UUID.randomUUID().toString();
    }
}
