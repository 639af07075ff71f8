package com.casespace.app.database;

import java.util.Locale;

public enum SourceLocation {
    LOCAL,
    REMOTE;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SourceLocation fromCode(String code) {
        if (code == null || code.isBlank()) return LOCAL;
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
