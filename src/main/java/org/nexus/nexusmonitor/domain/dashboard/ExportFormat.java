package org.nexus.nexusmonitor.domain.dashboard;

import java.util.Locale;

public enum ExportFormat {
    JSON, CSV;

    public static ExportFormat parse(String raw) {
        if (raw == null || raw.isBlank()) return JSON;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported export format: " + raw);
        }
    }
}
