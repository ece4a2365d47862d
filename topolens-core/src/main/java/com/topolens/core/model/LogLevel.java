package com.topolens.core.model;

import java.util.Locale;

public enum LogLevel {
    CRITICAL,
    ERROR,
    WARNING,
    INFO,
    DEBUG,
    UNKNOWN;

    public static LogLevel fromLabel(String level) {
        if (level == null || level.isEmpty()) {
            return UNKNOWN;
        }
        return switch (level.toLowerCase(Locale.ROOT)) {
            case "critical", "fatal", "crit", "emerg", "alert" -> CRITICAL;
            case "error", "err" -> ERROR;
            case "warning", "warn" -> WARNING;
            case "info", "notice" -> INFO;
            case "debug", "trace" -> DEBUG;
            default -> UNKNOWN;
        };
    }

    public boolean isError() {
        return this == CRITICAL || this == ERROR;
    }
}
