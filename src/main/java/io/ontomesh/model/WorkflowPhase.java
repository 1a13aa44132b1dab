package io.ontomesh.model;

import java.util.Locale;

public enum WorkflowPhase {
    INITIALIZING,
    SCANNING,
    ANALYZING,
    TIER1_BUILDING,
    RELATIONSHIPS,
    COMPLETING;

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WorkflowPhase fromWire(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
