package io.ontomesh.model;

import java.util.Locale;

public enum WorkflowState {
    PENDING,
    RUNNING,
    PAUSED,
    AWAITING_INPUT,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WorkflowState fromWire(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
