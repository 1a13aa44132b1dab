package io.ontomesh.model;

import java.util.Locale;

public enum CandidateStatus {
    PENDING,
    ACCEPTED,
    REJECTED;

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CandidateStatus fromWire(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
