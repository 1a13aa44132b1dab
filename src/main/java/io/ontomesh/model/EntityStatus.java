package io.ontomesh.model;

import java.util.Locale;

/**
 * Per-entity lifecycle. Statuses only move forward; {@link #FAILED} and
 * {@link #CANCELLED} are reachable from every non-terminal status.
 */
public enum EntityStatus {
    PENDING,
    SCANNING,
    SCANNED,
    ANALYZING,
    COMPLETE,
    NEEDS_INPUT,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == CANCELLED;
    }

    /**
     * Scanning, analyzing and needs-input entities are in flight or blocked on a human.
     */
    public boolean isInFlight() {
        return this == SCANNING || this == ANALYZING || this == NEEDS_INPUT;
    }

    public boolean canTransitionTo(EntityStatus next) {
        if (next == null) {
            return false;
        }
        if (this == next) {
            return true;
        }
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED || next == CANCELLED) {
            return true;
        }
        return switch (this) {
            case PENDING -> next == SCANNING || next == SCANNED;
            case SCANNING -> next == SCANNED || next == COMPLETE;
            case SCANNED -> next == ANALYZING;
            case ANALYZING -> next == COMPLETE || next == NEEDS_INPUT;
            case NEEDS_INPUT -> next == ANALYZING;
            default -> false;
        };
    }

    public String wire() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static EntityStatus fromWire(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
