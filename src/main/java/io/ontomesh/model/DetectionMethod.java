package io.ontomesh.model;

import java.util.Locale;

public enum DetectionMethod {
    VALUE_MATCH("value_overlap"),
    NAME_INFERENCE("name_pattern"),
    METADATA("fk_metadata"),
    LLM("llm_analysis"),
    HYBRID("llm_analysis");

    private final String inferenceMethod;

    DetectionMethod(String inferenceMethod) {
        this.inferenceMethod = inferenceMethod;
    }

    /**
     * Name recorded on a committed relationship for candidates found this way.
     */
    public String inferenceMethod() {
        return inferenceMethod;
    }

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DetectionMethod fromWire(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
