package org.carball.planlens.model.diagnostic;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
