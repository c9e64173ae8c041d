package org.carball.planlens.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
