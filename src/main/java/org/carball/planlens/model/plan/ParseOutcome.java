package org.carball.planlens.model.plan;

/**
 * How a parse call ended. {@code EMPTY} means the payload was recognized as the
 * expected format but carried no operators; {@code UNRECOGNIZED} means no format
 * marker was found at all.
 */
public enum ParseOutcome {
    PARSED,
    EMPTY,
    UNRECOGNIZED
}
