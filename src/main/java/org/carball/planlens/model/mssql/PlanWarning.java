package org.carball.planlens.model.mssql;

/**
 * One entry of the statement warning set, as found in the plan text.
 */
public record PlanWarning(WarningType type, String message) {}
