package org.carball.planlens.model.mssql;

public record UsedIndex(String name, String kind) {}
