package com.tablerewriter.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MappingEntry {
    public static final String WILDCARD = "*";

    private String sourceObject;
    private String targetObject;

    // Parsed components, null when the rule does not name them
    private String sourceCatalog;
    private String sourceDatabase;
    private String sourceTable;
    private String targetCatalog;
    private String targetDatabase;
    private String targetTable;

    public boolean isDatabaseLevelMapping() {
        return WILDCARD.equals(sourceTable);
    }

    public boolean isTableLevelMapping() {
        return !isDatabaseLevelMapping();
    }
}
