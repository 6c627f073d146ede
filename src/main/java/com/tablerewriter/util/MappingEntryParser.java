package com.tablerewriter.util;

import java.util.ArrayList;
import java.util.List;

import com.tablerewriter.dto.MappingEntry;
import com.tablerewriter.rewrite.IdentifierQuoting;

/**
 * Parses {@code source -> target} mapping rules such as {@code sales.orders -> lake.sales_v2.orders}
 * or {@code sales.* -> lake.sales_v2.*}.
 */
public final class MappingEntryParser {

    private MappingEntryParser() {
    }

    public static MappingEntry parse(String sourceObject, String targetObject) {
        if (sourceObject == null || sourceObject.trim().isEmpty()) {
            throw new IllegalArgumentException("Mapping source is required");
        }
        if (targetObject == null || targetObject.trim().isEmpty()) {
            throw new IllegalArgumentException("Mapping target is required for source '" + sourceObject + "'");
        }

        List<String> source = splitParts(sourceObject);
        List<String> target = splitParts(targetObject);

        MappingEntry entry = new MappingEntry();
        entry.setSourceObject(sourceObject.trim());
        entry.setTargetObject(targetObject.trim());

        // Parts are read right to left: table, database, catalog
        entry.setSourceTable(part(source, 1));
        entry.setSourceDatabase(part(source, 2));
        entry.setSourceCatalog(part(source, 3));
        entry.setTargetTable(part(target, 1));
        entry.setTargetDatabase(part(target, 2));
        entry.setTargetCatalog(part(target, 3));

        boolean sourceWildcard = MappingEntry.WILDCARD.equals(entry.getSourceTable());
        boolean targetWildcard = MappingEntry.WILDCARD.equals(entry.getTargetTable());
        if (sourceWildcard && entry.getSourceDatabase() == null) {
            throw new IllegalArgumentException("Wildcard mapping '" + sourceObject + "' must name a database");
        }
        if (sourceWildcard != targetWildcard) {
            throw new IllegalArgumentException("Mapping '" + sourceObject + "' -> '" + targetObject
                    + "' must use a table wildcard on both sides or on neither");
        }
        if (sourceWildcard && entry.getTargetDatabase() == null) {
            throw new IllegalArgumentException("Wildcard mapping target '" + targetObject + "' must name a database");
        }
        return entry;
    }

    private static List<String> splitParts(String object) {
        String[] raw = object.trim().split("\\.", -1);
        if (raw.length > 3) {
            throw new IllegalArgumentException("Table object '" + object + "' has more than three parts");
        }
        List<String> parts = new ArrayList<>();
        for (String part : raw) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                throw new IllegalArgumentException("Table object '" + object + "' contains an empty part");
            }
            parts.add(IdentifierQuoting.unquote(trimmed));
        }
        return parts;
    }

    private static String part(List<String> parts, int fromRight) {
        int index = parts.size() - fromRight;
        return index >= 0 ? parts.get(index) : null;
    }
}
