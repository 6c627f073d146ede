package com.tablerewriter.rewrite;

import java.util.StringJoiner;

import lombok.Value;

/**
 * Unquoted catalog / database / table components of one table reference.
 */
@Value
public class TableIdentifier {
    String catalog;
    String database;
    String name;

    public static TableIdentifier of(String database, String name) {
        return new TableIdentifier(null, database, name);
    }

    public boolean hasCatalog() {
        return catalog != null;
    }

    public boolean hasDatabase() {
        return database != null;
    }

    /**
     * Dotted form without any quoting, e.g. {@code cat.db.orders}.
     */
    public String toDottedString() {
        StringJoiner joiner = new StringJoiner(".");
        if (catalog != null) {
            joiner.add(catalog);
        }
        if (database != null) {
            joiner.add(database);
        }
        if (name != null) {
            joiner.add(name);
        }
        return joiner.toString();
    }
}
