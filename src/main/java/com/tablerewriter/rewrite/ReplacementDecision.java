package com.tablerewriter.rewrite;

import lombok.NonNull;
import lombok.Value;

/**
 * What a {@link TableNameMapper} wants done with one table reference, slot by slot.
 */
@Value
public class ReplacementDecision {

    private static final ReplacementDecision KEEP_ALL =
            new ReplacementDecision(Replacement.keep(), Replacement.keep(), Replacement.keep());

    @NonNull Replacement catalog;
    @NonNull Replacement database;
    @NonNull Replacement name;

    public static ReplacementDecision keepAll() {
        return KEEP_ALL;
    }

    public static ReplacementDecision of(Replacement catalog, Replacement database, Replacement name) {
        return new ReplacementDecision(catalog, database, name);
    }

    public static ReplacementDecision database(String newDatabase) {
        return new ReplacementDecision(Replacement.keep(), Replacement.set(newDatabase), Replacement.keep());
    }

    public static ReplacementDecision table(String newName) {
        return new ReplacementDecision(Replacement.keep(), Replacement.keep(), Replacement.set(newName));
    }

    public boolean isKeepAll() {
        return catalog.isKeep() && database.isKeep() && name.isKeep();
    }

    public TableIdentifier applyTo(TableIdentifier original) {
        return new TableIdentifier(
                catalog.applyTo(original.getCatalog()),
                database.applyTo(original.getDatabase()),
                name.applyTo(original.getName()));
    }
}
