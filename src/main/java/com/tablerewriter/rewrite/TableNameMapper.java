package com.tablerewriter.rewrite;

/**
 * Caller-supplied decision logic for table references.
 *
 * <p>Called once per resolvable table reference, duplicates included, with the unquoted
 * component values. Any argument may be {@code null}. Exceptions thrown here abort the
 * rewrite and reach the caller unchanged.
 */
@FunctionalInterface
public interface TableNameMapper {

    ReplacementDecision map(String catalog, String database, String name);

    static TableNameMapper identity() {
        return (catalog, database, name) -> ReplacementDecision.keepAll();
    }
}
