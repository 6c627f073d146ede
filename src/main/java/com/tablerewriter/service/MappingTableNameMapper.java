package com.tablerewriter.service;

import java.util.ArrayList;
import java.util.List;

import com.tablerewriter.dto.MappingEntry;
import com.tablerewriter.rewrite.Replacement;
import com.tablerewriter.rewrite.ReplacementDecision;
import com.tablerewriter.rewrite.TableNameMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link TableNameMapper} driven by mapping rules.
 *
 * <p>Table rules are tried before database wildcard rules, each in declaration order. Matching
 * ignores case. A rule that does not name a catalog (or database) matches any. Target parts a
 * rule leaves out are kept as they are in the query.
 */
@Slf4j
public class MappingTableNameMapper implements TableNameMapper {

    private final List<MappingEntry> tableRules = new ArrayList<>();
    private final List<MappingEntry> databaseRules = new ArrayList<>();

    public MappingTableNameMapper(List<MappingEntry> mappings) {
        for (MappingEntry mapping : mappings) {
            if (mapping.isDatabaseLevelMapping()) {
                databaseRules.add(mapping);
            } else {
                tableRules.add(mapping);
            }
        }
    }

    @Override
    public ReplacementDecision map(String catalog, String database, String name) {
        for (MappingEntry rule : tableRules) {
            if (matches(rule.getSourceCatalog(), catalog)
                    && matches(rule.getSourceDatabase(), database)
                    && matches(rule.getSourceTable(), name)) {
                log.debug("Table rule '{}' matched {}.{}", rule.getSourceObject(), database, name);
                return decisionFor(rule);
            }
        }
        for (MappingEntry rule : databaseRules) {
            if (matches(rule.getSourceCatalog(), catalog) && matches(rule.getSourceDatabase(), database)) {
                log.debug("Database rule '{}' matched {}.{}", rule.getSourceObject(), database, name);
                return decisionFor(rule);
            }
        }
        return ReplacementDecision.keepAll();
    }

    public int size() {
        return tableRules.size() + databaseRules.size();
    }

    private static boolean matches(String ruleValue, String actual) {
        return ruleValue == null || ruleValue.equalsIgnoreCase(actual);
    }

    private static ReplacementDecision decisionFor(MappingEntry rule) {
        String targetTable = MappingEntry.WILDCARD.equals(rule.getTargetTable()) ? null : rule.getTargetTable();
        return ReplacementDecision.of(
                Replacement.setOrKeep(rule.getTargetCatalog()),
                Replacement.setOrKeep(rule.getTargetDatabase()),
                Replacement.setOrKeep(targetTable));
    }
}
