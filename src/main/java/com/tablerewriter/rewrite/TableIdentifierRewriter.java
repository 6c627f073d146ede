package com.tablerewriter.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Database;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Select;

/**
 * Rewrites the catalog, database and table parts of table references in a SQL query.
 *
 * <p>Every table reference that carries a database qualifier is handed to the bound
 * {@link TableNameMapper}, and the decided identifier is written back into the parsed tree.
 * Bare table names are left alone unless {@link RewriteOptions#isIncludeUnqualified()} is set,
 * and names of WITH items in scope are never handed over.
 *
 * <p>Quoting is kept on components whose value does not change. A changed component stays
 * quoted if it was quoted, and is otherwise quoted only when the new value needs it.
 *
 * <p>The text produced by {@link #rewrite(String)} is JSqlParser's rendering of the statement:
 * whitespace and keyword spacing are normalized by the renderer, not by this class.
 *
 * <p>Instances are immutable and can be shared between threads as long as the mapper can.
 */
@Slf4j
public class TableIdentifierRewriter {

    private final TableNameMapper mapper;
    private final RewriteOptions options;

    public TableIdentifierRewriter(TableNameMapper mapper) {
        this(mapper, RewriteOptions.defaults());
    }

    public TableIdentifierRewriter(TableNameMapper mapper, RewriteOptions options) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Parses {@code sql}, rewrites its table references and renders the result.
     *
     * @throws JSQLParserException if the text is not valid SQL, passed through from JSqlParser
     * @throws UnsupportedStatementException if the statement is not a SELECT query
     * @throws InvalidReplacementException if the mapper decides an identifier that cannot be written
     */
    public String rewrite(String sql) throws JSQLParserException {
        log.debug("Input SQL: {}", sql);
        Statement statement = parse(sql);
        rewrite(statement);
        String result = render(statement);
        log.debug("Rewritten SQL: {}", result);
        return result;
    }

    /**
     * Rewrites an already parsed statement in place.
     */
    public void rewrite(Statement statement) {
        Select select = requireSelect(statement);
        new TableReferenceWalker(this::processTable).walk(select);
    }

    /**
     * Table references the mapper would be called with, in visiting order. Nothing is rewritten.
     */
    public List<TableIdentifier> findTableReferences(String sql) throws JSQLParserException {
        Select select = requireSelect(parse(sql));
        List<TableIdentifier> references = new ArrayList<>();
        new TableReferenceWalker((table, cteReference, parentSlot) -> {
            TableIdentifier identifier = decompose(table);
            if (isResolvable(identifier, cteReference)) {
                references.add(identifier);
            }
        }).walk(select);
        return references;
    }

    private Statement parse(String sql) throws JSQLParserException {
        if (sql == null || sql.trim().isEmpty()) {
            throw new IllegalArgumentException("SQL text is required and cannot be empty");
        }
        return CCJSqlParserUtil.parse(sql);
    }

    private static Select requireSelect(Statement statement) {
        Objects.requireNonNull(statement, "statement");
        if (!(statement instanceof Select)) {
            throw new UnsupportedStatementException(statement.getClass().getSimpleName());
        }
        return (Select) statement;
    }

    private static String render(Statement statement) {
        try {
            return statement.toString();
        } catch (RuntimeException e) {
            throw new IllegalStateException("Failed to render rewritten statement", e);
        }
    }

    private void processTable(Table table, boolean cteReference, Consumer<FromItem> parentSlot) {
        TableIdentifier original = decompose(table);
        log.debug("Processing table: catalog={}, db={}, name={}",
                original.getCatalog(), original.getDatabase(), original.getName());

        if (!isResolvable(original, cteReference)) {
            log.debug("Skipping table {} - not a qualified table reference", table.getFullyQualifiedName());
            return;
        }

        ReplacementDecision decision = mapper.map(original.getCatalog(), original.getDatabase(), original.getName());
        if (decision == null) {
            throw new IllegalStateException("Table name mapper returned no decision for " + original.toDottedString());
        }
        log.debug("Decision for {}: {}", original.toDottedString(), decision);
        if (decision.isKeepAll()) {
            return;
        }

        TableIdentifier target = decision.applyTo(original);
        if (target.getName() == null) {
            throw new InvalidReplacementException("Table name cannot be cleared", original, decision);
        }
        if (target.hasCatalog() && !target.hasDatabase()) {
            throw new InvalidReplacementException("Catalog qualification requires a database", original, decision);
        }

        String catalogText = reconstruct(catalogOf(table), original.getCatalog(), target.getCatalog());
        String databaseText = reconstruct(table.getSchemaName(), original.getDatabase(), target.getDatabase());
        String nameText = reconstruct(table.getName(), original.getName(), target.getName());

        boolean shrinks = (original.hasCatalog() && !target.hasCatalog())
                || (original.hasDatabase() && !target.hasDatabase());
        if (shrinks) {
            // JSqlParser cannot drop a leading name part in place
            Table replacement = databaseText == null ? new Table(nameText) : new Table(databaseText, nameText);
            replacement.setAlias(table.getAlias());
            replacement.setPivot(table.getPivot());
            replacement.setUnPivot(table.getUnPivot());
            parentSlot.accept(replacement);
            log.debug("Replaced table {} with {}", table.getFullyQualifiedName(), replacement.getFullyQualifiedName());
            return;
        }

        table.setName(nameText);
        if (databaseText != null) {
            table.setSchemaName(databaseText);
        }
        if (catalogText != null) {
            table.setDatabase(new Database(catalogText));
        }
        log.debug("Modified table: {}", table.getFullyQualifiedName());
    }

    private boolean isResolvable(TableIdentifier identifier, boolean cteReference) {
        if (identifier.getName() == null) {
            return false;
        }
        if (identifier.hasDatabase()) {
            return true;
        }
        return options.isIncludeUnqualified() && !cteReference;
    }

    private String reconstruct(String raw, String originalValue, String newValue) {
        if (newValue == null) {
            return null;
        }
        if (newValue.equals(originalValue)) {
            return raw;
        }
        return options.getQuoting().render(newValue, IdentifierQuoting.isQuoted(raw));
    }

    private static TableIdentifier decompose(Table table) {
        return new TableIdentifier(
                component(catalogOf(table)),
                component(table.getSchemaName()),
                component(table.getName()));
    }

    private static String catalogOf(Table table) {
        Database database = table.getDatabase();
        return database == null ? null : database.getDatabaseName();
    }

    private static String component(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        return IdentifierQuoting.unquote(raw);
    }
}
