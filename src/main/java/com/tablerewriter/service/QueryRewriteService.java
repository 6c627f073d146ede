package com.tablerewriter.service;

import com.tablerewriter.config.RewriterConfig;
import com.tablerewriter.dto.MappingEntry;
import com.tablerewriter.dto.QueryDTO;
import com.tablerewriter.dto.RewriteResponse;
import com.tablerewriter.dto.RewriteStatus;
import com.tablerewriter.rewrite.TableIdentifier;
import com.tablerewriter.rewrite.TableIdentifierRewriter;
import com.tablerewriter.rewrite.TableNameMapper;
import com.tablerewriter.util.MappingEntryParser;
import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
public class QueryRewriteService {

    private final RewriterConfig config;
    private final List<MappingEntry> configuredMappings;

    public QueryRewriteService(RewriterConfig config) {
        this.config = config;
        this.configuredMappings = parseConfiguredMappings(config.getMappings());
        log.info("Loaded {} configured table mappings", configuredMappings.size());
    }

    public List<MappingEntry> getConfiguredMappings() {
        return configuredMappings;
    }

    /**
     * Rewrites one statement with the configured mappings.
     */
    public RewriteResponse rewrite(String sql, Boolean includeUnqualified) throws JSQLParserException {
        return rewrite(sql, new MappingTableNameMapper(configuredMappings), includeUnqualified);
    }

    public RewriteResponse rewrite(String sql, TableNameMapper mapper, Boolean includeUnqualified)
            throws JSQLParserException {
        if (sql == null || sql.trim().isEmpty()) {
            throw new IllegalArgumentException("sql is required and cannot be empty");
        }
        TableIdentifierRewriter rewriter = new TableIdentifierRewriter(mapper, config.toRewriteOptions(includeUnqualified));

        Statement statement = CCJSqlParserUtil.parse(sql);
        String before = statement.toString();
        rewriter.rewrite(statement);
        String after = statement.toString();

        boolean changed = !before.equals(after);
        return RewriteResponse.builder()
                .originalSql(sql)
                .rewrittenSql(changed ? after : sql)
                .changed(changed)
                .build();
    }

    public List<TableIdentifier> findTableReferences(String sql, Boolean includeUnqualified) throws JSQLParserException {
        TableIdentifierRewriter rewriter = new TableIdentifierRewriter(
                TableNameMapper.identity(), config.toRewriteOptions(includeUnqualified));
        return rewriter.findTableReferences(sql);
    }

    /**
     * Rewrites every query independently. A query that cannot be rewritten is marked
     * {@link RewriteStatus#FAILED} with the error and the batch goes on.
     */
    public List<QueryDTO> rewriteQueries(List<QueryDTO> queries, List<MappingEntry> mappings, Boolean includeUnqualified) {
        TableNameMapper mapper = new MappingTableNameMapper(mappings);
        int rewritten = 0;
        int failed = 0;

        for (QueryDTO query : queries) {
            try {
                RewriteResponse result = rewrite(query.getOriginalQuery(), mapper, includeUnqualified);
                query.setUpdatedQuery(result.getRewrittenSql());
                query.setError(null);
                if (result.isChanged()) {
                    query.setStatus(RewriteStatus.REWRITTEN);
                    rewritten++;
                    log.debug("Query '{}' rewritten", query.getQueryName());
                } else {
                    query.setStatus(RewriteStatus.UNCHANGED);
                }
            } catch (JSQLParserException | RuntimeException e) {
                log.warn("Rewrite failed for query '{}': {}", query.getQueryName(), e.getMessage());
                query.setUpdatedQuery(null);
                query.setStatus(RewriteStatus.FAILED);
                query.setError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                failed++;
            }
        }

        log.info("Rewrite complete. {} rewritten, {} failed out of {} queries", rewritten, failed, queries.size());
        return queries;
    }

    private static List<MappingEntry> parseConfiguredMappings(List<RewriterConfig.MappingRule> rules) {
        List<MappingEntry> mappings = new ArrayList<>();
        if (rules == null) {
            return mappings;
        }
        for (RewriterConfig.MappingRule rule : rules) {
            mappings.add(MappingEntryParser.parse(rule.getSource(), rule.getTarget()));
        }
        return mappings;
    }
}
