package com.tablerewriter.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import com.tablerewriter.rewrite.IdentifierQuoting;
import com.tablerewriter.rewrite.RewriteOptions;

import lombok.Data;

@Configuration
@ConfigurationProperties(prefix = "rewriter")
@Data
public class RewriterConfig {
    private boolean includeUnqualified = false;
    private IdentifierQuoting dialect = IdentifierQuoting.SPARK;
    private String reportsDir = "reports";
    private List<MappingRule> mappings = new ArrayList<>();

    @Data
    public static class MappingRule {
        private String source;
        private String target;
    }

    /**
     * Engine options from configuration, with an optional per-request override of
     * {@code include-unqualified}.
     */
    public RewriteOptions toRewriteOptions(Boolean includeUnqualifiedOverride) {
        return RewriteOptions.builder()
                .includeUnqualified(includeUnqualifiedOverride != null ? includeUnqualifiedOverride : includeUnqualified)
                .quoting(dialect)
                .build();
    }
}
