package com.tablerewriter.rewrite;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class RewriteOptions {

    /**
     * Also hand bare table names (no database qualifier) to the mapper. CTE names in scope are
     * still skipped. Off by default: a bare name may be a CTE, or only resolvable against the
     * session's current database.
     */
    @Builder.Default
    boolean includeUnqualified = false;

    @Builder.Default
    IdentifierQuoting quoting = IdentifierQuoting.SPARK;

    public static RewriteOptions defaults() {
        return RewriteOptions.builder().build();
    }
}
