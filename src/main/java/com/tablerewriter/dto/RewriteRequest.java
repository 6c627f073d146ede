package com.tablerewriter.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RewriteRequest {
    private String sql;
    // null falls back to rewriter.include-unqualified
    private Boolean includeUnqualified;
}
