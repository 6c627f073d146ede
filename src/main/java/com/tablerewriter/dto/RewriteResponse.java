package com.tablerewriter.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RewriteResponse {
    private String originalSql;
    private String rewrittenSql;
    private boolean changed;
}
