package com.tablerewriter.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RewriteBatchResponse {
    private boolean success;
    private String message;
    private int totalQueries;
    private int rewrittenQueries;
    private int failedQueries;
    private String reportFileName;
    private String error;
}
