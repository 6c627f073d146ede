package com.tablerewriter.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryDTO {
    private String queryName;
    private String description;
    private String originalQuery;
    private String updatedQuery;
    private RewriteStatus status;
    private String error;

    public QueryDTO(String queryName, String description, String originalQuery) {
        this.queryName = queryName;
        this.description = description;
        this.originalQuery = originalQuery;
    }

    public boolean isRewritten() {
        return status == RewriteStatus.REWRITTEN;
    }
}
