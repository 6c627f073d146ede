package com.tablerewriter.dto;

public enum RewriteStatus {
    REWRITTEN,
    UNCHANGED,
    FAILED
}
