package com.tablerewriter.rewrite;

public class UnsupportedStatementException extends IllegalArgumentException {

    public UnsupportedStatementException(String statementType) {
        super("Only SELECT queries can be rewritten, got " + statementType + " statement");
    }
}
