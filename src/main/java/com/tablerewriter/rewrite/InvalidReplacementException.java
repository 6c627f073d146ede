package com.tablerewriter.rewrite;

import lombok.Getter;

/**
 * A mapper decision that cannot be written back as a table identifier.
 */
@Getter
public class InvalidReplacementException extends IllegalArgumentException {

    private final TableIdentifier original;
    private final ReplacementDecision decision;

    public InvalidReplacementException(String message, TableIdentifier original, ReplacementDecision decision) {
        super(message + " (table " + original.toDottedString() + ", decision " + decision + ")");
        this.original = original;
        this.decision = decision;
    }
}
