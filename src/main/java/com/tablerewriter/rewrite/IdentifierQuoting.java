package com.tablerewriter.rewrite;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import net.sf.jsqlparser.parser.ParserKeywordsUtils;

/**
 * Identifier quoting rules of the SQL dialect the rewritten statement is rendered in.
 *
 * <p>JSqlParser keeps the delimiters of a quoted identifier in the identifier text, so a
 * component is "quoted" exactly when its raw text is wrapped in delimiters.
 */
public enum IdentifierQuoting {
    SPARK('`', '`'),
    ANSI('"', '"');

    private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Set<String> RESERVED_WORDS = reservedWords();

    private final char open;
    private final char close;

    IdentifierQuoting(char open, char close) {
        this.open = open;
        this.close = close;
    }

    /**
     * Whether raw identifier text carries delimiters: backticks, double quotes or brackets.
     */
    public static boolean isQuoted(String raw) {
        if (raw == null || raw.length() < 2) {
            return false;
        }
        char first = raw.charAt(0);
        char last = raw.charAt(raw.length() - 1);
        return (first == '`' && last == '`')
                || (first == '"' && last == '"')
                || (first == '[' && last == ']');
    }

    /**
     * Strips delimiters and collapses doubled closing delimiters. Unquoted text is returned as is.
     */
    public static String unquote(String raw) {
        if (!isQuoted(raw)) {
            return raw;
        }
        char last = raw.charAt(raw.length() - 1);
        String inner = raw.substring(1, raw.length() - 1);
        String doubled = String.valueOf(last) + last;
        return inner.replace(doubled, String.valueOf(last));
    }

    /**
     * JSqlParser's own reserved keywords, plus grammar tokens its keyword table leaves out and
     * words reserved by ANSI SQL or Spark that JSqlParser happens to accept bare.
     */
    private static Set<String> reservedWords() {
        Set<String> words = new HashSet<>(ParserKeywordsUtils.getReservedKeywords(
                ParserKeywordsUtils.RESTRICTED_JSQLPARSER
                        | ParserKeywordsUtils.RESTRICTED_TABLE
                        | ParserKeywordsUtils.RESTRICTED_ALIAS));
        words.addAll(Arrays.asList(
                "RECURSIVE", "RETURNING", "UNBOUNDED",
                "AS", "ASC", "BY", "CASE", "CAST", "COLUMN", "DEFAULT", "DELETE", "DESC", "DROP",
                "END", "FALSE", "IN", "INSERT", "IS", "ON", "OR", "PRIMARY", "REFERENCES", "TABLE",
                "THEN", "TO", "TRUE", "UPDATE"));
        return Collections.unmodifiableSet(words);
    }

    public boolean requiresQuoting(String value) {
        return !SIMPLE_IDENTIFIER.matcher(value).matches()
                || RESERVED_WORDS.contains(value.toUpperCase(Locale.ROOT));
    }

    public String quote(String value) {
        String escaped = value.replace(String.valueOf(close), String.valueOf(close) + close);
        return open + escaped + close;
    }

    /**
     * Raw text for a component value, quoted when asked to or when the value needs it.
     */
    public String render(String value, boolean keepQuoted) {
        return keepQuoted || requiresQuoting(value) ? quote(value) : value;
    }
}
