package com.shardscope.expression;

import java.util.Set;

/**
 * Quoting helpers for rendering expressions as SQL text.
 */
public final class SQLText {

    private static final Set<String> RESERVED_WORDS = Set.of(
        "SELECT", "FROM", "WHERE", "GROUP", "BY", "ORDER", "HAVING",
        "JOIN", "ON", "USING", "AS", "AND", "OR", "NOT", "IN", "ANY",
        "ALL", "EXISTS", "CASE", "WHEN", "THEN", "ELSE", "END", "NULL",
        "TRUE", "FALSE", "IS", "BETWEEN", "LIKE", "DISTINCT", "LIMIT"
    );

    private SQLText() {}

    /**
     * Quotes an identifier with double quotes, doubling embedded quotes.
     *
     * @param identifier the identifier to quote
     * @return the quoted identifier
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Quotes an identifier only when it is not a plain lower-risk name.
     *
     * @param identifier the identifier to conditionally quote
     * @return the identifier, quoted if necessary
     */
    public static String quoteIdentifierIfNeeded(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        if (needsQuoting(identifier)) {
            return quoteIdentifier(identifier);
        }
        return identifier;
    }

    /**
     * Quotes a string literal, returning NULL for a null value.
     *
     * @param value the string value
     * @return the quoted literal
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        return "'" + value.replace("'", "''") + "'";
    }

    private static boolean needsQuoting(String identifier) {
        char first = identifier.charAt(0);
        if (!Character.isLetter(first) && first != '_') {
            return true;
        }
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return true;
            }
        }
        return RESERVED_WORDS.contains(identifier.toUpperCase());
    }
}
