package com.skanga.dbgate.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Minimal SQL tokenizer used by {@link PolicyGuard}.
 * It only knows enough to skip string literals, quoted identifiers and comments, so that keywords and
 * placeholders are never picked up from inside them. It is a lexical heuristic, not a parser.
 * Executable comments ({@code /*! ... *}{@code /} and MariaDB's {@code /*M! ... *}{@code /}) are lexed as code
 * because the server runs them.
 */
final class SqlLexer {
    enum TokenType {
        WORD,
        SEMICOLON,
        OPEN_PAREN,
        QUESTION_PLACEHOLDER,
        FORMAT_PLACEHOLDER,
        SYMBOL
    }

    /**
     * @param type  token kind
     * @param text  upper-cased text for words, raw text otherwise
     * @param start offset of the first character in the source
     * @param end   offset just past the last character
     */
    record Token(TokenType type, String text, int start, int end) {
    }

    private SqlLexer() {
    }

    static List<Token> tokenize(String sqlText) {
        List<Token> sqlTokens = new ArrayList<>();
        if (sqlText == null) {
            return sqlTokens;
        }
        int length = sqlText.length();
        int pos = 0;
        while (pos < length) {
            char current = sqlText.charAt(pos);
            char next = pos + 1 < length ? sqlText.charAt(pos + 1) : '\0';

            if (Character.isWhitespace(current)) {
                pos++;
            } else if (current == '-' && next == '-' && (pos + 2 >= length || Character.isWhitespace(sqlText.charAt(pos + 2)))) {
                pos = skipLineComment(sqlText, pos);
            } else if (current == '#') {
                pos = skipLineComment(sqlText, pos);
            } else if (current == '/' && next == '*') {
                int markerLength = executableMarkerLength(sqlText, pos);
                if (markerLength > 0) {
                    // executable comment: drop the marker and optional version, lex the body
                    pos += markerLength;
                    while (pos < length && Character.isDigit(sqlText.charAt(pos))) {
                        pos++;
                    }
                } else {
                    int close = sqlText.indexOf("*/", pos + 2);
                    pos = close < 0 ? length : close + 2;
                }
            } else if (current == '*' && next == '/') {
                // end of an executable comment
                pos += 2;
            } else if (current == '\'' || current == '"' || current == '`') {
                pos = skipQuoted(sqlText, pos, current);
            } else if (Character.isLetter(current) || current == '_') {
                int wordEnd = pos + 1;
                while (wordEnd < length && (Character.isLetterOrDigit(sqlText.charAt(wordEnd))
                        || sqlText.charAt(wordEnd) == '_' || sqlText.charAt(wordEnd) == '$')) {
                    wordEnd++;
                }
                sqlTokens.add(new Token(TokenType.WORD, sqlText.substring(pos, wordEnd).toUpperCase(Locale.ROOT), pos, wordEnd));
                pos = wordEnd;
            } else if (current == ';') {
                sqlTokens.add(new Token(TokenType.SEMICOLON, ";", pos, pos + 1));
                pos++;
            } else if (current == '(') {
                sqlTokens.add(new Token(TokenType.OPEN_PAREN, "(", pos, pos + 1));
                pos++;
            } else if (current == '?') {
                sqlTokens.add(new Token(TokenType.QUESTION_PLACEHOLDER, "?", pos, pos + 1));
                pos++;
            } else if (current == '%' && next == 's') {
                sqlTokens.add(new Token(TokenType.FORMAT_PLACEHOLDER, "%s", pos, pos + 2));
                pos += 2;
            } else if (current == '%' && next == '%') {
                sqlTokens.add(new Token(TokenType.SYMBOL, "%%", pos, pos + 2));
                pos += 2;
            } else {
                sqlTokens.add(new Token(TokenType.SYMBOL, String.valueOf(current), pos, pos + 1));
                pos++;
            }
        }
        return sqlTokens;
    }

    /**
     * Length of a {@code /*!} or {@code /*M!} opener at {@code pos}, or 0 for a plain comment.
     */
    private static int executableMarkerLength(String sqlText, int pos) {
        if (sqlText.startsWith("/*!", pos)) {
            return 3;
        }
        if (sqlText.startsWith("/*M!", pos) || sqlText.startsWith("/*m!", pos)) {
            return 4;
        }
        return 0;
    }

    private static int skipLineComment(String sqlText, int pos) {
        int lineEnd = sqlText.indexOf('\n', pos);
        return lineEnd < 0 ? sqlText.length() : lineEnd + 1;
    }

    /**
     * Skips a quoted section. Doubled quotes and backslash escapes stay inside it.
     */
    private static int skipQuoted(String sqlText, int pos, char quoteChar) {
        int length = sqlText.length();
        int scan = pos + 1;
        while (scan < length) {
            char current = sqlText.charAt(scan);
            if (current == '\\' && quoteChar != '`') {
                scan += 2;
            } else if (current == quoteChar) {
                if (scan + 1 < length && sqlText.charAt(scan + 1) == quoteChar) {
                    scan += 2;
                } else {
                    return scan + 1;
                }
            } else {
                scan++;
            }
        }
        return length;
    }
}
