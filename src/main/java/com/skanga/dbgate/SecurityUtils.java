package com.skanga.dbgate;

import java.util.Collection;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers that keep credentials and oversized driver text out of messages returned to clients.
 */
public final class SecurityUtils {
    public static final int MAX_ERROR_MESSAGE_LENGTH = 500;
    public static final String MASK = "***";

    private static final Pattern PASSWORD_ASSIGNMENT = Pattern.compile(
            "(?i)\\b(password|passwd|pwd|secret)(\\s*[=:]\\s*)('[^']*'|\"[^\"]*\"|[^\\s;&,)]+)");
    private static final Pattern URL_CREDENTIALS = Pattern.compile("(?i)(//[^/:@\\s]+):([^@/\\s]+)@");

    private SecurityUtils() {
    }

    /**
     * Masks credentials in a driver message and caps its length.
     *
     * @param message     raw driver text, may be null
     * @param secretValues literal secrets (configured passwords) that must never appear
     * @return text safe to hand to a client
     */
    public static String sanitizeMessage(String message, Collection<String> secretValues) {
        if (message == null || message.isBlank()) {
            return "unknown error";
        }
        String sanitizedText = maskSensitive(message, secretValues);
        sanitizedText = sanitizedText.replaceAll("\\s+", " ").trim();
        return truncate(sanitizedText, MAX_ERROR_MESSAGE_LENGTH);
    }

    /**
     * Replaces configured secrets, {@code password=...} style assignments and URL user-info passwords.
     */
    public static String maskSensitive(String text, Collection<String> secretValues) {
        if (text == null) {
            return null;
        }
        String maskedText = text;
        if (secretValues != null) {
            for (String secretValue : secretValues) {
                // very short secrets would mask unrelated text
                if (secretValue != null && secretValue.length() >= 3) {
                    maskedText = maskedText.replace(secretValue, MASK);
                }
            }
        }
        maskedText = PASSWORD_ASSIGNMENT.matcher(maskedText).replaceAll("$1$2" + Matcher.quoteReplacement(MASK));
        maskedText = URL_CREDENTIALS.matcher(maskedText).replaceAll("$1:" + Matcher.quoteReplacement(MASK) + "@");
        return maskedText;
    }

    /**
     * Cuts text to {@code maxLength} characters, marking the cut with an ellipsis.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLength - 3)) + "...";
    }

    /**
     * Shortened SQL for log lines.
     */
    public static String abbreviateSql(String sqlQuery) {
        if (sqlQuery == null) {
            return "";
        }
        String singleLine = sqlQuery.replaceAll("\\s+", " ").trim();
        return singleLine.length() > 200 ? singleLine.substring(0, 200) + "..." : singleLine;
    }
}
