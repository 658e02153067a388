package com.example.baselinediff.client.git;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts Gerrit trailers from a full commit message. Keys are matched
 * case-insensitively at the start of a line; the first occurrence wins.
 */
public final class CommitTrailers {

    private static final Pattern CHANGE_ID = Pattern.compile("(?im)^\\s*Change-Id:\\s*([A-Za-z0-9]+)");
    private static final Pattern REVIEWED_ON = Pattern.compile("(?im)^\\s*Reviewed-on:\\s*(\\S+)");

    private CommitTrailers() {
    }

    public static String changeId(String message) {
        return firstGroup(CHANGE_ID, message);
    }

    public static String reviewedOn(String message) {
        return firstGroup(REVIEWED_ON, message);
    }

    /**
     * First line of the message.
     */
    public static String subject(String message) {
        if (message == null) {
            return "";
        }
        int newline = message.indexOf('\n');
        String first = newline < 0 ? message : message.substring(0, newline);
        return first.strip();
    }

    /**
     * Everything after the first line, trimmed.
     */
    public static String body(String message) {
        if (message == null) {
            return "";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? "" : message.substring(newline + 1).strip();
    }

    private static String firstGroup(Pattern pattern, String message) {
        if (message == null || message.isEmpty()) {
            return null;
        }
        Matcher matcher = pattern.matcher(message);
        return matcher.find() ? matcher.group(1) : null;
    }
}
