package com.phillippitts.scriberelay.util;

import java.util.regex.Pattern;

/** Helpers for privacy-safe logging and user-facing error text. */
public final class LogSanitizer {

    private static final Pattern URL = Pattern.compile("(?i)\\b(?:https?|wss?)://\\S+");
    private static final Pattern AWS_ACCESS_KEY = Pattern.compile("\\b(?:AKIA|ASIA)[0-9A-Z]{16}\\b");
    private static final Pattern SIGNED_QUERY_PARAM = Pattern.compile("(?i)(X-Amz-[A-Za-z-]+)=[^&\\s]+");
    private static final Pattern AUTH_SCHEME = Pattern.compile("(?i)\\b(Bearer|Token)\\s+[^\\s,;]+");

    private LogSanitizer() {}

    /**
     * Describes text by its length only, so transcript content never reaches a log line.
     */
    public static String describe(String text) {
        return "[" + (text == null ? 0 : text.length()) + " chars]";
    }

    /**
     * Masks URLs, signed query parameters, access keys and authorization tokens.
     * Returns "" for null.
     */
    public static String maskSecrets(String s) {
        if (s == null) {
            return "";
        }
        String out = URL.matcher(s).replaceAll("[url]");
        out = SIGNED_QUERY_PARAM.matcher(out).replaceAll("$1=[redacted]");
        out = AWS_ACCESS_KEY.matcher(out).replaceAll("[key]");
        return AUTH_SCHEME.matcher(out).replaceAll("$1 [redacted]");
    }
}
