package com.numera.backend.services.extraction.repair;

import java.util.regex.Pattern;

/**
 * Removes code fences and surrounding prose, keeping the span from the first opening
 * bracket or brace to the last closer.
 */
public final class ResponseSlicer {

    private static final Pattern FENCE = Pattern.compile("```[A-Za-z0-9_-]*");

    private ResponseSlicer() {}

    public static String slice(String raw) {
        if (raw == null) return "";
        String s = FENCE.matcher(raw).replaceAll("").trim();

        int firstBracket = s.indexOf('[');
        int firstBrace = s.indexOf('{');
        int start;
        if (firstBracket == -1) start = firstBrace;
        else if (firstBrace == -1) start = firstBracket;
        else start = Math.min(firstBracket, firstBrace);

        if (start == -1) return s;

        int end = Math.max(s.lastIndexOf(']'), s.lastIndexOf('}'));
        if (end < start) {
            // no closer after the opener: truncated output, keep the tail for bracket repair
            return s.substring(start);
        }
        return s.substring(start, end + 1);
    }
}
