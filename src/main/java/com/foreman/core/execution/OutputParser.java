package com.foreman.core.execution;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts structured parts (summary, plan) from agent output.
 */
public final class OutputParser {

    private static final Pattern SUMMARY = Pattern.compile("<summary>(.*?)</summary>", Pattern.DOTALL);
    private static final Pattern PLAN = Pattern.compile("<plan>(.*?)</plan>", Pattern.DOTALL);

    private OutputParser() {}

    /**
     * Returns the last {@code <summary>} block, else the last non-blank paragraph,
     * else null for blank output.
     */
    public static String extractSummary(String output) {
        if (output == null || output.isBlank()) {
            return null;
        }
        String last = lastMatch(SUMMARY, output);
        if (last != null) {
            return last;
        }
        String[] paragraphs = output.strip().split("\\n\\s*\\n");
        for (int i = paragraphs.length - 1; i >= 0; i--) {
            if (!paragraphs[i].isBlank()) {
                return paragraphs[i].strip();
            }
        }
        return null;
    }

    /** Returns the {@code <plan>} block when present, otherwise the whole output trimmed. */
    public static String extractPlan(String output) {
        if (output == null) {
            return "";
        }
        String plan = lastMatch(PLAN, output);
        return plan != null ? plan : output.strip();
    }

    private static String lastMatch(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        String last = null;
        while (m.find()) {
            last = m.group(1).strip();
        }
        return last;
    }
}
