package io.remindrunr.security;

import org.springframework.stereotype.Component;

/**
 * Cleans free text arriving over the API before it is stored or sent to a model.
 * Absent values stay absent so partial updates keep their meaning.
 */
@Component
public class InputSanitizer {

    static final int MAX_TITLE_LENGTH = 200;
    static final int MAX_TEXT_LENGTH = 10_000;

    /**
     * Sanitizes message or prompt text.
     * Removes control characters except newlines and tabs, and truncates overly long text.
     *
     * @param content the raw text, may be null
     * @return sanitized text, or null if {@code content} was null
     */
    public String sanitize(String content) {
        return clean(content, MAX_TEXT_LENGTH);
    }

    /**
     * Sanitizes a single-line title or name. Line breaks become spaces.
     */
    public String sanitizeTitle(String title) {
        String cleaned = clean(title, MAX_TITLE_LENGTH);
        return cleaned == null ? null : cleaned.replaceAll("[\\r\\n\\t]+", " ");
    }

    private static String clean(String content, int maxLength) {
        if (content == null) return null;

        // Remove null bytes and other control characters (keep newlines, tabs)
        String cleaned = content.replaceAll("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]", "");

        if (cleaned.length() > maxLength) {
            cleaned = cleaned.substring(0, maxLength) + "... [truncated]";
        }
        return cleaned;
    }
}
