package io.cronkeeper.security;

import org.springframework.stereotype.Component;

/**
 * Cleans text entering the scheduler through the REST and tool layers before it is stored
 * on a job and later handed to an executor.
 */
@Component
public class InputSanitizer {

    static final int MAX_MESSAGE_LENGTH = 10_000;
    static final int MAX_NAME_LENGTH = 200;

    /**
     * Removes control characters (newlines and tabs are kept) and truncates overly long text.
     *
     * @param content the raw text
     * @return sanitized text, empty for null
     */
    public String sanitize(String content) {
        if (content == null) return "";

        String cleaned = content.replaceAll("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]", "");

        if (cleaned.length() > MAX_MESSAGE_LENGTH) {
            cleaned = cleaned.substring(0, MAX_MESSAGE_LENGTH) + "... [truncated]";
        }

        return cleaned;
    }

    /**
     * Like {@link #sanitize(String)} but keeps null as null, for optional fields of a patch.
     */
    public String sanitizeOptional(String content) {
        return content == null ? null : sanitize(content);
    }

    /**
     * Sanitizes a job name: a single trimmed line of at most {@value #MAX_NAME_LENGTH} characters.
     */
    public String sanitizeName(String name) {
        if (name == null) return "";

        String cleaned = name.replaceAll("[\\x00-\\x1F\\x7F]+", " ").strip();
        if (cleaned.length() > MAX_NAME_LENGTH) {
            cleaned = cleaned.substring(0, MAX_NAME_LENGTH);
        }
        return cleaned;
    }
}
