package io.sqsoffline.provision;

/**
 * Queue name sanitization.
 *
 * <p>Backend queue names are limited to {@code [A-Za-z0-9_-]} and {@value #MAX_LENGTH}
 * characters. {@link #sanitize(String)} maps anything else onto a valid name deterministically.
 */
public final class QueueNames {
    public static final int MAX_LENGTH = 80;
    public static final String FALLBACK_NAME = "queue";

    private QueueNames() {}

    /**
     * Sanitizes a queue name: disallowed characters become {@code '-'}, runs of {@code '-'}
     * collapse, trailing {@code '-'} are trimmed, and the result is truncated to
     * {@value #MAX_LENGTH} characters. Returns {@value #FALLBACK_NAME} if nothing is left.
     *
     * <p>Idempotent: {@code sanitize(sanitize(x)).equals(sanitize(x))}.
     *
     * @param name the raw name, may be {@code null}
     * @return a valid, non-empty queue name
     */
    public static String sanitize(String name) {
        if (name == null) {
            return FALLBACK_NAME;
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            char mapped = isAllowed(c) ? c : '-';
            if (mapped == '-' && sb.length() > 0 && sb.charAt(sb.length() - 1) == '-') {
                continue;
            }
            sb.append(mapped);
        }
        trimTrailingSeparators(sb);
        if (sb.length() > MAX_LENGTH) {
            sb.setLength(MAX_LENGTH);
            trimTrailingSeparators(sb);
        }
        return sb.length() == 0 ? FALLBACK_NAME : sb.toString();
    }

    /**
     * @param name a queue name
     * @return {@code true} if {@code name} is already a valid queue name
     */
    public static boolean isValid(String name) {
        if (name == null || name.isEmpty() || name.length() > MAX_LENGTH) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!isAllowed(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isAllowed(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_' || c == '-';
    }

    private static void trimTrailingSeparators(StringBuilder sb) {
        while (sb.length() > 0 && sb.charAt(sb.length() - 1) == '-') {
            sb.setLength(sb.length() - 1);
        }
    }
}
