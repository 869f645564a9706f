package com.phillippitts.avifconverter.util;

/** Utility for log-safe rendering of caller-supplied strings. */
public final class LogSanitizer {

    /** Longest filename rendered in a log line. */
    public static final int MAX_FILENAME_CHARS = 128;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Reduces an uploaded filename to a single log-safe token: directory parts are dropped,
     * control characters and anything outside {@code [A-Za-z0-9._-]} become '_', and the
     * result is capped at {@link #MAX_FILENAME_CHARS}. Returns "unnamed" for blank input.
     */
    public static String filename(String raw) {
        if (raw == null || raw.isBlank()) {
            return "unnamed";
        }
        String base = raw;
        int slash = Math.max(base.lastIndexOf('/'), base.lastIndexOf('\\'));
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        StringBuilder sb = new StringBuilder(base.length());
        for (int i = 0; i < base.length(); i++) {
            char c = base.charAt(i);
            boolean safe = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '.' || c == '-' || c == '_';
            sb.append(safe ? c : '_');
        }
        String cleaned = truncate(sb.toString(), MAX_FILENAME_CHARS);
        if (cleaned.isEmpty() || cleaned.chars().allMatch(ch -> ch == '.')) {
            return "unnamed";
        }
        return cleaned;
    }

    /**
     * Sanitized base name (extension stripped) with a new extension, e.g. for naming the
     * AVIF returned to a client.
     */
    public static String replaceExtension(String raw, String newExtension) {
        String name = filename(raw);
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return stem + "." + newExtension;
    }
}
