package com.behaviorguard.detector.event;

import java.util.Locale;

/**
 * Helpers for Windows image and file paths as reported by the telemetry
 * source. Both separators are accepted since forwarders are not consistent.
 */
public final class ImagePaths {

    private ImagePaths() {
    }

    /** File name component of a path, or an empty string for null/blank input. */
    public static String fileName(String path) {
        if (path == null || path.isBlank()) {
            return "";
        }
        String trimmed = path.trim();
        int cut = Math.max(trimmed.lastIndexOf('\\'), trimmed.lastIndexOf('/'));
        return cut >= 0 ? trimmed.substring(cut + 1) : trimmed;
    }

    /** Lower-cased extension including the dot ({@code .exe}), or an empty string. */
    public static String extension(String path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
