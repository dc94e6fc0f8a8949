package com.linkdrop.api.service;

import java.nio.charset.StandardCharsets;

/**
 * Reduces an uploaded filename to its last path component so it cannot escape the upload directory.
 */
public final class FilenameSanitizer {

    static final String FALLBACK = "file";

    // Leaves room for the "{token}-" prefix under the usual 255-byte file name limit
    static final int MAX_NAME_BYTES = 200;
    private static final int MAX_EXTENSION_BYTES = 16;

    private FilenameSanitizer() {
    }

    public static String sanitize(String original) {
        if (original == null) {
            return FALLBACK;
        }
        // Browsers on Windows may send the full client path
        String name = original.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);

        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!Character.isISOControl(c)) {
                sb.append(c);
            }
        }
        name = capLength(sb.toString().strip()).strip();

        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            return FALLBACK;
        }
        return name;
    }

    // Shortens the stem, keeping a short extension, on code point boundaries
    private static String capLength(String name) {
        if (utf8Length(name) <= MAX_NAME_BYTES) {
            return name;
        }
        String stem = name;
        String extension = "";
        int dot = name.lastIndexOf('.');
        if (dot > 0 && utf8Length(name.substring(dot)) <= MAX_EXTENSION_BYTES) {
            stem = name.substring(0, dot);
            extension = name.substring(dot);
        }

        int budget = MAX_NAME_BYTES - utf8Length(extension);
        StringBuilder kept = new StringBuilder();
        int used = 0;
        for (int i = 0; i < stem.length(); ) {
            int codePoint = stem.codePointAt(i);
            int bytes = utf8Length(new String(Character.toChars(codePoint)));
            if (used + bytes > budget) {
                break;
            }
            kept.appendCodePoint(codePoint);
            used += bytes;
            i += Character.charCount(codePoint);
        }
        return kept.toString().stripTrailing() + extension;
    }

    private static int utf8Length(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length;
    }
}
