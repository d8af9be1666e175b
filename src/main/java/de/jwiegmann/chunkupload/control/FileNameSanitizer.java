package de.jwiegmann.chunkupload.control;

import java.util.regex.Pattern;

/**
 * Macht aus einem vom Client gelieferten Dateinamen einen sicheren Anzeigenamen:
 * nur der letzte Pfadbestandteil, alles außer [a-zA-Z0-9._-] wird zu '_'.
 */
public final class FileNameSanitizer {

    private static final Pattern UNSAFE = Pattern.compile("[^a-zA-Z0-9._-]");

    private FileNameSanitizer() {
    }

    /**
     * @return bereinigter Name, leer wenn nichts Verwendbares übrig bleibt
     */
    public static String sanitize(String fileName) {
        if (fileName == null) {
            return "";
        }
        String trimmed = fileName.trim();
        int lastSeparator = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        String baseName = trimmed.substring(lastSeparator + 1);
        if (baseName.equals(".") || baseName.equals("..")) {
            return "";
        }
        return UNSAFE.matcher(baseName).replaceAll("_");
    }
}
