package com.rootrag.parser;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.rootrag.index.DocOrigin;

public final class SourceFileClassifier {
    private static final Map<String, String> LANGUAGE_BY_EXTENSION = Map.of(
            ".h", "cpp",
            ".hpp", "cpp",
            ".hh", "cpp",
            ".cc", "cpp",
            ".cpp", "cpp",
            ".cxx", "cpp",
            ".c", "c");

    private static final Set<String> HEADER_EXTENSIONS = Set.of(".h", ".hpp", ".hh");

    private SourceFileClassifier() {
    }

    public static String language(Path file) {
        return LANGUAGE_BY_EXTENSION.getOrDefault(extension(file).toLowerCase(Locale.ROOT), "text");
    }

    public static DocOrigin docOrigin(Path file) {
        return HEADER_EXTENSIONS.contains(extension(file)) ? DocOrigin.SOURCE_HEADER : DocOrigin.SOURCE_IMPL;
    }

    // Case-sensitive; only language() folds case.
    static String extension(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return "";
        }
        return name.substring(dot);
    }
}
