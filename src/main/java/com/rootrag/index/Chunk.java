package com.rootrag.index;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rootrag.core.ValidationException;

/**
 * One contiguous, inclusive line range of a single source file together with the
 * corpus version it was cut from. Instances are validated on construction, including
 * when Jackson rebuilds them from {@code chunks.jsonl}.
 */
public record Chunk(
        @JsonProperty("chunk_id") String chunkId,
        @JsonProperty("root_ref") String rootRef,
        @JsonProperty("resolved_commit") String resolvedCommit,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("language") String language,
        @JsonProperty("start_line") int startLine,
        @JsonProperty("end_line") int endLine,
        @JsonProperty("content") String content,
        @JsonProperty("doc_origin") DocOrigin docOrigin,
        @JsonProperty("index_schema_version") String indexSchemaVersion,
        @JsonProperty("symbol_path") String symbolPath,
        @JsonProperty("has_doxygen") boolean hasDoxygen) {

    public static final String INDEX_SCHEMA_VERSION = "1.0.0";
    public static final int MAX_CONTENT_LENGTH = 1_000_000;
    public static final int CHUNK_ID_LENGTH = 12;

    public Chunk {
        ValidationException.requireNonBlank("chunk_id", chunkId);
        ValidationException.requireNonBlank("root_ref", rootRef);
        ValidationException.requireNonBlank("resolved_commit", resolvedCommit);
        validateFilePath(filePath);
        if (language == null || language.isEmpty() || !language.equals(language.toLowerCase(Locale.ROOT))) {
            throw new ValidationException("language", "must be a lowercase identifier, got: " + language);
        }
        if (startLine < 1) {
            throw new ValidationException("start_line", "must be >= 1, got " + startLine);
        }
        if (endLine < startLine) {
            throw new ValidationException("end_line", "(" + endLine + ") must be >= start_line (" + startLine + ")");
        }
        if (content == null || isBlankContent(content)) {
            throw new ValidationException("content", "must not be empty or whitespace-only");
        }
        if (content.length() > MAX_CONTENT_LENGTH) {
            throw new ValidationException("content", "exceeds maximum length of " + MAX_CONTENT_LENGTH + " characters");
        }
        if (docOrigin == null) {
            throw new ValidationException("doc_origin", "must not be null");
        }
        if (indexSchemaVersion == null || indexSchemaVersion.isBlank()) {
            indexSchemaVersion = INDEX_SCHEMA_VERSION;
        }
    }

    public static Chunk fromFileSlice(
            String filePath,
            int startLine,
            int endLine,
            String content,
            String rootRef,
            String resolvedCommit,
            String language,
            DocOrigin docOrigin,
            String symbolPath,
            boolean hasDoxygen) {
        String chunkId = computeChunkId(rootRef, resolvedCommit, filePath, startLine, endLine);
        return new Chunk(chunkId, rootRef, resolvedCommit, filePath, language, startLine, endLine, content,
                docOrigin, INDEX_SCHEMA_VERSION, symbolPath, hasDoxygen);
    }

    public static String computeChunkId(String rootRef, String resolvedCommit, String filePath, int startLine, int endLine) {
        String provenance = rootRef + ":" + resolvedCommit + ":" + filePath + ":" + startLine + ":" + endLine;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(provenance.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, CHUNK_ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * True when every character is whitespace in the Unicode sense, including no-break
     * spaces and NEL, which {@link String#isBlank()} does not treat as blank.
     */
    public static boolean isBlankContent(String content) {
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (!Character.isWhitespace(c) && !Character.isSpaceChar(c) && c != '\u0085') {
                return false;
            }
        }
        return true;
    }

    static void validateFilePath(String filePath) {
        if (filePath == null || filePath.isEmpty()) {
            throw new ValidationException("file_path", "must not be empty");
        }
        if (filePath.startsWith("/") || filePath.startsWith("\\")) {
            throw new ValidationException("file_path", "must be relative, got: " + filePath);
        }
        if (filePath.contains("\\")) {
            throw new ValidationException("file_path", "must use '/' separators, got: " + filePath);
        }
        if (".".equals(filePath) || "..".equals(filePath) || filePath.startsWith("../")
                || filePath.contains("/../") || filePath.endsWith("/..")) {
            throw new ValidationException("file_path", "must not escape the repository root, got: " + filePath);
        }
    }

    public int lineCount() {
        return endLine - startLine + 1;
    }
}
