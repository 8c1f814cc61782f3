package com.rootrag.index;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rootrag.core.ValidationException;
import com.rootrag.corpus.CorpusManifest;

public record IndexManifest(
        @JsonProperty("index_id") String indexId,
        @JsonProperty("corpus_id") String corpusId,
        @JsonProperty("root_ref") String rootRef,
        @JsonProperty("resolved_commit") String resolvedCommit,
        @JsonProperty("corpus_url") String corpusUrl,
        @JsonProperty("chunks_path") String chunksPath,
        @JsonProperty("fts_db_path") String ftsDbPath,
        @JsonProperty("schema_version") String schemaVersion,
        @JsonProperty("index_schema_version") String indexSchemaVersion,
        @JsonProperty("chunk_count") int chunkCount,
        @JsonProperty("file_count") int fileCount,
        @JsonProperty("retrieval_modes") List<String> retrievalModes,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("tool_version") String toolVersion) {

    public static final String SCHEMA_VERSION = "1.0.0";
    public static final String LEXICAL = "lexical";

    public IndexManifest {
        ValidationException.requireNonBlank("root_ref", rootRef);
        CorpusManifest.validateCommit(resolvedCommit);
        ValidationException.requireNonBlank("corpus_url", corpusUrl);
        ValidationException.requireNonBlank("chunks_path", chunksPath);
        ValidationException.requireNonBlank("fts_db_path", ftsDbPath);
        ValidationException.requireNonBlank("tool_version", toolVersion);
        if (createdAt == null) {
            throw new ValidationException("created_at", "must not be null");
        }
        if (chunkCount < 0) {
            throw new ValidationException("chunk_count", "must be >= 0, got " + chunkCount);
        }
        if (fileCount < 0) {
            throw new ValidationException("file_count", "must be >= 0, got " + fileCount);
        }
        if (schemaVersion == null || schemaVersion.isBlank()) {
            schemaVersion = SCHEMA_VERSION;
        }
        if (indexSchemaVersion == null || indexSchemaVersion.isBlank()) {
            indexSchemaVersion = Chunk.INDEX_SCHEMA_VERSION;
        }
        if (retrievalModes == null || retrievalModes.isEmpty()) {
            retrievalModes = List.of(LEXICAL);
        } else if (!retrievalModes.equals(List.of(LEXICAL))) {
            throw new ValidationException("retrieval_modes", "only [lexical] is supported, got " + retrievalModes);
        } else {
            retrievalModes = List.copyOf(retrievalModes);
        }

        String expectedCorpusId = computeCorpusId(rootRef, resolvedCommit);
        if (!expectedCorpusId.equals(corpusId)) {
            throw new ValidationException("corpus_id", "expected '" + expectedCorpusId + "', got '" + corpusId + "'");
        }
        String expectedIndexId = computeIndexId(expectedCorpusId, createdAt);
        if (!expectedIndexId.equals(indexId)) {
            throw new ValidationException("index_id", "expected '" + expectedIndexId + "', got '" + indexId + "'");
        }
    }

    public static IndexManifest create(
            String rootRef,
            String resolvedCommit,
            String corpusUrl,
            String chunksPath,
            String ftsDbPath,
            int chunkCount,
            int fileCount,
            Instant createdAt,
            String toolVersion) {
        String corpusId = computeCorpusId(rootRef, resolvedCommit);
        return new IndexManifest(
                computeIndexId(corpusId, createdAt),
                corpusId,
                rootRef,
                resolvedCommit,
                corpusUrl,
                chunksPath,
                ftsDbPath,
                SCHEMA_VERSION,
                Chunk.INDEX_SCHEMA_VERSION,
                chunkCount,
                fileCount,
                List.of(LEXICAL),
                createdAt,
                toolVersion);
    }

    public static String computeCorpusId(String rootRef, String resolvedCommit) {
        return rootRef + "__" + resolvedCommit.substring(0, Math.min(12, resolvedCommit.length()));
    }

    public static String computeIndexId(String corpusId, Instant createdAt) {
        return corpusId + "__" + compactTimestamp(createdAt);
    }

    // 2026-02-27T23:59:00.123456Z -> 20260227T235900123456Z
    static String compactTimestamp(Instant instant) {
        return instant.toString().replace("-", "").replace(":", "").replace(".", "");
    }
}
