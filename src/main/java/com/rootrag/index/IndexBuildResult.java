package com.rootrag.index;

import java.nio.file.Path;
import java.util.List;

import com.rootrag.parser.ChunkingResult;

public record IndexBuildResult(
        boolean success,
        FailureReason reason,
        String message,
        BuildStage stage,
        IndexManifest manifest,
        int chunkCount,
        int fileCount,
        List<ChunkingResult.FileFailure> fileFailures,
        Path chunksPath,
        Path indexDir,
        FtsBuildResult ftsBuild) {

    public IndexBuildResult {
        fileFailures = fileFailures == null ? List.of() : List.copyOf(fileFailures);
    }

    public enum BuildStage {
        NOT_STARTED,
        AVAILABLE_CHECKED,
        CHUNKS_WRITTEN,
        SCHEMA_CREATED,
        CHUNKS_INSERTED,
        MANIFEST_PERSISTED
    }

    public enum FailureReason {
        FTS_UNAVAILABLE("fts_unavailable"),
        NO_CHUNKS("no_chunks"),
        CHUNKS_WRITE_FAILED("chunks_write_failed"),
        SCHEMA_FAILED("schema_failed"),
        INSERT_PARTIAL("insert_partial"),
        INSERT_FAILED("insert_failed"),
        MANIFEST_WRITE_FAILED("manifest_write_failed");

        private final String code;

        FailureReason(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    public String reasonCode() {
        return reason == null ? null : reason.code();
    }
}
