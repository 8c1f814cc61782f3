package com.rootrag.index;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one Lucene build. {@code schemaCreated} separates a build that never got an
 * empty index on disk from one that failed while inserting.
 */
public record FtsBuildResult(
        Path indexPath,
        int chunkCount,
        int errorCount,
        Instant createdAt,
        Status status,
        boolean schemaCreated,
        List<String> failedChunkIds,
        String error) {

    public enum Status {
        SUCCESS,
        PARTIAL,
        FAILED
    }

    public FtsBuildResult {
        failedChunkIds = failedChunkIds == null ? List.of() : List.copyOf(failedChunkIds);
    }

    static FtsBuildResult schemaFailed(Path indexPath, Instant createdAt, String error) {
        return new FtsBuildResult(indexPath, 0, 0, createdAt, Status.FAILED, false, List.of(), error);
    }

    static FtsBuildResult insertFailed(Path indexPath, int chunkCount, Instant createdAt, String error) {
        return new FtsBuildResult(indexPath, 0, chunkCount, createdAt, Status.FAILED, true, List.of(), error);
    }

    static FtsBuildResult fromStats(Path indexPath, LexicalIndexWriter.InsertStats stats, Instant createdAt) {
        Status status;
        if (stats.errors() == 0) {
            status = Status.SUCCESS;
        } else if (stats.inserted() == 0) {
            status = Status.FAILED;
        } else {
            status = Status.PARTIAL;
        }
        String error = stats.errors() == 0 ? null : stats.errors() + " chunks failed to index: " + stats.failedChunkIds();
        return new FtsBuildResult(indexPath, stats.inserted(), stats.errors(), createdAt, status, true,
                stats.failedChunkIds(), error);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
