package com.rootrag.parser;

import java.nio.file.Path;
import java.util.List;

import com.rootrag.index.Chunk;

public record ChunkingResult(List<Chunk> chunks, int filesDiscovered, List<FileFailure> failures) {

    public ChunkingResult {
        chunks = List.copyOf(chunks);
        failures = List.copyOf(failures);
    }

    public int fileCount() {
        return (int) chunks.stream().map(Chunk::filePath).distinct().count();
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public record FileFailure(Path path, String reason) {
    }
}
