package com.rootrag.parser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rootrag.corpus.CorpusManifest;
import com.rootrag.index.Chunk;

public class CorpusChunker {
    private static final Logger log = LoggerFactory.getLogger(CorpusChunker.class);

    private final FileDiscovery fileDiscovery;
    private final Chunker chunker;

    public CorpusChunker(FileDiscovery fileDiscovery, Chunker chunker) {
        this.fileDiscovery = fileDiscovery;
        this.chunker = chunker;
    }

    public ChunkingResult chunkCorpus(CorpusManifest manifest, Path repoRoot) throws IOException {
        List<Path> files = fileDiscovery.discover(repoRoot);
        log.info("Chunking {} files from {} at {}", files.size(), manifest.rootRef(), manifest.shortCommit());

        List<Chunk> chunks = new ArrayList<>();
        List<ChunkingResult.FileFailure> failures = new ArrayList<>();
        for (Path file : files) {
            try {
                chunks.addAll(chunker.chunkFile(file, repoRoot, manifest.rootRef(), manifest.resolvedCommit()));
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping {}: {}", file, e.getMessage());
                failures.add(new ChunkingResult.FileFailure(file, e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }

        ChunkingResult result = new ChunkingResult(chunks, files.size(), failures);
        log.info("Chunked corpus chunks={} files={} failures={}", chunks.size(), result.fileCount(), failures.size());
        return result;
    }
}
