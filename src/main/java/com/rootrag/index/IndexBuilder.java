package com.rootrag.index;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rootrag.core.ManifestStore;
import com.rootrag.corpus.CorpusManifest;
import com.rootrag.index.IndexBuildResult.BuildStage;
import com.rootrag.index.IndexBuildResult.FailureReason;
import com.rootrag.parser.Chunker;
import com.rootrag.parser.ChunkingResult;
import com.rootrag.parser.CorpusChunker;
import com.rootrag.parser.FileDiscovery;
import com.rootrag.runtime.AppConfig;

/**
 * Runs a full build for one corpus version: capability check, chunking, {@code chunks.jsonl},
 * Lucene index and {@code index_manifest.json}. Each step either advances the build stage or
 * ends the build with a {@link FailureReason}; nothing is retried.
 */
public class IndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(IndexBuilder.class);

    public static final String INDEX_MANIFEST_FILE = "index_manifest.json";
    public static final String FTS_DIR = "fts";

    private final CorpusChunker corpusChunker;
    private final ChunkStore chunkStore;
    private final FtsAvailabilityProbe availabilityProbe;
    private final LexicalIndexWriter indexWriter;
    private final ManifestStore manifestStore;
    private final Clock clock;
    private final Path chunksDir;
    private final String toolVersion;

    public IndexBuilder(AppConfig config) {
        this(
                new CorpusChunker(
                        new FileDiscovery(config.getDiscovery()),
                        new Chunker(config.getChunking().getWindowLines(), config.getChunking().getOverlapLines())),
                new ChunkStore(),
                new FtsAvailabilityProbe(),
                new LexicalIndexWriter(),
                new ManifestStore(),
                Clock.systemUTC(),
                Path.of(config.getOutput().getChunksDir()),
                config.getToolVersion());
    }

    IndexBuilder(
            CorpusChunker corpusChunker,
            ChunkStore chunkStore,
            FtsAvailabilityProbe availabilityProbe,
            LexicalIndexWriter indexWriter,
            ManifestStore manifestStore,
            Clock clock,
            Path chunksDir,
            String toolVersion) {
        this.corpusChunker = corpusChunker;
        this.chunkStore = chunkStore;
        this.availabilityProbe = availabilityProbe;
        this.indexWriter = indexWriter;
        this.manifestStore = manifestStore;
        this.clock = clock;
        this.chunksDir = chunksDir;
        this.toolVersion = toolVersion;
    }

    public IndexBuildResult build(CorpusManifest corpus, Path outputDir) {
        Build build = new Build();

        FtsAvailabilityProbe.CapabilityReport capability = availabilityProbe.check();
        if (!capability.available()) {
            return build.fail(FailureReason.FTS_UNAVAILABLE, capability.reason());
        }
        build.stage = BuildStage.AVAILABLE_CHECKED;

        ChunkingResult chunking;
        try {
            chunking = corpusChunker.chunkCorpus(corpus, Path.of(corpus.localPath()));
        } catch (IOException | IllegalArgumentException e) {
            return build.fail(FailureReason.NO_CHUNKS, "corpus discovery failed: " + e.getMessage());
        }
        build.chunking = chunking;
        if (chunking.isEmpty()) {
            return build.fail(FailureReason.NO_CHUNKS,
                    "no chunks produced from " + chunking.filesDiscovered() + " discovered files");
        }
        List<Chunk> chunks = chunking.chunks();

        Instant createdAt = clock.instant();
        String corpusId = IndexManifest.computeCorpusId(corpus.rootRef(), corpus.resolvedCommit());
        String indexId = IndexManifest.computeIndexId(corpusId, createdAt);

        build.chunksPath = chunksDir
                .resolve(directoryName(corpus.rootRef()) + "__" + corpus.shortCommit())
                .resolve(ChunkStore.CHUNKS_FILE);
        try {
            chunkStore.write(build.chunksPath, chunks);
        } catch (IOException e) {
            log.error("Failed to write chunks to {}", build.chunksPath, e);
            return build.fail(FailureReason.CHUNKS_WRITE_FAILED, e.getMessage());
        }
        build.stage = BuildStage.CHUNKS_WRITTEN;

        build.indexDir = outputDir.resolve(directoryName(indexId));
        Path ftsPath = build.indexDir.resolve(FTS_DIR);
        FtsBuildResult fts = indexWriter.buildIndex(ftsPath, chunks, createdAt);
        build.fts = fts;
        if (!fts.schemaCreated()) {
            return build.fail(FailureReason.SCHEMA_FAILED, fts.error());
        }
        build.stage = BuildStage.SCHEMA_CREATED;
        if (fts.status() == FtsBuildResult.Status.FAILED) {
            return build.fail(FailureReason.INSERT_FAILED, fts.error());
        }
        if (fts.status() == FtsBuildResult.Status.PARTIAL) {
            return build.fail(FailureReason.INSERT_PARTIAL, fts.error());
        }
        build.stage = BuildStage.CHUNKS_INSERTED;

        IndexManifest manifest = IndexManifest.create(
                corpus.rootRef(),
                corpus.resolvedCommit(),
                corpus.repoUrl(),
                build.chunksPath.toAbsolutePath().normalize().toString(),
                ftsPath.toAbsolutePath().normalize().toString(),
                fts.chunkCount(),
                chunking.fileCount(),
                fts.createdAt(),
                toolVersion);
        Path manifestPath = build.indexDir.resolve(INDEX_MANIFEST_FILE);
        try {
            manifestStore.save(manifestPath, manifest);
        } catch (IOException e) {
            log.error("Failed to write index manifest {}", manifestPath, e);
            return build.fail(FailureReason.MANIFEST_WRITE_FAILED, e.getMessage());
        }
        build.stage = BuildStage.MANIFEST_PERSISTED;

        log.info("Index built index_id={} chunks={} files={} path={}",
                indexId, manifest.chunkCount(), manifest.fileCount(), build.indexDir);
        return new IndexBuildResult(true, null, "index built", build.stage, manifest,
                manifest.chunkCount(), manifest.fileCount(), chunking.failures(), build.chunksPath, build.indexDir, fts);
    }

    // Refs such as feature/x stay a single directory level.
    static String directoryName(String value) {
        return value.replace('/', '_').replace('\\', '_');
    }

    private static final class Build {
        private BuildStage stage = BuildStage.NOT_STARTED;
        private ChunkingResult chunking;
        private Path chunksPath;
        private Path indexDir;
        private FtsBuildResult fts;

        private IndexBuildResult fail(FailureReason reason, String message) {
            log.error("Index build failed reason={} stage={} message={}", reason.code(), stage, message);
            int chunkCount = chunking == null ? 0 : chunking.chunks().size();
            int fileCount = chunking == null ? 0 : chunking.fileCount();
            List<ChunkingResult.FileFailure> failures = chunking == null ? List.of() : chunking.failures();
            return new IndexBuildResult(false, reason, message, stage, null, chunkCount, fileCount, failures,
                    chunksPath, indexDir, fts);
        }
    }
}
