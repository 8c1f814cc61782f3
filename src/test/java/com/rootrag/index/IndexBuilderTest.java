package com.rootrag.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.apache.lucene.document.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.rootrag.core.ManifestStore;
import com.rootrag.corpus.CorpusManifest;
import com.rootrag.index.IndexBuildResult.BuildStage;
import com.rootrag.index.IndexBuildResult.FailureReason;
import com.rootrag.parser.Chunker;
import com.rootrag.parser.CorpusChunker;
import com.rootrag.parser.FileDiscovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndexBuilderTest {
    private static final Instant CREATED_AT = Instant.parse("2026-02-27T23:59:00.123456Z");
    private static final String INDEX_ID = "v6-32-00__0123456789ab__20260227T235900123456Z";

    @TempDir
    Path tempDir;

    @Test
    void shouldBuildChunksIndexAndManifest() throws Exception {
        Path repo = corpus();
        IndexBuilder builder = builder(new FtsAvailabilityProbe(), new LexicalIndexWriter(), new ManifestStore());

        IndexBuildResult result = builder.build(manifest(repo, "v6-32-00"), tempDir.resolve("indexes"));

        assertTrue(result.success(), result.message());
        assertNull(result.reason());
        assertEquals(BuildStage.MANIFEST_PERSISTED, result.stage());
        assertEquals(3, result.chunkCount());
        assertEquals(2, result.fileCount());

        Path indexDir = tempDir.resolve("indexes").resolve(INDEX_ID);
        assertEquals(indexDir, result.indexDir());
        Path chunksPath = tempDir.resolve("chunks/v6-32-00__0123456789ab/chunks.jsonl");
        assertEquals(chunksPath, result.chunksPath());
        assertEquals(3, new ChunkStore().readAll(chunksPath).size());

        IndexManifest stored = new ManifestStore().load(indexDir.resolve("index_manifest.json"), IndexManifest.class);
        assertEquals(result.manifest(), stored);
        assertEquals(INDEX_ID, stored.indexId());
        assertEquals("https://github.com/root-project/root.git", stored.corpusUrl());
        assertEquals(3, stored.chunkCount());
        assertEquals(2, stored.fileCount());
        assertEquals(indexDir.resolve("fts").toAbsolutePath().normalize().toString(), stored.ftsDbPath());
        assertEquals(FtsBuildResult.Status.SUCCESS, result.ftsBuild().status());
        assertEquals(3, result.ftsBuild().chunkCount());
        assertEquals(CREATED_AT, result.ftsBuild().createdAt());
        try (LexicalSearcher searcher = new LexicalSearcher(indexDir.resolve("fts"))) {
            assertEquals(3, searcher.documentCount());
            assertFalse(searcher.search("TObject", 10).isEmpty());
        }
    }

    @Test
    void shouldKeepSlashedRefsInOneDirectoryLevel() throws Exception {
        Path repo = corpus();
        IndexBuilder builder = builder(new FtsAvailabilityProbe(), new LexicalIndexWriter(), new ManifestStore());

        IndexBuildResult result = builder.build(manifest(repo, "feature/x"), tempDir.resolve("indexes"));

        assertTrue(result.success(), result.message());
        assertEquals("feature/x__0123456789ab__20260227T235900123456Z", result.manifest().indexId());
        assertEquals(tempDir.resolve("indexes/feature_x__0123456789ab__20260227T235900123456Z"), result.indexDir());
        assertTrue(Files.isRegularFile(tempDir.resolve("chunks/feature_x__0123456789ab/chunks.jsonl")));
    }

    @Test
    void shouldFailWithNoChunksForCorpusWithoutSources() throws Exception {
        Path repo = tempDir.resolve("repo");
        Files.createDirectories(repo);
        Files.writeString(repo.resolve("README.md"), "# ROOT\n");
        IndexBuilder builder = builder(new FtsAvailabilityProbe(), new LexicalIndexWriter(), new ManifestStore());

        IndexBuildResult result = builder.build(manifest(repo, "v6-32-00"), tempDir.resolve("indexes"));

        assertFalse(result.success());
        assertEquals(FailureReason.NO_CHUNKS, result.reason());
        assertEquals("no_chunks", result.reasonCode());
        assertEquals(BuildStage.AVAILABLE_CHECKED, result.stage());
        assertFalse(Files.exists(tempDir.resolve("indexes")));
    }

    @Test
    void shouldFailFastWhenFullTextBackendIsUnavailable() throws Exception {
        Path repo = corpus();
        FtsAvailabilityProbe missing = new FtsAvailabilityProbe() {
            @Override
            public CapabilityReport check() {
                return CapabilityReport.unavailable("lucene-core not on classpath");
            }
        };

        IndexBuildResult result = builder(missing, new LexicalIndexWriter(), new ManifestStore())
                .build(manifest(repo, "v6-32-00"), tempDir.resolve("indexes"));

        assertEquals(FailureReason.FTS_UNAVAILABLE, result.reason());
        assertEquals(BuildStage.NOT_STARTED, result.stage());
        assertFalse(Files.exists(tempDir.resolve("chunks")));
    }

    @Test
    void shouldReportSchemaFailure() throws Exception {
        Path repo = corpus();
        LexicalIndexWriter writer = new LexicalIndexWriter() {
            @Override
            public void createIndex(Path indexPath) throws IOException {
                throw new IOException("disk full");
            }
        };

        IndexBuildResult result = builder(new FtsAvailabilityProbe(), writer, new ManifestStore())
                .build(manifest(repo, "v6-32-00"), tempDir.resolve("indexes"));

        assertEquals(FailureReason.SCHEMA_FAILED, result.reason());
        assertEquals(BuildStage.CHUNKS_WRITTEN, result.stage());
        assertEquals(3, result.chunkCount());
        assertFalse(result.ftsBuild().schemaCreated());
        assertTrue(result.message().contains("disk full"));
    }

    @Test
    void shouldReportPartialInsert() throws Exception {
        Path repo = corpus();
        LexicalIndexWriter writer = new LexicalIndexWriter() {
            @Override
            Document toDocument(Chunk chunk) {
                if (chunk.filePath().endsWith(".cxx")) {
                    throw new IllegalStateException("row rejected");
                }
                return super.toDocument(chunk);
            }
        };

        IndexBuildResult result = builder(new FtsAvailabilityProbe(), writer, new ManifestStore())
                .build(manifest(repo, "v6-32-00"), tempDir.resolve("indexes"));

        assertEquals(FailureReason.INSERT_PARTIAL, result.reason());
        assertEquals(BuildStage.SCHEMA_CREATED, result.stage());
        assertNull(result.manifest());
        assertEquals(FtsBuildResult.Status.PARTIAL, result.ftsBuild().status());
        assertEquals(result.ftsBuild().errorCount(), result.ftsBuild().failedChunkIds().size());
    }

    @Test
    void shouldReportInsertFailureWhenEveryRowIsRejected() throws Exception {
        Path repo = corpus();
        LexicalIndexWriter writer = new LexicalIndexWriter() {
            @Override
            Document toDocument(Chunk chunk) {
                throw new IllegalStateException("row rejected");
            }
        };

        IndexBuildResult result = builder(new FtsAvailabilityProbe(), writer, new ManifestStore())
                .build(manifest(repo, "v6-32-00"), tempDir.resolve("indexes"));

        assertEquals(FailureReason.INSERT_FAILED, result.reason());
        assertEquals(BuildStage.SCHEMA_CREATED, result.stage());
        assertEquals(FtsBuildResult.Status.FAILED, result.ftsBuild().status());
        assertEquals(3, result.ftsBuild().errorCount());
        assertFalse(Files.exists(tempDir.resolve("indexes").resolve(INDEX_ID).resolve("index_manifest.json")));
    }

    @Test
    void shouldReportManifestWriteFailure() throws Exception {
        Path repo = corpus();
        ManifestStore failingStore = new ManifestStore() {
            @Override
            public void save(Path path, Object manifest) throws IOException {
                throw new IOException("read-only file system");
            }
        };

        IndexBuildResult result = builder(new FtsAvailabilityProbe(), new LexicalIndexWriter(), failingStore)
                .build(manifest(repo, "v6-32-00"), tempDir.resolve("indexes"));

        assertEquals(FailureReason.MANIFEST_WRITE_FAILED, result.reason());
        assertEquals(BuildStage.CHUNKS_INSERTED, result.stage());
    }

    @Test
    void shouldProduceIdenticalIndexesForIdenticalCorpus() throws Exception {
        Path repo = corpus();
        IndexBuilder builder = builder(new FtsAvailabilityProbe(), new LexicalIndexWriter(), new ManifestStore());

        IndexBuildResult first = builder.build(manifest(repo, "v6-32-00"), tempDir.resolve("first"));
        IndexBuildResult second = builder.build(manifest(repo, "v6-32-00"), tempDir.resolve("second"));

        try (LexicalSearcher a = new LexicalSearcher(first.indexDir().resolve("fts"));
             LexicalSearcher b = new LexicalSearcher(second.indexDir().resolve("fts"))) {
            assertEquals(a.documents(), b.documents());
            assertEquals(
                    a.search("TObject", 10).stream().map(LexicalHit::chunkId).toList(),
                    b.search("TObject", 10).stream().map(LexicalHit::chunkId).toList());
        }
    }

    private IndexBuilder builder(FtsAvailabilityProbe probe, LexicalIndexWriter writer, ManifestStore manifestStore) {
        return new IndexBuilder(
                new CorpusChunker(new FileDiscovery(), new Chunker(10, 2)),
                new ChunkStore(),
                probe,
                writer,
                manifestStore,
                Clock.fixed(CREATED_AT, ZoneOffset.UTC),
                tempDir.resolve("chunks"),
                "0.1.0");
    }

    private Path corpus() throws IOException {
        Path repo = tempDir.resolve("repo");
        Files.createDirectories(repo.resolve("core/base/inc"));
        Files.createDirectories(repo.resolve("core/base/src"));
        Files.writeString(repo.resolve("core/base/inc/TObject.h"),
                "/** Mother of all ROOT objects. */\nclass TObject {\npublic:\n   TObject();\n};\n");
        StringBuilder impl = new StringBuilder("#include \"TObject.h\"\n");
        for (int i = 2; i <= 12; i++) {
            impl.append("// TObject implementation line ").append(i).append('\n');
        }
        Files.writeString(repo.resolve("core/base/src/TObject.cxx"), impl.toString());
        return repo;
    }

    private static CorpusManifest manifest(Path repo, String rootRef) {
        return CorpusManifest.create("https://github.com/root-project/root.git", rootRef,
                "0123456789abcdef0123456789abcdef01234567", repo.toString(), Instant.parse("2026-02-20T10:00:00Z"),
                false, "0.1.0");
    }
}
