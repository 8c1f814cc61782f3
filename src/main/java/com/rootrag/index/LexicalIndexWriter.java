package com.rootrag.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.LogDocMergePolicy;
import org.apache.lucene.index.SerialMergeScheduler;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes chunks into a Lucene index, one document per chunk.
 *
 * <p>Documents are added in {@link #INSERTION_ORDER} through a serial merge scheduler and an
 * order-preserving merge policy, then merged to one segment, so document ids follow that order
 * and two builds over the same chunks rank ties identically.
 */
public class LexicalIndexWriter {
    private static final Logger log = LoggerFactory.getLogger(LexicalIndexWriter.class);

    public static final String FIELD_CONTENT = "content";
    public static final String FIELD_FILE_PATH = "file_path";
    public static final String FIELD_SYMBOL_PATH = "symbol_path";
    public static final String FIELD_DOC_ORIGIN = "doc_origin";
    public static final String FIELD_CHUNK_ID = "chunk_id";
    public static final String FIELD_START_LINE = "start_line";
    public static final String FIELD_END_LINE = "end_line";
    public static final String FIELD_ROOT_REF = "root_ref";
    public static final String FIELD_RESOLVED_COMMIT = "resolved_commit";
    public static final String FIELD_LANGUAGE = "language";
    public static final String FIELD_INDEX_SCHEMA_VERSION = "index_schema_version";

    public static final String[] SEARCHABLE_FIELDS = {
            FIELD_CONTENT, FIELD_FILE_PATH, FIELD_SYMBOL_PATH, FIELD_DOC_ORIGIN
    };

    public static final Comparator<Chunk> INSERTION_ORDER = Comparator
            .comparing(Chunk::filePath)
            .thenComparingInt(Chunk::startLine)
            .thenComparingInt(Chunk::endLine)
            .thenComparing(Chunk::chunkId);

    public static Analyzer newAnalyzer() {
        return new StandardAnalyzer();
    }

    public void createIndex(Path indexPath) throws IOException {
        Files.createDirectories(indexPath);
        try (Directory directory = FSDirectory.open(indexPath);
             Analyzer analyzer = newAnalyzer();
             IndexWriter writer = new IndexWriter(directory, writerConfig(analyzer, IndexWriterConfig.OpenMode.CREATE))) {
            writer.commit();
        }
        log.debug("Created empty index at {}", indexPath);
    }

    public InsertStats insertChunks(Path indexPath, List<Chunk> chunks) throws IOException {
        List<Chunk> ordered = new ArrayList<>(chunks);
        ordered.sort(INSERTION_ORDER);

        int inserted = 0;
        List<String> failedChunkIds = new ArrayList<>();
        try (Directory directory = FSDirectory.open(indexPath);
             Analyzer analyzer = newAnalyzer();
             IndexWriter writer = new IndexWriter(directory, writerConfig(analyzer, IndexWriterConfig.OpenMode.APPEND))) {
            for (Chunk chunk : ordered) {
                try {
                    writer.addDocument(toDocument(chunk));
                    inserted++;
                } catch (RuntimeException e) {
                    log.error("Failed to index chunk {} ({}:{}-{}): {}",
                            chunk.chunkId(), chunk.filePath(), chunk.startLine(), chunk.endLine(), e.getMessage());
                    failedChunkIds.add(chunk.chunkId());
                }
            }
            writer.forceMerge(1);
            writer.commit();
        }
        log.info("Indexed {} chunks into {} errors={}", inserted, indexPath, failedChunkIds.size());
        return new InsertStats(inserted, failedChunkIds.size(), failedChunkIds);
    }

    public FtsBuildResult buildIndex(Path indexPath, List<Chunk> chunks, Instant createdAt) {
        try {
            createIndex(indexPath);
        } catch (IOException e) {
            log.error("Failed to create index at {}", indexPath, e);
            return FtsBuildResult.schemaFailed(indexPath, createdAt, e.getMessage());
        }
        try {
            return FtsBuildResult.fromStats(indexPath, insertChunks(indexPath, chunks), createdAt);
        } catch (IOException e) {
            log.error("Failed to insert chunks into {}", indexPath, e);
            return FtsBuildResult.insertFailed(indexPath, chunks.size(), createdAt, e.getMessage());
        }
    }

    Document toDocument(Chunk chunk) {
        Document document = new Document();
        document.add(new TextField(FIELD_CONTENT, chunk.content(), Field.Store.YES));
        document.add(new TextField(FIELD_FILE_PATH, chunk.filePath(), Field.Store.YES));
        document.add(new TextField(FIELD_SYMBOL_PATH, chunk.symbolPath() == null ? "" : chunk.symbolPath(), Field.Store.YES));
        document.add(new TextField(FIELD_DOC_ORIGIN, chunk.docOrigin().value(), Field.Store.YES));
        document.add(new StoredField(FIELD_CHUNK_ID, chunk.chunkId()));
        document.add(new StoredField(FIELD_START_LINE, chunk.startLine()));
        document.add(new StoredField(FIELD_END_LINE, chunk.endLine()));
        document.add(new StoredField(FIELD_ROOT_REF, chunk.rootRef()));
        document.add(new StoredField(FIELD_RESOLVED_COMMIT, chunk.resolvedCommit()));
        document.add(new StoredField(FIELD_LANGUAGE, chunk.language()));
        document.add(new StoredField(FIELD_INDEX_SCHEMA_VERSION, chunk.indexSchemaVersion()));
        return document;
    }

    private static IndexWriterConfig writerConfig(Analyzer analyzer, IndexWriterConfig.OpenMode openMode) {
        return new IndexWriterConfig(analyzer)
                .setOpenMode(openMode)
                .setMergeScheduler(new SerialMergeScheduler())
                .setMergePolicy(new LogDocMergePolicy());
    }

    public record InsertStats(int inserted, int errors, List<String> failedChunkIds) {
        public InsertStats {
            failedChunkIds = List.copyOf(failedChunkIds);
        }
    }
}
