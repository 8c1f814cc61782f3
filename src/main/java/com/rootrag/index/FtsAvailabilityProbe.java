package com.rootrag.index;

import java.io.IOException;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that the full-text backend can index and query a document before a build writes anything.
 */
public class FtsAvailabilityProbe {
    private static final Logger log = LoggerFactory.getLogger(FtsAvailabilityProbe.class);

    private static final String PROBE_FIELD = "content";
    private static final String PROBE_TERM = "probe";

    public CapabilityReport check() {
        try (Directory directory = new ByteBuffersDirectory();
             Analyzer analyzer = LexicalIndexWriter.newAnalyzer()) {
            try (IndexWriter writer = new IndexWriter(directory, new IndexWriterConfig(analyzer))) {
                Document document = new Document();
                document.add(new TextField(PROBE_FIELD, "TH1F probe document", Field.Store.NO));
                writer.addDocument(document);
                writer.commit();
            }
            try (DirectoryReader reader = DirectoryReader.open(directory)) {
                long hits = new IndexSearcher(reader).count(new TermQuery(new Term(PROBE_FIELD, PROBE_TERM)));
                if (hits != 1) {
                    return CapabilityReport.unavailable("probe query returned " + hits + " hits");
                }
            }
            return CapabilityReport.ok();
        } catch (IOException | RuntimeException | LinkageError e) {
            log.warn("Full-text backend unavailable: {}", e.toString());
            return CapabilityReport.unavailable(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public record CapabilityReport(boolean available, String reason) {
        public static CapabilityReport ok() {
            return new CapabilityReport(true, "lucene available");
        }

        public static CapabilityReport unavailable(String reason) {
            return new CapabilityReport(false, reason);
        }
    }
}
