package com.rootrag.index;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.queryparser.classic.MultiFieldQueryParser;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;

public class LexicalSearcher implements Closeable {
    private final Directory directory;
    private final DirectoryReader reader;
    private final IndexSearcher searcher;
    private final Analyzer analyzer;

    public LexicalSearcher(Path indexPath) throws IOException {
        this.directory = FSDirectory.open(indexPath);
        try {
            this.reader = DirectoryReader.open(directory);
        } catch (IOException | RuntimeException e) {
            directory.close();
            throw e;
        }
        this.searcher = new IndexSearcher(reader);
        this.analyzer = LexicalIndexWriter.newAnalyzer();
    }

    public List<LexicalHit> search(String queryText, int limit) throws IOException {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }
        Query query;
        try {
            query = new MultiFieldQueryParser(LexicalIndexWriter.SEARCHABLE_FIELDS, analyzer).parse(queryText);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Malformed query: " + queryText, e);
        }
        TopDocs topDocs = searcher.search(query, limit);
        StoredFields storedFields = searcher.storedFields();
        List<LexicalHit> hits = new ArrayList<>();
        for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
            hits.add(toHit(storedFields.document(scoreDoc.doc), scoreDoc.score));
        }
        return hits;
    }

    /** All documents in index order, scored zero. */
    public List<LexicalHit> documents() throws IOException {
        StoredFields storedFields = reader.storedFields();
        List<LexicalHit> hits = new ArrayList<>();
        for (int doc = 0; doc < reader.maxDoc(); doc++) {
            hits.add(toHit(storedFields.document(doc), 0f));
        }
        return hits;
    }

    public int documentCount() {
        return reader.numDocs();
    }

    private static LexicalHit toHit(Document document, float score) {
        String symbolPath = document.get(LexicalIndexWriter.FIELD_SYMBOL_PATH);
        return new LexicalHit(
                document.get(LexicalIndexWriter.FIELD_CHUNK_ID),
                document.get(LexicalIndexWriter.FIELD_FILE_PATH),
                intField(document, LexicalIndexWriter.FIELD_START_LINE),
                intField(document, LexicalIndexWriter.FIELD_END_LINE),
                document.get(LexicalIndexWriter.FIELD_CONTENT),
                symbolPath == null || symbolPath.isEmpty() ? null : symbolPath,
                document.get(LexicalIndexWriter.FIELD_DOC_ORIGIN),
                document.get(LexicalIndexWriter.FIELD_ROOT_REF),
                document.get(LexicalIndexWriter.FIELD_RESOLVED_COMMIT),
                document.get(LexicalIndexWriter.FIELD_LANGUAGE),
                document.get(LexicalIndexWriter.FIELD_INDEX_SCHEMA_VERSION),
                score);
    }

    private static int intField(Document document, String name) {
        IndexableField field = document.getField(name);
        return field == null ? 0 : field.numericValue().intValue();
    }

    @Override
    public void close() throws IOException {
        try {
            reader.close();
        } finally {
            try {
                analyzer.close();
            } finally {
                directory.close();
            }
        }
    }
}
