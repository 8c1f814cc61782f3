package com.rootrag.index;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LexicalSearcherTest {

    @TempDir
    Path tempDir;

    private List<Chunk> chunks;

    @BeforeEach
    void setUp() {
        chunks = List.of(
                TestChunks.chunk("hist/inc/TH1.h", 1, 4, "class TH1 : public TNamed {\n  virtual Int_t Fill(Double_t x);\n};"),
                TestChunks.chunk("hist/src/TH1.cxx", 1, 3, "Int_t TH1::Fill(Double_t x)\n{\n  return Fill(x, 1.);"),
                TestChunks.chunk("tree/inc/TTree.h", 1, 2, "class TTree : public TNamed {\n  virtual Int_t Draw();"),
                TestChunks.chunk("io/src/TFile.cxx", 1, 2, "TFile *TFile::Open(const char *name)\n{ return nullptr; }"));
    }

    @Test
    void shouldFindChunksByContent() throws Exception {
        Path indexPath = build("fts", chunks);

        try (LexicalSearcher searcher = new LexicalSearcher(indexPath)) {
            List<LexicalHit> hits = searcher.search("Fill", 10);

            assertEquals(2, hits.size());
            assertTrue(hits.stream().allMatch(hit -> hit.filePath().startsWith("hist/")));
            assertTrue(hits.get(0).score() > 0f);
        }
    }

    @Test
    void shouldSearchFilePathAndDocOrigin() throws Exception {
        Path indexPath = build("fts", chunks);

        try (LexicalSearcher searcher = new LexicalSearcher(indexPath)) {
            assertEquals("io/src/TFile.cxx", searcher.search("file_path:tfile.cxx", 10).get(0).filePath());
            assertEquals(2, searcher.search("doc_origin:source_header", 10).size());
        }
    }

    @Test
    void shouldReturnIdenticalOrderingForIdenticalChunkSets() throws Exception {
        Path first = build("first", chunks);
        Path second = build("second", List.of(chunks.get(3), chunks.get(2), chunks.get(1), chunks.get(0)));

        try (LexicalSearcher a = new LexicalSearcher(first); LexicalSearcher b = new LexicalSearcher(second)) {
            assertEquals(ids(a.search("TNamed Fill", 10)), ids(b.search("TNamed Fill", 10)));
        }
    }

    @Test
    void shouldRejectMalformedQuery() throws Exception {
        Path indexPath = build("fts", chunks);

        try (LexicalSearcher searcher = new LexicalSearcher(indexPath)) {
            assertThrows(IllegalArgumentException.class, () -> searcher.search("Fill AND (", 10));
            assertThrows(IllegalArgumentException.class, () -> searcher.search("Fill", 0));
        }
    }

    private Path build(String name, List<Chunk> input) {
        Path indexPath = tempDir.resolve(name);
        FtsBuildResult result = new LexicalIndexWriter().buildIndex(indexPath, input, Instant.parse("2026-02-27T23:59:00Z"));
        assertEquals(FtsBuildResult.Status.SUCCESS, result.status());
        return indexPath;
    }

    private static List<String> ids(List<LexicalHit> hits) {
        return hits.stream().map(LexicalHit::chunkId).toList();
    }
}
