package com.rootrag.index;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rootrag.core.ManifestStore;

/**
 * JSONL persistence for chunks: one JSON object per line, UTF-8, overwritten on every write.
 */
public class ChunkStore {
    private static final Logger log = LoggerFactory.getLogger(ChunkStore.class);

    public static final String CHUNKS_FILE = "chunks.jsonl";

    private final ObjectMapper mapper;

    public ChunkStore() {
        this(ManifestStore.newMapper());
    }

    ChunkStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Path write(Path path, List<Chunk> chunks) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            for (Chunk chunk : chunks) {
                writer.write(mapper.writeValueAsString(chunk));
                writer.write('\n');
            }
        }
        log.info("Wrote {} chunks to {}", chunks.size(), path);
        return path;
    }

    public List<Chunk> readAll(Path path) throws IOException {
        List<Chunk> chunks = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    chunks.add(mapper.readValue(line, Chunk.class));
                } catch (IOException e) {
                    throw new IOException("Invalid chunk at " + path + ":" + lineNumber + ": " + e.getMessage(), e);
                }
            }
        }
        return chunks;
    }
}
