package com.rootrag.parser;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rootrag.index.Chunk;
import com.rootrag.index.DocOrigin;

/**
 * Cuts a single file into overlapping, line-aligned windows.
 */
public class Chunker {
    private static final Logger log = LoggerFactory.getLogger(Chunker.class);

    public static final int DEFAULT_WINDOW_LINES = 80;
    public static final int DEFAULT_OVERLAP_LINES = 10;

    private static final Pattern DOXYGEN = Pattern.compile("/\\*\\*|//!|///<");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    private final int windowLines;
    private final int overlapLines;

    public Chunker() {
        this(DEFAULT_WINDOW_LINES, DEFAULT_OVERLAP_LINES);
    }

    public Chunker(int windowLines, int overlapLines) {
        if (windowLines < 1) {
            throw new IllegalArgumentException("windowLines must be >= 1, got " + windowLines);
        }
        if (overlapLines < 0) {
            throw new IllegalArgumentException("overlapLines must be >= 0, got " + overlapLines);
        }
        this.windowLines = windowLines;
        this.overlapLines = overlapLines;
    }

    public int windowLines() {
        return windowLines;
    }

    public int overlapLines() {
        return overlapLines;
    }

    public List<Chunk> chunkFile(Path file, Path repoRoot, String rootRef, String resolvedCommit) throws IOException {
        List<String> lines = splitLines(readLossy(file));
        if (lines.isEmpty()) {
            return List.of();
        }

        String relativePath = relativePath(file, repoRoot);
        String language = SourceFileClassifier.language(file);
        DocOrigin docOrigin = SourceFileClassifier.docOrigin(file);

        int total = lines.size();
        int stride = Math.max(1, windowLines - overlapLines);
        List<Chunk> chunks = new ArrayList<>();
        int start = 0;
        while (true) {
            int end = start + Math.min(windowLines, total - start) - 1;
            String content = String.join("\n", lines.subList(start, end + 1));
            if (Chunk.isBlankContent(content)) {
                log.debug("Skipping blank window {}:{}-{}", relativePath, start + 1, end + 1);
            } else {
                chunks.add(Chunk.fromFileSlice(
                        relativePath,
                        start + 1,
                        end + 1,
                        content,
                        rootRef,
                        resolvedCommit,
                        language,
                        docOrigin,
                        null,
                        hasDoxygen(content)));
            }
            // The next window would start past the last line.
            if (stride >= total - start) {
                break;
            }
            start += stride;
        }
        return chunks;
    }

    static boolean hasDoxygen(String content) {
        return DOXYGEN.matcher(content).find();
    }

    static String readLossy(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new IOException("Unable to decode " + file, e);
        }
    }

    // A trailing terminator does not start another line.
    static List<String> splitLines(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>(Arrays.asList(LINE_BREAK.split(text, -1)));
        if (lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    static String relativePath(Path file, Path repoRoot) {
        Path normalizedFile = file.toAbsolutePath().normalize();
        Path normalizedRoot = repoRoot.toAbsolutePath().normalize();
        Path relative = normalizedFile.startsWith(normalizedRoot) ? normalizedRoot.relativize(normalizedFile) : file;
        return relative.toString().replace('\\', '/');
    }
}
