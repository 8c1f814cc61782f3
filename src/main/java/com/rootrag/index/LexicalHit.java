package com.rootrag.index;

public record LexicalHit(
        String chunkId,
        String filePath,
        int startLine,
        int endLine,
        String content,
        String symbolPath,
        String docOrigin,
        String rootRef,
        String resolvedCommit,
        String language,
        String indexSchemaVersion,
        float score) {
}
