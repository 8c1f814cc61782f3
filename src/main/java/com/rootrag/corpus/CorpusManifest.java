package com.rootrag.corpus;

import java.time.Instant;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rootrag.core.ValidationException;

public record CorpusManifest(
        @JsonProperty("schema_version") String schemaVersion,
        @JsonProperty("repo_url") String repoUrl,
        @JsonProperty("root_ref") String rootRef,
        @JsonProperty("resolved_commit") String resolvedCommit,
        @JsonProperty("local_path") String localPath,
        @JsonProperty("fetched_at") Instant fetchedAt,
        @JsonProperty("dirty") boolean dirty,
        @JsonProperty("tool_version") String toolVersion) {

    public static final String SCHEMA_VERSION = "corpus_manifest_v1";

    private static final Pattern COMMIT_SHA = Pattern.compile("[0-9a-f]{7,40}");

    public CorpusManifest {
        if (schemaVersion == null || schemaVersion.isBlank()) {
            schemaVersion = SCHEMA_VERSION;
        }
        ValidationException.requireNonBlank("repo_url", repoUrl);
        ValidationException.requireNonBlank("root_ref", rootRef);
        validateCommit(resolvedCommit);
        ValidationException.requireNonBlank("local_path", localPath);
        if (fetchedAt == null) {
            throw new ValidationException("fetched_at", "must not be null");
        }
        ValidationException.requireNonBlank("tool_version", toolVersion);
    }

    public static CorpusManifest create(
            String repoUrl,
            String rootRef,
            String resolvedCommit,
            String localPath,
            Instant fetchedAt,
            boolean dirty,
            String toolVersion) {
        return new CorpusManifest(SCHEMA_VERSION, repoUrl, rootRef, resolvedCommit, localPath, fetchedAt, dirty, toolVersion);
    }

    public static String validateCommit(String resolvedCommit) {
        if (resolvedCommit == null) {
            throw new ValidationException("resolved_commit", "must not be null");
        }
        if (!COMMIT_SHA.matcher(resolvedCommit).matches()) {
            throw new ValidationException("resolved_commit",
                    "must be 7-40 lowercase hex characters; got '" + resolvedCommit + "' (len=" + resolvedCommit.length() + ")");
        }
        return resolvedCommit;
    }

    public static boolean isCommitSha(String value) {
        return value != null && COMMIT_SHA.matcher(value).matches();
    }

    // Same checkout and fetch time, seen through another ref that resolves to the same commit.
    public CorpusManifest withRootRef(String requestedRef) {
        return new CorpusManifest(schemaVersion, repoUrl, requestedRef, resolvedCommit, localPath, fetchedAt, dirty, toolVersion);
    }

    public String shortCommit() {
        return resolvedCommit.substring(0, Math.min(12, resolvedCommit.length()));
    }
}
