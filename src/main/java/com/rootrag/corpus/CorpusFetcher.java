package com.rootrag.corpus;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rootrag.core.ManifestStore;
import com.rootrag.runtime.AppConfig;

public class CorpusFetcher {
    private static final Logger log = LoggerFactory.getLogger(CorpusFetcher.class);

    public static final String MANIFEST_FILE = "manifest.json";
    public static final String REPO_DIR = "repo";

    private final GitCommandRunner gitCommandRunner;
    private final ManifestStore manifestStore;
    private final Clock clock;
    private final AppConfig.FetchConfig fetchConfig;
    private final String toolVersion;

    public CorpusFetcher(AppConfig config) {
        this(new GitCommandRunner(config.getFetch().getGitExecutable()), new ManifestStore(), Clock.systemUTC(), config.getFetch(), config.getToolVersion());
    }

    CorpusFetcher(
            GitCommandRunner gitCommandRunner,
            ManifestStore manifestStore,
            Clock clock,
            AppConfig.FetchConfig fetchConfig,
            String toolVersion) {
        this.gitCommandRunner = gitCommandRunner;
        this.manifestStore = manifestStore;
        this.clock = clock;
        this.fetchConfig = fetchConfig;
        this.toolVersion = toolVersion;
    }

    public CorpusManifest fetch(String repoUrl, String rootRef, Path cacheDir, boolean forceRefresh) throws IOException {
        if (repoUrl == null || repoUrl.isBlank()) {
            throw new IllegalArgumentException("repoUrl must not be blank");
        }
        if (rootRef == null || rootRef.isBlank()) {
            throw new IllegalArgumentException("rootRef must not be blank");
        }

        String resolvedCommit = resolveRef(repoUrl, rootRef);
        String corpusKey = corpusDirectoryName(repoUrl, resolvedCommit);
        Path corpusDir = cacheDir.resolve(corpusKey);
        Path repoDir = corpusDir.resolve(REPO_DIR);
        Path manifestPath = corpusDir.resolve(MANIFEST_FILE);

        if (!forceRefresh && Files.isDirectory(repoDir) && Files.isRegularFile(manifestPath)) {
            CorpusManifest cached = manifestStore.load(manifestPath, CorpusManifest.class);
            if (!fetchConfig.isVerifyCachedCommit() || cachedCommitMatches(repoDir, cached)) {
                log.info("Using cached corpus {}", corpusKey);
                if (!cached.rootRef().equals(rootRef)) {
                    log.info("Cached corpus {} was fetched as {}, reporting it as {}", corpusKey, cached.rootRef(), rootRef);
                    return cached.withRootRef(rootRef);
                }
                return cached;
            }
            log.warn("Cached corpus {} does not match its manifest commit {}, fetching again", corpusKey, cached.shortCommit());
        }

        Files.createDirectories(cacheDir);
        Path stagingDir = Files.createTempDirectory(cacheDir, ".fetch-");
        boolean dirty;
        try {
            Path stagedRepo = stagingDir.resolve(REPO_DIR);
            String checkedOut = cloneAndCheckout(repoUrl, rootRef, stagedRepo);
            if (!checkedOut.equals(resolvedCommit)) {
                log.warn("Resolved commit mismatch ref={} lsRemote={} checkout={}", rootRef, resolvedCommit, checkedOut);
            }
            dirty = isDirty(stagedRepo);
            install(stagedRepo, repoDir);
        } finally {
            cleanupStaging(stagingDir);
        }

        CorpusManifest manifest = CorpusManifest.create(
                repoUrl,
                rootRef,
                resolvedCommit,
                repoDir.toAbsolutePath().normalize().toString(),
                clock.instant(),
                dirty,
                toolVersion);
        manifestStore.save(manifestPath, manifest);
        log.info("Manifest saved to {}", manifestPath);
        return manifest;
    }

    public String resolveRef(String repoUrl, String rootRef) throws IOException {
        if (rootRef.length() == 40 && CorpusManifest.isCommitSha(rootRef)) {
            return rootRef;
        }
        GitCommandResult result = run(null, Duration.ofMillis(fetchConfig.getLsRemoteTimeoutMs()),
                "ls-remote", "--heads", "--tags", repoUrl, rootRef);
        if (result.timedOut() || result.launchFailed()) {
            throw new GitOperationException("git ls-remote failed for " + repoUrl + " timedOut=" + result.timedOut()
                    + " stderr=" + result.stderr(), result);
        }
        if (result.exitCode() != 0) {
            throw new InvalidRefException(rootRef, "Cannot resolve ref '" + rootRef + "' in " + repoUrl + ": " + result.stderr());
        }

        Map<String, String> refs = new LinkedHashMap<>();
        for (String line : result.stdout().split("\\R")) {
            String[] parts = line.trim().split("\\s+");
            if (parts.length == 2) {
                refs.put(parts[1], parts[0]);
            }
        }
        if (refs.isEmpty()) {
            throw new InvalidRefException(rootRef, "Reference '" + rootRef + "' not found in " + repoUrl);
        }

        String sha = refs.get("refs/heads/" + rootRef);
        if (sha == null) {
            sha = refs.get("refs/tags/" + rootRef + "^{}");
        }
        if (sha == null) {
            sha = refs.get("refs/tags/" + rootRef);
        }
        if (sha == null) {
            sha = refs.values().iterator().next();
        }
        if (!CorpusManifest.isCommitSha(sha)) {
            throw new GitOperationException("Unexpected ls-remote output for " + rootRef + ": " + result.stdout(), result);
        }
        log.info("Resolved {} -> {}", rootRef, sha.substring(0, Math.min(12, sha.length())));
        return sha;
    }

    static String corpusDirectoryName(String repoUrl, String resolvedCommit) {
        return repoSlug(repoUrl) + "__" + resolvedCommit.substring(0, Math.min(12, resolvedCommit.length()));
    }

    static String repoSlug(String repoUrl) {
        String clean = repoUrl.strip();
        while (clean.endsWith("/") && clean.length() > 1) {
            clean = clean.substring(0, clean.length() - 1);
        }
        if (clean.endsWith(".git")) {
            clean = clean.substring(0, clean.length() - 4);
        }

        String slug = null;
        try {
            URI uri = new URI(clean);
            if (uri.getRawAuthority() != null && uri.getPath() != null) {
                List<String> parts = new ArrayList<>();
                for (String part : uri.getPath().split("/")) {
                    if (!part.isEmpty()) {
                        parts.add(part);
                    }
                }
                if (parts.size() >= 2) {
                    slug = parts.get(parts.size() - 2) + "__" + parts.get(parts.size() - 1);
                } else if (parts.size() == 1) {
                    slug = parts.get(0);
                }
            }
        } catch (URISyntaxException e) {
            log.debug("Repository location is not a URI, treating as path: {}", clean);
        }
        if (slug == null) {
            int separator = Math.max(clean.lastIndexOf('/'), clean.lastIndexOf('\\'));
            slug = separator >= 0 ? clean.substring(separator + 1) : clean;
        }
        slug = slug.replaceAll("[^A-Za-z0-9._-]", "-");
        return slug.isBlank() ? "repo" : slug;
    }

    private String cloneAndCheckout(String repoUrl, String rootRef, Path targetPath) throws IOException {
        log.info("Cloning {} to {}", repoUrl, targetPath);
        runRequired(null, Duration.ofMillis(fetchConfig.getCloneTimeoutMs()),
                "clone", "--quiet", repoUrl, targetPath.toString());

        log.info("Checking out {}", rootRef);
        GitCommandResult checkout = run(targetPath, Duration.ofMillis(fetchConfig.getCheckoutTimeoutMs()),
                "checkout", "--quiet", rootRef);
        if (checkout.timedOut() || checkout.launchFailed()) {
            throw new GitOperationException("git checkout failed timedOut=" + checkout.timedOut() + " stderr=" + checkout.stderr(), checkout);
        }
        if (!checkout.isSuccess()) {
            throw new InvalidRefException(rootRef, "Cannot checkout ref '" + rootRef + "': " + checkout.stderr());
        }

        return runRequired(targetPath, Duration.ofMillis(fetchConfig.getLsRemoteTimeoutMs()),
                "rev-parse", "HEAD").stdout().trim();
    }

    private boolean isDirty(Path repoDir) throws IOException {
        GitCommandResult status = runRequired(repoDir, Duration.ofMillis(fetchConfig.getLsRemoteTimeoutMs()),
                "status", "--porcelain");
        return !status.stdout().isBlank();
    }

    private boolean cachedCommitMatches(Path repoDir, CorpusManifest cached) throws IOException {
        GitCommandResult head = run(repoDir, Duration.ofMillis(fetchConfig.getLsRemoteTimeoutMs()),
                "rev-parse", "HEAD");
        if (!head.isSuccess()) {
            log.warn("Unable to verify cached corpus {} exitCode={} stderr={}", repoDir, head.exitCode(), head.stderr());
            return false;
        }
        return head.stdout().trim().startsWith(cached.resolvedCommit());
    }

    private void install(Path stagedRepo, Path repoDir) throws IOException {
        Files.createDirectories(repoDir.getParent());
        if (Files.exists(repoDir)) {
            log.info("Removing stale corpus at {}", repoDir);
            deleteRecursively(repoDir);
        }
        log.info("Installing corpus to {}", repoDir);
        try {
            Files.move(stagedRepo, repoDir, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to a plain rename", repoDir);
            Files.move(stagedRepo, repoDir);
        }
    }

    private GitCommandResult runRequired(Path repoDir, Duration timeout, String... args) throws IOException {
        GitCommandResult result = run(repoDir, timeout, args);
        if (!result.isSuccess()) {
            log.error("git command failed command='{}' exitCode={} timedOut={} stderr={}",
                    result.commandLine(), result.exitCode(), result.timedOut(), result.stderr());
            throw new GitOperationException("Command failed (" + result.commandLine() + ") exitCode=" + result.exitCode()
                    + " timedOut=" + result.timedOut() + " stderr=" + result.stderr(), result);
        }
        return result;
    }

    private GitCommandResult run(Path repoDir, Duration timeout, String... args) throws IOException {
        GitCommandResult result = gitCommandRunner.run(repoDir, timeout, args);
        if (result.interrupted()) {
            throw new InterruptedIOException("Command interrupted: " + result.commandLine());
        }
        return result;
    }

    private void cleanupStaging(Path stagingDir) {
        try {
            deleteRecursively(stagingDir);
        } catch (IOException e) {
            log.warn("Unable to remove staging directory {}", stagingDir, e);
        }
    }

    static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            List<Path> ordered = paths.sorted(Comparator.reverseOrder()).toList();
            for (Path path : ordered) {
                Files.deleteIfExists(path);
            }
        }
    }
}
