package com.rootrag;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rootrag.core.ManifestStore;
import com.rootrag.corpus.CorpusFetcher;
import com.rootrag.corpus.CorpusManifest;
import com.rootrag.corpus.InvalidRefException;
import com.rootrag.index.IndexBuildResult;
import com.rootrag.index.IndexBuilder;
import com.rootrag.runtime.AppConfig;
import com.rootrag.runtime.ConfigException;
import com.rootrag.runtime.ConfigLoader;

import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "root-rag",
        mixinStandardHelpOptions = true,
        version = "root-rag 0.1.0",
        description = "Fetches a pinned source corpus and builds a deterministic lexical index over it.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INVALID_REF = 3;
    static final int EXIT_CONFIG = 7;
    static final int EXIT_FTS_UNAVAILABLE = 8;

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = commandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine(Main main) {
        CommandLine commandLine = new CommandLine(main);
        commandLine.addSubcommand("fetch", main.new FetchCommand());
        commandLine.addSubcommand("index", main.new IndexCommand());
        return commandLine;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_USAGE;
    }

    CorpusFetcher createFetcher(AppConfig config) {
        return new CorpusFetcher(config);
    }

    IndexBuilder createIndexBuilder(AppConfig config) {
        return new IndexBuilder(config);
    }

    private static void status(CommandSpec commandSpec, String line) {
        PrintWriter out = commandSpec.commandLine().getOut();
        out.println(line);
        out.flush();
    }

    abstract static class CorpusOptions {
        @Spec
        CommandSpec spec;

        @Option(names = "--repo-url", description = "Repository to fetch (default from config)")
        String repoUrl;

        @Option(names = "--cache-dir", description = "Directory holding fetched corpora (default from config)")
        Path cacheDir;

        @Option(names = { "-c", "--config" }, description = "Path to YAML config file")
        Path configPath;

        String effectiveRepoUrl(AppConfig config) {
            return repoUrl == null || repoUrl.isBlank() ? config.getFetch().getRepoUrl() : repoUrl;
        }

        Path effectiveCacheDir(AppConfig config) {
            return cacheDir == null ? Path.of(config.getOutput().getCacheDir()) : cacheDir;
        }
    }

    @Command(name = "fetch", mixinStandardHelpOptions = true, description = "Resolve a ref and materialize the corpus in the cache.")
    class FetchCommand extends CorpusOptions implements Callable<Integer> {
        @Option(names = "--root-ref", required = true, description = "Branch, tag or commit of the corpus")
        String rootRef;

        @Option(names = "--force-refresh", description = "Fetch again even when the corpus is cached", defaultValue = "false")
        boolean forceRefresh;

        @Override
        public Integer call() {
            AppConfig config;
            try {
                config = new ConfigLoader().load(configPath);
            } catch (ConfigException e) {
                log.error("Configuration error: {}", e.getMessage());
                status(spec, "Configuration error: " + e.getMessage());
                return EXIT_CONFIG;
            }
            String url = effectiveRepoUrl(config);
            try {
                CorpusManifest manifest = createFetcher(config).fetch(url, rootRef, effectiveCacheDir(config), forceRefresh);
                status(spec, "Fetched " + manifest.rootRef() + " at " + manifest.shortCommit() + " into " + manifest.localPath());
                return EXIT_OK;
            } catch (InvalidRefException e) {
                log.error("Invalid ref ref={} repo={}: {}", rootRef, url, e.getMessage());
                status(spec, "Invalid ref '" + rootRef + "': " + e.getMessage());
                return EXIT_INVALID_REF;
            } catch (IOException e) {
                log.error("Fetch failed ref={} repo={}", rootRef, url, e);
                status(spec, "Fetch failed: " + e.getMessage());
                return EXIT_FAILURE;
            }
        }
    }

    /** Where {@code index} gets its corpus: a ref to fetch, or the manifest of a corpus fetched earlier. */
    static class CorpusSource {
        @Option(names = "--root-ref", required = true, description = "Branch, tag or commit of the corpus")
        String rootRef;

        @Option(names = "--manifest", required = true, description = "manifest.json of an already fetched corpus")
        Path manifestPath;
    }

    @Command(name = "index", mixinStandardHelpOptions = true, description = "Fetch the corpus if needed and build its lexical index.")
    class IndexCommand extends CorpusOptions implements Callable<Integer> {
        @ArgGroup(exclusive = true, multiplicity = "1")
        CorpusSource source;

        @Option(names = "--output-dir", description = "Directory receiving index builds (default from config)")
        Path outputDir;

        @Option(names = "--window-lines", description = "Lines per chunk (default from config)")
        Integer windowLines;

        @Option(names = "--overlap-lines", description = "Lines shared by consecutive chunks (default from config)")
        Integer overlapLines;

        @Override
        public Integer call() {
            AppConfig config;
            try {
                config = new ConfigLoader().load(configPath);
            } catch (ConfigException e) {
                log.error("Configuration error: {}", e.getMessage());
                status(spec, "Configuration error: " + e.getMessage());
                return EXIT_CONFIG;
            }
            if (windowLines != null) {
                config.getChunking().setWindowLines(windowLines);
            }
            if (overlapLines != null) {
                config.getChunking().setOverlapLines(overlapLines);
            }
            if (config.getChunking().getWindowLines() < 1 || config.getChunking().getOverlapLines() < 0) {
                status(spec, "--window-lines must be >= 1 and --overlap-lines >= 0");
                return EXIT_USAGE;
            }

            CorpusManifest corpus;
            if (source.manifestPath != null) {
                try {
                    corpus = new ManifestStore().load(source.manifestPath, CorpusManifest.class);
                } catch (IOException e) {
                    log.error("Unable to read corpus manifest {}", source.manifestPath, e);
                    status(spec, "Cannot read corpus manifest " + source.manifestPath + ": " + e.getMessage());
                    return EXIT_FAILURE;
                }
                log.info("Indexing fetched corpus {} at {}", corpus.rootRef(), corpus.shortCommit());
            } else {
                String rootRef = source.rootRef;
                String url = effectiveRepoUrl(config);
                try {
                    corpus = createFetcher(config).fetch(url, rootRef, effectiveCacheDir(config), false);
                } catch (InvalidRefException e) {
                    log.error("Invalid ref ref={} repo={}: {}", rootRef, url, e.getMessage());
                    status(spec, "Invalid ref '" + rootRef + "': " + e.getMessage());
                    return EXIT_INVALID_REF;
                } catch (IOException e) {
                    log.error("Fetch failed ref={} repo={}", rootRef, url, e);
                    status(spec, "Fetch failed: " + e.getMessage());
                    return EXIT_FAILURE;
                }
            }

            Path indexRoot = outputDir == null ? Path.of(config.getOutput().getIndexDir()) : outputDir;
            IndexBuildResult result = createIndexBuilder(config).build(corpus, indexRoot);
            if (!result.success()) {
                log.error("Index build failed reason={} stage={}", result.reasonCode(), result.stage());
                status(spec, "Index build failed (" + result.reasonCode() + "): " + result.message());
                return result.reason() == IndexBuildResult.FailureReason.FTS_UNAVAILABLE ? EXIT_FTS_UNAVAILABLE : EXIT_FAILURE;
            }
            if (!result.fileFailures().isEmpty()) {
                log.warn("{} files were skipped during chunking", result.fileFailures().size());
            }
            status(spec, "Indexed " + result.chunkCount() + " chunks from " + result.fileCount() + " files into "
                    + result.indexDir() + " (index_id=" + result.manifest().indexId() + ")");
            return EXIT_OK;
        }
    }
}
