package com.rootrag.runtime;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    public static final String DEFAULT_TOOL_VERSION = "0.1.0";

    private String toolVersion = DEFAULT_TOOL_VERSION;
    private ChunkingConfig chunking = new ChunkingConfig();
    private DiscoveryConfig discovery = new DiscoveryConfig();
    private FetchConfig fetch = new FetchConfig();
    private OutputConfig output = new OutputConfig();

    public String getToolVersion() {
        return toolVersion;
    }

    public void setToolVersion(String toolVersion) {
        this.toolVersion = toolVersion == null || toolVersion.isBlank() ? DEFAULT_TOOL_VERSION : toolVersion;
    }

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public DiscoveryConfig getDiscovery() {
        return discovery;
    }

    public void setDiscovery(DiscoveryConfig discovery) {
        this.discovery = discovery == null ? new DiscoveryConfig() : discovery;
    }

    public FetchConfig getFetch() {
        return fetch;
    }

    public void setFetch(FetchConfig fetch) {
        this.fetch = fetch == null ? new FetchConfig() : fetch;
    }

    public OutputConfig getOutput() {
        return output;
    }

    public void setOutput(OutputConfig output) {
        this.output = output == null ? new OutputConfig() : output;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int windowLines = 80;
        private int overlapLines = 10;

        public int getWindowLines() {
            return windowLines;
        }

        public void setWindowLines(int windowLines) {
            this.windowLines = windowLines;
        }

        public int getOverlapLines() {
            return overlapLines;
        }

        public void setOverlapLines(int overlapLines) {
            this.overlapLines = overlapLines;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DiscoveryConfig {
        private List<String> includedExtensions = List.of(".h", ".hpp", ".hh", ".cxx", ".cpp", ".cc", ".c");
        private List<String> excludedDirectories = List.of(
                "build", ".git", ".github", "external", "qa", ".pytest_cache", "__pycache__", ".venv", "venv");

        public List<String> getIncludedExtensions() {
            return includedExtensions;
        }

        public void setIncludedExtensions(List<String> includedExtensions) {
            this.includedExtensions = includedExtensions == null ? List.of() : includedExtensions;
        }

        public List<String> getExcludedDirectories() {
            return excludedDirectories;
        }

        public void setExcludedDirectories(List<String> excludedDirectories) {
            this.excludedDirectories = excludedDirectories == null ? List.of() : excludedDirectories;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FetchConfig {
        private String repoUrl = "https://github.com/root-project/root.git";
        private long lsRemoteTimeoutMs = 30_000;
        private long cloneTimeoutMs = 300_000;
        private long checkoutTimeoutMs = 60_000;
        private boolean verifyCachedCommit = false;
        private String gitExecutable = "git";

        public String getRepoUrl() {
            return repoUrl;
        }

        public void setRepoUrl(String repoUrl) {
            this.repoUrl = repoUrl;
        }

        public long getLsRemoteTimeoutMs() {
            return lsRemoteTimeoutMs;
        }

        public void setLsRemoteTimeoutMs(long lsRemoteTimeoutMs) {
            this.lsRemoteTimeoutMs = lsRemoteTimeoutMs;
        }

        public long getCloneTimeoutMs() {
            return cloneTimeoutMs;
        }

        public void setCloneTimeoutMs(long cloneTimeoutMs) {
            this.cloneTimeoutMs = cloneTimeoutMs;
        }

        public long getCheckoutTimeoutMs() {
            return checkoutTimeoutMs;
        }

        public void setCheckoutTimeoutMs(long checkoutTimeoutMs) {
            this.checkoutTimeoutMs = checkoutTimeoutMs;
        }

        public boolean isVerifyCachedCommit() {
            return verifyCachedCommit;
        }

        public void setVerifyCachedCommit(boolean verifyCachedCommit) {
            this.verifyCachedCommit = verifyCachedCommit;
        }

        public String getGitExecutable() {
            return gitExecutable;
        }

        public void setGitExecutable(String gitExecutable) {
            this.gitExecutable = gitExecutable;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OutputConfig {
        private String chunksDir = "data/processed/chunks";
        private String cacheDir = "data/raw";
        private String indexDir = "data/indexes";

        public String getChunksDir() {
            return chunksDir;
        }

        public void setChunksDir(String chunksDir) {
            if (chunksDir != null) {
                this.chunksDir = chunksDir;
            }
        }

        public String getCacheDir() {
            return cacheDir;
        }

        public void setCacheDir(String cacheDir) {
            if (cacheDir != null) {
                this.cacheDir = cacheDir;
            }
        }

        public String getIndexDir() {
            return indexDir;
        }

        public void setIndexDir(String indexDir) {
            if (indexDir != null) {
                this.indexDir = indexDir;
            }
        }
    }
}
