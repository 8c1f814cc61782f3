package com.rootrag.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public AppConfig load(Path configPath) throws ConfigException {
        if (configPath == null) {
            return new AppConfig();
        }
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigException("Config file not found: " + configPath.toAbsolutePath().normalize());
        }
        AppConfig config;
        try {
            config = mapper.readValue(configPath.toFile(), AppConfig.class);
        } catch (IOException e) {
            throw new ConfigException("Unable to parse config file " + configPath + ": " + e.getMessage(), e);
        }
        if (config == null) {
            log.warn("Config file {} is empty, using defaults", configPath);
            return new AppConfig();
        }
        validate(config);
        log.info("Loaded config from {}", configPath);
        return config;
    }

    private void validate(AppConfig config) throws ConfigException {
        AppConfig.ChunkingConfig chunking = config.getChunking();
        if (chunking.getWindowLines() < 1) {
            throw new ConfigException("chunking.windowLines must be >= 1, got " + chunking.getWindowLines());
        }
        if (chunking.getOverlapLines() < 0) {
            throw new ConfigException("chunking.overlapLines must be >= 0, got " + chunking.getOverlapLines());
        }
        if (config.getDiscovery().getIncludedExtensions().isEmpty()) {
            throw new ConfigException("discovery.includedExtensions must not be empty");
        }
        AppConfig.FetchConfig fetch = config.getFetch();
        if (fetch.getLsRemoteTimeoutMs() <= 0 || fetch.getCloneTimeoutMs() <= 0 || fetch.getCheckoutTimeoutMs() <= 0) {
            throw new ConfigException("fetch timeouts must be positive");
        }
        if (fetch.getGitExecutable() == null || fetch.getGitExecutable().isBlank()) {
            throw new ConfigException("fetch.gitExecutable must not be blank");
        }
    }
}
