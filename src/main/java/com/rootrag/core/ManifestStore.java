package com.rootrag.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class ManifestStore {
    private final ObjectMapper mapper;

    public ManifestStore() {
        this(newMapper());
    }

    ManifestStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper newMapper() {
        return JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    public <T> T load(Path path, Class<T> type) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Manifest not found: " + path);
        }
        return mapper.readValue(path.toFile(), type);
    }

    public void save(Path path, Object manifest) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), manifest);
    }
}
