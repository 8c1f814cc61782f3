package com.rootrag.parser;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rootrag.runtime.AppConfig;

public class FileDiscovery {
    private static final Logger log = LoggerFactory.getLogger(FileDiscovery.class);

    private final Set<String> includedExtensions;
    private final Set<String> excludedDirectories;

    public FileDiscovery() {
        this(new AppConfig.DiscoveryConfig());
    }

    public FileDiscovery(AppConfig.DiscoveryConfig config) {
        this(config.getIncludedExtensions(), config.getExcludedDirectories());
    }

    public FileDiscovery(Iterable<String> includedExtensions, Iterable<String> excludedDirectories) {
        this.includedExtensions = new LinkedHashSet<>();
        for (String extension : includedExtensions) {
            this.includedExtensions.add(extension.startsWith(".") ? extension : "." + extension);
        }
        this.excludedDirectories = new LinkedHashSet<>();
        excludedDirectories.forEach(this.excludedDirectories::add);
    }

    public List<Path> discover(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Not a directory: " + root);
        }
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && excludedDirectories.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                // Symlinked files count when their target is a regular file; linked directories are not followed.
                if (Files.isRegularFile(file) && includedExtensions.contains(SourceFileClassifier.extension(file))) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(Comparator.comparing(Path::toString));
        log.debug("Discovered {} source files under {}", files.size(), root);
        return files;
    }
}
