package com.rootrag.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FileDiscoveryTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldFindSourceFilesSortedAndSkipExcludedDirectories() throws Exception {
        Path root = tempDir.resolve("repo");
        write(root.resolve("math/TMath.cxx"));
        write(root.resolve("core/TObject.h"));
        write(root.resolve("core/TObject.cxx"));
        write(root.resolve("core/base/TNamed.hh"));
        write(root.resolve("io/rio.c"));
        write(root.resolve("build/generated.h"));
        write(root.resolve(".git/hooks/sample.c"));
        write(root.resolve("core/test/qa/stress.cxx"));
        write(root.resolve("external/zlib/zlib.c"));
        write(root.resolve("README.md"));
        write(root.resolve("tutorials/hist/fillrandom.C"));

        List<Path> files = new FileDiscovery().discover(root);

        assertEquals(List.of(
                root.resolve("core/TObject.cxx"),
                root.resolve("core/TObject.h"),
                root.resolve("core/base/TNamed.hh"),
                root.resolve("io/rio.c"),
                root.resolve("math/TMath.cxx")),
                files);
    }

    @Test
    void shouldNotApplyExclusionToTheRootItself() throws Exception {
        Path root = tempDir.resolve("build");
        write(root.resolve("src/main.cpp"));

        assertEquals(List.of(root.resolve("src/main.cpp")), new FileDiscovery().discover(root));
    }

    @Test
    void shouldReturnIdenticalListsOnRepeatedCalls() throws Exception {
        Path root = tempDir.resolve("repo");
        for (int i = 0; i < 20; i++) {
            write(root.resolve("pkg" + (i % 4) + "/File" + i + ".cpp"));
        }
        FileDiscovery discovery = new FileDiscovery();

        assertEquals(discovery.discover(root), discovery.discover(root));
    }

    @Test
    void shouldHonourConfiguredExtensionsAndExclusions() throws Exception {
        Path root = tempDir.resolve("repo");
        write(root.resolve("docs/guide.md"));
        write(root.resolve("vendor/lib.md"));
        write(root.resolve("core/TObject.h"));

        FileDiscovery discovery = new FileDiscovery(List.of("md"), List.of("vendor"));

        assertEquals(List.of(root.resolve("docs/guide.md")), discovery.discover(root));
    }

    @Test
    void shouldRejectRootThatIsNotADirectory() throws Exception {
        Path file = tempDir.resolve("TObject.h");
        write(file);

        assertThrows(IllegalArgumentException.class, () -> new FileDiscovery().discover(file));
        assertThrows(IllegalArgumentException.class, () -> new FileDiscovery().discover(tempDir.resolve("missing")));
    }

    @Test
    void shouldIncludeSymlinkedFilesButNotFollowLinkedDirectories() throws Exception {
        Path root = tempDir.resolve("repo");
        Path outside = tempDir.resolve("outside");
        write(root.resolve("core/TObject.h"));
        write(outside.resolve("TShared.h"));
        write(outside.resolve("lib/TLib.cxx"));
        try {
            Files.createSymbolicLink(root.resolve("core/TShared.h"), outside.resolve("TShared.h"));
            Files.createSymbolicLink(root.resolve("lib"), outside.resolve("lib"));
        } catch (UnsupportedOperationException | IOException e) {
            Assumptions.abort("symbolic links unavailable: " + e.getMessage());
        }

        assertEquals(List.of(root.resolve("core/TObject.h"), root.resolve("core/TShared.h")),
                new FileDiscovery().discover(root));
    }

    private static void write(Path path) throws Exception {
        Files.createDirectories(path.getParent());
        Files.writeString(path, "// " + path.getFileName() + "\n");
    }
}
