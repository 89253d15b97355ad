/* (C)2026 */
package com.ammann.history.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StoreLayoutTest {

    private static final String CONTEXT = "vessels.urn:mrn:imo:mmsi:368396230";

    @TempDir Path root;

    private StoreLayout layout;

    @BeforeEach
    void setUp() {
        layout = new StoreLayout(root);
    }

    @Test
    void resolvesPathDirectoryBelowContext() {
        Path directory = layout.pathDirectory(CONTEXT, "navigation.speedOverGround").orElseThrow();

        assertThat(directory).isEqualTo(root.toAbsolutePath().normalize()
                .resolve("vessels/urn_mrn_imo_mmsi_368396230/navigation/speedOverGround"));
    }

    @Test
    void resolvedDirectoriesNeverLeaveRoot() {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        for (String path : new String[] {"../../../etc", "..", "a/../../b", "navigation....", "/etc/passwd"}) {
            layout.pathDirectory(CONTEXT, path)
                    .ifPresent(dir -> assertThat(dir.normalize()).startsWithRaw(normalizedRoot));
        }
        assertThat(layout.pathDirectory(CONTEXT, "../../../etc")).hasValueSatisfying(
                dir -> assertThat(dir).startsWithRaw(normalizedRoot.resolve("vessels/urn_mrn_imo_mmsi_368396230")));
        assertThat(layout.pathDirectory(CONTEXT, "..")).isEmpty();
        assertThat(layout.contextDirectory("vessels/../..")).isEmpty();
    }

    @Test
    void listsOnlyDirectParquetFiles() throws IOException {
        Path dir = Files.createDirectories(root.resolve("vessels/self/navigation/position"));
        Files.createFile(dir.resolve("b.parquet"));
        Files.createFile(dir.resolve("a.parquet"));
        Files.createFile(dir.resolve("notes.txt"));
        Files.createDirectories(dir.resolve("nested"));
        Files.createFile(dir.resolve("nested/c.parquet"));

        assertThat(layout.parquetFiles(dir)).extracting(p -> p.getFileName().toString())
                .containsExactly("a.parquet", "b.parquet");
        assertThat(layout.parquetFiles(root.resolve("missing"))).isEmpty();
    }

    @Test
    void recursiveListingSkipsHousekeepingDirectories() throws IOException {
        Path context = Files.createDirectories(root.resolve("vessels/self"));
        Files.createDirectories(context.resolve("navigation/position"));
        Files.createFile(context.resolve("navigation/position/a.parquet"));
        Files.createDirectories(context.resolve("processed/navigation"));
        Files.createFile(context.resolve("processed/navigation/old.parquet"));
        Files.createDirectories(context.resolve("navigation/quarantine"));
        Files.createFile(context.resolve("navigation/quarantine/bad.parquet"));

        assertThat(layout.parquetFilesRecursive(context))
                .containsExactly(context.resolve("navigation/position/a.parquet"));
    }

    @Test
    void mapsFilesBackToPathAndContext() {
        Path contextDir = layout.contextDirectory(CONTEXT).orElseThrow();
        Path file = contextDir.resolve("navigation/courseOverGroundTrue/2025.parquet");

        assertThat(layout.pathOf(contextDir, file)).contains("navigation.courseOverGroundTrue");
        assertThat(layout.contextOf(file)).contains(CONTEXT);
        assertThat(layout.pathOf(contextDir, contextDir.resolve("top.parquet"))).isEmpty();
    }

    @Test
    void listsContextDirectories() throws IOException {
        Files.createDirectories(root.resolve("vessels/a/navigation"));
        Files.createDirectories(root.resolve("vessels/b"));
        Files.createDirectories(root.resolve("aircraft/c"));

        assertThat(layout.contextDirectories()).extracting(p -> root.relativize(p).toString().replace('\\', '/'))
                .containsExactly("aircraft/c", "vessels/a", "vessels/b");
    }
}
