/* (C)2026 */
package com.ammann.history.service;

import static com.ammann.history.support.ParquetFixtures.dbl;
import static com.ammann.history.support.ParquetFixtures.row;
import static com.ammann.history.support.ParquetFixtures.str;
import static com.ammann.history.support.ParquetFixtures.ts;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.history.enumeration.ComponentDataType;
import com.ammann.history.model.ComponentSchema;
import com.ammann.history.store.DuckDbConnectionProvider;
import com.ammann.history.store.StoreLayout;
import com.ammann.history.support.ParquetFixtures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchemaProbeServiceTest {

    private static final String CONTEXT = "vessels.urn:mrn:imo:mmsi:1";

    @TempDir Path root;

    private SchemaProbeService probe;
    private StoreLayout layout;

    @BeforeEach
    void setUp() {
        layout = new StoreLayout(root);
        probe = new SchemaProbeService();
        probe.storeLayout = layout;
        probe.connectionProvider = new DuckDbConnectionProvider();
    }

    @AfterEach
    void tearDown() {
        probe.connectionProvider.shutdown();
    }

    @Test
    void scalarFilesYieldEmptySchema() {
        Path dir = layout.pathDirectory(CONTEXT, "navigation.speedOverGround").orElseThrow();
        ParquetFixtures.write(dir.resolve("a.parquet"), "signalk_timestamp, value, value_json",
                row(ts("2025-08-11T10:00:00Z"), dbl(3.2), str(null)));

        ComponentSchema schema = probe.probe(CONTEXT, "navigation.speedOverGround");

        assertThat(schema.isComposite()).isFalse();
    }

    @Test
    void unionsComponentsAcrossFilesFirstDeclarationWins() {
        Path dir = layout.pathDirectory(CONTEXT, "navigation.position").orElseThrow();
        ParquetFixtures.write(dir.resolve("a.parquet"),
                "signalk_timestamp, value_latitude, value_longitude, value_json, value_units",
                row(ts("2025-08-11T10:00:00Z"), dbl(60.1), dbl(5.3), str(null), str("deg")));
        ParquetFixtures.write(dir.resolve("b.parquet"),
                "signalk_timestamp, value_latitude, value_source",
                row(ts("2025-08-11T10:01:00Z"), str("60.2"), str("gps")));

        ComponentSchema schema = probe.probe(CONTEXT, "navigation.position");

        assertThat(schema.components()).containsOnlyKeys("latitude", "longitude", "source");
        assertThat(schema.components().get("latitude").dataType()).isEqualTo(ComponentDataType.NUMERIC);
        assertThat(schema.components().get("latitude").columnName()).isEqualTo("value_latitude");
        assertThat(schema.components().get("source").dataType()).isEqualTo(ComponentDataType.STRING);
    }

    @Test
    void skipsUnreadableFiles() throws IOException {
        Path dir = layout.pathDirectory(CONTEXT, "navigation.position").orElseThrow();
        ParquetFixtures.write(dir.resolve("a.parquet"), "signalk_timestamp, value_latitude",
                row(ts("2025-08-11T10:00:00Z"), dbl(60.1)));
        Files.writeString(dir.resolve("broken.parquet"), "garbage");

        assertThat(probe.probe(CONTEXT, "navigation.position").components()).containsOnlyKeys("latitude");
    }

    @Test
    void missingOrRejectedPathsAreScalar() {
        assertThat(probe.probe(CONTEXT, "environment.depth")).isEqualTo(ComponentSchema.EMPTY);
        assertThat(probe.probe(CONTEXT, "..")).isEqualTo(ComponentSchema.EMPTY);
    }
}
