/* (C)2026 */
package com.ammann.history.service;

import com.ammann.history.enumeration.ComponentDataType;
import com.ammann.history.exception.StoreAccessException;
import com.ammann.history.model.ComponentInfo;
import com.ammann.history.model.ComponentSchema;
import com.ammann.history.query.BucketQueryBuilder;
import com.ammann.history.store.DuckDbConnectionProvider;
import com.ammann.history.store.StoreLayout;
import io.quarkus.cache.CacheInvalidateAll;
import io.quarkus.cache.CacheResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Classifies a signal path as scalar or composite by reading the Parquet footers of its
 * files.
 *
 * <p>A file with a {@code value} column holds scalar samples and contributes nothing.
 * Every other file contributes its {@code value_*} columns, apart from the structured
 * fallback and metadata columns, to one union schema where the first declaration of a
 * sub-field wins. An empty schema means the path is scalar.
 */
@ApplicationScoped
public class SchemaProbeService {

    private static final Logger LOG = Logger.getLogger(SchemaProbeService.class);

    static final String VALUE_COLUMN = "value";
    static final String COMPONENT_PREFIX = "value_";
    static final Set<String> NON_COMPONENT_COLUMNS =
            Set.of("value_json", "value_units", "value_description");

    @Inject DuckDbConnectionProvider connectionProvider;

    @Inject StoreLayout storeLayout;

    /**
     * Probes the schema of one path. Results are cached per context and path.
     *
     * @throws StoreAccessException when no engine connection can be opened
     */
    @CacheResult(cacheName = "path-schemas")
    public ComponentSchema probe(String context, String path) {
        Optional<Path> directory = storeLayout.pathDirectory(context, path);
        if (directory.isEmpty()) {
            return ComponentSchema.EMPTY;
        }
        List<Path> files = storeLayout.parquetFiles(directory.get());
        if (files.isEmpty()) {
            return ComponentSchema.EMPTY;
        }

        Map<String, ComponentInfo> components = new LinkedHashMap<>();
        try (Connection connection = connectionProvider.openConnection()) {
            for (Path file : files) {
                try {
                    mergeFileSchema(connection, file, components);
                } catch (SQLException e) {
                    LOG.warnf("Skipping unreadable schema of %s: %s", file, e.getMessage());
                }
            }
        } catch (SQLException e) {
            throw new StoreAccessException("Cannot open store connection: " + e.getMessage(), e);
        }

        LOG.debugf("Schema of %s in %s: %s", path, context,
                components.isEmpty() ? "scalar" : components.keySet());
        return components.isEmpty() ? ComponentSchema.EMPTY : new ComponentSchema(components);
    }

    @CacheInvalidateAll(cacheName = "path-schemas")
    public void invalidateAll() {
        LOG.info("Path schema cache cleared");
    }

    private void mergeFileSchema(Connection connection, Path file, Map<String, ComponentInfo> components)
            throws SQLException {
        String sql = "SELECT name, type, converted_type FROM parquet_schema("
                + BucketQueryBuilder.quoteLiteral(file.toString()) + ")";
        List<ComponentInfo> fileComponents = new ArrayList<>();
        boolean scalar = false;
        try (Statement statement = connection.createStatement();
                ResultSet resultSet = statement.executeQuery(sql)) {
            while (resultSet.next()) {
                String name = resultSet.getString("name");
                if (VALUE_COLUMN.equals(name)) {
                    scalar = true;
                } else if (name != null
                        && name.startsWith(COMPONENT_PREFIX)
                        && name.length() > COMPONENT_PREFIX.length()
                        && !NON_COMPONENT_COLUMNS.contains(name)) {
                    ComponentDataType type = ComponentDataType.fromColumnType(
                            resultSet.getString("type"), resultSet.getString("converted_type"));
                    fileComponents.add(new ComponentInfo(
                            name.substring(COMPONENT_PREFIX.length()), name, type));
                }
            }
        }
        if (scalar) {
            return;
        }
        for (ComponentInfo component : fileComponents) {
            components.putIfAbsent(component.name(), component);
        }
    }
}
