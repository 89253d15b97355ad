/* (C)2026 */
package com.ammann.history.store;

import com.ammann.history.exception.StoreAccessException;
import com.ammann.history.model.TimeRange;
import com.ammann.history.query.BucketQueryBuilder;
import com.ammann.history.util.TimeFormats;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/**
 * Finds which Parquet files hold samples inside a time window.
 *
 * <p>Files are scanned in batches with a single {@code SELECT DISTINCT filename} each. When
 * a batch fails (typically one unreadable file) its files are retried one by one and the
 * unreadable ones are skipped.
 */
@ApplicationScoped
public class DataFileScanner {

    private static final Logger LOG = Logger.getLogger(DataFileScanner.class);
    static final int BATCH_SIZE = 256;

    @Inject DuckDbConnectionProvider connectionProvider;

    public DataFileScanner() {}

    public DataFileScanner(DuckDbConnectionProvider connectionProvider) {
        this.connectionProvider = connectionProvider;
    }

    /**
     * Returns the subset of {@code files} with at least one sample in {@code range}.
     *
     * @throws StoreAccessException when no connection to the engine can be opened
     */
    public Set<Path> filesWithData(List<Path> files, TimeRange range) {
        Set<Path> result = new LinkedHashSet<>();
        if (files.isEmpty()) {
            return result;
        }
        try (Connection connection = connectionProvider.openConnection()) {
            for (int start = 0; start < files.size(); start += BATCH_SIZE) {
                List<Path> batch = files.subList(start, Math.min(files.size(), start + BATCH_SIZE));
                try {
                    result.addAll(scan(connection, batch, range));
                } catch (SQLException e) {
                    LOG.debugf("Batch scan failed, retrying %d files individually: %s",
                            batch.size(), e.getMessage());
                    for (Path file : batch) {
                        result.addAll(scanSingle(connection, file, range));
                    }
                }
            }
        } catch (SQLException e) {
            throw new StoreAccessException("Cannot open store connection: " + e.getMessage(), e);
        }
        return result;
    }

    /**
     * Whether any of {@code files} holds a sample in {@code range}.
     */
    public boolean hasData(List<Path> files, TimeRange range) {
        return !filesWithData(files, range).isEmpty();
    }

    private Set<Path> scanSingle(Connection connection, Path file, TimeRange range) {
        try {
            return scan(connection, List.of(file), range);
        } catch (SQLException e) {
            LOG.warnf("Skipping unreadable data file %s: %s", file, e.getMessage());
            return Set.of();
        }
    }

    private Set<Path> scan(Connection connection, List<Path> files, TimeRange range)
            throws SQLException {
        String sources = files.stream()
                .map(f -> BucketQueryBuilder.quoteLiteral(f.toString()))
                .collect(Collectors.joining(", ", "[", "]"));
        String timestamp = "CAST(" + BucketQueryBuilder.quoteIdentifier(BucketQueryBuilder.TIMESTAMP_COLUMN)
                + " AS TIMESTAMP)";
        String sql = "SELECT DISTINCT filename FROM read_parquet(" + sources
                + ", union_by_name = true, filename = true)"
                + " WHERE " + timestamp + " >= CAST(? AS TIMESTAMP)"
                + " AND " + timestamp + " < CAST(? AS TIMESTAMP)";

        Set<Path> found = new LinkedHashSet<>();
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, TimeFormats.sqlTimestamp(range.from()));
            statement.setString(2, TimeFormats.sqlTimestamp(range.to()));
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    found.add(Paths.get(resultSet.getString(1)).toAbsolutePath().normalize());
                }
            }
        }
        return found;
    }
}
