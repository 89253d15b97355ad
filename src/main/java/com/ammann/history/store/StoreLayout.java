/* (C)2026 */
package com.ammann.history.store;

import com.ammann.history.exception.StoreAccessException;
import jakarta.enterprise.context.ApplicationScoped;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Maps contexts and signal paths onto the Parquet directory tree and back.
 *
 * <p>Layout: {@code <data-dir>/<contextType>/<contextId>/<path segments>/*.parquet}, where
 * colons in the context id are stored as underscores. Housekeeping directories of the
 * writer are never read.
 */
@ApplicationScoped
public class StoreLayout {

    private static final Logger LOG = Logger.getLogger(StoreLayout.class);

    static final Set<String> SKIPPED_DIRECTORIES =
            Set.of("processed", "failed", "quarantine", "repaired", "claude-schemas");

    private static final String PARQUET_SUFFIX = ".parquet";

    @ConfigProperty(name = "history.data-dir", defaultValue = "./data")
    String dataDir;

    public StoreLayout() {}

    public StoreLayout(Path root) {
        this.dataDir = root.toString();
    }

    public Path root() {
        return Paths.get(dataDir).toAbsolutePath().normalize();
    }

    /**
     * Directory of a context, or empty when the context cannot be mapped safely.
     */
    public Optional<Path> contextDirectory(String context) {
        return PathSanitizer.contextSegments(context).flatMap(this::resolveInsideRoot);
    }

    /**
     * Directory holding the files of a signal path within a context, or empty when either
     * part cannot be mapped safely.
     */
    public Optional<Path> pathDirectory(String context, String signalPath) {
        Optional<List<String>> contextSegments = PathSanitizer.contextSegments(context);
        Optional<List<String>> pathSegments = PathSanitizer.pathSegments(signalPath);
        if (contextSegments.isEmpty() || pathSegments.isEmpty()) {
            return Optional.empty();
        }
        List<String> all = new ArrayList<>(contextSegments.get());
        all.addAll(pathSegments.get());
        return resolveInsideRoot(all);
    }

    /**
     * Glob matching the Parquet files stored directly in a path directory.
     */
    public String parquetGlob(Path directory) {
        return directory.resolve("*" + PARQUET_SUFFIX).toString();
    }

    /**
     * Parquet files stored directly in the given directory, sorted by name.
     */
    public List<Path> parquetFiles(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(directory)) {
            return children.filter(this::isParquetFile).sorted().toList();
        } catch (IOException e) {
            throw new StoreAccessException("Cannot list data directory " + directory, e);
        }
    }

    /**
     * Parquet files anywhere below the given directory, skipping writer housekeeping
     * directories.
     */
    public List<Path> parquetFilesRecursive(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        collect(directory, files);
        files.sort(null);
        return files;
    }

    /**
     * Context directories, i.e. the second level below the data root.
     */
    public List<Path> contextDirectories() {
        Path root = root();
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> types = Files.list(root)) {
            return types.filter(Files::isDirectory)
                    .flatMap(this::childDirectories)
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new StoreAccessException("Cannot list data root " + root, e);
        }
    }

    /**
     * Signal path of a data file relative to its context directory, e.g.
     * {@code navigation.position} for {@code <ctx>/navigation/position/a.parquet}.
     */
    public Optional<String> pathOf(Path contextDirectory, Path file) {
        Path parent = file.toAbsolutePath().normalize().getParent();
        Path base = contextDirectory.toAbsolutePath().normalize();
        if (parent == null || !parent.startsWith(base) || parent.equals(base)) {
            return Optional.empty();
        }
        List<String> segments = new ArrayList<>();
        base.relativize(parent).forEach(p -> segments.add(p.toString()));
        return Optional.of(String.join(".", segments));
    }

    /**
     * Context a data file belongs to, e.g. {@code vessels.urn:mrn:imo:mmsi:1} for
     * {@code <root>/vessels/urn_mrn_imo_mmsi_1/navigation/position/a.parquet}.
     */
    public Optional<String> contextOf(Path file) {
        Path root = root();
        Path normalized = file.toAbsolutePath().normalize();
        if (!normalized.startsWith(root)) {
            return Optional.empty();
        }
        Path relative = root.relativize(normalized);
        if (relative.getNameCount() < 3) {
            return Optional.empty();
        }
        String type = relative.getName(0).toString();
        String id = relative.getName(1).toString().replace('_', ':');
        return Optional.of(type + "." + id);
    }

    private Optional<Path> resolveInsideRoot(List<String> segments) {
        Path root = root();
        Path resolved = root;
        for (String segment : segments) {
            resolved = resolved.resolve(segment);
        }
        resolved = resolved.normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            LOG.warnf("Rejected store location outside data root: %s", segments);
            return Optional.empty();
        }
        return Optional.of(resolved);
    }

    private Stream<Path> childDirectories(Path directory) {
        try (Stream<Path> children = Files.list(directory)) {
            return children.filter(Files::isDirectory).toList().stream();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void collect(Path directory, List<Path> files) {
        try (Stream<Path> children = Files.list(directory)) {
            for (Path child : children.toList()) {
                if (Files.isDirectory(child)) {
                    if (!SKIPPED_DIRECTORIES.contains(child.getFileName().toString())) {
                        collect(child, files);
                    }
                } else if (isParquetFile(child)) {
                    files.add(child);
                }
            }
        } catch (IOException e) {
            LOG.warnf("Skipping unreadable directory %s: %s", directory, e.getMessage());
        }
    }

    private boolean isParquetFile(Path file) {
        return Files.isRegularFile(file) && file.getFileName().toString().endsWith(PARQUET_SUFFIX);
    }
}
