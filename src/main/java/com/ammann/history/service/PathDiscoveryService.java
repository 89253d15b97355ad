/* (C)2026 */
package com.ammann.history.service;

import com.ammann.history.cache.PathCache;
import com.ammann.history.model.TimeRange;
import com.ammann.history.store.DataFileScanner;
import com.ammann.history.store.StoreLayout;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Lists the paths of a context that hold samples within a time window.
 */
@ApplicationScoped
public class PathDiscoveryService {

    private static final Logger LOG = Logger.getLogger(PathDiscoveryService.class);

    @Inject PathCache pathCache;

    @Inject StoreLayout storeLayout;

    @Inject DataFileScanner dataFileScanner;

    public List<String> discoverPaths(String context, TimeRange range) {
        List<String> cached = pathCache.getCachedPaths(context, range.from(), range.to());
        if (cached != null) {
            LOG.debugf("Path cache hit for %s", context);
            return cached;
        }

        Optional<Path> contextDirectory = storeLayout.contextDirectory(context);
        if (contextDirectory.isEmpty()) {
            return List.of();
        }
        long started = System.currentTimeMillis();
        List<Path> files = storeLayout.parquetFilesRecursive(contextDirectory.get());
        Set<Path> withData = dataFileScanner.filesWithData(files, range);
        List<String> paths = withData.stream()
                .map(file -> storeLayout.pathOf(contextDirectory.get(), file))
                .flatMap(Optional::stream)
                .distinct()
                .sorted()
                .toList();

        pathCache.setCachedPaths(context, range.from(), range.to(), paths);
        LOG.infof("Discovered %d paths for %s from %d files in %d ms",
                paths.size(), context, files.size(), System.currentTimeMillis() - started);
        return paths;
    }
}
