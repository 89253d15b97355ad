/* (C)2026 */
package com.ammann.history.service;

import com.ammann.history.cache.ContextCache;
import com.ammann.history.model.TimeRange;
import com.ammann.history.store.DataFileScanner;
import com.ammann.history.store.StoreLayout;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Lists the contexts that hold samples within a time window.
 */
@ApplicationScoped
public class ContextDiscoveryService {

    private static final Logger LOG = Logger.getLogger(ContextDiscoveryService.class);

    @Inject ContextCache contextCache;

    @Inject StoreLayout storeLayout;

    @Inject DataFileScanner dataFileScanner;

    public List<String> discoverContexts(TimeRange range) {
        List<String> cached = contextCache.getCachedContexts(range.from(), range.to());
        if (cached != null) {
            LOG.debug("Context cache hit");
            return cached;
        }

        List<String> contexts = new ArrayList<>();
        for (Path directory : storeLayout.contextDirectories()) {
            List<Path> files = storeLayout.parquetFilesRecursive(directory);
            if (!files.isEmpty() && dataFileScanner.hasData(files, range)) {
                storeLayout.contextOf(files.get(0)).ifPresent(contexts::add);
            }
        }
        contexts.sort(null);

        contextCache.setCachedContexts(range.from(), range.to(), contexts);
        LOG.infof("Discovered %d contexts", contexts.size());
        return contexts;
    }
}
