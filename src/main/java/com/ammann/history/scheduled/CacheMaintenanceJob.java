/* (C)2026 */
package com.ammann.history.scheduled;

import com.ammann.history.cache.ContextCache;
import com.ammann.history.cache.PathCache;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Purges expired entries from the discovery caches.
 * <p>
 * Expired entries are also dropped when read; this job frees the ones that are never read
 * again.
 */
@ApplicationScoped
public class CacheMaintenanceJob {

    private static final Logger LOG = Logger.getLogger(CacheMaintenanceJob.class);

    @Inject PathCache pathCache;

    @Inject ContextCache contextCache;

    @Scheduled(every = "${history.cache.purge-interval:60s}", identity = "history-cache-purge")
    public void purgeExpiredEntries() {
        int paths = pathCache.purgeExpired();
        int contexts = contextCache.purgeExpired();
        if (paths + contexts > 0) {
            LOG.debugf("Purged %d path and %d context cache entries", paths, contexts);
        }
    }
}
