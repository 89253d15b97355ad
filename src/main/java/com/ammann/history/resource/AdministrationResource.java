/* (C)2026 */
package com.ammann.history.resource;

import com.ammann.history.cache.ContextCache;
import com.ammann.history.cache.PathCache;
import com.ammann.history.dto.CacheOverviewDTO;
import com.ammann.history.properties.ApiProperties;
import com.ammann.history.service.SchemaProbeService;
import com.ammann.history.service.UnitConversionService;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource providing cache inspection and maintenance endpoints.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Administration API", description = "Cache inspection and maintenance")
@Produces(MediaType.APPLICATION_JSON)
public class AdministrationResource
{
    private static final Logger LOG = Logger.getLogger(AdministrationResource.class);

    @Inject PathCache pathCache;

    @Inject ContextCache contextCache;

    @Inject SchemaProbeService schemaProbeService;

    @Inject UnitConversionService unitConversionService;

    @GET
    @Path(ApiProperties.Admin.CACHE)
    @Operation(summary = "Cache Statistics", description = "Size, capacity and TTL of the discovery caches")
    public Response getCacheStatistics()
    {
        return Response.ok(new CacheOverviewDTO(pathCache.stats(), contextCache.stats())).build();
    }

    @DELETE
    @Path(ApiProperties.Admin.CACHE)
    @Operation(summary = "Clear Caches", description = "Clears discovery, schema and unit caches")
    public Response clearCaches()
    {
        pathCache.clear();
        contextCache.clear();
        schemaProbeService.invalidateAll();
        unitConversionService.invalidate();
        LOG.info("All history caches cleared");
        return Response.noContent().build();
    }
}
