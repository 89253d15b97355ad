/* (C)2026 */
package com.ammann.history.resource;

import com.ammann.history.dto.HistoryQueryParamsDTO;
import com.ammann.history.dto.HistoryValuesResponseDTO;
import com.ammann.history.dto.RefreshInfoDTO;
import com.ammann.history.model.HistoryQuery;
import com.ammann.history.model.TimeRange;
import com.ammann.history.properties.ApiProperties;
import com.ammann.history.query.QueryCancellation;
import com.ammann.history.service.ContextDiscoveryService;
import com.ammann.history.service.HistoryQueryService;
import com.ammann.history.service.HistoryRequestParser;
import com.ammann.history.service.PathDiscoveryService;
import com.ammann.history.util.TimeFormats;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.inject.Inject;
import jakarta.ws.rs.BeanParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Clock;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * Signal K history API: bucketed values, and discovery of contexts and paths with data in
 * a time window.
 */
@Path(ApiProperties.History.BASE)
@Tag(name = "History API", description = "Historical telemetry values and discovery")
@Produces(MediaType.APPLICATION_JSON)
public class HistoryResource {

    private static final Logger LOG = Logger.getLogger(HistoryResource.class);

    @Inject HistoryRequestParser requestParser;

    @Inject HistoryQueryService historyQueryService;

    @Inject PathDiscoveryService pathDiscoveryService;

    @Inject ContextDiscoveryService contextDiscoveryService;

    @Inject Clock clock;

    @GET
    @Path(ApiProperties.History.VALUES)
    @Operation(
            summary = "Get History Values",
            description =
                    "Returns one row per time bucket with one aggregated value per requested path."
                            + " Time range: duration, from + duration, to + duration, from, from + to.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Values retrieved successfully",
                content = @Content(schema = @Schema(implementation = HistoryValuesResponseDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "503", description = "Query cancelled or store unavailable"),
        @APIResponse(responseCode = "504", description = "Query timed out")
    })
    public Uni<Response> getValues(@BeanParam HistoryQueryParamsDTO params) {
        HistoryQuery query = requestParser.parseValuesQuery(params);
        LOG.debugf("History values request: context=%s paths=%d resolution=%d",
                query.context(), query.pathSpecs().size(), query.resolutionMillis());

        QueryCancellation cancellation = new QueryCancellation();
        return Uni.createFrom()
                .item(() -> historyQueryService.getValues(query, cancellation))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .onCancellation().invoke(() -> {
                    if (cancellation.cancel()) {
                        LOG.infof("Client cancelled history request for %s", query.context());
                    }
                })
                .map(response -> toResponse(query, response));
    }

    @GET
    @Path(ApiProperties.History.CONTEXTS)
    @Operation(summary = "Get Contexts", description = "Lists contexts with data in the time range")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Contexts retrieved successfully"),
        @APIResponse(responseCode = "400", description = "Invalid parameters")
    })
    public Response getContexts(@BeanParam HistoryQueryParamsDTO params) {
        TimeRange range = requestParser.parseRange(params);
        List<String> contexts = contextDiscoveryService.discoverContexts(range);
        return Response.ok(contexts).build();
    }

    @GET
    @Path(ApiProperties.History.PATHS)
    @Operation(summary = "Get Paths", description = "Lists paths of a context with data in the time range")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Paths retrieved successfully"),
        @APIResponse(responseCode = "400", description = "Invalid parameters")
    })
    public Response getPaths(@BeanParam HistoryQueryParamsDTO params) {
        TimeRange range = requestParser.parseRange(params);
        String context = requestParser.resolveContext(params.context);
        List<String> paths = pathDiscoveryService.discoverPaths(context, range);
        return Response.ok(paths).build();
    }

    Response toResponse(HistoryQuery query, HistoryValuesResponseDTO response) {
        if (!query.refresh()) {
            return Response.ok(response).build();
        }
        long intervalSeconds = Math.max(1L, Math.round(query.resolutionMillis() / 1000.0));
        RefreshInfoDTO refresh = new RefreshInfoDTO(
                true, intervalSeconds, TimeFormats.utc(clock.instant().plusSeconds(intervalSeconds)));
        return Response.ok(response.withRefresh(refresh))
                .header("Cache-Control", "no-cache, no-store, must-revalidate")
                .header("Pragma", "no-cache")
                .header("Expires", "0")
                .header("Refresh", String.valueOf(intervalSeconds))
                .build();
    }
}
