/* (C)2026 */
package com.ammann.history.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Statistics of the discovery caches")
public record CacheOverviewDTO(
        @Schema(description = "Available-paths cache") CacheStatsDTO paths,
        @Schema(description = "Available-contexts cache") CacheStatsDTO contexts) {}
