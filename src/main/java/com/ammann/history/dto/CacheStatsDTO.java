/* (C)2026 */
package com.ammann.history.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Statistics of one discovery cache")
public record CacheStatsDTO(
        @Schema(description = "Current number of entries") int size,
        @Schema(description = "Maximum number of entries") int maxSize,
        @Schema(description = "Entry time-to-live in milliseconds") long ttlMs) {}
