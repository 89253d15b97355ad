/* (C)2026 */
package com.ammann.history.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Polling hints for clients using the endpoint as a live source")
public record RefreshInfoDTO(
        @Schema(description = "Whether refresh is enabled") boolean enabled,
        @Schema(description = "Suggested polling interval in seconds") long intervalSeconds,
        @Schema(description = "Suggested time of the next poll") String nextRefresh) {}
