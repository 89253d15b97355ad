/* (C)2026 */
package com.ammann.history.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Timezone applied to the returned timestamps")
public record TimezoneInfoDTO(
        @Schema(description = "Zone id, e.g. Europe/Berlin") String zone,
        @Schema(description = "Offset of the zone at the end of the window, e.g. +02:00") String offset,
        @Schema(description = "Whether timestamps were converted") boolean converted) {}
