/* (C)2026 */
package com.ammann.history.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Query window echoed in history responses.
 *
 * @param from window start, UTC or zone-qualified when local time conversion is active
 * @param to window end
 */
@Schema(description = "Resolved query window")
public record RangeDTO(
        @Schema(description = "Window start timestamp") String from,
        @Schema(description = "Window end timestamp") String to) {}
