/* (C)2026 */
package com.ammann.history.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Unit conversion applied to one path")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UnitInfoDTO(
        @Schema(description = "Unit of the stored values") String baseUnit,
        @Schema(description = "Unit of the returned values") String targetUnit,
        @Schema(description = "Display symbol of the target unit") String symbol,
        @Schema(description = "Display format, e.g. 0.0") String displayFormat,
        @Schema(description = "Unit category, e.g. speed") String category) {}
