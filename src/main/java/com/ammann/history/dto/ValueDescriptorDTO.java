/* (C)2026 */
package com.ammann.history.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Describes one value column of the data rows")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValueDescriptorDTO(
        @Schema(description = "Signal path, or path.ema / path.sma for derived columns") String path,
        @Schema(description = "Aggregation method or derived statistic") String method,
        @Schema(description = "Target unit when unit conversion was applied") String unit,
        @Schema(description = "Display format of the converted unit") String displayFormat) {

    public static ValueDescriptorDTO of(String path, String method) {
        return new ValueDescriptorDTO(path, method, null, null);
    }
}
