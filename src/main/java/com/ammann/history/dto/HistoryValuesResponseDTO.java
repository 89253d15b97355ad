/* (C)2026 */
package com.ammann.history.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Response of the history values endpoint.
 *
 * <p>Each data row is {@code [timestamp, value_1, ..., value_n]} with one value per
 * entry of {@code values}. Optional sections are omitted when their stage did not run.
 */
@Schema(description = "Bucketed history values")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryValuesResponseDTO(
        @Schema(description = "Context the values belong to") String context,
        @Schema(description = "Query window") RangeDTO range,
        @Schema(description = "Column descriptors, in row order") List<ValueDescriptorDTO> values,
        @Schema(description = "Data rows ordered by timestamp") List<List<Object>> data,
        @Schema(description = "Applied unit conversions by path") Map<String, UnitInfoDTO> units,
        @Schema(description = "Applied timezone") TimezoneInfoDTO timezone,
        @Schema(description = "Polling hints") RefreshInfoDTO refresh) {

    public HistoryValuesResponseDTO withRefresh(RefreshInfoDTO refreshInfo) {
        return new HistoryValuesResponseDTO(context, range, values, data, units, timezone, refreshInfo);
    }
}
