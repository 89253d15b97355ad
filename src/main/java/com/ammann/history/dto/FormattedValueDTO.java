/* (C)2026 */
package com.ammann.history.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Converted numeric cell with its display rendering.
 *
 * @param value converted value
 * @param formatted value rendered with the display format and unit symbol, e.g. {@code 6.2 kn}
 */
@Schema(description = "Converted value with display rendering")
public record FormattedValueDTO(double value, String formatted) {}
