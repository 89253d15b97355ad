/* (C)2026 */
package com.ammann.history.service;

import com.ammann.history.dto.UnitPreferenceDTO;
import com.ammann.history.exception.ConversionProviderException;
import java.util.Map;

/**
 * Source of per-path unit preferences.
 */
public interface UnitPreferenceProvider {

    /**
     * Returns all known conversions keyed by signal path. An empty map means the provider
     * is still initializing.
     *
     * @throws ConversionProviderException when the provider cannot be reached
     */
    Map<String, UnitPreferenceDTO> allConversions();
}
