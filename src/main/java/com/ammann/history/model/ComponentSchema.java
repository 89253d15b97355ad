/* (C)2026 */
package com.ammann.history.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered sub-field layout of a composite path. An empty schema means the path is scalar.
 */
public record ComponentSchema(Map<String, ComponentInfo> components) {

    public static final ComponentSchema EMPTY = new ComponentSchema(Map.of());

    public ComponentSchema {
        components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
    }

    public boolean isComposite() {
        return !components.isEmpty();
    }

    public boolean isNumeric(String componentName) {
        ComponentInfo info = components.get(componentName);
        return info != null && info.isNumeric();
    }
}
