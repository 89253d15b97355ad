/* (C)2026 */
package com.ammann.history.store;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Canonicalizes signal paths and contexts before they become directory names.
 *
 * <p>A signal path keeps only {@code [A-Za-z0-9._]}; it is split on dots and empty
 * segments are dropped. Because neither slashes nor empty segments survive, a
 * canonical path can never address a parent directory. {@link StoreLayout} additionally
 * verifies that the resolved directory stays below the data root.
 */
public final class PathSanitizer {

    private static final Pattern DISALLOWED_PATH_CHARS = Pattern.compile("[^A-Za-z0-9._]");
    private static final Pattern CONTEXT_SEGMENT = Pattern.compile("[A-Za-z0-9_\\-]+");

    private PathSanitizer() {}

    /**
     * Splits a signal path into directory segments.
     *
     * @param signalPath raw path, e.g. {@code navigation.speedOverGround}
     * @return the segments, or empty when nothing usable remains
     */
    public static Optional<List<String>> pathSegments(String signalPath) {
        if (signalPath == null) {
            return Optional.empty();
        }
        String stripped = DISALLOWED_PATH_CHARS.matcher(signalPath).replaceAll("");
        List<String> segments =
                Arrays.stream(stripped.split("\\.")).filter(s -> !s.isEmpty()).toList();
        return segments.isEmpty() ? Optional.empty() : Optional.of(segments);
    }

    /**
     * Canonical dot form of a signal path, e.g. {@code ..navigation..position/} becomes
     * {@code navigation.position}.
     */
    public static Optional<String> canonicalPath(String signalPath) {
        return pathSegments(signalPath).map(segments -> String.join(".", segments));
    }

    /**
     * Splits a context into directory segments: dots separate directories and colons
     * become underscores, so {@code vessels.urn:mrn:imo:mmsi:1} maps to
     * {@code vessels/urn_mrn_imo_mmsi_1}. Any segment with other characters rejects the
     * whole context.
     */
    public static Optional<List<String>> contextSegments(String context) {
        if (context == null || context.isBlank()) {
            return Optional.empty();
        }
        List<String> segments =
                Arrays.stream(context.replace(':', '_').split("\\."))
                        .filter(s -> !s.isEmpty())
                        .toList();
        if (segments.isEmpty()
                || segments.stream().anyMatch(s -> !CONTEXT_SEGMENT.matcher(s).matches())) {
            return Optional.empty();
        }
        return Optional.of(segments);
    }
}
