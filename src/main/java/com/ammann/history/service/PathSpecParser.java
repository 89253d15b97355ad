/* (C)2026 */
package com.ammann.history.service;

import com.ammann.history.enumeration.AggregateMethod;
import com.ammann.history.model.PathSpec;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/**
 * Parses the {@code paths} parameter, e.g.
 * {@code navigation.speedOverGround:max,navigation.position}, into path specs.
 */
@ApplicationScoped
public class PathSpecParser {

    private static final Logger LOG = Logger.getLogger(PathSpecParser.class);
    private static final Pattern DISALLOWED = Pattern.compile("[^0-9A-Za-z.,:_]");

    public List<PathSpec> parse(String paths) {
        List<PathSpec> specs = new ArrayList<>();
        if (paths == null) {
            return specs;
        }
        for (String expression : DISALLOWED.matcher(paths).replaceAll("").split(",")) {
            if (!expression.isBlank()) {
                PathSpec spec = parseExpression(expression);
                if (spec != null) {
                    specs.add(spec);
                }
            }
        }
        return specs;
    }

    /**
     * Parses one {@code path[:method]} expression; unknown methods fall back to
     * {@code average}.
     *
     * @return the spec, or {@code null} when the path part is empty
     */
    public PathSpec parseExpression(String expression) {
        String[] parts = expression.split(":");
        if (parts.length == 0 || parts[0].isBlank()) {
            return null;
        }
        AggregateMethod method = AggregateMethod.AVERAGE;
        if (parts.length > 1) {
            method = AggregateMethod.fromParameter(parts[1]).orElseGet(() -> {
                LOG.debugf("Unknown aggregate method '%s' for %s, using average", parts[1], parts[0]);
                return AggregateMethod.AVERAGE;
            });
        }
        return PathSpec.of(parts[0], method);
    }
}
