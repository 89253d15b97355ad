/* (C)2026 */
package com.ammann.history.query;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/**
 * SQL text with positional {@code ?} placeholders and the values bound to them.
 *
 * @param sql statement text; identifiers and literals are already escaped
 * @param parameters values for the placeholders, in order
 */
public record PreparedQuery(String sql, List<Object> parameters) {

    public PreparedQuery {
        parameters = List.copyOf(parameters);
    }

    /**
     * Binds all parameters to a statement prepared from {@link #sql()}.
     */
    public void bind(PreparedStatement statement) throws SQLException {
        for (int i = 0; i < parameters.size(); i++) {
            Object parameter = parameters.get(i);
            if (parameter instanceof String text) {
                statement.setString(i + 1, text);
            } else if (parameter instanceof Long number) {
                statement.setLong(i + 1, number);
            } else {
                statement.setObject(i + 1, parameter);
            }
        }
    }
}
