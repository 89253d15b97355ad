/* (C)2026 */
package com.ammann.history.query;

import com.ammann.history.exception.QueryCancelledException;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jboss.logging.Logger;

/**
 * Cancellation token shared by all per-path tasks of one history request.
 *
 * <p>Tasks check the token before opening a connection and register the JDBC statement
 * they are executing. {@link #cancel()} marks the request as cancelled, cancels every
 * registered statement and runs the registered callbacks. Statements or callbacks
 * registered after cancellation are cancelled or run immediately. Cancelling twice has no
 * further effect.
 */
public class QueryCancellation {

    private static final Logger LOG = Logger.getLogger(QueryCancellation.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Set<Statement> statements = ConcurrentHashMap.newKeySet();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws QueryCancelledException when the request has been cancelled
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new QueryCancelledException("History query was cancelled");
        }
    }

    /**
     * Tracks a running statement so it can be aborted.
     */
    public void register(Statement statement) {
        statements.add(statement);
        if (cancelled.get()) {
            cancelStatement(statement);
        }
    }

    public void unregister(Statement statement) {
        statements.remove(statement);
    }

    /**
     * Adds an action run once on cancellation.
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            callback.run();
        }
    }

    /**
     * Cancels the request.
     *
     * @return {@code true} if this call performed the cancellation
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        LOG.debugf("Cancelling %d running statements", statements.size());
        for (Statement statement : statements) {
            cancelStatement(statement);
        }
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                callback.run();
            }
        }
        return true;
    }

    int registeredStatements() {
        return statements.size();
    }

    private void cancelStatement(Statement statement) {
        try {
            statement.cancel();
        } catch (SQLException e) {
            LOG.debugf("Statement cancel failed: %s", e.getMessage());
        }
    }
}
