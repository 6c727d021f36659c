// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.store;

import java.sql.SQLException;
import org.jspecify.annotations.Nullable;

/**
 * A domain store operation failed at the database level.
 */
public final class StoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StoreException(final String message, final SQLException cause) {
        super(message + ": " + cause.getMessage(), cause);
    }

    public StoreException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /** SQLSTATE of the underlying failure, when there is one. */
    public @Nullable String sqlState() {
        return getCause() instanceof SQLException sql ? sql.getSQLState() : null;
    }
}
