package io.batchrun.server.persistence;

import java.io.Serial;

/// Raised when a statement against the batchrun schema fails.
///
/// Wraps {@link java.sql.SQLException} so the storage interfaces of
/// `batchrun-core`, which declare no checked exceptions, can be implemented over JDBC.
///
/// @see JdbcSupport
public class PersistenceException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4471203958821937641L;

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
