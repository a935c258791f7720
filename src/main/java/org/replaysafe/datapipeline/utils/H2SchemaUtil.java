package org.replaysafe.datapipeline.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Helpers for idempotent schema creation on H2.
 */
public final class H2SchemaUtil {

    private static final Logger log = LoggerFactory.getLogger(H2SchemaUtil.class);

    private H2SchemaUtil() {
        // utility class
    }

    /**
     * Executes {@code CREATE ... IF NOT EXISTS} DDL and commits it.
     * <p>
     * H2 2.2.224 can still report "object already exists" when two connections create the
     * same object concurrently; that case is treated as success.
     *
     * @param connection Connection with auto-commit disabled.
     * @param sql        The DDL statement.
     * @param objectName Name used in log messages.
     * @throws SQLException for any other failure.
     */
    public static void executeDdlIfNotExists(Connection connection, String sql, String objectName) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
            connection.commit();
            log.debug("Ensured H2 object: {}", objectName);
        } catch (SQLException e) {
            if (e.getMessage() != null && e.getMessage().contains("already exists")) {
                connection.rollback();
                log.debug("H2 object '{}' already exists (created by another connection)", objectName);
            } else {
                throw e;
            }
        }
    }
}
