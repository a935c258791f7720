package org.replaysafe.datapipeline.api.resources.database;

import org.replaysafe.datapipeline.api.contracts.AnalyticalRow;
import org.replaysafe.datapipeline.api.resources.IResource;

import java.util.List;

/**
 * Append-only capability of the analytical store (usage type {@code db-analytical}).
 */
public interface IAnalyticalWriter extends IResource {

    /**
     * Appends all rows in one transaction.
     *
     * @throws AnalyticalSinkException if the append failed; nothing was written.
     */
    void append(List<AnalyticalRow> rows) throws AnalyticalSinkException;
}
