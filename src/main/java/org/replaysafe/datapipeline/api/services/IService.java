package org.replaysafe.datapipeline.api.services;

import org.replaysafe.datapipeline.api.resources.OperationalError;

import java.util.List;

/**
 * Lifecycle contract for all pipeline services managed by the ServiceManager.
 */
public interface IService {

    enum State {
        STOPPED,
        RUNNING,
        PAUSED,
        ERROR
    }

    void start();

    /**
     * Stops the service. Work that is already inside a storage transaction is finished
     * before the service thread terminates.
     */
    void stop();

    void pause();

    /**
     * Resumes a paused service. Services that halted themselves because a batch had to be
     * parked also resume from their last durable progress.
     */
    void resume();

    State getCurrentState();

    void restart();

    List<OperationalError> getErrors();

    void clearErrors();
}
