package com.ryuqq.fleet.core.spi;

import java.util.List;

/**
 * Worker process lifecycle SPI.
 *
 * <p>Starts and stops the long-running worker processes (extraction and transport units) that an
 * operation drives. Process supervision, restarts and persistence of worker state belong to the
 * implementation.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe</li>
 *   <li>{@link #stopWorker(String)} is idempotent: stopping an unknown or already stopped worker is a no-op</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ProcessLifecycleManager {

    /**
     * Starts a worker.
     *
     * @param command what the worker runs
     * @return the new worker's id
     * @throws IllegalArgumentException if command is null
     * @throws RuntimeException if the worker could not be started
     */
    String startWorker(WorkerCommand command);

    /**
     * Stops a worker.
     *
     * @param workerId the worker id returned by {@link #startWorker(WorkerCommand)}
     */
    void stopWorker(String workerId);

    /**
     * Lists workers by role and status.
     *
     * @param type worker role
     * @param status worker status
     * @return matching worker ids (never null)
     */
    List<String> findWorkers(WorkerType type, WorkerStatus status);
}
