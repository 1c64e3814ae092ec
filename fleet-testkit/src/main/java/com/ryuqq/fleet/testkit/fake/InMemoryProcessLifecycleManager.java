package com.ryuqq.fleet.testkit.fake;

import com.ryuqq.fleet.core.spi.ProcessLifecycleManager;
import com.ryuqq.fleet.core.spi.WorkerCommand;
import com.ryuqq.fleet.core.spi.WorkerStatus;
import com.ryuqq.fleet.core.spi.WorkerType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of ProcessLifecycleManager for testing purposes.
 *
 * <p>No process is actually started. Workers are bookkeeping entries whose status tests can
 * inspect or change.</p>
 *
 * <p><strong>Failure injection:</strong> {@link #failStartFor(String)} makes the next start for a ship throw.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryProcessLifecycleManager implements ProcessLifecycleManager {

    private final AtomicInteger sequence = new AtomicInteger();
    private final Map<String, WorkerEntry> workers = new ConcurrentHashMap<>();
    private final List<String> stopCalls = new CopyOnWriteArrayList<>();
    private final Set<String> failingShips = ConcurrentHashMap.newKeySet();

    @Override
    public String startWorker(WorkerCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (failingShips.remove(command.shipSymbol())) {
            throw new IllegalStateException("worker start failed for ship " + command.shipSymbol());
        }

        String workerId = command.type().name().toLowerCase() + "-" + sequence.incrementAndGet();
        workers.put(workerId, new WorkerEntry(command, WorkerStatus.RUNNING));
        return workerId;
    }

    @Override
    public void stopWorker(String workerId) {
        stopCalls.add(workerId);
        workers.computeIfPresent(workerId, (id, entry) ->
            entry.status() == WorkerStatus.RUNNING ? new WorkerEntry(entry.command(), WorkerStatus.STOPPED) : entry);
    }

    @Override
    public List<String> findWorkers(WorkerType type, WorkerStatus status) {
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, WorkerEntry> entry : workers.entrySet()) {
            WorkerEntry worker = entry.getValue();
            if (worker.command().type() == type && worker.status() == status) {
                result.add(entry.getKey());
            }
        }
        result.sort(null);
        return result;
    }

    /**
     * Makes the next {@link #startWorker(WorkerCommand)} for the ship throw.
     *
     * @param shipSymbol ship whose start should fail
     */
    public void failStartFor(String shipSymbol) {
        failingShips.add(shipSymbol);
    }

    /**
     * Marks a running worker as finished.
     *
     * @param workerId worker id
     * @param status terminal status
     */
    public void finish(String workerId, WorkerStatus status) {
        workers.computeIfPresent(workerId, (id, entry) -> new WorkerEntry(entry.command(), status));
    }

    public WorkerStatus status(String workerId) {
        WorkerEntry entry = workers.get(workerId);
        return entry == null ? null : entry.status();
    }

    public WorkerCommand command(String workerId) {
        WorkerEntry entry = workers.get(workerId);
        return entry == null ? null : entry.command();
    }

    /**
     * Every id passed to {@link #stopWorker(String)}, in call order, including repeats.
     */
    public List<String> stopCalls() {
        return List.copyOf(stopCalls);
    }

    public int workerCount() {
        return workers.size();
    }

    /**
     * Clears all state.
     */
    public void clear() {
        workers.clear();
        stopCalls.clear();
        failingShips.clear();
    }

    private record WorkerEntry(WorkerCommand command, WorkerStatus status) {
    }
}
