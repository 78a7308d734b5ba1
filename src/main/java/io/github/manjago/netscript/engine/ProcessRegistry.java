package io.github.manjago.netscript.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Live processes by pid.
 */
public final class ProcessRegistry {

    private final Map<Integer, WorkerScript> processes = new LinkedHashMap<>();

    /**
     * @throws IllegalStateException if the pid is already registered
     */
    public void register(WorkerScript ws) {
        WorkerScript existing = processes.putIfAbsent(ws.getPid(), ws);
        if (existing != null) {
            throw new IllegalStateException("Pid " + ws.getPid() + " is already used by " + existing);
        }
    }

    /**
     * Remove a process. Removing an absent pid does nothing.
     *
     * @return true if the pid was registered
     */
    public boolean unregister(int pid) {
        return processes.remove(pid) != null;
    }

    public Optional<WorkerScript> lookup(int pid) {
        return Optional.ofNullable(processes.get(pid));
    }

    public boolean contains(int pid) {
        return processes.containsKey(pid);
    }

    /**
     * Snapshot of all live processes, safe to iterate while processes end.
     */
    public List<WorkerScript> allLive() {
        return new ArrayList<>(processes.values());
    }

    public int size() {
        return processes.size();
    }

    public void clear() {
        processes.clear();
    }
}
