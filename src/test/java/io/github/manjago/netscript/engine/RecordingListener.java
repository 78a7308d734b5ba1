package io.github.manjago.netscript.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Listener that keeps every event for assertions.
 */
class RecordingListener implements EngineListener {

    final List<WorkerScript> started = new ArrayList<>();
    final List<WorkerScript> exited = new ArrayList<>();
    final List<ExitStatus> statuses = new ArrayList<>();
    final List<String> messages = new ArrayList<>();
    final List<String> terminal = new ArrayList<>();

    @Override
    public void onStart(WorkerScript ws) {
        started.add(ws);
    }

    @Override
    public void onExit(WorkerScript ws, ExitStatus status) {
        exited.add(ws);
        statuses.add(status);
    }

    @Override
    public void onUserMessage(String message) {
        messages.add(message);
    }

    @Override
    public void onTerminalOutput(String text) {
        terminal.add(text);
    }

    WorkerScript exitedByName(String name) {
        return exited.stream().filter(ws -> ws.getName().equals(name)).findFirst()
                .orElseThrow(() -> new AssertionError(name + " did not exit"));
    }
}
