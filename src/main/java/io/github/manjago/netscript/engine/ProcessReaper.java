package io.github.manjago.netscript.engine;

import io.github.manjago.netscript.host.Host;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tears processes down, exactly once each.
 * <p>
 * Teardown stops the process, cancels its sleep, unregisters it, releases its
 * RAM, removes its record from the host and settles its completion.
 */
public final class ProcessReaper {

    private static final Logger log = LoggerFactory.getLogger(ProcessReaper.class);

    private final ProcessRegistry registry;
    private final EngineListener listener;

    public ProcessReaper(ProcessRegistry registry, EngineListener listener) {
        this.registry = registry;
        this.listener = listener;
    }

    /**
     * Tear a process down.
     *
     * @param ws     process
     * @param status why it ends; ignored if the process was already torn down
     * @return false if the process had already been torn down
     */
    public boolean teardown(WorkerScript ws, ExitStatus status) {
        if (ws.isTornDown()) {
            return false;
        }
        ws.markTornDown(status);
        ws.getEnv().requestStop();
        ws.setRunning(false);
        ws.cancelDelay();

        registry.unregister(ws.getPid());
        Host host = ws.getHost();
        host.getRam().release(ws.getRamUsage());
        host.removeRunningScript(ws.getScriptRef());

        log.debug("Process {} ({}@{}) torn down: {}, released {} GB",
                ws.getPid(), ws.getName(), host.getHostname(), status, ws.getRamUsage());
        try {
            listener.onExit(ws, status);
        } catch (RuntimeException e) {
            log.error("Listener failed on exit of process {} ({})", ws.getPid(), ws.getName(), e);
        }

        if (status == ExitStatus.FINISHED || status == ExitStatus.FAILED_TO_START) {
            ws.finish();
        } else {
            ws.fail(new ProcessFailure.AlreadyTerminated(ws));
        }
        return true;
    }
}
