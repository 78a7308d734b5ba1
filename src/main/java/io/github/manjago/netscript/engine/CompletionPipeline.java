package io.github.manjago.netscript.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Settles the outcome of every process: passes earnings to the parent,
 * reports crashes and tears the process down.
 */
public final class CompletionPipeline {

    private static final Logger log = LoggerFactory.getLogger(CompletionPipeline.class);

    static final String BUG_MESSAGE = "Script runtime unknown error. This is a bug please contact game developer";
    static final String UNKNOWN_DEATH_MESSAGE = "An unknown script died for an unknown reason. This is a bug please contact game dev";

    private final ProcessRegistry registry;
    private final ProcessReaper reaper;
    private final EngineListener listener;

    public CompletionPipeline(ProcessRegistry registry, ProcessReaper reaper, EngineListener listener) {
        this.registry = registry;
        this.reaper = reaper;
        this.listener = listener;
    }

    /**
     * Attach the pipeline to a process's completion.
     */
    public void attach(WorkerScript ws) {
        ws.getCompletion().handle((w, error) -> {
            if (error == null) {
                onSuccess(ws);
            } else {
                onFailure(ws, ProcessFailure.of(error));
            }
            return null;
        }).exceptionally(t -> {
            log.error("Completion of process {} ({}) failed", ws.getPid(), ws.getName(), t);
            return null;
        });
    }

    // ========== Success ==========

    void onSuccess(WorkerScript ws) {
        transferEarnings(ws);

        // Stopped somewhere else already (exit, kill, failed start)
        if (!ws.isRunning()) {
            return;
        }
        reaper.teardown(ws, ExitStatus.FINISHED);
        ws.log("", "Script finished running");
        log.debug("Process {} ({}) finished", ws.getPid(), ws.getName());
    }

    private void transferEarnings(WorkerScript ws) {
        if (ws.getParentPid() == WorkerScript.NO_PARENT) {
            return;
        }
        Optional<WorkerScript> parent = registry.lookup(ws.getParentPid());
        if (parent.isPresent() && parent.get().isRunning()) {
            parent.get().getScriptRef().addOnlineExpGained(ws.getScriptRef().getOnlineExpGained());
            parent.get().getScriptRef().addOnlineMoneyMade(ws.getScriptRef().getOnlineMoneyMade());
        }
    }

    // ========== Failure ==========

    void onFailure(WorkerScript ws, ProcessFailure failure) {
        ExitStatus status = failure instanceof ProcessFailure.AlreadyTerminated ? ExitStatus.KILLED : ExitStatus.CRASHED;
        String userMessage = null;

        if (failure instanceof ProcessFailure.RuntimeError error) {
            Optional<RuntimeErrorMessage> parsed = RuntimeErrorMessage.parse(error.message());
            if (parsed.isPresent()) {
                userMessage = parsed.get().render(ws.getArgs());
                ws.log("", "Script crashed with runtime error");
                log.info("Process {} ({}@{}) crashed: {}", ws.getPid(), ws.getName(),
                        ws.getHost().getHostname(), parsed.get().message());
            } else {
                log.error("Malformed runtime error from process {} ({}): {}", ws.getPid(), ws.getName(), error.message());
                userMessage = BUG_MESSAGE;
            }
        } else if (failure instanceof ProcessFailure.AlreadyTerminated) {
            ws.log("", "Script killed");
        } else if (failure instanceof ProcessFailure.NativeFault fault) {
            log.error("Internal fault in process {} ({})", ws.getPid(), ws.getName(), fault.cause());
            userMessage = BUG_MESSAGE;
        } else if (failure instanceof ProcessFailure.Unrecognized unknown) {
            log.error("Process {} ({}) failed with an unrecognized payload: {}", ws.getPid(), ws.getName(), unknown.payload());
            userMessage = UNKNOWN_DEATH_MESSAGE;
        }

        // Torn down before the user hears about it
        ws.getEnv().requestStop();
        reaper.teardown(ws, status);
        if (userMessage != null) {
            listener.onUserMessage(userMessage);
        }
    }
}
