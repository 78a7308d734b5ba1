package io.github.manjago.netscript.engine;

import io.github.manjago.netscript.api.Binding;
import io.github.manjago.netscript.api.HostFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Allows one host call in flight per native process.
 * <p>
 * A second call while one is outstanding fails the whole process. Timer
 * capabilities ({@code sleep}) may always overlap.
 */
public final class CallSerializer {

    private static final Logger log = LoggerFactory.getLogger(CallSerializer.class);

    static final String CONCURRENT_CALL =
            "Concurrent calls to Netscript functions not allowed! "
            + "Did you forget to await hack(), grow(), or some other "
            + "promise-returning function? (Currently running: %s tried to run: %s)";

    /**
     * Wrap a binding for one process.
     */
    public HostFunction wrap(Binding binding) {
        return (ws, args) -> invoke(ws, binding, args);
    }

    /**
     * Run a host call under the serialization rule.
     *
     * @throws ScriptKilledException      if the process was asked to stop
     * @throws ConcurrentCallException    if another call is in flight; the process has failed already
     */
    public Object invoke(WorkerScript ws, Binding binding, List<Object> args) {
        Environment env = ws.getEnv();
        String name = binding.name();
        if (env.isStopRequested()) {
            throw new ScriptKilledException(ws);
        }
        if (binding.capability().isSerializationExempt()) {
            return binding.function().invoke(ws, args);
        }

        String inFlight = env.getRunningFn();
        if (inFlight != null) {
            String message = String.format(CONCURRENT_CALL, inFlight, name);
            log.debug("Process {} made a concurrent call: {} while {} is running", ws.getPid(), name, inFlight);
            ws.abort(new ProcessFailure.RuntimeError(RuntimeErrorMessage.build(ws, message)));
            throw new ConcurrentCallException(message);
        }

        env.setRunningFn(name);
        Object result;
        try {
            result = binding.function().invoke(ws, args);
        } catch (RuntimeException e) {
            env.setRunningFn(null);
            throw e;
        }
        if (result instanceof CompletionStage<?> stage) {
            return stage.whenComplete((value, error) -> env.setRunningFn(null));
        }
        env.setRunningFn(null);
        return result;
    }

    /**
     * Thrown at the call that broke the one-call-in-flight rule.
     */
    public static class ConcurrentCallException extends RuntimeException {
        public ConcurrentCallException(String message) {
            super(message);
        }
    }
}
